package my.corptax.app.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;

@Getter
@AllArgsConstructor
public class RateTier {
	private final BigDecimal threshold;
	private final BigDecimal rate;
	private final BigDecimal reliefFraction;
}
