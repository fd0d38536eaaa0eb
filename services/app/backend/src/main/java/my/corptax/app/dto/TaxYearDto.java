package my.corptax.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record TaxYearDto(@JsonProperty("fy_year") int fyYear,
						 @JsonProperty("start_date") LocalDate startDate,
						 @JsonProperty("end_date") LocalDate endDate,
						 @JsonProperty("aia_limit") BigDecimal aiaLimit,
						 List<Tier> tiers) {
	public record Tier(int index,
					   BigDecimal threshold,
					   BigDecimal rate,
					   @JsonProperty("relief_fraction") BigDecimal reliefFraction) {
	}
}
