package my.corptax.app.service;

import my.corptax.app.model.Money;
import my.corptax.app.service.util.Ratios;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Three-band charge for one calculation slice: small profits rate up to the lower limit, main rate
 * from the upper limit, and main rate less marginal relief in between.
 */
@Service
public class CorporationTaxCalculator {
	public TaxComputation compute(Money taxableProfit, Money augmentedProfit, Money lowerLimit, Money upperLimit,
			BigDecimal smallRate, BigDecimal mainRate, BigDecimal reliefFraction) {
		Money taxable = taxableProfit.atLeastZero();
		Money augmented = augmentedProfit.atLeastZero();
		Money lower = lowerLimit.atLeastZero();
		Money upper = upperLimit.atLeastZero();
		BigDecimal small = nonNegative(smallRate);
		BigDecimal main = nonNegative(mainRate);
		BigDecimal fraction = nonNegative(reliefFraction);

		if (augmented.compareTo(lower) <= 0) {
			return new TaxComputation(Band.SMALL_PROFITS, taxable, augmented, taxable.times(small), Money.ZERO);
		}
		if (augmented.compareTo(upper) >= 0) {
			return new TaxComputation(Band.MAIN_RATE, taxable, augmented, taxable.times(main), Money.ZERO);
		}
		BigDecimal profitRatio = Ratios.fraction(taxable.exact(), augmented.exact());
		Money relief = upper.minus(augmented).times(fraction).times(profitRatio);
		return new TaxComputation(Band.MARGINAL_RELIEF, taxable, augmented, taxable.times(main).minus(relief), relief);
	}

	private static BigDecimal nonNegative(BigDecimal value) {
		return value == null || value.signum() < 0 ? BigDecimal.ZERO : value;
	}

	public enum Band {
		SMALL_PROFITS,
		MARGINAL_RELIEF,
		MAIN_RATE
	}

	public record TaxComputation(
			Band band,
			Money taxableProfit,
			Money augmentedProfit,
			Money charge,
			Money marginalRelief
	) {
	}
}
