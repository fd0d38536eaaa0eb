package my.corptax.app.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Rates and limits for one UK financial year (1 April to 31 March). Tiers are ordered small profits,
 * marginal relief band, main rate.
 */
public record TaxYearDefinition(
		int fyYear,
		LocalDate startDate,
		LocalDate endDate,
		List<RateTier> tiers,
		BigDecimal aiaLimit
) {
	public static final int TIER_COUNT = 3;

	public TaxYearDefinition {
		tiers = tiers == null ? List.of() : List.copyOf(tiers);
		aiaLimit = aiaLimit == null ? BigDecimal.ZERO : aiaLimit;
	}

	public RateTier smallProfitsTier() {
		return tiers.get(0);
	}

	public RateTier marginalTier() {
		return tiers.get(1);
	}

	public RateTier mainTier() {
		return tiers.get(2);
	}

	public BigDecimal smallRate() {
		return smallProfitsTier().getRate();
	}

	public BigDecimal mainRate() {
		return mainTier().getRate();
	}

	public BigDecimal reliefFraction() {
		return marginalTier().getReliefFraction();
	}

	public BigDecimal lowerThreshold() {
		return marginalTier().getThreshold();
	}

	public BigDecimal upperThreshold() {
		return mainTier().getThreshold();
	}

	public RegimeSignature regimeSignature() {
		return new RegimeSignature(smallRate(), mainRate(), reliefFraction(), lowerThreshold(), upperThreshold());
	}
}
