package my.corptax.app.model;

import java.math.BigDecimal;

/**
 * Rate/threshold combination that decides whether two adjacent FY slices can be taxed as one.
 * Compared numerically so that 0.25 and 0.250 are the same regime.
 */
public record RegimeSignature(
		BigDecimal smallRate,
		BigDecimal mainRate,
		BigDecimal reliefFraction,
		BigDecimal lowerThresholdBase,
		BigDecimal upperThresholdBase
) {
	public boolean sameRegime(RegimeSignature other) {
		return other != null
				&& smallRate.compareTo(other.smallRate) == 0
				&& mainRate.compareTo(other.mainRate) == 0
				&& reliefFraction.compareTo(other.reliefFraction) == 0
				&& lowerThresholdBase.compareTo(other.lowerThresholdBase) == 0
				&& upperThresholdBase.compareTo(other.upperThresholdBase) == 0;
	}
}
