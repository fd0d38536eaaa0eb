package my.corptax.app.model;

/**
 * Everything derived for one FY overlap of a period, kept together so nothing has to be looked up by
 * FY year later on.
 */
public record FySlice(
		FyOverlap overlap,
		Money lowerThreshold,
		Money upperThreshold,
		Money aiaCap,
		Money taxableProfit,
		Money augmentedProfit
) {
	public FySlice withProfits(Money taxable, Money augmented) {
		return new FySlice(overlap, lowerThreshold, upperThreshold, aiaCap, taxable, augmented);
	}

	public int fyYear() {
		return overlap.fyYear();
	}

	public int days() {
		return overlap.apDaysInFy();
	}
}
