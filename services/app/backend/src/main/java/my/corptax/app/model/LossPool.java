package my.corptax.app.model;

/**
 * State of one loss pool across a single period. {@code carriedForward} is what the next period opens
 * with: {@code available - used + currentPeriodUnrelieved}.
 */
public record LossPool(
		Money available,
		Money used,
		Money currentPeriodIncurred,
		Money currentPeriodUnrelieved,
		Money carriedForward,
		Money usageRequestRemaining
) {
}
