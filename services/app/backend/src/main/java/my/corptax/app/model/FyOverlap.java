package my.corptax.app.model;

import java.time.LocalDate;

/**
 * Intersection of one period with one financial year. Day counts include both ends.
 */
public record FyOverlap(
		TaxYearDefinition taxYear,
		LocalDate overlapStart,
		LocalDate overlapEnd,
		int apDaysInFy,
		int fyTotalDays
) {
	public int fyYear() {
		return taxYear.fyYear();
	}
}
