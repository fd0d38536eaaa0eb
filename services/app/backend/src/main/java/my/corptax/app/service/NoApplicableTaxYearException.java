package my.corptax.app.service;

import java.time.LocalDate;

/**
 * The tax-year reference table has no entry covering part of an accounting period. This is a
 * configuration gap, not a problem with the request.
 */
public class NoApplicableTaxYearException extends IllegalStateException {
	public NoApplicableTaxYearException(LocalDate start, LocalDate end) {
		super("No overlapping financial years found for " + start + " to " + end
				+ ". Update the tax-year reference table.");
	}
}
