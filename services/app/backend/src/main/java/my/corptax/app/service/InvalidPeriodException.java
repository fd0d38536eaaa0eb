package my.corptax.app.service;

import java.time.LocalDate;

public class InvalidPeriodException extends InvalidInputException {
	public InvalidPeriodException(LocalDate start, LocalDate end) {
		super("accountingPeriodEnd",
				"Accounting period end date " + end + " must be on/after start date " + start + ".");
	}
}
