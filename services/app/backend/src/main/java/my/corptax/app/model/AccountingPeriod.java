package my.corptax.app.model;

import java.time.LocalDate;

public record AccountingPeriod(
		int index,
		String name,
		LocalDate start,
		LocalDate end,
		int days,
		boolean shortPeriod
) {
}
