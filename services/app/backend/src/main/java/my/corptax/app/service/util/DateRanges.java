package my.corptax.app.service.util;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

public final class DateRanges {
	private DateRanges() {
	}

	public static int daysInclusive(LocalDate start, LocalDate end) {
		if (start == null || end == null || end.isBefore(start)) {
			return 0;
		}
		return Math.toIntExact(ChronoUnit.DAYS.between(start, end) + 1);
	}

	/**
	 * Last day of the twelve calendar months starting at {@code start}. Month arithmetic clamps the
	 * day-of-month, so 29 Feb 2024 runs to 27 Feb 2025 and 31 Jan to 30 Jan of the next year.
	 */
	public static LocalDate twelveMonthsEnd(LocalDate start) {
		return start.plusMonths(12).minusDays(1);
	}

	public static LocalDate later(LocalDate a, LocalDate b) {
		return a.isAfter(b) ? a : b;
	}

	public static LocalDate earlier(LocalDate a, LocalDate b) {
		return a.isBefore(b) ? a : b;
	}
}
