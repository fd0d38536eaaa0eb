package my.corptax.app.service;

import my.corptax.app.model.AccountingPeriod;
import my.corptax.app.service.util.DateRanges;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * Splits an accounting period that runs past twelve calendar months into a 12-month period and a
 * short remainder. The cut is calendar based, so a 366-day year starting 1 January is not split.
 */
@Service
public class PeriodSplitter {
	static final String FULL_PERIOD = "Full Period";
	static final String FIRST_PERIOD = "Period 1 (12 months)";
	static final String SECOND_PERIOD = "Period 2 (short period)";

	public List<AccountingPeriod> split(LocalDate start, LocalDate end) {
		if (start == null || end == null || end.isBefore(start)) {
			throw new InvalidPeriodException(start, end);
		}
		LocalDate firstPeriodEnd = DateRanges.twelveMonthsEnd(start);
		if (!end.isAfter(firstPeriodEnd)) {
			return List.of(new AccountingPeriod(1, FULL_PERIOD, start, end,
					DateRanges.daysInclusive(start, end), false));
		}
		LocalDate secondPeriodStart = firstPeriodEnd.plusDays(1);
		return List.of(
				new AccountingPeriod(1, FIRST_PERIOD, start, firstPeriodEnd,
						DateRanges.daysInclusive(start, firstPeriodEnd), false),
				new AccountingPeriod(2, SECOND_PERIOD, secondPeriodStart, end,
						DateRanges.daysInclusive(secondPeriodStart, end), true));
	}
}
