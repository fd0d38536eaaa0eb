package my.corptax.app.service;

import my.corptax.app.model.AccountingPeriod;
import my.corptax.app.model.FyOverlap;
import my.corptax.app.model.TaxYearDefinition;
import my.corptax.app.model.TaxYearTable;
import my.corptax.app.service.util.DateRanges;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
public class FyOverlapResolver {
	public List<FyOverlap> resolve(AccountingPeriod period, TaxYearTable table) {
		List<FyOverlap> overlaps = new ArrayList<>();
		List<TaxYearDefinition> years = table == null ? List.of() : table.years();
		for (TaxYearDefinition year : years) {
			LocalDate overlapStart = DateRanges.later(period.start(), year.startDate());
			LocalDate overlapEnd = DateRanges.earlier(period.end(), year.endDate());
			int days = DateRanges.daysInclusive(overlapStart, overlapEnd);
			if (days <= 0) {
				continue;
			}
			overlaps.add(new FyOverlap(year, overlapStart, overlapEnd, days,
					DateRanges.daysInclusive(year.startDate(), year.endDate())));
		}
		// a gap in the table would leave some of the period's days untaxed
		int coveredDays = overlaps.stream().mapToInt(FyOverlap::apDaysInFy).sum();
		if (overlaps.isEmpty() || coveredDays != period.days()) {
			throw new NoApplicableTaxYearException(period.start(), period.end());
		}
		overlaps.sort(Comparator.comparing(FyOverlap::overlapStart));
		return List.copyOf(overlaps);
	}
}
