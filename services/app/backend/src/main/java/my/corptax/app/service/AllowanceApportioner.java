package my.corptax.app.service;

import my.corptax.app.model.AccountingPeriod;
import my.corptax.app.model.FyOverlap;
import my.corptax.app.model.FySlice;
import my.corptax.app.model.Money;
import my.corptax.app.service.util.Ratios;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Apportions the annual marginal relief thresholds and the AIA limit to each FY slice of a period.
 * <p>
 * A 12-month period divides each annual figure by the associated-company divisor and then shares it
 * out by the slice's portion of the period's days, so the slices never add up to more than one year.
 * A short period instead prorates each FY's figure by the days it covers in that FY, which gives a
 * short period less than a full year's allowance.
 */
@Service
public class AllowanceApportioner {
	public List<FySlice> apportion(AccountingPeriod period, List<FyOverlap> overlaps, int associatedCompanyCount) {
		BigDecimal divisor = Ratios.divisor(associatedCompanyCount);
		List<FySlice> slices = new ArrayList<>(overlaps.size());
		for (FyOverlap overlap : overlaps) {
			slices.add(new FySlice(
					overlap,
					apportion(overlap.taxYear().lowerThreshold(), overlap, period, divisor),
					apportion(overlap.taxYear().upperThreshold(), overlap, period, divisor),
					apportion(overlap.taxYear().aiaLimit(), overlap, period, divisor),
					Money.ZERO,
					Money.ZERO));
		}
		return List.copyOf(slices);
	}

	static Money apportion(BigDecimal annual, FyOverlap overlap, AccountingPeriod period, BigDecimal divisor) {
		Money amount = Money.of(annual);
		if (period.shortPeriod()) {
			return Money.of(amount.times(Ratios.fraction(overlap.apDaysInFy(), overlap.fyTotalDays())).exact()
					.divide(divisor, Money.PRECISION));
		}
		return Money.of(amount.exact().divide(divisor, Money.PRECISION))
				.times(Ratios.fraction(overlap.apDaysInFy(), period.days()));
	}
}
