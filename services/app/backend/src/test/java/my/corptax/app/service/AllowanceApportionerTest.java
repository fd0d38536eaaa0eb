package my.corptax.app.service;

import my.corptax.app.model.AccountingPeriod;
import my.corptax.app.model.FySlice;
import my.corptax.app.model.Money;
import my.corptax.app.support.TestEngines;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AllowanceApportionerTest {
	private final AllowanceApportioner apportioner = new AllowanceApportioner();
	private final FyOverlapResolver resolver = new FyOverlapResolver();

	@Test
	void givesFullYearThresholdsToTwelveMonthPeriod() {
		List<FySlice> slices = apportion(LocalDate.of(2024, 4, 1), LocalDate.of(2025, 3, 31), false, 0);

		assertThat(slices).singleElement().satisfies(slice -> {
			assertThat(slice.lowerThreshold().exact()).isEqualByComparingTo("50000");
			assertThat(slice.upperThreshold().exact()).isEqualByComparingTo("250000");
			assertThat(slice.aiaCap().exact()).isEqualByComparingTo("1000000");
			assertThat(slice.taxableProfit()).isEqualTo(Money.ZERO);
		});
	}

	@Test
	void dividesThresholdsByAssociatedCompanies() {
		List<FySlice> slices = apportion(LocalDate.of(2024, 4, 1), LocalDate.of(2025, 3, 31), false, 2);

		FySlice slice = slices.get(0);
		assertThat(slice.lowerThreshold().exact().setScale(2, RoundingMode.HALF_UP)).isEqualByComparingTo("16666.67");
		assertThat(slice.upperThreshold().exact().setScale(2, RoundingMode.HALF_UP)).isEqualByComparingTo("83333.33");
	}

	@Test
	void sharesThresholdsAcrossFinancialYearsByPeriodDays() {
		List<FySlice> slices = apportion(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31), false, 0);

		assertThat(slices).hasSize(2);
		BigDecimal lowerTotal = slices.get(0).lowerThreshold().exact().add(slices.get(1).lowerThreshold().exact());
		assertThat(lowerTotal.doubleValue()).isCloseTo(50000.0, within(0.0001));
		assertThat(slices.get(0).lowerThreshold().exact().doubleValue())
				.isCloseTo(50000.0 * 91 / 366, within(0.0001));
	}

	@Test
	void proratesShortPeriodByFinancialYearLength() {
		List<FySlice> slices = apportion(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 1), true, 0);

		assertThat(slices.get(0).lowerThreshold().exact().doubleValue())
				.isCloseTo(50000.0 / 365, within(0.0001));
		assertThat(slices.get(0).aiaCap().exact().doubleValue())
				.isCloseTo(1000000.0 / 365, within(0.0001));
	}

	@Test
	void thresholdsNeverGrowWithMoreAssociatedCompanies() {
		FySlice previous = null;
		for (int associated = 0; associated <= 5; associated++) {
			FySlice slice = apportion(LocalDate.of(2024, 4, 1), LocalDate.of(2025, 3, 31), false, associated).get(0);
			if (previous != null) {
				assertThat(slice.lowerThreshold().compareTo(previous.lowerThreshold())).isLessThan(0);
				assertThat(slice.upperThreshold().compareTo(previous.upperThreshold())).isLessThan(0);
			}
			previous = slice;
		}
	}

	private List<FySlice> apportion(LocalDate start, LocalDate end, boolean shortPeriod, int associated) {
		AccountingPeriod period = new AccountingPeriod(1, "Full Period", start, end,
				(int) (end.toEpochDay() - start.toEpochDay() + 1), shortPeriod);
		return apportioner.apportion(period, resolver.resolve(period, TestEngines.defaultTable()), associated);
	}
}
