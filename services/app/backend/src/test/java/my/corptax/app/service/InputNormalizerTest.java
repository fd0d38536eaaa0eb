package my.corptax.app.service;

import my.corptax.app.model.NormalizedInput;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InputNormalizerTest {
	private final InputNormalizer normalizer = new InputNormalizer();

	@Test
	void resolvesLegacyNamesWhenCanonicalIsAbsent() {
		Map<String, Object> raw = new HashMap<>();
		raw.put("apStart", "2024-04-01");
		raw.put("apEnd", "2025-03-31");
		raw.put("turnover", 100000);
		raw.put("costOfSales", "40000");
		raw.put("box_190_rental_income", 1200);
		raw.put("assocCompanies", 2);

		NormalizedInput input = normalizer.normalize(raw);

		assertThat(input.accountingPeriodDays()).isEqualTo(365);
		assertThat(input.associatedCompanyCount()).isEqualTo(2);
		assertThat(input.profitAndLoss().tradingTurnover().exact()).isEqualByComparingTo("100000");
		assertThat(input.profitAndLoss().costOfGoodsSold().exact()).isEqualByComparingTo("40000");
		assertThat(input.profitAndLoss().propertyIncome().exact()).isEqualByComparingTo("1200");
	}

	@Test
	void canonicalNameWinsOverLegacyAlias() {
		Map<String, Object> raw = baseInput();
		raw.put("tradingTurnover", 500);
		raw.put("turnover", 900);
		raw.put("val_turnover", 700);

		NormalizedInput input = normalizer.normalize(raw);

		assertThat(input.profitAndLoss().tradingTurnover().exact()).isEqualByComparingTo("500");
	}

	@Test
	void earlierLegacyAliasWinsOverLaterOne() {
		Map<String, Object> raw = baseInput();
		raw.put("disposalGains", 300);
		raw.put("box_205_disposal_gains", 800);

		NormalizedInput input = normalizer.normalize(raw);

		assertThat(input.profitAndLoss().tradingBalancingCharges().exact()).isEqualByComparingTo("300");
	}

	@Test
	void roundsMoneyToWholePoundsAndTreatsBlankAsZero() {
		Map<String, Object> raw = baseInput();
		raw.put("tradingTurnover", "123456.50");
		raw.put("depreciationExpense", 2500.49);
		raw.put("staffEmploymentCosts", " ");
		raw.put("otherOperatingCharges", "1,250");

		NormalizedInput input = normalizer.normalize(raw);

		assertThat(input.profitAndLoss().tradingTurnover().exact()).isEqualByComparingTo("123457");
		assertThat(input.profitAndLoss().depreciationExpense().exact()).isEqualByComparingTo("2500");
		assertThat(input.profitAndLoss().staffEmploymentCosts().exact()).isEqualByComparingTo("0");
		assertThat(input.profitAndLoss().otherOperatingCharges().exact()).isEqualByComparingTo("1250");
	}

	@Test
	void keepsMissingLossUsageRequestAsUnlimited() {
		Map<String, Object> raw = baseInput();
		raw.put("tradingLossBF", 30000);
		raw.put("propertyLossUsageRequested", "");

		NormalizedInput input = normalizer.normalize(raw);

		assertThat(input.losses().tradingLossBroughtForward().exact()).isEqualByComparingTo("30000");
		assertThat(input.losses().tradingLossUsageRequested()).isNull();
		assertThat(input.losses().propertyLossUsageRequested()).isNull();
	}

	@Test
	void fallsBackToTotalAiaAdditionsForTrade() {
		Map<String, Object> raw = baseInput();
		raw.put("aiaAdditions", 1500000);
		raw.put("aiaNonTradeAdditions", 2000);

		NormalizedInput input = normalizer.normalize(raw);

		assertThat(input.capitalAllowances().annualInvestmentAllowanceTradeAdditions().exact())
				.isEqualByComparingTo("1500000");
		assertThat(input.capitalAllowances().annualInvestmentAllowanceTotalAdditions().exact())
				.isEqualByComparingTo("1502000");
	}

	@Test
	void readsCheckmarksAndDeclaration() {
		Map<String, Object> raw = baseInput();
		raw.put("box_455_underlying_rate_relief_claim", "X");
		raw.put("reliefCarriedBackToEarlierPeriod", "no");
		raw.put("box_975_name", "A Director");

		NormalizedInput input = normalizer.normalize(raw);

		assertThat(input.ct600().underlyingRateReliefClaim()).isTrue();
		assertThat(input.ct600().reliefCarriedBackToEarlierPeriod()).isFalse();
		assertThat(input.declaration().name()).isEqualTo("A Director");
		assertThat(input.declaration().status()).isEmpty();
	}

	@Test
	void truncatesAndFloorsAssociatedCompanies() {
		Map<String, Object> raw = baseInput();
		raw.put("associatedCompanyCount", "2.9");
		assertThat(normalizer.normalize(raw).associatedCompanyCount()).isEqualTo(2);

		raw.put("associatedCompanyCount", -4);
		assertThat(normalizer.normalize(raw).associatedCompanyCount()).isZero();
	}

	@Test
	void rejectsNonNumericMoney() {
		Map<String, Object> raw = baseInput();
		raw.put("interestIncome", "lots");

		assertThatThrownBy(() -> normalizer.normalize(raw))
				.isInstanceOf(InvalidInputException.class)
				.hasMessageContaining("interestIncome");
	}

	@Test
	void rejectsNonFiniteMoney() {
		Map<String, Object> raw = baseInput();
		raw.put("dividendIncome", Double.NaN);

		assertThatThrownBy(() -> normalizer.normalize(raw))
				.isInstanceOf(InvalidInputException.class)
				.hasMessageContaining("finite");
	}

	@Test
	void rejectsMoneyOutOfRange() {
		Map<String, Object> raw = baseInput();
		raw.put("governmentGrants", "1E999999999");

		assertThatThrownBy(() -> normalizer.normalize(raw))
				.isInstanceOf(InvalidInputException.class)
				.hasMessageContaining("governmentGrants");
	}

	@Test
	void treatsVanishinglySmallMoneyAsZero() {
		Map<String, Object> raw = baseInput();
		raw.put("interestIncome", "1E-999999999");

		assertThat(normalizer.normalize(raw).profitAndLoss().interestIncome().signum()).isZero();
	}

	@Test
	void rejectsAssociatedCompanyCountOutOfRange() {
		Map<String, Object> raw = baseInput();
		raw.put("associatedCompanyCount", "1e12");

		assertThatThrownBy(() -> normalizer.normalize(raw))
				.isInstanceOf(InvalidInputException.class)
				.hasMessageContaining("associatedCompanyCount");
	}

	@Test
	void rejectsMissingOrMalformedDates() {
		Map<String, Object> missing = new HashMap<>();
		missing.put("accountingPeriodEnd", "2025-03-31");
		assertThatThrownBy(() -> normalizer.normalize(missing))
				.isInstanceOf(InvalidInputException.class)
				.hasMessageContaining("accountingPeriodStart");

		Map<String, Object> malformed = baseInput();
		malformed.put("accountingPeriodEnd", "31/03/2025");
		assertThatThrownBy(() -> normalizer.normalize(malformed))
				.isInstanceOf(InvalidInputException.class)
				.hasMessageContaining("YYYY-MM-DD");
	}

	@Test
	void rejectsEndBeforeStart() {
		Map<String, Object> raw = baseInput();
		raw.put("accountingPeriodEnd", "2024-03-31");

		assertThatThrownBy(() -> normalizer.normalize(raw))
				.isInstanceOf(InvalidPeriodException.class);
	}

	private static Map<String, Object> baseInput() {
		Map<String, Object> raw = new HashMap<>();
		raw.put("accountingPeriodStart", "2024-04-01");
		raw.put("accountingPeriodEnd", "2025-03-31");
		return raw;
	}
}
