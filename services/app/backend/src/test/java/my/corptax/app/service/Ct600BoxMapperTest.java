package my.corptax.app.service;

import my.corptax.app.model.EngineRun;
import my.corptax.app.support.TestEngines;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class Ct600BoxMapperTest {
	private final CorporationTaxEngine engine = TestEngines.engine();
	private final Ct600BoxMapper mapper = new Ct600BoxMapper();

	@Test
	void mapsMarginalReliefComputation() {
		Map<String, Object> boxes = map(input("2024-04-01", "2025-03-31", 250000, 150000));

		assertThat(boxes.get("box_30_period_start")).isEqualTo("2024-04-01");
		assertThat(boxes.get("box_35_period_end")).isEqualTo("2025-03-31");
		assertThat(boxes.get("box_326_assoc_companies")).isEqualTo(0);
		assertThat(boxes.get("box_327_assoc_companies")).isEqualTo("");
		assertThat(decimal(boxes, "box_145_trade_turnover")).isEqualByComparingTo("250000");
		assertThat(decimal(boxes, "box_155_trading_profit")).isEqualByComparingTo("100000");
		assertThat(decimal(boxes, "box_165_net_trading_profits")).isEqualByComparingTo("100000");
		assertThat(decimal(boxes, "box_315_taxable_profit")).isEqualByComparingTo("100000");
		assertThat(boxes.get("box_329_small_profits_rate_or_marginal_relief_entitlement")).isEqualTo("X");
		assertThat(boxes.get("box_330_financial_year")).isEqualTo(2024);
		assertThat(decimal(boxes, "box_335_profits_chargeable_at_corresponding_rate")).isEqualByComparingTo("100000");
		assertThat(decimal(boxes, "box_340_corresponding_rate")).isEqualByComparingTo("25");
		assertThat(decimal(boxes, "box_345_tax")).isEqualByComparingTo("25000");
		assertThat(decimal(boxes, "box_350_profits_chargeable_at_corresponding_rate")).isEqualByComparingTo("0");
		assertThat(boxes.get("box_380_financial_year")).isEqualTo("");
		assertThat(decimal(boxes, "box_430_corporation_tax")).isEqualByComparingTo("25000");
		assertThat(decimal(boxes, "box_435_marginal_relief")).isEqualByComparingTo("2250");
		assertThat(decimal(boxes, "box_440_corporation_tax_chargeable")).isEqualByComparingTo("22750");
		assertThat(decimal(boxes, "box_475_net_ct_liability")).isEqualByComparingTo("22750");
		assertThat(decimal(boxes, "box_528_total_self_assessment_tax_payable")).isEqualByComparingTo("22750");
		assertThat(boxes.get("_integrity_box_430_minus_435_equals_440")).isEqualTo("X");
	}

	@Test
	void showsSmallProfitsSliceAtSmallRate() {
		Map<String, Object> boxes = map(input("2024-04-01", "2025-03-31", 100000, 75000));

		assertThat(decimal(boxes, "box_340_corresponding_rate")).isEqualByComparingTo("19");
		assertThat(decimal(boxes, "box_345_tax")).isEqualByComparingTo("4750");
		assertThat(decimal(boxes, "box_430_corporation_tax")).isEqualByComparingTo("4750");
		assertThat(decimal(boxes, "box_435_marginal_relief")).isEqualByComparingTo("0");
	}

	@Test
	void fillsOneRateGroupPerFinancialYear() {
		Map<String, Object> boxes = map(input("2022-10-01", "2023-09-30", 40000, 0));

		assertThat(boxes.get("box_326_assoc_companies")).isEqualTo(0);
		assertThat(boxes.get("box_327_assoc_companies")).isEqualTo(0);
		assertThat(boxes.get("box_328_assoc_companies")).isEqualTo("");
		assertThat(boxes.get("box_330_financial_year")).isEqualTo(2022);
		assertThat(boxes.get("box_380_financial_year")).isEqualTo(2023);
		assertThat(decimal(boxes, "box_340_corresponding_rate")).isEqualByComparingTo("19");
		assertThat(decimal(boxes, "box_390_corresponding_rate")).isEqualByComparingTo("19");
		BigDecimal profits = decimal(boxes, "box_335_profits_chargeable_at_corresponding_rate")
				.add(decimal(boxes, "box_385_profits_chargeable_at_corresponding_rate"));
		assertThat(profits).isEqualByComparingTo("40000");
	}

	@Test
	void carriesSupplementaryBoxesThroughTaxChain() {
		Map<String, Object> raw = input("2024-04-01", "2025-03-31", 100000, 75000);
		raw.put("communityInvestmentTaxRelief", 101);
		raw.put("loansToParticipatorsTax", 500);
		raw.put("bankLevyPayable", 200);
		raw.put("incomeTaxDeductedFromGrossIncome", 49);
		raw.put("restitutionTax", 10);
		raw.put("underlyingRateReliefClaim", true);
		raw.put("declarationName", "A Director");

		Map<String, Object> boxes = map(raw);

		assertThat(decimal(boxes, "box_445_community_investment_tax_relief")).isEqualByComparingTo("101.00");
		assertThat(decimal(boxes, "box_470_total_reliefs_and_deductions")).isEqualByComparingTo("101");
		assertThat(decimal(boxes, "box_475_net_ct_liability")).isEqualByComparingTo("4649");
		assertThat(decimal(boxes, "box_500_cfc_bank_levy_surcharge_and_rpdt")).isEqualByComparingTo("200");
		assertThat(decimal(boxes, "box_510_total_tax_chargeable")).isEqualByComparingTo("5349");
		assertThat(decimal(boxes, "box_525_self_assessment_tax_payable")).isEqualByComparingTo("5300");
		assertThat(decimal(boxes, "box_528_total_self_assessment_tax_payable")).isEqualByComparingTo("5310");
		assertThat(decimal(boxes, "box_520_income_tax_repayable")).isEqualByComparingTo("0");
		assertThat(boxes.get("box_455_underlying_rate_relief_claim")).isEqualTo("X");
		assertThat(boxes.get("box_460_relief_carried_back_to_earlier_period")).isEqualTo("");
		assertThat(boxes.get("box_975_name")).isEqualTo("A Director");
	}

	@Test
	void reportsLossesInTransparencyKeys() {
		Map<String, Object> raw = input("2024-04-01", "2025-03-31", 150000, 95000);
		raw.put("tradingLossBroughtForward", 40000);
		raw.put("propertyLossBroughtForward", 3000);
		raw.put("propertyIncome", 2000);

		Map<String, Object> boxes = map(raw);

		assertThat(decimal(boxes, "box_160_trading_losses_bfwd_used")).isEqualByComparingTo("40000");
		assertThat(decimal(boxes, "_trading_losses_bfwd")).isEqualByComparingTo("40000");
		assertThat(decimal(boxes, "box_250_property_business_losses_used")).isEqualByComparingTo("3000");
		assertThat(decimal(boxes, "_property_losses_cfwd")).isEqualByComparingTo("0");
		assertThat(decimal(boxes, "box_315_taxable_profit")).isEqualByComparingTo("14000");
	}

	private Map<String, Object> map(Map<String, Object> raw) {
		EngineRun run = engine.run(raw);
		return mapper.map(run.normalizedInput(), run.result());
	}

	private static BigDecimal decimal(Map<String, Object> boxes, String key) {
		assertThat(boxes).containsKey(key);
		return (BigDecimal) boxes.get(key);
	}

	private static Map<String, Object> input(String start, String end, long turnover, long costs) {
		Map<String, Object> raw = new HashMap<>();
		raw.put("accountingPeriodStart", start);
		raw.put("accountingPeriodEnd", end);
		raw.put("tradingTurnover", turnover);
		raw.put("otherOperatingCharges", costs);
		return raw;
	}
}
