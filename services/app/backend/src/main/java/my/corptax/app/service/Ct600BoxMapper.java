package my.corptax.app.service;

import my.corptax.app.model.CanonicalResult;
import my.corptax.app.model.Money;
import my.corptax.app.model.NormalizedInput;
import my.corptax.app.service.util.Ratios;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Relabels a canonical result as CT600 boxes. Figures are rounded here and nowhere else; no tax is
 * worked out again.
 */
@Component
public class Ct600BoxMapper {
	private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");
	// Tolerance for split slices whose effective rate drifts slightly above the small profits rate.
	private static final BigDecimal SMALL_RATE_TOLERANCE = new BigDecimal("0.002");
	private static final int MAX_RATE_TABLE_YEARS = 2;
	private static final int MAX_RATE_TABLE_ROWS = 3;
	private static final int[][] RATE_TABLE_BOXES = {
			// year box, profit box, rate box, tax box
			{330, 335, 340, 345},
			{0, 350, 355, 360},
			{0, 365, 370, 375},
			{380, 385, 390, 395},
			{0, 400, 405, 410},
			{0, 415, 420, 425}
	};

	public Map<String, Object> map(NormalizedInput input, CanonicalResult result) {
		Map<String, Object> boxes = new LinkedHashMap<>();
		NormalizedInput.ProfitAndLoss pnl = input.profitAndLoss();
		NormalizedInput.Ct600Supplement ct600 = input.ct600();
		CanonicalResult.Computation computation = result.computation();
		CanonicalResult.Property property = result.property();
		CanonicalResult.Tax tax = result.tax();

		boxes.put("box_30_period_start", input.accountingPeriodStart().toString());
		boxes.put("box_35_period_end", input.accountingPeriodEnd().toString());
		List<Integer> assocYears = new ArrayList<>(new TreeSet<>(result.slices().stream()
				.flatMap(slice -> slice.fyYears().stream())
				.toList()));
		boxes.put("box_326_assoc_companies", assocYears.size() >= 1 ? input.associatedCompanyCount() : "");
		boxes.put("box_327_assoc_companies", assocYears.size() >= 2 ? input.associatedCompanyCount() : "");
		boxes.put("box_328_assoc_companies", assocYears.size() >= 3 ? input.associatedCompanyCount() : "");

		boxes.put("box_145_trade_turnover", roundNonNegative(pnl.tradingTurnover()));
		boxes.put("box_155_trading_profit", roundNonNegative(computation.grossTradingProfit()));
		boxes.put("box_160_trading_losses_bfwd_used", computation.tradingLossUsed().rounded());
		boxes.put("box_165_net_trading_profits", roundNonNegative(computation.taxableTradingProfit()));
		boxes.put("box_170_non_trading_loan_relationship_profits", roundNonNegative(pnl.interestIncome()));
		boxes.put("box_190_property_business_income", roundNonNegative(property.propertyBusinessIncomeForCT600()));
		boxes.put("box_205_income_not_elsewhere", roundNonNegative(computation.miscellaneousIncomeNotElsewhere()));
		boxes.put("box_210_chargeable_gains", roundNonNegative(pnl.chargeableGains()));
		boxes.put("box_235_profits_subtotal", roundNonNegative(computation.profitsSubtotal()));
		boxes.put("box_250_property_business_losses_used", property.propertyLossUsed().rounded());
		boxes.put("box_300_profits_before_deductions", roundNonNegative(computation.profitsSubtotal()));
		boxes.put("box_305_donations", BigDecimal.ZERO);
		boxes.put("box_310_group_relief", BigDecimal.ZERO);
		boxes.put("box_312_other_deductions", BigDecimal.ZERO);
		boxes.put("box_315_taxable_profit", roundNonNegative(computation.taxableTotalProfits()));
		boxes.put("box_620_franked_investment_income_exempt_abgh", roundNonNegative(pnl.dividendIncome()));

		boxes.put("box_329_small_profits_rate_or_marginal_relief_entitlement",
				checkmark(tax.smallProfitsRateOrMarginalReliefEntitlement()));

		fillRateTable(boxes, result.slices());
		BigDecimal box430 = tax.corporationTaxTableTotal().rounded();
		BigDecimal box435 = pence(tax.marginalRelief());
		BigDecimal box440 = tax.corporationTaxChargeable().rounded();
		boxes.put("box_430_corporation_tax", box430);
		boxes.put("box_435_marginal_relief", box435);
		boxes.put("box_440_corporation_tax_chargeable", box440);

		boxes.put("box_445_community_investment_tax_relief", pence(ct600.communityInvestmentTaxRelief()));
		boxes.put("box_450_double_taxation_relief", pence(ct600.doubleTaxationRelief()));
		boxes.put("box_455_underlying_rate_relief_claim", checkmark(ct600.underlyingRateReliefClaim()));
		boxes.put("box_460_relief_carried_back_to_earlier_period", checkmark(ct600.reliefCarriedBackToEarlierPeriod()));
		boxes.put("box_465_advance_corporation_tax", pence(ct600.advanceCorporationTax()));
		boxes.put("box_470_total_reliefs_and_deductions", tax.totalReliefsAndDeductions().rounded());

		boxes.put("box_475_net_ct_liability", tax.netCtLiability().rounded());
		boxes.put("box_480_tax_payable_by_a_close_company", pence(ct600.loansToParticipatorsTax()));
		boxes.put("box_500_cfc_bank_levy_surcharge_and_rpdt", tax.totalBox500Charges().rounded());
		boxes.put("box_501_eogpl_payable", pence(ct600.eogplPayable()));
		boxes.put("box_502_egl_payable", pence(ct600.eglPayable()));
		boxes.put("box_505_supplementary_charge", pence(ct600.supplementaryChargePayable()));
		boxes.put("box_510_total_tax_chargeable", tax.totalTaxChargeable().rounded());
		boxes.put("box_515_income_tax_deducted_from_gross_income", pence(ct600.incomeTaxDeductedFromGrossIncome()));
		boxes.put("box_520_income_tax_repayable", tax.incomeTaxRepayable().rounded());
		boxes.put("box_525_self_assessment_tax_payable", tax.selfAssessmentTaxPayable().rounded());
		boxes.put("box_526_coronavirus_support_payment_overpayment_now_due",
				pence(ct600.coronavirusSupportPaymentOverpaymentNowDue()));
		boxes.put("box_527_restitution_tax", pence(ct600.restitutionTax()));
		boxes.put("box_528_total_self_assessment_tax_payable", tax.totalSelfAssessmentTaxPayable().rounded());

		NormalizedInput.Declaration declaration = input.declaration();
		boxes.put("box_975_name", nullToEmpty(declaration.name()));
		boxes.put("box_980_date", nullToEmpty(declaration.date()));
		boxes.put("box_985_status", nullToEmpty(declaration.status()));

		// Not CT600 boxes; kept for review.
		boxes.put("_marginal_relief_total", tax.marginalRelief().rounded());
		boxes.put("_trading_balancing_charges", pnl.tradingBalancingCharges().rounded());
		boxes.put("_trading_losses_bfwd", computation.tradingLossBroughtForwardAvailable().rounded());
		boxes.put("_trading_losses_used", computation.tradingLossUsed().rounded());
		boxes.put("_trading_losses_available", computation.tradingLossBroughtForwardRemaining().rounded());
		boxes.put("_property_losses_bfwd", property.propertyLossBroughtForward().rounded());
		boxes.put("_property_losses_used", property.propertyLossUsed().rounded());
		boxes.put("_property_losses_available", property.propertyLossAvailable().rounded());
		boxes.put("_property_losses_cfwd", property.propertyLossCarriedForward().rounded());
		boxes.put("_engine_corporation_tax_charge", tax.corporationTaxCharge().rounded());
		// Box 430 less box 435 should equal box 440.
		BigDecimal integrityDelta = box430.subtract(box435).subtract(box440).setScale(2, RoundingMode.HALF_UP);
		boxes.put("_integrity_box_430_minus_435_equals_440",
				integrityDelta.abs().compareTo(new BigDecimal("0.01")) < 0 ? "X" : "");
		boxes.put("_integrity_box_430_435_440_delta", integrityDelta);
		return boxes;
	}

	private void fillRateTable(Map<String, Object> boxes, List<CanonicalResult.SliceResult> slices) {
		Map<Integer, Map<BigDecimal, RateRow>> byYear = new TreeMap<>();
		for (CanonicalResult.SliceResult slice : slices) {
			RateRow row = toRateRow(slice);
			if (row == null) {
				continue;
			}
			byYear.computeIfAbsent(slice.fyYear(), year -> new TreeMap<>())
					.merge(row.ratePct().setScale(4, RoundingMode.HALF_UP), row, RateRow::plus);
		}
		List<Integer> years = byYear.keySet().stream().limit(MAX_RATE_TABLE_YEARS).toList();
		for (int i = 0; i < RATE_TABLE_BOXES.length; i++) {
			int[] rowBoxes = RATE_TABLE_BOXES[i];
			int groupIndex = i / MAX_RATE_TABLE_ROWS;
			int rowIndex = i % MAX_RATE_TABLE_ROWS;
			Integer year = groupIndex < years.size() ? years.get(groupIndex) : null;
			List<RateRow> rows = year == null ? List.of() : new ArrayList<>(byYear.get(year).values());
			RateRow row = rowIndex < rows.size() ? rows.get(rowIndex) : null;
			if (rowBoxes[0] != 0) {
				boxes.put("box_" + rowBoxes[0] + "_financial_year", year == null ? "" : year);
			}
			boxes.put("box_" + rowBoxes[1] + "_profits_chargeable_at_corresponding_rate",
					row == null ? pence(Money.ZERO) : pence(row.profit()));
			boxes.put("box_" + rowBoxes[2] + "_corresponding_rate",
					row == null ? pence(Money.ZERO) : row.ratePct().setScale(2, RoundingMode.HALF_UP));
			boxes.put("box_" + rowBoxes[3] + "_tax", row == null ? pence(Money.ZERO) : pence(row.taxBeforeRelief()));
		}
	}

	/**
	 * A slice taxed with marginal relief is shown at the main rate, since box 435 carries the relief.
	 * Otherwise the slice is shown at whichever configured rate its effective rate matches.
	 */
	static RateRow toRateRow(CanonicalResult.SliceResult slice) {
		Money taxable = slice.taxableProfit().atLeastZero();
		if (!taxable.isPositive()) {
			return null;
		}
		BigDecimal smallRate = slice.smallRate();
		BigDecimal mainRate = slice.mainRate();
		BigDecimal rate;
		if (slice.marginalRelief().isPositive() && mainRate.signum() > 0) {
			rate = mainRate;
		} else {
			BigDecimal effective = Ratios.fraction(slice.ctCharge().atLeastZero().exact(), taxable.exact());
			if (smallRate.signum() > 0 && mainRate.compareTo(smallRate) > 0
					&& effective.compareTo(smallRate.add(SMALL_RATE_TOLERANCE)) <= 0) {
				rate = smallRate;
			} else if (mainRate.signum() > 0) {
				rate = mainRate;
			} else {
				rate = effective;
			}
		}
		return new RateRow(taxable, rate.multiply(ONE_HUNDRED), taxable.times(rate));
	}

	private static BigDecimal roundNonNegative(Money value) {
		return value.atLeastZero().rounded();
	}

	private static BigDecimal pence(Money value) {
		return value.exact().setScale(2, RoundingMode.HALF_UP);
	}

	private static String checkmark(boolean value) {
		return value ? "X" : "";
	}

	private static String nullToEmpty(String value) {
		return value == null ? "" : value;
	}

	record RateRow(
			Money profit,
			BigDecimal ratePct,
			Money taxBeforeRelief
	) {
		RateRow plus(RateRow other) {
			return new RateRow(profit.plus(other.profit()), ratePct, taxBeforeRelief.plus(other.taxBeforeRelief()));
		}
	}
}
