package my.corptax.app.service;

import my.corptax.app.model.AccountingPeriod;
import my.corptax.app.model.CalculationSlice;
import my.corptax.app.model.CanonicalResult;
import my.corptax.app.model.FySlice;
import my.corptax.app.model.Money;
import my.corptax.app.model.NormalizedInput;
import my.corptax.app.service.util.Ratios;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Builds the per-slice and per-period audit records and sums them into the canonical result. Totals
 * are always taken over exact amounts; rounding happens when figures are written out.
 */
@Service
public class ResultAggregator {
	static final String PERIOD_SLICE_STRUCTURE_NOTE = "Period 1/2 are submission periods (>12 months only). "
			+ "Slice 1/2 are tax-regime slices within each period.";
	static final String LOSS_RELIEF_NOTE = "Trading losses brought forward are applied against taxable trading "
			+ "profits only. Current-period losses are set against other profits of the same period and the "
			+ "unrelieved balance is carried forward. Property losses are claimable against total profits "
			+ "(subject to availability and claim).";
	static final String AIA_ALLOCATION_NOTE = "Per-slice requested/claimed/unrelieved figures are allocated by "
			+ "AIA cap-share for reporting.";

	public CanonicalResult.SliceResult slice(AccountingPeriod period, int sliceIndex, CalculationSlice slice,
			CorporationTaxCalculator.TaxComputation tax) {
		BigDecimal mainRate = slice.regime().mainRate();
		List<CanonicalResult.FyComponent> components = new ArrayList<>();
		int componentIndex = 1;
		for (FySlice component : slice.components()) {
			components.add(new CanonicalResult.FyComponent(
					componentIndex++,
					component.fyYear(),
					component.overlap().overlapStart(),
					component.overlap().overlapEnd(),
					component.days(),
					component.taxableProfit(),
					component.augmentedProfit(),
					new CanonicalResult.Thresholds(component.lowerThreshold(), component.upperThreshold()),
					component.aiaCap()));
		}
		List<Integer> fyYears = slice.fyYears();
		return new CanonicalResult.SliceResult(
				period.index(),
				period.name(),
				sliceIndex,
				"Slice " + sliceIndex,
				slice.start(),
				slice.end(),
				fyYears.get(0),
				fyYears,
				slice.days(),
				new CanonicalResult.Thresholds(slice.lowerThreshold(), slice.upperThreshold()),
				slice.aiaCap(),
				tax.taxableProfit(),
				tax.augmentedProfit(),
				tax.charge(),
				tax.marginalRelief(),
				slice.regime().smallRate(),
				mainRate,
				slice.regime().reliefFraction(),
				Ratios.fraction(tax.charge().exact(), tax.taxableProfit().exact()),
				tax.taxableProfit().times(mainRate),
				fyYears.size() > 1,
				components);
	}

	public CanonicalResult.PeriodResult period(AccountingPeriod period, ProfitClassifier.ClassifiedProfit profit,
			LossReliefSequencer.PeriodRelief relief, Money augmentedProfit,
			List<CanonicalResult.SliceResult> slices) {
		Money propertyUsed = relief.propertyLoss().used();
		Money usedAgainstProperty = propertyUsed.min(profit.rentalGross().atLeastZero());
		return new CanonicalResult.PeriodResult(
				period.index(),
				period.name(),
				period.start(),
				period.end(),
				period.days(),
				period.shortPeriod(),
				profit.profitBeforeTax(),
				profit.addBacks(),
				profit.tradingBeforeAia(),
				profit.nonTradingBeforeAia(),
				profit.taxableBeforeLoss(),
				relief.tradingAfterLoss(),
				profit.nonTradingAfterAia(),
				relief.taxableProfit(),
				augmentedProfit,
				profit.gainsRingFenceAdjustment(),
				profit.rentalGross(),
				profit.propertyAfterAia(),
				profit.rentalGross().minus(usedAgainstProperty).atLeastZero(),
				usedAgainstProperty,
				relief.tradingLoss(),
				relief.propertyLoss(),
				profit.aia(),
				sum(slices, CanonicalResult.SliceResult::ctCharge),
				sum(slices, CanonicalResult.SliceResult::marginalRelief),
				slices);
	}

	public CanonicalResult aggregate(NormalizedInput input, List<CanonicalResult.PeriodResult> periods,
			LossReliefSequencer losses) {
		NormalizedInput.ProfitAndLoss pnl = input.profitAndLoss();
		List<CanonicalResult.SliceResult> slices = periods.stream().flatMap(period -> period.slices().stream()).toList();

		Money profitBeforeTax = pnl.totalIncome().minus(pnl.totalExpenses());
		CanonicalResult.Accounts accounts = new CanonicalResult.Accounts(
				pnl.totalIncome(),
				pnl.totalExpenses(),
				profitBeforeTax);

		Money propertyBusinessIncome = sum(periods, CanonicalResult.PeriodResult::propertyProfitAfterAia).atLeastZero();
		Money propertyLossUsed = sum(periods, period -> period.propertyLoss().used());
		CanonicalResult.Property property = new CanonicalResult.Property(
				pnl.propertyIncome(),
				losses.propertyBroughtForward(),
				sum(periods, CanonicalResult.PeriodResult::propertyProfitAfterLoss),
				propertyBusinessIncome,
				propertyLossUsed,
				losses.propertyPool(),
				losses.propertyPool());

		Money addBacks = sum(periods, CanonicalResult.PeriodResult::addBacks);
		Money capitalAllowances = sum(periods, period -> period.aia().totalClaim());
		Money tradingLossUsed = sum(periods, period -> period.tradingLoss().used());
		Money tradingLossIncurred = sum(periods, period -> period.tradingLoss().currentPeriodIncurred());
		Money broughtForwardRemaining = losses.tradingBroughtForward().minus(tradingLossUsed).atLeastZero();
		Money taxableTradingProfit = sum(periods, CanonicalResult.PeriodResult::tradingProfitAfterLoss);
		Money taxableNonTradingProfits = sum(periods, CanonicalResult.PeriodResult::nonTradingProfitAfterAia);
		Money taxableTotalProfits = sum(periods, CanonicalResult.PeriodResult::taxableProfit).atLeastZero();
		Money chargeableGains = pnl.chargeableGains().atLeastZero();

		Money aiaTotalCap = sum(slices, CanonicalResult.SliceResult::aiaCapForFy);
		Money aiaRequested = input.capitalAllowances().annualInvestmentAllowanceTotalAdditions().atLeastZero();
		Money aiaUnrelieved = aiaRequested.minus(capitalAllowances).atLeastZero();

		CanonicalResult.Computation computation = new CanonicalResult.Computation(
				addBacks,
				capitalAllowances,
				capitalAllowances,
				tradingLossUsed,
				losses.tradingBroughtForward(),
				broughtForwardRemaining,
				tradingLossIncurred,
				losses.tradingPool(),
				taxableTradingProfit,
				taxableNonTradingProfits,
				taxableTotalProfits,
				taxableTotalProfits.plus(pnl.dividendIncome()),
				taxableTradingProfit.plus(tradingLossUsed),
				taxableTradingProfit.plus(taxableNonTradingProfits),
				profitBeforeTax.plus(addBacks),
				pnl.tradingTurnover().plus(pnl.governmentGrants()).plus(pnl.tradingBalancingCharges()),
				pnl.interestIncome().plus(pnl.propertyIncome()).plus(pnl.chargeableGains()),
				propertyBusinessIncome.plus(pnl.interestIncome()).plus(chargeableGains).plus(pnl.dividendIncome()),
				Money.ZERO,
				aiaTotalCap,
				aiaRequested,
				aiaUnrelieved,
				aiaParts(slices, aiaRequested, capitalAllowances, aiaUnrelieved));

		CanonicalResult.Tax tax = tax(input.ct600(),
				sum(slices, CanonicalResult.SliceResult::ctCharge),
				sum(slices, CanonicalResult.SliceResult::marginalRelief),
				slices.stream().anyMatch(ResultAggregator::hasSmallProfitsOrMarginalReliefEntitlement));

		CanonicalResult.Metadata metadata = new CanonicalResult.Metadata(
				input.accountingPeriodDays(),
				periods.size() > 1,
				PERIOD_SLICE_STRUCTURE_NOTE,
				LOSS_RELIEF_NOTE,
				AIA_ALLOCATION_NOTE,
				new CanonicalResult.LossPoolSummary(
						losses.tradingBroughtForward(),
						broughtForwardRemaining,
						tradingLossIncurred,
						losses.tradingPool(),
						losses.tradingRequested(),
						requestRemaining(losses.tradingRequestRemaining(), losses.tradingRequested(), tradingLossUsed)),
				new CanonicalResult.LossPoolSummary(
						losses.propertyBroughtForward(),
						losses.propertyBroughtForward().minus(propertyLossUsed).atLeastZero(),
						sum(periods, period -> period.propertyLoss().currentPeriodIncurred()),
						losses.propertyPool(),
						losses.propertyRequested(),
						requestRemaining(losses.propertyRequestRemaining(), losses.propertyRequested(), propertyLossUsed)));

		return new CanonicalResult(accounts, property, computation, tax, periods, slices, metadata);
	}

	static CanonicalResult.Tax tax(NormalizedInput.Ct600Supplement ct600, Money charge, Money marginalRelief,
			boolean entitlement) {
		Money reliefs = ct600.communityInvestmentTaxRelief()
				.plus(ct600.doubleTaxationRelief())
				.plus(ct600.advanceCorporationTax());
		Money box500 = ct600.controlledForeignCompaniesTax()
				.plus(ct600.bankLevyPayable())
				.plus(ct600.bankSurchargePayable())
				.plus(ct600.residentialPropertyDeveloperTax());
		Money netLiability = charge.minus(reliefs).atLeastZero();
		Money totalTaxChargeable = netLiability
				.plus(ct600.loansToParticipatorsTax())
				.plus(box500)
				.plus(ct600.eogplPayable())
				.plus(ct600.eglPayable())
				.plus(ct600.supplementaryChargePayable());
		Money incomeTaxDeducted = ct600.incomeTaxDeductedFromGrossIncome();
		Money selfAssessmentPayable = totalTaxChargeable.minus(incomeTaxDeducted).atLeastZero();
		Money totalSelfAssessmentPayable = selfAssessmentPayable
				.plus(ct600.coronavirusSupportPaymentOverpaymentNowDue())
				.plus(ct600.restitutionTax());
		return new CanonicalResult.Tax(
				charge,
				marginalRelief,
				charge,
				charge.plus(marginalRelief),
				reliefs,
				box500,
				netLiability,
				totalTaxChargeable,
				incomeTaxDeducted.minus(totalTaxChargeable).atLeastZero(),
				selfAssessmentPayable,
				totalSelfAssessmentPayable,
				totalSelfAssessmentPayable,
				entitlement);
	}

	static boolean hasSmallProfitsOrMarginalReliefEntitlement(CanonicalResult.SliceResult slice) {
		if (!slice.taxableProfit().isPositive()) {
			return false;
		}
		BigDecimal smallRate = slice.smallRate();
		BigDecimal mainRate = slice.mainRate();
		if (smallRate.signum() <= 0 || mainRate.compareTo(smallRate) <= 0) {
			return false;
		}
		Money upper = slice.thresholds().upper();
		if (!upper.isPositive()) {
			return slice.marginalRelief().isPositive();
		}
		return slice.augmentedProfit().compareTo(upper) < 0;
	}

	static List<CanonicalResult.AiaPart> aiaParts(List<CanonicalResult.SliceResult> slices, Money requested,
			Money claimed, Money unrelieved) {
		List<Money> weights = slices.stream().map(CanonicalResult.SliceResult::aiaCapForFy).toList();
		List<Money> requestedParts = allocateByWeight(requested, weights);
		List<Money> claimedParts = allocateByWeight(claimed, weights);
		List<Money> unrelievedParts = allocateByWeight(unrelieved, weights);
		List<CanonicalResult.AiaPart> parts = new ArrayList<>(slices.size());
		for (int i = 0; i < slices.size(); i++) {
			CanonicalResult.SliceResult slice = slices.get(i);
			parts.add(new CanonicalResult.AiaPart(
					slice.fyYear(),
					slice.fyYears(),
					slice.periodIndex(),
					slice.sliceIndex(),
					slice.apDaysInFy(),
					slice.aiaCapForFy(),
					requestedParts.get(i),
					claimedParts.get(i),
					unrelievedParts.get(i)));
		}
		return parts;
	}

	/**
	 * Splits a total into whole pounds by weight for display. The last row takes whatever is left so
	 * the parts always add up to the rounded total.
	 */
	static List<Money> allocateByWeight(Money total, List<Money> weights) {
		BigDecimal weightTotal = Money.sum(weights).exact();
		BigDecimal remaining = total.rounded();
		List<Money> parts = new ArrayList<>(weights.size());
		for (int i = 0; i < weights.size(); i++) {
			BigDecimal allocated;
			if (i == weights.size() - 1) {
				allocated = remaining;
			} else {
				allocated = total.times(Ratios.fraction(weights.get(i).exact(), weightTotal)).exact()
						.setScale(0, RoundingMode.HALF_UP);
			}
			remaining = remaining.subtract(allocated);
			parts.add(Money.of(allocated));
		}
		return parts;
	}

	private static Money requestRemaining(Money tracked, Money requested, Money used) {
		return tracked != null ? tracked : requested.minus(used).atLeastZero();
	}

	private static <T> Money sum(List<T> items, Function<T, Money> value) {
		return Money.sum(items.stream().map(value).toList());
	}
}
