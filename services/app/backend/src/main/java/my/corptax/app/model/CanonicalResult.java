package my.corptax.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Sole output of the engine and sole input of the form mappers. Built once per computation and never
 * mutated afterwards; mappers relabel these figures and must not recompute tax.
 */
public record CanonicalResult(
		Accounts accounts,
		Property property,
		Computation computation,
		Tax tax,
		List<PeriodResult> periods,
		List<SliceResult> slices,
		Metadata metadata
) {
	public CanonicalResult {
		periods = List.copyOf(periods);
		slices = List.copyOf(slices);
	}

	public record Accounts(
			Money totalIncome,
			Money totalExpenses,
			Money profitBeforeTax
	) {
	}

	public record Property(
			Money rentalIncome,
			Money propertyLossBroughtForward,
			Money propertyProfitAfterLossOffset,
			Money propertyBusinessIncomeForCT600,
			Money propertyLossUsed,
			Money propertyLossAvailable,
			@JsonProperty("propertyLossCF") Money propertyLossCarriedForward
	) {
	}

	public record Computation(
			Money addBacks,
			Money deductions,
			Money capitalAllowances,
			Money tradingLossUsed,
			Money tradingLossBroughtForwardAvailable,
			Money tradingLossBroughtForwardRemaining,
			Money tradingLossCurrentPeriodIncurred,
			Money tradingLossCarriedForward,
			Money taxableTradingProfit,
			Money taxableNonTradingProfits,
			Money taxableTotalProfits,
			Money augmentedProfits,
			Money grossTradingProfit,
			Money profitsSubtotal,
			Money subtotalBeforeDeductions,
			Money totalTradingIncome,
			Money nonTradingIncomeExcludedFromTradingView,
			Money totalOtherIncome,
			Money miscellaneousIncomeNotElsewhere,
			Money aiaTotalCap,
			Money aiaRequestedTotal,
			Money aiaUnrelievedBroughtForwardTotal,
			List<AiaPart> aiaPartsByFy
	) {
		public Computation {
			aiaPartsByFy = List.copyOf(aiaPartsByFy);
		}
	}

	public record AiaPart(
			int fyYear,
			List<Integer> fyYears,
			int periodIndex,
			int sliceIndex,
			int apDaysInFy,
			Money aiaLimitProRated,
			Money aiaClaimRequested,
			Money aiaAllowanceClaimed,
			Money aiaUnrelievedBroughtForward
	) {
	}

	public record Tax(
			Money corporationTaxCharge,
			Money marginalRelief,
			Money corporationTaxChargeable,
			Money corporationTaxTableTotal,
			Money totalReliefsAndDeductions,
			Money totalBox500Charges,
			@JsonProperty("netCTLiability") Money netCtLiability,
			Money totalTaxChargeable,
			Money incomeTaxRepayable,
			Money selfAssessmentTaxPayable,
			Money totalSelfAssessmentTaxPayable,
			Money taxPayable,
			boolean smallProfitsRateOrMarginalReliefEntitlement
	) {
	}

	public record PeriodResult(
			int periodIndex,
			String periodName,
			LocalDate periodStart,
			LocalDate periodEnd,
			int days,
			boolean shortPeriod,
			Money profitBeforeTax,
			Money addBacks,
			Money tradingProfitBeforeAia,
			Money nonTradingProfitBeforeAia,
			Money taxableBeforeLoss,
			Money tradingProfitAfterLoss,
			Money nonTradingProfitAfterAia,
			Money taxableProfit,
			Money augmentedProfit,
			Money chargeableGainsRingFenced,
			Money propertyRentalGross,
			Money propertyProfitAfterAia,
			Money propertyProfitAfterLoss,
			Money propertyLossUsedAgainstPropertyStream,
			LossPool tradingLoss,
			LossPool propertyLoss,
			AiaAllocation aia,
			Money ctCharge,
			Money marginalRelief,
			List<SliceResult> slices
	) {
		public PeriodResult {
			slices = List.copyOf(slices);
		}
	}

	public record AiaAllocation(
			Money cap,
			Money tradeAdditionsShare,
			Money nonTradeAdditionsShare,
			Money tradeClaim,
			Money nonTradeClaim
	) {
		public Money additionsShare() {
			return tradeAdditionsShare.plus(nonTradeAdditionsShare);
		}

		public Money totalClaim() {
			return tradeClaim.plus(nonTradeClaim);
		}
	}

	public record Thresholds(
			Money lower,
			Money upper
	) {
	}

	public record SliceResult(
			int periodIndex,
			String periodName,
			int sliceIndex,
			String sliceName,
			LocalDate sliceStart,
			LocalDate sliceEnd,
			int fyYear,
			List<Integer> fyYears,
			int apDaysInFy,
			Thresholds thresholds,
			Money aiaCapForFy,
			Money taxableProfit,
			Money augmentedProfit,
			Money ctCharge,
			Money marginalRelief,
			@JsonProperty("small_rate") BigDecimal smallRate,
			@JsonProperty("main_rate") BigDecimal mainRate,
			@JsonProperty("relief_fraction") BigDecimal reliefFraction,
			BigDecimal effectiveTaxRate,
			Money corporationTaxAtMainRate,
			boolean regimeGrouped,
			List<FyComponent> fyComponents
	) {
		public SliceResult {
			fyYears = List.copyOf(fyYears);
			fyComponents = List.copyOf(fyComponents);
		}
	}

	public record FyComponent(
			int componentIndex,
			int fyYear,
			LocalDate sliceStart,
			LocalDate sliceEnd,
			int apDaysInFy,
			Money taxableProfit,
			Money augmentedProfit,
			Thresholds thresholds,
			Money aiaCapForFy
	) {
	}

	public record LossPoolSummary(
			Money broughtForward,
			Money broughtForwardRemaining,
			Money currentPeriodIncurred,
			Money carriedForward,
			Money usageRequested,
			Money usageRequestRemaining
	) {
	}

	public record Metadata(
			int apDays,
			boolean apSplit,
			String periodSliceStructureNote,
			String lossReliefNote,
			String aiaAllocationNote,
			LossPoolSummary tradingLoss,
			LossPoolSummary propertyLoss
	) {
	}
}
