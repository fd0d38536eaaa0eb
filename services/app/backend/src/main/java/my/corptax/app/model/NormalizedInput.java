package my.corptax.app.model;

import java.time.LocalDate;

/**
 * Strongly typed, alias-free view of one computation request. Money amounts are whole pounds.
 * A {@code null} loss usage request means "use as much as is available".
 */
public record NormalizedInput(
		LocalDate accountingPeriodStart,
		LocalDate accountingPeriodEnd,
		int accountingPeriodDays,
		int associatedCompanyCount,
		ProfitAndLoss profitAndLoss,
		Adjustments adjustments,
		CapitalAllowances capitalAllowances,
		Losses losses,
		Ct600Supplement ct600,
		Declaration declaration
) {
	public record ProfitAndLoss(
			Money tradingTurnover,
			Money governmentGrants,
			Money propertyIncome,
			Money interestIncome,
			Money tradingBalancingCharges,
			Money chargeableGains,
			String chargeableGainsComputationFileName,
			Money dividendIncome,
			Money costOfGoodsSold,
			Money staffEmploymentCosts,
			Money depreciationExpense,
			Money otherOperatingCharges
	) {
		public Money totalIncome() {
			return tradingTurnover.plus(governmentGrants)
					.plus(propertyIncome)
					.plus(interestIncome)
					.plus(tradingBalancingCharges)
					.plus(chargeableGains);
		}

		public Money totalExpenses() {
			return costOfGoodsSold.plus(staffEmploymentCosts)
					.plus(depreciationExpense)
					.plus(otherOperatingCharges);
		}
	}

	public record Adjustments(
			Money disallowableExpenditure,
			Money otherTaxAdjustmentsAddBack
	) {
	}

	public record CapitalAllowances(
			Money annualInvestmentAllowanceTradeAdditions,
			Money annualInvestmentAllowanceNonTradeAdditions
	) {
		public Money annualInvestmentAllowanceTotalAdditions() {
			return annualInvestmentAllowanceTradeAdditions.plus(annualInvestmentAllowanceNonTradeAdditions);
		}
	}

	public record Losses(
			Money tradingLossBroughtForward,
			Money tradingLossUsageRequested,
			Money propertyLossBroughtForward,
			Money propertyLossUsageRequested
	) {
	}

	public record Ct600Supplement(
			Money communityInvestmentTaxRelief,
			Money doubleTaxationRelief,
			Money advanceCorporationTax,
			Money loansToParticipatorsTax,
			Money controlledForeignCompaniesTax,
			Money bankLevyPayable,
			Money bankSurchargePayable,
			Money residentialPropertyDeveloperTax,
			Money eogplPayable,
			Money eglPayable,
			Money supplementaryChargePayable,
			Money incomeTaxDeductedFromGrossIncome,
			Money coronavirusSupportPaymentOverpaymentNowDue,
			Money restitutionTax,
			boolean underlyingRateReliefClaim,
			boolean reliefCarriedBackToEarlierPeriod
	) {
	}

	public record Declaration(
			String name,
			String date,
			String status
	) {
	}
}
