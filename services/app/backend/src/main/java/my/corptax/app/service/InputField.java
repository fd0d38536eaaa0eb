package my.corptax.app.service;

import java.util.List;

/**
 * Crosswalk of every accepted input key. Each logical field has one canonical name; the legacy names
 * listed after it are only consulted, in order, when no earlier name is present.
 */
public enum InputField {
	ACCOUNTING_PERIOD_START("accountingPeriodStart", "apStart", "box_30_period_start"),
	ACCOUNTING_PERIOD_END("accountingPeriodEnd", "apEnd", "box_35_period_end"),
	ASSOCIATED_COMPANY_COUNT("associatedCompanyCount", "assocCompanies", "box_326_assoc_companies"),

	TRADING_TURNOVER("tradingTurnover", "turnover", "val_turnover"),
	GOVERNMENT_GRANTS("governmentGrants", "govtGrants", "box_325_govt_grants"),
	PROPERTY_INCOME("propertyIncome", "rentalIncome", "box_190_rental_income"),
	INTEREST_INCOME("interestIncome", "box_170_interest_income"),
	TRADING_BALANCING_CHARGES("tradingBalancingCharges", "disposalGains", "balancingChargesTrade",
			"assetDisposalsBalancingCharge", "box_205_disposal_gains"),
	CHARGEABLE_GAINS("chargeableGains", "capitalGains", "box_210_chargeable_gains"),
	CHARGEABLE_GAINS_COMPUTATION_FILE_NAME("chargeableGainsComputationFileName", "capitalGainsFileName",
			"capital_gains_source_file"),
	DIVIDEND_INCOME("dividendIncome", "box_620_dividend_income"),

	COST_OF_GOODS_SOLD("costOfGoodsSold", "costOfSales", "val_cost_of_sales"),
	STAFF_EMPLOYMENT_COSTS("staffEmploymentCosts", "staffCosts", "val_staff_costs"),
	DEPRECIATION_EXPENSE("depreciationExpense", "depreciation", "val_depreciation_acc"),
	OTHER_OPERATING_CHARGES("otherOperatingCharges", "otherCharges", "val_other_charges"),

	DISALLOWABLE_EXPENDITURE("disallowableExpenditure", "disallowableExpenses", "val_disallowable_expenses"),
	OTHER_TAX_ADJUSTMENTS_ADD_BACK("otherTaxAdjustmentsAddBack", "otherAdjustments", "val_other_adjustments"),

	AIA_TRADE_ADDITIONS("annualInvestmentAllowanceTradeAdditions", "aiaTradeAdditions", "aiaTrade",
			"box_670_aia_trade_additions", "box_670_aia_additions"),
	AIA_NON_TRADE_ADDITIONS("annualInvestmentAllowanceNonTradeAdditions", "aiaNonTradeAdditions", "aiaNonTrade",
			"box_671_aia_non_trade_additions"),
	AIA_TOTAL_ADDITIONS("annualInvestmentAllowanceTotalAdditions", "aiaAdditions", "box_670_aia_additions"),

	TRADING_LOSS_BROUGHT_FORWARD("tradingLossBroughtForward", "tradingLossBF", "box_160_trading_losses_bfwd"),
	TRADING_LOSS_USAGE_REQUESTED("tradingLossUsageRequested", "tradingLossUseRequested",
			"box_161_trading_losses_use_requested"),
	PROPERTY_LOSS_BROUGHT_FORWARD("propertyLossBroughtForward", "propertyLossBF", "box_250_prop_losses_bfwd"),
	PROPERTY_LOSS_USAGE_REQUESTED("propertyLossUsageRequested"),

	COMMUNITY_INVESTMENT_TAX_RELIEF("communityInvestmentTaxRelief", "box_445_community_investment_tax_relief"),
	DOUBLE_TAXATION_RELIEF("doubleTaxationRelief", "box_450_double_taxation_relief"),
	ADVANCE_CORPORATION_TAX("advanceCorporationTax", "box_465_advance_corporation_tax"),
	LOANS_TO_PARTICIPATORS_TAX("loansToParticipatorsTax", "box_480_loans_to_participators_tax"),
	CONTROLLED_FOREIGN_COMPANIES_TAX("controlledForeignCompaniesTax", "box_490_controlled_foreign_companies_tax"),
	BANK_LEVY_PAYABLE("bankLevyPayable", "box_495_bank_levy_payable"),
	BANK_SURCHARGE_PAYABLE("bankSurchargePayable", "box_496_bank_surcharge_payable"),
	RESIDENTIAL_PROPERTY_DEVELOPER_TAX("residentialPropertyDeveloperTax", "box_497_residential_property_developer_tax"),
	EOGPL_PAYABLE("eogplPayable", "box_501_energy_oil_and_gas_profits_levy"),
	EGL_PAYABLE("eglPayable", "box_502_electricity_generator_levy"),
	SUPPLEMENTARY_CHARGE_PAYABLE("supplementaryChargePayable", "box_505_supplementary_charge_payable"),
	INCOME_TAX_DEDUCTED_FROM_GROSS_INCOME("incomeTaxDeductedFromGrossIncome",
			"box_515_income_tax_deducted_from_gross_income"),
	CORONAVIRUS_SUPPORT_PAYMENT_OVERPAYMENT_NOW_DUE("coronavirusSupportPaymentOverpaymentNowDue",
			"box_526_coronavirus_support_payment_overpayment_now_due"),
	RESTITUTION_TAX("restitutionTax", "box_527_restitution_tax"),
	UNDERLYING_RATE_RELIEF_CLAIM("underlyingRateReliefClaim", "box_455_underlying_rate_relief_claim"),
	RELIEF_CARRIED_BACK_TO_EARLIER_PERIOD("reliefCarriedBackToEarlierPeriod",
			"box_460_relief_carried_back_to_earlier_period"),

	DECLARATION_NAME("declarationName", "box_975_name"),
	DECLARATION_DATE("declarationDate", "box_980_date"),
	DECLARATION_STATUS("declarationStatus", "box_985_status");

	private final String canonicalName;
	private final List<String> legacyNames;

	InputField(String canonicalName, String... legacyNames) {
		this.canonicalName = canonicalName;
		this.legacyNames = List.of(legacyNames);
	}

	public String canonicalName() {
		return canonicalName;
	}

	public List<String> legacyNames() {
		return legacyNames;
	}
}
