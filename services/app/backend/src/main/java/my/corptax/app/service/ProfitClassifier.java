package my.corptax.app.service;

import my.corptax.app.model.AccountingPeriod;
import my.corptax.app.model.CanonicalResult;
import my.corptax.app.model.Money;
import my.corptax.app.model.NormalizedInput;
import my.corptax.app.service.util.Ratios;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Takes a period's day share of the accounts and splits the taxable base into a trading stream and
 * a non-trading stream (interest, property, chargeable gains), then applies the AIA shared cap.
 */
@Service
public class ProfitClassifier {
	public ClassifiedProfit classify(NormalizedInput input, AccountingPeriod period, Money aiaCap) {
		BigDecimal ratio = Ratios.fraction(period.days(), input.accountingPeriodDays());
		NormalizedInput.ProfitAndLoss pnl = input.profitAndLoss();
		NormalizedInput.Adjustments adjustments = input.adjustments();

		Money profitBeforeTax = pnl.totalIncome().minus(pnl.totalExpenses()).times(ratio);
		Money addBacks = pnl.depreciationExpense()
				.plus(adjustments.disallowableExpenditure())
				.plus(adjustments.otherTaxAdjustmentsAddBack())
				.times(ratio);

		// Chargeable gains are ring-fenced: a net capital loss never reduces other income.
		Money rawGains = pnl.chargeableGains().times(ratio);
		Money gains = rawGains.atLeastZero();
		Money ringFenceAdjustment = gains.minus(rawGains);

		Money interest = pnl.interestIncome().times(ratio);
		Money rental = pnl.propertyIncome().times(ratio);
		Money dividends = pnl.dividendIncome().times(ratio);

		Money taxableBeforeAia = profitBeforeTax.plus(addBacks).plus(ringFenceAdjustment);
		Money nonTradingBeforeAia = interest.plus(rental).plus(gains);
		Money tradingBeforeAia = taxableBeforeAia.minus(nonTradingBeforeAia);

		Money tradeAdditions = input.capitalAllowances().annualInvestmentAllowanceTradeAdditions().times(ratio);
		Money nonTradeAdditions = input.capitalAllowances().annualInvestmentAllowanceNonTradeAdditions().times(ratio);
		AiaClaims claims = allocateSharedCap(tradeAdditions, nonTradeAdditions, aiaCap);
		CanonicalResult.AiaAllocation aia = new CanonicalResult.AiaAllocation(
				aiaCap,
				tradeAdditions,
				nonTradeAdditions,
				claims.tradeClaim(),
				claims.nonTradeClaim());

		Money tradingAfterAia = tradingBeforeAia.minus(claims.tradeClaim());
		// Non-trade AIA offsets the property stream only, never interest.
		Money propertyAfterAia = rental.minus(claims.nonTradeClaim());
		Money nonTradingAfterAia = interest.plus(propertyAfterAia).plus(gains);

		return new ClassifiedProfit(
				ratio,
				profitBeforeTax,
				addBacks,
				interest,
				rental,
				gains,
				ringFenceAdjustment,
				dividends,
				tradingBeforeAia,
				nonTradingBeforeAia,
				aia,
				tradingAfterAia,
				propertyAfterAia,
				nonTradingAfterAia,
				tradingAfterAia.plus(nonTradingAfterAia));
	}

	/**
	 * Shares one AIA cap between trade and non-trade additions. When the requests fit they are granted
	 * in full; otherwise the cap is split in proportion to the requests, each side is clamped to what
	 * it asked for and any headroom left goes to trade first. Claims are not limited by profit.
	 */
	public static AiaClaims allocateSharedCap(Money tradeRequested, Money nonTradeRequested, Money cap) {
		Money masterCap = cap == null ? Money.ZERO : cap.atLeastZero();
		Money trade = tradeRequested == null ? Money.ZERO : tradeRequested.atLeastZero();
		Money nonTrade = nonTradeRequested == null ? Money.ZERO : nonTradeRequested.atLeastZero();
		Money total = trade.plus(nonTrade);
		if (masterCap.signum() <= 0 || total.signum() <= 0) {
			return new AiaClaims(Money.ZERO, Money.ZERO);
		}
		if (total.compareTo(masterCap) <= 0) {
			return new AiaClaims(trade, nonTrade);
		}

		Money tradeClaim = masterCap.times(Ratios.fraction(trade.exact(), total.exact()));
		Money nonTradeClaim = masterCap.minus(tradeClaim);
		tradeClaim = tradeClaim.min(trade);
		nonTradeClaim = nonTradeClaim.min(nonTrade);

		Money remainder = masterCap.minus(tradeClaim).minus(nonTradeClaim);
		if (remainder.isPositive()) {
			Money tradeTopUp = remainder.min(trade.minus(tradeClaim).atLeastZero());
			tradeClaim = tradeClaim.plus(tradeTopUp);
			remainder = remainder.minus(tradeTopUp);
			if (remainder.isPositive()) {
				nonTradeClaim = nonTradeClaim.plus(remainder.min(nonTrade.minus(nonTradeClaim).atLeastZero()));
			}
		}
		return new AiaClaims(tradeClaim, nonTradeClaim);
	}

	public record AiaClaims(
			Money tradeClaim,
			Money nonTradeClaim
	) {
		public Money total() {
			return tradeClaim.plus(nonTradeClaim);
		}
	}

	public record ClassifiedProfit(
			BigDecimal periodRatio,
			Money profitBeforeTax,
			Money addBacks,
			Money interest,
			Money rentalGross,
			Money chargeableGains,
			Money gainsRingFenceAdjustment,
			Money dividends,
			Money tradingBeforeAia,
			Money nonTradingBeforeAia,
			CanonicalResult.AiaAllocation aia,
			Money tradingAfterAia,
			Money propertyAfterAia,
			Money nonTradingAfterAia,
			Money taxableBeforeLoss
	) {
	}
}
