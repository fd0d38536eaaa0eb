package my.corptax.app.service;

import my.corptax.app.model.LossPool;
import my.corptax.app.model.Money;
import my.corptax.app.model.NormalizedInput;

/**
 * Threads the trading and property loss pools through the periods of one accounting period, in
 * chronological order. Pools are carried, never apportioned by days, so a new instance is needed
 * for every computation.
 */
public class LossReliefSequencer {
	private final Money tradingBroughtForward;
	private final Money propertyBroughtForward;
	private final Money tradingRequested;
	private final Money propertyRequested;

	private Money tradingPool;
	private Money propertyPool;
	private Money tradingRequestRemaining;
	private Money propertyRequestRemaining;

	public LossReliefSequencer(NormalizedInput.Losses losses) {
		this.tradingBroughtForward = losses.tradingLossBroughtForward().atLeastZero();
		this.propertyBroughtForward = losses.propertyLossBroughtForward().atLeastZero();
		this.tradingRequested = requested(tradingBroughtForward, losses.tradingLossUsageRequested());
		this.propertyRequested = requested(propertyBroughtForward, losses.propertyLossUsageRequested());
		this.tradingPool = tradingBroughtForward;
		this.propertyPool = propertyBroughtForward;
		this.tradingRequestRemaining = losses.tradingLossUsageRequested() == null ? null : tradingRequested;
		this.propertyRequestRemaining = losses.propertyLossUsageRequested() == null ? null : propertyRequested;
	}

	/**
	 * Relieves one period. Brought-forward trading losses only reduce trading profit after AIA;
	 * brought-forward property losses reduce total profit after trading loss relief. Losses made in the
	 * period are set against the period's other profits first and only the unrelieved rest is carried.
	 */
	public PeriodRelief relieve(Money tradingAfterAia, Money propertyAfterAia, Money interest, Money gains) {
		Money tradingAvailable = tradingPool;
		Money tradingUsed = capped(tradingAvailable, tradingRequestRemaining, tradingAfterAia.atLeastZero());
		Money tradingAfterLoss = tradingAfterAia.minus(tradingUsed);
		Money nonTradingAfterAia = interest.plus(propertyAfterAia).plus(gains);
		Money taxableAfterTradingLoss = tradingAfterLoss.plus(nonTradingAfterAia);

		Money propertyAvailable = propertyPool;
		Money propertyUsed = capped(propertyAvailable, propertyRequestRemaining, taxableAfterTradingLoss.atLeastZero());

		Money otherIncome = interest.plus(gains).atLeastZero();
		Money tradingIncurred = tradingAfterLoss.negate().atLeastZero();
		Money propertyIncurred = propertyAfterAia.negate().atLeastZero();
		Money tradingAbsorbed = tradingIncurred.min(otherIncome.plus(propertyAfterAia.atLeastZero()));
		Money tradingUnrelieved = tradingIncurred.minus(tradingAbsorbed);
		Money propertyAbsorbed = propertyIncurred.min(
				tradingAfterLoss.atLeastZero().plus(otherIncome.minus(tradingAbsorbed).atLeastZero()));
		Money propertyUnrelieved = propertyIncurred.minus(propertyAbsorbed);

		tradingPool = tradingAvailable.minus(tradingUsed).atLeastZero().plus(tradingUnrelieved);
		propertyPool = propertyAvailable.minus(propertyUsed).atLeastZero().plus(propertyUnrelieved);
		tradingRequestRemaining = decrement(tradingRequestRemaining, tradingUsed);
		propertyRequestRemaining = decrement(propertyRequestRemaining, propertyUsed);

		return new PeriodRelief(
				new LossPool(tradingAvailable, tradingUsed, tradingIncurred, tradingUnrelieved, tradingPool,
						tradingRequestRemaining),
				new LossPool(propertyAvailable, propertyUsed, propertyIncurred, propertyUnrelieved, propertyPool,
						propertyRequestRemaining),
				tradingAfterLoss,
				taxableAfterTradingLoss,
				taxableAfterTradingLoss.minus(propertyUsed).atLeastZero());
	}

	public Money tradingBroughtForward() {
		return tradingBroughtForward;
	}

	public Money propertyBroughtForward() {
		return propertyBroughtForward;
	}

	/** Usage requested at the start, capped at the opening pool. */
	public Money tradingRequested() {
		return tradingRequested;
	}

	public Money propertyRequested() {
		return propertyRequested;
	}

	public Money tradingPool() {
		return tradingPool;
	}

	public Money propertyPool() {
		return propertyPool;
	}

	public Money tradingRequestRemaining() {
		return tradingRequestRemaining;
	}

	public Money propertyRequestRemaining() {
		return propertyRequestRemaining;
	}

	private static Money requested(Money pool, Money request) {
		return request == null ? pool : pool.min(request.atLeastZero());
	}

	private static Money capped(Money pool, Money requestRemaining, Money profit) {
		Money used = pool.min(profit);
		return requestRemaining == null ? used : used.min(requestRemaining);
	}

	private static Money decrement(Money remaining, Money used) {
		return remaining == null ? null : remaining.minus(used).atLeastZero();
	}

	public record PeriodRelief(
			LossPool tradingLoss,
			LossPool propertyLoss,
			Money tradingAfterLoss,
			Money taxableAfterTradingLoss,
			Money taxableProfit
	) {
	}
}
