package my.corptax.app.service;

import my.corptax.app.model.Money;
import my.corptax.app.model.NormalizedInput;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LossReliefSequencerTest {

	@Test
	void usesBroughtForwardTradingLossAgainstTradingProfit() {
		LossReliefSequencer sequencer = sequencer(30000, null, 0, null);

		LossReliefSequencer.PeriodRelief relief = sequencer.relieve(Money.of(55000), Money.ZERO, Money.ZERO, Money.ZERO);

		assertThat(relief.tradingLoss().used().exact()).isEqualByComparingTo("30000");
		assertThat(relief.tradingAfterLoss().exact()).isEqualByComparingTo("25000");
		assertThat(relief.taxableProfit().exact()).isEqualByComparingTo("25000");
		assertThat(relief.tradingLoss().carriedForward().signum()).isZero();
		assertThat(relief.tradingLoss().usageRequestRemaining()).isNull();
	}

	@Test
	void tradingLossDoesNotReduceInterest() {
		LossReliefSequencer sequencer = sequencer(30000, null, 0, null);

		LossReliefSequencer.PeriodRelief relief = sequencer.relieve(Money.of(10000), Money.ZERO, Money.of(5000), Money.ZERO);

		assertThat(relief.tradingLoss().used().exact()).isEqualByComparingTo("10000");
		assertThat(relief.taxableProfit().exact()).isEqualByComparingTo("5000");
		assertThat(sequencer.tradingPool().exact()).isEqualByComparingTo("20000");
	}

	@Test
	void honoursUsageRequest() {
		LossReliefSequencer sequencer = sequencer(30000, 10000L, 0, null);

		LossReliefSequencer.PeriodRelief relief = sequencer.relieve(Money.of(55000), Money.ZERO, Money.ZERO, Money.ZERO);

		assertThat(sequencer.tradingRequested().exact()).isEqualByComparingTo("10000");
		assertThat(relief.tradingLoss().used().exact()).isEqualByComparingTo("10000");
		assertThat(relief.tradingLoss().carriedForward().exact()).isEqualByComparingTo("20000");
		assertThat(relief.tradingLoss().usageRequestRemaining().signum()).isZero();
	}

	@Test
	void capsRequestAtPool() {
		LossReliefSequencer sequencer = sequencer(30000, 50000L, 0, null);

		assertThat(sequencer.tradingRequested().exact()).isEqualByComparingTo("30000");
	}

	@Test
	void setsInPeriodTradingLossAgainstOtherIncomeAndCarriesRest() {
		LossReliefSequencer sequencer = sequencer(0, null, 0, null);

		LossReliefSequencer.PeriodRelief relief = sequencer.relieve(Money.of(-20000), Money.of(5000), Money.of(3000), Money.ZERO);

		assertThat(relief.tradingLoss().currentPeriodIncurred().exact()).isEqualByComparingTo("20000");
		assertThat(relief.tradingLoss().currentPeriodUnrelieved().exact()).isEqualByComparingTo("12000");
		assertThat(relief.tradingLoss().carriedForward().exact()).isEqualByComparingTo("12000");
		assertThat(relief.taxableProfit().signum()).isZero();
	}

	@Test
	void usesPropertyLossAgainstTotalProfit() {
		LossReliefSequencer sequencer = sequencer(0, null, 10000, null);

		LossReliefSequencer.PeriodRelief relief = sequencer.relieve(Money.of(4000), Money.of(3000), Money.of(2000), Money.ZERO);

		assertThat(relief.taxableAfterTradingLoss().exact()).isEqualByComparingTo("9000");
		assertThat(relief.propertyLoss().used().exact()).isEqualByComparingTo("9000");
		assertThat(relief.propertyLoss().carriedForward().exact()).isEqualByComparingTo("1000");
		assertThat(relief.taxableProfit().signum()).isZero();
	}

	@Test
	void carriesUnrelievedPropertyLoss() {
		LossReliefSequencer sequencer = sequencer(0, null, 0, null);

		LossReliefSequencer.PeriodRelief relief = sequencer.relieve(Money.of(4000), Money.of(-6000), Money.of(1000), Money.ZERO);

		assertThat(relief.propertyLoss().currentPeriodIncurred().exact()).isEqualByComparingTo("6000");
		assertThat(relief.propertyLoss().currentPeriodUnrelieved().exact()).isEqualByComparingTo("1000");
		assertThat(sequencer.propertyPool().exact()).isEqualByComparingTo("1000");
		assertThat(relief.taxableProfit().signum()).isZero();
	}

	@Test
	void carriesPoolIntoNextPeriod() {
		LossReliefSequencer sequencer = sequencer(400000, null, 0, null);

		LossReliefSequencer.PeriodRelief first = sequencer.relieve(Money.of(366000), Money.ZERO, Money.ZERO, Money.ZERO);
		LossReliefSequencer.PeriodRelief second = sequencer.relieve(Money.of(181000), Money.ZERO, Money.ZERO, Money.ZERO);

		assertThat(first.tradingLoss().used().exact()).isEqualByComparingTo("366000");
		assertThat(second.tradingLoss().available().exact()).isEqualByComparingTo("34000");
		assertThat(second.tradingLoss().used().exact()).isEqualByComparingTo("34000");
		assertThat(second.taxableProfit().exact()).isEqualByComparingTo("147000");
		assertThat(sequencer.tradingPool().signum()).isZero();
		assertThat(sequencer.tradingBroughtForward().exact()).isEqualByComparingTo("400000");
	}

	@Test
	void requestSpansPeriods() {
		LossReliefSequencer sequencer = sequencer(100000, 50000L, 0, null);

		sequencer.relieve(Money.of(30000), Money.ZERO, Money.ZERO, Money.ZERO);
		LossReliefSequencer.PeriodRelief second = sequencer.relieve(Money.of(30000), Money.ZERO, Money.ZERO, Money.ZERO);

		assertThat(second.tradingLoss().used().exact()).isEqualByComparingTo("20000");
		assertThat(sequencer.tradingPool().exact()).isEqualByComparingTo("50000");
	}

	private static LossReliefSequencer sequencer(long tradingPool, Long tradingRequest, long propertyPool, Long propertyRequest) {
		return new LossReliefSequencer(new NormalizedInput.Losses(
				Money.of(tradingPool),
				tradingRequest == null ? null : Money.of(tradingRequest),
				Money.of(propertyPool),
				propertyRequest == null ? null : Money.of(propertyRequest)));
	}
}
