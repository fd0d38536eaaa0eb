package my.corptax.app.taxyear;

import java.math.BigDecimal;

public class RateTierDefinition {
	private Integer index;
	private BigDecimal threshold;
	private BigDecimal rate;
	private BigDecimal reliefFraction;
	// Older tables repeat the AIA limit on every tier; the first tier's value is used.
	private BigDecimal aiaLimit;

	public Integer getIndex() {
		return index;
	}

	public void setIndex(Integer index) {
		this.index = index;
	}

	public BigDecimal getThreshold() {
		return threshold;
	}

	public void setThreshold(BigDecimal threshold) {
		this.threshold = threshold;
	}

	public BigDecimal getRate() {
		return rate;
	}

	public void setRate(BigDecimal rate) {
		this.rate = rate;
	}

	public BigDecimal getReliefFraction() {
		return reliefFraction;
	}

	public void setReliefFraction(BigDecimal reliefFraction) {
		this.reliefFraction = reliefFraction;
	}

	public BigDecimal getAiaLimit() {
		return aiaLimit;
	}

	public void setAiaLimit(BigDecimal aiaLimit) {
		this.aiaLimit = aiaLimit;
	}
}
