package my.corptax.app.taxyear;

import java.math.BigDecimal;
import java.util.List;

public class TaxYearEntryDefinition {
	private Integer fyYear;
	private String startDate;
	private String endDate;
	private BigDecimal aiaLimit;
	private List<RateTierDefinition> tiers;

	public Integer getFyYear() {
		return fyYear;
	}

	public void setFyYear(Integer fyYear) {
		this.fyYear = fyYear;
	}

	public String getStartDate() {
		return startDate;
	}

	public void setStartDate(String startDate) {
		this.startDate = startDate;
	}

	public String getEndDate() {
		return endDate;
	}

	public void setEndDate(String endDate) {
		this.endDate = endDate;
	}

	public BigDecimal getAiaLimit() {
		return aiaLimit;
	}

	public void setAiaLimit(BigDecimal aiaLimit) {
		this.aiaLimit = aiaLimit;
	}

	public List<RateTierDefinition> getTiers() {
		return tiers;
	}

	public void setTiers(List<RateTierDefinition> tiers) {
		this.tiers = tiers;
	}
}
