package my.corptax.app.taxyear;

import java.util.List;

public class TaxYearTableDefinition {
	private List<TaxYearEntryDefinition> years;

	public List<TaxYearEntryDefinition> getYears() {
		return years;
	}

	public void setYears(List<TaxYearEntryDefinition> years) {
		this.years = years;
	}
}
