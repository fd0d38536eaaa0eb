package my.corptax.app.model;

import java.util.Comparator;
import java.util.List;

/**
 * Immutable reference table of financial years. Instances are never mutated after construction, so a
 * single table can be shared by concurrent computations.
 */
public final class TaxYearTable {
	private final List<TaxYearDefinition> years;

	public TaxYearTable(List<TaxYearDefinition> years) {
		this.years = years == null
				? List.of()
				: years.stream().sorted(Comparator.comparing(TaxYearDefinition::startDate)).toList();
	}

	public List<TaxYearDefinition> years() {
		return years;
	}

	public boolean isEmpty() {
		return years.isEmpty();
	}
}
