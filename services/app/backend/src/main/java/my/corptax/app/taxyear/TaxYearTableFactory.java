package my.corptax.app.taxyear;

import my.corptax.app.model.RateTier;
import my.corptax.app.model.TaxYearDefinition;
import my.corptax.app.model.TaxYearTable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Parses, validates and freezes a tax-year table. Every table handed to the engine goes through here,
 * so an invalid table never reaches a computation.
 */
public class TaxYearTableFactory {
	private final TaxYearTableParser parser;
	private final TaxYearTableValidator validator;

	public TaxYearTableFactory() {
		this(new TaxYearTableParser(), new TaxYearTableValidator());
	}

	public TaxYearTableFactory(TaxYearTableParser parser, TaxYearTableValidator validator) {
		this.parser = parser;
		this.validator = validator;
	}

	public TaxYearTable fromContent(String content) {
		return build(parser.parse(content));
	}

	public TaxYearTable build(TaxYearTableDefinition definition) {
		List<String> errors = validator.validate(definition);
		if (!errors.isEmpty()) {
			throw new InvalidTaxYearTableException(errors);
		}
		List<TaxYearDefinition> years = new ArrayList<>();
		for (TaxYearEntryDefinition entry : definition.getYears()) {
			List<RateTier> tiers = orderedTiers(entry.getTiers()).stream()
					.map(tier -> new RateTier(
							tier.getThreshold(),
							tier.getRate(),
							tier.getReliefFraction() == null ? BigDecimal.ZERO : tier.getReliefFraction()))
					.toList();
			years.add(new TaxYearDefinition(
					entry.getFyYear(),
					LocalDate.parse(entry.getStartDate().trim()),
					LocalDate.parse(entry.getEndDate().trim()),
					tiers,
					aiaLimit(entry)));
		}
		return new TaxYearTable(years);
	}

	static List<RateTierDefinition> orderedTiers(List<RateTierDefinition> tiers) {
		boolean indexed = tiers.stream().allMatch(tier -> tier != null && tier.getIndex() != null);
		if (!indexed) {
			return tiers;
		}
		return tiers.stream().sorted(Comparator.comparing(RateTierDefinition::getIndex)).toList();
	}

	static BigDecimal aiaLimit(TaxYearEntryDefinition entry) {
		if (entry.getAiaLimit() != null) {
			return entry.getAiaLimit();
		}
		if (entry.getTiers() == null || entry.getTiers().isEmpty()) {
			return null;
		}
		RateTierDefinition first = orderedTiers(entry.getTiers()).get(0);
		return first == null ? null : first.getAiaLimit();
	}
}
