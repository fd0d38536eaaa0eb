package my.corptax.app.taxyear;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class TaxYearTableValidator {
	public List<String> validate(TaxYearTableDefinition definition) {
		List<String> errors = new ArrayList<>();
		if (definition == null || definition.getYears() == null || definition.getYears().isEmpty()) {
			errors.add("years must not be empty");
			return errors;
		}
		Set<Integer> seenYears = new HashSet<>();
		List<LocalDate[]> ranges = new ArrayList<>();
		for (TaxYearEntryDefinition entry : definition.getYears()) {
			if (entry == null) {
				errors.add("years must not contain empty entries");
				continue;
			}
			String label = entry.getFyYear() == null ? "year" : "fy_year " + entry.getFyYear();
			if (entry.getFyYear() == null) {
				errors.add("fy_year is required");
			} else if (!seenYears.add(entry.getFyYear())) {
				errors.add(label + " is defined more than once");
			}
			LocalDate start = parseDate(entry.getStartDate(), label + ".start_date", errors);
			LocalDate end = parseDate(entry.getEndDate(), label + ".end_date", errors);
			if (start != null && end != null) {
				if (end.isBefore(start)) {
					errors.add(label + ".end_date must be on or after start_date");
				} else {
					ranges.add(new LocalDate[] {start, end});
				}
			}
			BigDecimal aiaLimit = TaxYearTableFactory.aiaLimit(entry);
			if (aiaLimit == null) {
				errors.add(label + ".aia_limit is required");
			} else if (aiaLimit.signum() < 0) {
				errors.add(label + ".aia_limit must not be negative");
			}
			validateTiers(entry.getTiers(), label, errors);
		}
		ranges.sort(Comparator.comparing(range -> range[0]));
		for (int i = 1; i < ranges.size(); i++) {
			if (!ranges.get(i)[0].isAfter(ranges.get(i - 1)[1])) {
				errors.add("years overlap around " + ranges.get(i)[0]);
			}
		}
		return errors;
	}

	private void validateTiers(List<RateTierDefinition> tiers, String label, List<String> errors) {
		if (tiers == null || tiers.size() != 3) {
			errors.add(label + ".tiers must contain exactly 3 tiers");
			return;
		}
		List<RateTierDefinition> ordered = TaxYearTableFactory.orderedTiers(tiers);
		BigDecimal previousThreshold = null;
		for (int i = 0; i < ordered.size(); i++) {
			RateTierDefinition tier = ordered.get(i);
			String tierLabel = label + ".tiers[" + (i + 1) + "]";
			if (tier == null) {
				errors.add(tierLabel + " is empty");
				continue;
			}
			if (tier.getThreshold() == null) {
				errors.add(tierLabel + ".threshold is required");
			} else {
				if (i == 0 && tier.getThreshold().signum() != 0) {
					errors.add(tierLabel + ".threshold must be 0");
				}
				if (previousThreshold != null && tier.getThreshold().compareTo(previousThreshold) <= 0) {
					errors.add(tierLabel + ".threshold must be greater than the previous tier");
				}
				previousThreshold = tier.getThreshold();
			}
			if (tier.getRate() == null) {
				errors.add(tierLabel + ".rate is required");
			} else if (tier.getRate().signum() < 0 || tier.getRate().compareTo(BigDecimal.ONE) > 0) {
				errors.add(tierLabel + ".rate must be between 0 and 1");
			}
			if (tier.getReliefFraction() != null && tier.getReliefFraction().signum() < 0) {
				errors.add(tierLabel + ".relief_fraction must not be negative");
			}
		}
	}

	private LocalDate parseDate(String value, String field, List<String> errors) {
		if (value == null || value.isBlank()) {
			errors.add(field + " is required");
			return null;
		}
		try {
			return LocalDate.parse(value.trim());
		} catch (DateTimeParseException ex) {
			errors.add(field + " must be an ISO date (YYYY-MM-DD)");
			return null;
		}
	}
}
