package my.corptax.app.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * One or more contiguous FY slices of a period that share a tax regime and are therefore taxed as a
 * single band.
 */
public record CalculationSlice(
		RegimeSignature signature,
		TaxYearDefinition regime,
		List<FySlice> components,
		LocalDate start,
		LocalDate end,
		int days,
		Money taxableProfit,
		Money augmentedProfit,
		Money lowerThreshold,
		Money upperThreshold,
		Money aiaCap
) {
	public CalculationSlice {
		components = List.copyOf(components);
	}

	public static CalculationSlice of(FySlice slice) {
		FyOverlap overlap = slice.overlap();
		return new CalculationSlice(
				overlap.taxYear().regimeSignature(),
				overlap.taxYear(),
				List.of(slice),
				overlap.overlapStart(),
				overlap.overlapEnd(),
				overlap.apDaysInFy(),
				slice.taxableProfit(),
				slice.augmentedProfit(),
				slice.lowerThreshold(),
				slice.upperThreshold(),
				slice.aiaCap());
	}

	public CalculationSlice merge(FySlice slice) {
		List<FySlice> merged = new ArrayList<>(components);
		merged.add(slice);
		return new CalculationSlice(
				signature,
				regime,
				merged,
				start,
				slice.overlap().overlapEnd(),
				days + slice.days(),
				taxableProfit.plus(slice.taxableProfit()),
				augmentedProfit.plus(slice.augmentedProfit()),
				lowerThreshold.plus(slice.lowerThreshold()),
				upperThreshold.plus(slice.upperThreshold()),
				aiaCap.plus(slice.aiaCap()));
	}

	public List<Integer> fyYears() {
		return components.stream().map(FySlice::fyYear).toList();
	}
}
