package my.corptax.app.service;

import my.corptax.app.model.CalculationSlice;
import my.corptax.app.model.FySlice;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Merges neighbouring FY slices that carry the same rates and thresholds, so that marginal relief is
 * worked out over the whole band instead of being cut at an FY boundary where nothing changed.
 */
@Service
public class RegimeCollapser {
	public List<CalculationSlice> collapse(List<FySlice> slices) {
		List<FySlice> ordered = new ArrayList<>(slices);
		ordered.sort(Comparator.comparing(slice -> slice.overlap().overlapStart()));
		List<CalculationSlice> collapsed = new ArrayList<>();
		for (FySlice slice : ordered) {
			int last = collapsed.size() - 1;
			if (last >= 0 && collapsed.get(last).signature().sameRegime(slice.overlap().taxYear().regimeSignature())) {
				collapsed.set(last, collapsed.get(last).merge(slice));
			} else {
				collapsed.add(CalculationSlice.of(slice));
			}
		}
		return List.copyOf(collapsed);
	}
}
