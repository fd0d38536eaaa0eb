package my.corptax.app.model;

public record EngineRun(
		NormalizedInput normalizedInput,
		CanonicalResult result,
		TaxYearTable taxYearTable
) {
}
