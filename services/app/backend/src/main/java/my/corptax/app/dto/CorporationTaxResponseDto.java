package my.corptax.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.corptax.app.model.CanonicalResult;
import my.corptax.app.model.NormalizedInput;

public record CorporationTaxResponseDto(@JsonProperty("normalized_input") NormalizedInput normalizedInput,
										CanonicalResult result) {
}
