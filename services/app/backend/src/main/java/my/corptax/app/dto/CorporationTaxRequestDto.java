package my.corptax.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * {@code taxYears} may be the table as JSON/YAML text or as an inline object or list.
 */
public record CorporationTaxRequestDto(@NotNull Map<String, Object> inputs,
									   @JsonProperty("tax_years") Object taxYears) {
}
