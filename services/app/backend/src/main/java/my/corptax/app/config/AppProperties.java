package my.corptax.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid @NotNull TaxYears taxYears
) {
	public record TaxYears(
			@NotBlank String resource,
			boolean allowRequestOverride
	) {
	}
}
