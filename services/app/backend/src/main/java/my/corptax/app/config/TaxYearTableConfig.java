package my.corptax.app.config;

import my.corptax.app.model.TaxYearDefinition;
import my.corptax.app.model.TaxYearTable;
import my.corptax.app.taxyear.InvalidTaxYearTableException;
import my.corptax.app.taxyear.TaxYearTableFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

@Configuration
public class TaxYearTableConfig {
	private static final Logger logger = LoggerFactory.getLogger(TaxYearTableConfig.class);

	@Bean
	public TaxYearTableFactory taxYearTableFactory() {
		return new TaxYearTableFactory();
	}

	@Bean
	public TaxYearTable defaultTaxYearTable(AppProperties properties,
											ResourceLoader resourceLoader,
											TaxYearTableFactory factory) {
		String location = properties.taxYears().resource();
		Resource resource = resourceLoader.getResource(location);
		if (!resource.exists()) {
			logger.error("Tax-year table resource not found: {}", location);
			throw new InvalidTaxYearTableException(List.of("Tax-year table resource not found: " + location));
		}
		try (InputStream inputStream = resource.getInputStream()) {
			String content = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
			TaxYearTable table = factory.fromContent(content);
			List<TaxYearDefinition> years = table.years();
			logger.info("Loaded tax-year table from {} (FY{} to FY{}, {} years).", location,
					years.get(0).fyYear(), years.get(years.size() - 1).fyYear(), years.size());
			return table;
		} catch (IOException ex) {
			throw new InvalidTaxYearTableException("Failed to read tax-year table from " + location, ex);
		}
	}
}
