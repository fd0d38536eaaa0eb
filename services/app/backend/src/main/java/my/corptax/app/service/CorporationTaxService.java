package my.corptax.app.service;

import my.corptax.app.config.AppProperties;
import my.corptax.app.dto.CorporationTaxRequestDto;
import my.corptax.app.dto.TaxYearDto;
import my.corptax.app.model.EngineRun;
import my.corptax.app.model.RateTier;
import my.corptax.app.model.TaxYearDefinition;
import my.corptax.app.model.TaxYearTable;
import my.corptax.app.taxyear.TaxYearTableFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tools.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class CorporationTaxService {
	private static final Logger logger = LoggerFactory.getLogger(CorporationTaxService.class);

	private final CorporationTaxEngine engine;
	private final Ct600BoxMapper ct600BoxMapper;
	private final TaxYearTableFactory taxYearTableFactory;
	private final AppProperties properties;
	private final ObjectMapper objectMapper;

	public CorporationTaxService(CorporationTaxEngine engine,
								 Ct600BoxMapper ct600BoxMapper,
								 TaxYearTableFactory taxYearTableFactory,
								 AppProperties properties,
								 ObjectMapper objectMapper) {
		this.engine = engine;
		this.ct600BoxMapper = ct600BoxMapper;
		this.taxYearTableFactory = taxYearTableFactory;
		this.properties = properties;
		this.objectMapper = objectMapper;
	}

	public EngineRun compute(CorporationTaxRequestDto request) {
		if (request == null || request.inputs() == null) {
			throw new InvalidInputException("inputs", "inputs are required");
		}
		TaxYearTable table = resolveTable(request.taxYears());
		EngineRun run = engine.run(request.inputs(), table);
		logger.debug("Computed corporation tax for {} to {}: charge {}", run.normalizedInput().accountingPeriodStart(),
				run.normalizedInput().accountingPeriodEnd(), run.result().tax().corporationTaxCharge());
		return run;
	}

	public Map<String, Object> computeCt600(CorporationTaxRequestDto request) {
		EngineRun run = compute(request);
		return ct600BoxMapper.map(run.normalizedInput(), run.result());
	}

	public List<TaxYearDto> listTaxYears() {
		List<TaxYearDto> years = new ArrayList<>();
		for (TaxYearDefinition year : engine.defaultTaxYearTable().years()) {
			List<TaxYearDto.Tier> tiers = new ArrayList<>();
			int index = 1;
			for (RateTier tier : year.tiers()) {
				tiers.add(new TaxYearDto.Tier(index++, tier.getThreshold(), tier.getRate(), tier.getReliefFraction()));
			}
			years.add(new TaxYearDto(year.fyYear(), year.startDate(), year.endDate(), year.aiaLimit(), tiers));
		}
		return years;
	}

	private TaxYearTable resolveTable(Object override) {
		if (override == null || (override instanceof String text && text.isBlank())) {
			return engine.defaultTaxYearTable();
		}
		if (!properties.taxYears().allowRequestOverride()) {
			logger.warn("Rejected request-supplied tax-year table; overrides are disabled.");
			throw new InvalidInputException("tax_years", "Tax-year table overrides are disabled.");
		}
		String content = override instanceof String text ? text : objectMapper.writeValueAsString(override);
		TaxYearTable table = taxYearTableFactory.fromContent(content);
		logger.info("Using request-supplied tax-year table ({} years).", table.years().size());
		return table;
	}
}
