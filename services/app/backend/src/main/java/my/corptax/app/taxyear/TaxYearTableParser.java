package my.corptax.app.taxyear;

import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.PropertyNamingStrategies;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;
import tools.jackson.dataformat.yaml.YAMLMapper;

import java.util.List;

/**
 * Reads a tax-year table written as JSON or YAML, either as {@code {years: [...]}} or as a bare list
 * of years. Keys are snake_case.
 */
public class TaxYearTableParser {
	private final ObjectMapper jsonMapper;
	private final ObjectMapper yamlMapper;

	public TaxYearTableParser() {
		this.jsonMapper = JsonMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true)
				.build();

		this.yamlMapper = YAMLMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true)
				.build();
	}

	public TaxYearTableDefinition parse(String content) {
		if (content == null || content.isBlank()) {
			throw new InvalidTaxYearTableException(List.of("Tax-year table is empty"));
		}
		JsonNode root;
		ObjectMapper mapper;
		try {
			root = jsonMapper.readTree(content);
			mapper = jsonMapper;
		} catch (Exception jsonEx) {
			try {
				root = yamlMapper.readTree(content);
				mapper = yamlMapper;
			} catch (Exception yamlEx) {
				throw new InvalidTaxYearTableException("Tax-year table is neither valid JSON nor YAML", yamlEx);
			}
		}
		if (root == null || root.isMissingNode() || root.isNull()) {
			throw new InvalidTaxYearTableException(List.of("Tax-year table is empty"));
		}
		if (root.isArray()) {
			ObjectNode wrapper = mapper.createObjectNode();
			wrapper.set("years", root);
			root = wrapper;
		}
		try {
			return mapper.treeToValue(root, TaxYearTableDefinition.class);
		} catch (Exception ex) {
			throw new InvalidTaxYearTableException("Tax-year table has an unexpected shape: " + ex.getMessage(), ex);
		}
	}
}
