package my.corptax.app.taxyear;

import my.corptax.app.model.TaxYearDefinition;
import my.corptax.app.model.TaxYearTable;
import my.corptax.app.support.TestEngines;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaxYearTableFactoryTest {
	private final TaxYearTableFactory factory = new TaxYearTableFactory();

	@Test
	void loadsBundledTable() {
		TaxYearTable table = TestEngines.defaultTable();

		assertThat(table.years()).extracting(TaxYearDefinition::fyYear).contains(2022, 2023, 2024, 2025);
		TaxYearDefinition fy2024 = table.years().stream().filter(year -> year.fyYear() == 2024).findFirst().orElseThrow();
		assertThat(fy2024.startDate()).isEqualTo(LocalDate.of(2024, 4, 1));
		assertThat(fy2024.smallRate()).isEqualByComparingTo("0.19");
		assertThat(fy2024.mainRate()).isEqualByComparingTo("0.25");
		assertThat(fy2024.reliefFraction()).isEqualByComparingTo("0.015");
		assertThat(fy2024.lowerThreshold()).isEqualByComparingTo("50000");
		assertThat(fy2024.upperThreshold()).isEqualByComparingTo("250000");
		assertThat(fy2024.aiaLimit()).isEqualByComparingTo("1000000");
	}

	@Test
	void parsesJsonTable() {
		TaxYearTable table = factory.fromContent(TestEngines.resource("/tax-years/fy2024.json"));

		assertThat(table.years()).singleElement().satisfies(year -> {
			assertThat(year.fyYear()).isEqualTo(2024);
			assertThat(year.mainRate()).isEqualByComparingTo("0.25");
		});
	}

	@Test
	void parsesBareListAndOrdersTiersByIndex() {
		String yaml = """
				- fy_year: 2024
				  start_date: "2024-04-01"
				  end_date: "2025-03-31"
				  aia_limit: 1000000
				  tiers:
				    - {index: 3, threshold: 250000, rate: 0.25}
				    - {index: 1, threshold: 0, rate: 0.19}
				    - {index: 2, threshold: 50000, rate: 0.25, relief_fraction: 0.015}
				""";

		TaxYearTable table = factory.fromContent(yaml);

		TaxYearDefinition year = table.years().get(0);
		assertThat(year.smallRate()).isEqualByComparingTo("0.19");
		assertThat(year.lowerThreshold()).isEqualByComparingTo("50000");
		assertThat(year.mainTier().getReliefFraction()).isEqualByComparingTo("0");
	}

	@Test
	void readsLegacyAiaLimitFromFirstTier() {
		String json = """
				{"years": [{"fy_year": 2024, "start_date": "2024-04-01", "end_date": "2025-03-31",
				  "tiers": [
				    {"index": 1, "threshold": 0, "rate": 0.19, "relief_fraction": 0, "aia_limit": 500000},
				    {"index": 2, "threshold": 50000, "rate": 0.25, "relief_fraction": 0.015},
				    {"index": 3, "threshold": 250000, "rate": 0.25, "relief_fraction": 0}]}]}
				""";

		TaxYearTable table = factory.fromContent(json);

		assertThat(table.years().get(0).aiaLimit()).isEqualByComparingTo("500000");
	}

	@Test
	void ordersYearsByStartDate() {
		TaxYearTable table = factory.build(TaxYearTableValidatorTest.table(
				TaxYearTableValidatorTest.year(2025, "2025-04-01", "2026-03-31"),
				TaxYearTableValidatorTest.year(2024, "2024-04-01", "2025-03-31")));

		assertThat(table.years()).extracting(TaxYearDefinition::fyYear).containsExactly(2024, 2025);
	}

	@Test
	void reportsEveryValidationError() {
		String json = """
				{"years": [{"fy_year": 2024, "start_date": "2024-04-01", "end_date": "2025-03-31", "tiers": []}]}
				""";

		assertThatThrownBy(() -> factory.fromContent(json))
				.isInstanceOfSatisfying(InvalidTaxYearTableException.class, ex -> assertThat(ex.getErrors())
						.anyMatch(e -> e.contains("aia_limit"))
						.anyMatch(e -> e.contains("exactly 3 tiers")));
	}

	@Test
	void rejectsEmptyOrUnreadableContent() {
		assertThatThrownBy(() -> factory.fromContent(" "))
				.isInstanceOf(InvalidTaxYearTableException.class);
		assertThatThrownBy(() -> factory.fromContent("just some text"))
				.isInstanceOf(InvalidTaxYearTableException.class);
		assertThatThrownBy(() -> factory.fromContent("{\"years\": \"nope\"}"))
				.isInstanceOf(InvalidTaxYearTableException.class);
	}
}
