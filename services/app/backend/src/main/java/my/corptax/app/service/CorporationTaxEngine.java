package my.corptax.app.service;

import my.corptax.app.model.AccountingPeriod;
import my.corptax.app.model.CalculationSlice;
import my.corptax.app.model.CanonicalResult;
import my.corptax.app.model.EngineRun;
import my.corptax.app.model.FyOverlap;
import my.corptax.app.model.FySlice;
import my.corptax.app.model.Money;
import my.corptax.app.model.NormalizedInput;
import my.corptax.app.model.TaxYearTable;
import my.corptax.app.service.util.Ratios;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the computation. One call normalizes the input, splits the accounting period,
 * relieves losses period by period and taxes each regime slice. Nothing is kept between calls.
 */
@Service
public class CorporationTaxEngine {
	private static final Logger logger = LoggerFactory.getLogger(CorporationTaxEngine.class);

	private final InputNormalizer inputNormalizer;
	private final PeriodSplitter periodSplitter;
	private final FyOverlapResolver fyOverlapResolver;
	private final AllowanceApportioner allowanceApportioner;
	private final ProfitClassifier profitClassifier;
	private final RegimeCollapser regimeCollapser;
	private final CorporationTaxCalculator calculator;
	private final ResultAggregator resultAggregator;
	private final TaxYearTable defaultTaxYearTable;

	public CorporationTaxEngine(InputNormalizer inputNormalizer,
								PeriodSplitter periodSplitter,
								FyOverlapResolver fyOverlapResolver,
								AllowanceApportioner allowanceApportioner,
								ProfitClassifier profitClassifier,
								RegimeCollapser regimeCollapser,
								CorporationTaxCalculator calculator,
								ResultAggregator resultAggregator,
								TaxYearTable defaultTaxYearTable) {
		this.inputNormalizer = inputNormalizer;
		this.periodSplitter = periodSplitter;
		this.fyOverlapResolver = fyOverlapResolver;
		this.allowanceApportioner = allowanceApportioner;
		this.profitClassifier = profitClassifier;
		this.regimeCollapser = regimeCollapser;
		this.calculator = calculator;
		this.resultAggregator = resultAggregator;
		this.defaultTaxYearTable = defaultTaxYearTable;
	}

	public EngineRun run(Map<String, ?> rawInput) {
		return run(rawInput, defaultTaxYearTable);
	}

	public EngineRun run(Map<String, ?> rawInput, TaxYearTable taxYearTable) {
		NormalizedInput input = inputNormalizer.normalize(rawInput);
		TaxYearTable table = taxYearTable == null ? defaultTaxYearTable : taxYearTable;
		return new EngineRun(input, compute(input, table), table);
	}

	public TaxYearTable defaultTaxYearTable() {
		return defaultTaxYearTable;
	}

	CanonicalResult compute(NormalizedInput input, TaxYearTable table) {
		List<AccountingPeriod> periods = periodSplitter.split(input.accountingPeriodStart(), input.accountingPeriodEnd());
		logger.debug("Computing {} to {} ({} days) as {} period(s)", input.accountingPeriodStart(),
				input.accountingPeriodEnd(), input.accountingPeriodDays(), periods.size());
		LossReliefSequencer losses = new LossReliefSequencer(input.losses());
		List<CanonicalResult.PeriodResult> periodResults = new ArrayList<>(periods.size());
		for (AccountingPeriod period : periods) {
			periodResults.add(computePeriod(input, period, table, losses));
		}
		return resultAggregator.aggregate(input, periodResults, losses);
	}

	private CanonicalResult.PeriodResult computePeriod(NormalizedInput input, AccountingPeriod period,
			TaxYearTable table, LossReliefSequencer losses) {
		List<FyOverlap> overlaps = fyOverlapResolver.resolve(period, table);
		List<FySlice> fySlices = allowanceApportioner.apportion(period, overlaps, input.associatedCompanyCount());
		Money aiaCap = Money.sum(fySlices.stream().map(FySlice::aiaCap).toList());

		ProfitClassifier.ClassifiedProfit profit = profitClassifier.classify(input, period, aiaCap);
		LossReliefSequencer.PeriodRelief relief = losses.relieve(profit.tradingAfterAia(), profit.propertyAfterAia(),
				profit.interest(), profit.chargeableGains());
		Money taxable = relief.taxableProfit();
		Money augmented = taxable.plus(profit.dividends());

		List<FySlice> withProfits = new ArrayList<>(fySlices.size());
		for (FySlice slice : fySlices) {
			BigDecimal share = Ratios.fraction(slice.days(), period.days());
			withProfits.add(slice.withProfits(taxable.times(share), augmented.times(share)));
		}

		List<CanonicalResult.SliceResult> sliceResults = new ArrayList<>();
		int sliceIndex = 1;
		for (CalculationSlice slice : regimeCollapser.collapse(withProfits)) {
			CorporationTaxCalculator.TaxComputation tax = calculator.compute(
					slice.taxableProfit(),
					slice.augmentedProfit(),
					slice.lowerThreshold(),
					slice.upperThreshold(),
					slice.regime().smallRate(),
					slice.regime().mainRate(),
					slice.regime().reliefFraction());
			logger.debug("{} slice {} FY {}: taxable {} band {}", period.name(), sliceIndex, slice.fyYears(),
					tax.taxableProfit(), tax.band());
			sliceResults.add(resultAggregator.slice(period, sliceIndex++, slice, tax));
		}
		return resultAggregator.period(period, profit, relief, augmented, sliceResults);
	}
}
