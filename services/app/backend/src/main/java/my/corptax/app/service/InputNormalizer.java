package my.corptax.app.service;

import my.corptax.app.model.Money;
import my.corptax.app.model.NormalizedInput;
import my.corptax.app.service.util.DateRanges;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns a flat raw input record (canonical or legacy keys) into a {@link NormalizedInput}. This is the
 * only place that knows about legacy field names.
 */
@Service
public class InputNormalizer {
	private static final Logger logger = LoggerFactory.getLogger(InputNormalizer.class);
	private static final Set<String> CHECKMARK_TRUE = Set.of("x", "true", "1", "yes");
	private static final int MAX_INTEGER_DIGITS = 15;

	public NormalizedInput normalize(Map<String, ?> rawInput) {
		Map<String, ?> raw = rawInput == null ? Map.of() : rawInput;

		LocalDate start = requireDate(raw, InputField.ACCOUNTING_PERIOD_START);
		LocalDate end = requireDate(raw, InputField.ACCOUNTING_PERIOD_END);
		if (end.isBefore(start)) {
			throw new InvalidPeriodException(start, end);
		}
		int associatedCompanies = associatedCompanyCount(raw);

		NormalizedInput.ProfitAndLoss profitAndLoss = new NormalizedInput.ProfitAndLoss(
				money(raw, InputField.TRADING_TURNOVER),
				money(raw, InputField.GOVERNMENT_GRANTS),
				money(raw, InputField.PROPERTY_INCOME),
				money(raw, InputField.INTEREST_INCOME),
				money(raw, InputField.TRADING_BALANCING_CHARGES),
				money(raw, InputField.CHARGEABLE_GAINS),
				text(raw, InputField.CHARGEABLE_GAINS_COMPUTATION_FILE_NAME),
				money(raw, InputField.DIVIDEND_INCOME),
				money(raw, InputField.COST_OF_GOODS_SOLD),
				money(raw, InputField.STAFF_EMPLOYMENT_COSTS),
				money(raw, InputField.DEPRECIATION_EXPENSE),
				money(raw, InputField.OTHER_OPERATING_CHARGES));

		NormalizedInput.Adjustments adjustments = new NormalizedInput.Adjustments(
				money(raw, InputField.DISALLOWABLE_EXPENDITURE),
				money(raw, InputField.OTHER_TAX_ADJUSTMENTS_ADD_BACK));

		// A request that only gives a total is treated as trade additions.
		Money aiaTrade = money(raw, InputField.AIA_TRADE_ADDITIONS);
		if (aiaTrade.signum() == 0) {
			aiaTrade = money(raw, InputField.AIA_TOTAL_ADDITIONS);
		}
		NormalizedInput.CapitalAllowances capitalAllowances = new NormalizedInput.CapitalAllowances(
				aiaTrade,
				money(raw, InputField.AIA_NON_TRADE_ADDITIONS));

		NormalizedInput.Losses losses = new NormalizedInput.Losses(
				money(raw, InputField.TRADING_LOSS_BROUGHT_FORWARD),
				usageRequest(raw, InputField.TRADING_LOSS_USAGE_REQUESTED),
				money(raw, InputField.PROPERTY_LOSS_BROUGHT_FORWARD),
				usageRequest(raw, InputField.PROPERTY_LOSS_USAGE_REQUESTED));

		NormalizedInput.Ct600Supplement ct600 = new NormalizedInput.Ct600Supplement(
				money(raw, InputField.COMMUNITY_INVESTMENT_TAX_RELIEF),
				money(raw, InputField.DOUBLE_TAXATION_RELIEF),
				money(raw, InputField.ADVANCE_CORPORATION_TAX),
				money(raw, InputField.LOANS_TO_PARTICIPATORS_TAX),
				money(raw, InputField.CONTROLLED_FOREIGN_COMPANIES_TAX),
				money(raw, InputField.BANK_LEVY_PAYABLE),
				money(raw, InputField.BANK_SURCHARGE_PAYABLE),
				money(raw, InputField.RESIDENTIAL_PROPERTY_DEVELOPER_TAX),
				money(raw, InputField.EOGPL_PAYABLE),
				money(raw, InputField.EGL_PAYABLE),
				money(raw, InputField.SUPPLEMENTARY_CHARGE_PAYABLE),
				money(raw, InputField.INCOME_TAX_DEDUCTED_FROM_GROSS_INCOME),
				money(raw, InputField.CORONAVIRUS_SUPPORT_PAYMENT_OVERPAYMENT_NOW_DUE),
				money(raw, InputField.RESTITUTION_TAX),
				checkmark(raw, InputField.UNDERLYING_RATE_RELIEF_CLAIM),
				checkmark(raw, InputField.RELIEF_CARRIED_BACK_TO_EARLIER_PERIOD));

		NormalizedInput.Declaration declaration = new NormalizedInput.Declaration(
				text(raw, InputField.DECLARATION_NAME),
				text(raw, InputField.DECLARATION_DATE),
				text(raw, InputField.DECLARATION_STATUS));

		return new NormalizedInput(
				start,
				end,
				DateRanges.daysInclusive(start, end),
				associatedCompanies,
				profitAndLoss,
				adjustments,
				capitalAllowances,
				losses,
				ct600,
				declaration);
	}

	Object resolve(Map<String, ?> raw, InputField field) {
		Object value = raw.get(field.canonicalName());
		if (value != null) {
			return value;
		}
		for (String legacyName : field.legacyNames()) {
			value = raw.get(legacyName);
			if (value != null) {
				logger.debug("Resolved {} from legacy key {}", field.canonicalName(), legacyName);
				return value;
			}
		}
		return null;
	}

	private LocalDate requireDate(Map<String, ?> raw, InputField field) {
		Object value = resolve(raw, field);
		if (value instanceof LocalDate date) {
			return date;
		}
		String text = value == null ? "" : value.toString().trim();
		if (text.isEmpty()) {
			throw new InvalidInputException(field.canonicalName(),
					"Missing " + field.canonicalName() + ". Use YYYY-MM-DD.");
		}
		try {
			return LocalDate.parse(text);
		} catch (DateTimeParseException ex) {
			throw new InvalidInputException(field.canonicalName(),
					"Invalid " + field.canonicalName() + " '" + text + "'. Use YYYY-MM-DD.");
		}
	}

	private int associatedCompanyCount(Map<String, ?> raw) {
		BigDecimal value = decimal(resolve(raw, InputField.ASSOCIATED_COMPANY_COUNT), InputField.ASSOCIATED_COMPANY_COUNT);
		if (value == null || value.signum() <= 0) {
			return 0;
		}
		try {
			return value.setScale(0, RoundingMode.DOWN).intValueExact();
		} catch (ArithmeticException ex) {
			throw new InvalidInputException(InputField.ASSOCIATED_COMPANY_COUNT.canonicalName(),
					InputField.ASSOCIATED_COMPANY_COUNT.canonicalName() + " is out of range, got '" + value.toPlainString() + "'.");
		}
	}

	private Money money(Map<String, ?> raw, InputField field) {
		BigDecimal value = decimal(resolve(raw, field), field);
		return value == null ? Money.ZERO : Money.of(value.setScale(0, RoundingMode.HALF_UP));
	}

	private Money usageRequest(Map<String, ?> raw, InputField field) {
		Object value = resolve(raw, field);
		if (value == null || value.toString().isBlank()) {
			return null;
		}
		BigDecimal parsed = decimal(value, field);
		return Money.of(parsed.max(BigDecimal.ZERO).setScale(0, RoundingMode.HALF_UP));
	}

	private String text(Map<String, ?> raw, InputField field) {
		Object value = resolve(raw, field);
		return value == null ? "" : value.toString();
	}

	private boolean checkmark(Map<String, ?> raw, InputField field) {
		Object value = resolve(raw, field);
		if (value instanceof Boolean flag) {
			return flag;
		}
		String text = value == null ? "" : value.toString().trim().toLowerCase(Locale.ROOT);
		return CHECKMARK_TRUE.contains(text);
	}

	private BigDecimal decimal(Object value, InputField field) {
		BigDecimal parsed = parseDecimal(value, field);
		if (parsed == null) {
			return null;
		}
		// digits left of the point; negative when |value| < 0.1
		int integerDigits = parsed.precision() - parsed.scale();
		if (integerDigits > MAX_INTEGER_DIGITS) {
			throw new InvalidInputException(field.canonicalName(),
					field.canonicalName() + " is out of range, got '" + value + "'.");
		}
		return integerDigits < 0 ? BigDecimal.ZERO : parsed;
	}

	private BigDecimal parseDecimal(Object value, InputField field) {
		if (value == null) {
			return null;
		}
		if (value instanceof BigDecimal decimal) {
			return decimal;
		}
		if (value instanceof Double || value instanceof Float) {
			double number = ((Number) value).doubleValue();
			if (!Double.isFinite(number)) {
				throw new InvalidInputException(field.canonicalName(),
						field.canonicalName() + " must be a finite amount.");
			}
			return BigDecimal.valueOf(number);
		}
		if (value instanceof Number number) {
			return new BigDecimal(number.toString());
		}
		String text = value.toString().trim().replace(",", "");
		if (text.isEmpty()) {
			return BigDecimal.ZERO;
		}
		try {
			return new BigDecimal(text);
		} catch (NumberFormatException ex) {
			throw new InvalidInputException(field.canonicalName(),
					field.canonicalName() + " must be a number, got '" + value + "'.");
		}
	}
}
