package my.corptax.app.service.util;

import my.corptax.app.model.Money;

import java.math.BigDecimal;

public final class Ratios {
	private Ratios() {
	}

	// A zero denominator yields 0 instead of an ArithmeticException.
	public static BigDecimal fraction(long numerator, long denominator) {
		if (denominator == 0) {
			return BigDecimal.ZERO;
		}
		return BigDecimal.valueOf(numerator).divide(BigDecimal.valueOf(denominator), Money.PRECISION);
	}

	public static BigDecimal fraction(BigDecimal numerator, BigDecimal denominator) {
		if (numerator == null || denominator == null || denominator.signum() == 0) {
			return BigDecimal.ZERO;
		}
		return numerator.divide(denominator, Money.PRECISION);
	}

	public static BigDecimal divisor(int associatedCompanyCount) {
		return BigDecimal.valueOf(Math.max(0, associatedCompanyCount) + 1L);
	}
}
