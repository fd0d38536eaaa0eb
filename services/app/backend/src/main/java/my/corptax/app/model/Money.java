package my.corptax.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * A monetary figure held at full precision. The whole-pound view is derived on demand and is only
 * used for reporting; sums and ratios are always taken over {@link #exact()}.
 */
public record Money(BigDecimal exact) implements Comparable<Money> {
	public static final MathContext PRECISION = MathContext.DECIMAL128;
	public static final Money ZERO = new Money(BigDecimal.ZERO);

	public Money {
		exact = exact == null ? BigDecimal.ZERO : exact;
	}

	public static Money of(BigDecimal value) {
		return new Money(value);
	}

	public static Money of(long value) {
		return new Money(BigDecimal.valueOf(value));
	}

	public static Money of(String value) {
		return new Money(new BigDecimal(value));
	}

	public static Money sum(Collection<Money> values) {
		BigDecimal total = BigDecimal.ZERO;
		for (Money value : values) {
			if (value != null) {
				total = total.add(value.exact());
			}
		}
		return new Money(total);
	}

	@JsonValue
	public BigDecimal rounded() {
		return exact.setScale(0, RoundingMode.HALF_UP);
	}

	public Money plus(Money other) {
		return other == null ? this : new Money(exact.add(other.exact()));
	}

	public Money minus(Money other) {
		return other == null ? this : new Money(exact.subtract(other.exact()));
	}

	public Money times(BigDecimal factor) {
		return new Money(exact.multiply(factor, PRECISION));
	}

	public Money negate() {
		return new Money(exact.negate());
	}

	public Money atLeastZero() {
		return exact.signum() < 0 ? ZERO : this;
	}

	public Money min(Money other) {
		return compareTo(other) <= 0 ? this : other;
	}

	public Money max(Money other) {
		return compareTo(other) >= 0 ? this : other;
	}

	public int signum() {
		return exact.signum();
	}

	public boolean isPositive() {
		return exact.signum() > 0;
	}

	@Override
	public int compareTo(Money other) {
		return exact.compareTo(other.exact());
	}

	@Override
	public boolean equals(Object other) {
		return other instanceof Money money && exact.compareTo(money.exact()) == 0;
	}

	@Override
	public int hashCode() {
		return exact.stripTrailingZeros().hashCode();
	}

	@Override
	public String toString() {
		return exact.toPlainString();
	}
}
