package com.tradingcore.domain.common;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A percentage such as a fee (0.1), a stop distance (-2) or a return. Values live in
 * [-100, 100] unless created with {@code allowAbove100}, which lifts only the upper bound for
 * cumulative or ratio-derived figures.
 */
public final class Percentage implements Comparable<Percentage> {
  private static final BigDecimal MIN = BigDecimal.valueOf(-100);
  private static final BigDecimal BASIS_POINTS_PER_PERCENT = BigDecimal.valueOf(100);

  private final BigDecimal value;

  private Percentage(BigDecimal value) {
    this.value = value;
  }

  public static Percentage of(BigDecimal value) {
    return of(value, false);
  }

  public static Percentage of(BigDecimal value, boolean allowAbove100) {
    Decimals.requireValue(value, "Percentage");
    if (value.compareTo(MIN) < 0) {
      throw new InvalidValueException("Percentage", "cannot be less than -100%", value);
    }
    if (!allowAbove100 && value.compareTo(Decimals.HUNDRED) > 0) {
      throw new InvalidValueException("Percentage", "cannot be greater than 100%", value);
    }
    return new Percentage(value);
  }

  public static Percentage of(double value) {
    return of(Decimals.valueOf(value, "Percentage"), false);
  }

  public static Percentage of(double value, boolean allowAbove100) {
    return of(Decimals.valueOf(value, "Percentage"), allowAbove100);
  }

  public static Percentage of(String value) {
    return of(Decimals.parse(value, "Percentage"), false);
  }

  public static Percentage zero() {
    return new Percentage(BigDecimal.ZERO);
  }

  /** 0.5 becomes 50%, 1.5 becomes 150%. */
  public static Percentage fromRatio(BigDecimal ratio) {
    Decimals.requireValue(ratio, "Percentage");
    return of(ratio.multiply(Decimals.HUNDRED), true);
  }

  public static Percentage fromRatio(double ratio) {
    return fromRatio(Decimals.valueOf(ratio, "Percentage"));
  }

  /** 50 bps becomes 0.5%. */
  public static Percentage fromBasisPoints(BigDecimal basisPoints) {
    Decimals.requireValue(basisPoints, "Percentage");
    return of(Decimals.divide(basisPoints, BASIS_POINTS_PER_PERCENT), false);
  }

  public static Percentage fromBasisPoints(double basisPoints) {
    return fromBasisPoints(Decimals.valueOf(basisPoints, "Percentage"));
  }

  public BigDecimal value() {
    return value;
  }

  public double doubleValue() {
    return value.doubleValue();
  }

  public BigDecimal toRatio() {
    return Decimals.divide(value, Decimals.HUNDRED);
  }

  public BigDecimal toBasisPoints() {
    return value.multiply(BASIS_POINTS_PER_PERCENT);
  }

  public Percentage add(Percentage other) {
    return of(value.add(other.value), true);
  }

  public Percentage subtract(Percentage other) {
    return of(value.subtract(other.value), false);
  }

  public Percentage multiply(double factor) {
    return multiply(Decimals.operand(factor, "Percentage.multiply"));
  }

  public Percentage multiply(BigDecimal factor) {
    Decimals.operand(factor, "Percentage.multiply");
    return of(value.multiply(factor), true);
  }

  /** The share of {@code amount} this percentage represents. Only [0, 100] is meaningful. */
  public Amount portionOf(Amount amount) {
    Objects.requireNonNull(amount, "amount must not be null");
    if (value.signum() < 0 || value.compareTo(Decimals.HUNDRED) > 0) {
      throw new InvalidOperationException(
          "Percentage.portionOf", "percentage must be between 0 and 100", value);
    }
    return amount.multiply(toRatio());
  }

  public boolean isZero() {
    return value.signum() == 0;
  }

  public boolean isPositive() {
    return value.signum() > 0;
  }

  public boolean isNegative() {
    return value.signum() < 0;
  }

  public boolean isGreaterThan(Percentage other) {
    return compareTo(other) > 0;
  }

  public boolean isGreaterThanOrEqual(Percentage other) {
    return compareTo(other) >= 0;
  }

  public boolean isLessThan(Percentage other) {
    return compareTo(other) < 0;
  }

  public boolean isLessThanOrEqual(Percentage other) {
    return compareTo(other) <= 0;
  }

  public String format(int decimals) {
    return Decimals.scaleTo(value, decimals).toPlainString() + "%";
  }

  @Override
  public int compareTo(Percentage other) {
    return value.compareTo(other.value);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Percentage percentage && value.compareTo(percentage.value) == 0;
  }

  @Override
  public int hashCode() {
    return Decimals.hash(value);
  }

  @Override
  public String toString() {
    return format(2);
  }
}
