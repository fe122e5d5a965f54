package com.tradingcore.domain.common;

import java.math.BigDecimal;

/** Dimensionless non-negative count, multiplier or ratio. Use {@link Amount} for asset sums. */
public record Quantity(BigDecimal value) implements Comparable<Quantity> {
  public Quantity {
    Decimals.requireValue(value, "Quantity");
    if (value.signum() < 0) {
      throw new InvalidValueException("Quantity", "cannot be negative", value);
    }
  }

  public static Quantity of(BigDecimal value) {
    return new Quantity(value);
  }

  public static Quantity of(String value) {
    return new Quantity(Decimals.parse(value, "Quantity"));
  }

  public static Quantity of(double value) {
    return new Quantity(Decimals.valueOf(value, "Quantity"));
  }

  public static Quantity zero() {
    return new Quantity(BigDecimal.ZERO);
  }

  public static Quantity one() {
    return new Quantity(BigDecimal.ONE);
  }

  public Quantity add(Quantity other) {
    return new Quantity(value.add(other.value));
  }

  public Quantity subtract(Quantity other) {
    BigDecimal result = value.subtract(other.value);
    if (result.signum() < 0) {
      throw new InvalidOperationException(
          "Quantity.subtract",
          "result would be negative: " + value + " - " + other.value,
          result);
    }
    return new Quantity(result);
  }

  public Quantity multiply(double factor) {
    return multiply(Decimals.operand(factor, "Quantity.multiply"));
  }

  public Quantity multiply(BigDecimal factor) {
    Decimals.operand(factor, "Quantity.multiply");
    if (factor.signum() < 0) {
      throw new InvalidOperationException("Quantity.multiply", "factor cannot be negative", factor);
    }
    return new Quantity(value.multiply(factor));
  }

  public Quantity divide(double divisor) {
    return divide(Decimals.operand(divisor, "Quantity.divide"));
  }

  public Quantity divide(BigDecimal divisor) {
    Decimals.nonZeroDivisor(Decimals.operand(divisor, "Quantity.divide"), "Quantity.divide");
    if (divisor.signum() < 0) {
      throw new InvalidOperationException("Quantity.divide", "divisor cannot be negative", divisor);
    }
    return new Quantity(Decimals.divide(value, divisor));
  }

  public boolean isZero() {
    return value.signum() == 0;
  }

  public boolean isPositive() {
    return value.signum() > 0;
  }

  public boolean isGreaterThan(Quantity other) {
    return compareTo(other) > 0;
  }

  public boolean isGreaterThanOrEqual(Quantity other) {
    return compareTo(other) >= 0;
  }

  public boolean isLessThan(Quantity other) {
    return compareTo(other) < 0;
  }

  public boolean isLessThanOrEqual(Quantity other) {
    return compareTo(other) <= 0;
  }

  public double doubleValue() {
    return value.doubleValue();
  }

  @Override
  public int compareTo(Quantity other) {
    return value.compareTo(other.value);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Quantity quantity && value.compareTo(quantity.value) == 0;
  }

  @Override
  public int hashCode() {
    return Decimals.hash(value);
  }

  @Override
  public String toString() {
    return value.toPlainString();
  }
}
