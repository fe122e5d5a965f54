package com.tradingcore.domain.common;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A signed quantity of one asset, e.g. 1.5 BTC or -20 USDT of realized loss. Arithmetic and
 * comparison between amounts of different assets is rejected.
 */
public record Amount(BigDecimal value, Asset asset) implements Comparable<Amount> {
  public Amount {
    Decimals.requireValue(value, "Amount");
    if (asset == null) {
      throw new InvalidValueException("Amount", "asset must not be null", value);
    }
  }

  public static Amount of(BigDecimal value, Asset asset) {
    return new Amount(value, asset);
  }

  public static Amount of(String value, Asset asset) {
    return new Amount(Decimals.parse(value, "Amount"), asset);
  }

  public static Amount of(double value, Asset asset) {
    return new Amount(Decimals.valueOf(value, "Amount"), asset);
  }

  public static Amount zero(Asset asset) {
    return new Amount(BigDecimal.ZERO, asset);
  }

  public static Amount sum(Asset asset, Iterable<Amount> amounts) {
    Amount total = zero(asset);
    for (Amount amount : amounts) {
      total = total.add(amount);
    }
    return total;
  }

  public double doubleValue() {
    return value.doubleValue();
  }

  public Amount add(Amount other) {
    assertSameAsset(other, "Amount.add");
    return new Amount(value.add(other.value), asset);
  }

  public Amount subtract(Amount other) {
    assertSameAsset(other, "Amount.subtract");
    return new Amount(value.subtract(other.value), asset);
  }

  /** Subtracts but never goes below zero, for balance decrements. */
  public Amount subtractOrZero(Amount other) {
    assertSameAsset(other, "Amount.subtractOrZero");
    return new Amount(value.subtract(other.value).max(BigDecimal.ZERO), asset);
  }

  public Amount multiply(double factor) {
    return multiply(Decimals.operand(factor, "Amount.multiply"));
  }

  public Amount multiply(BigDecimal factor) {
    Decimals.operand(factor, "Amount.multiply");
    return new Amount(value.multiply(factor), asset);
  }

  public Amount divide(double divisor) {
    return divide(Decimals.operand(divisor, "Amount.divide"));
  }

  public Amount divide(BigDecimal divisor) {
    Decimals.nonZeroDivisor(Decimals.operand(divisor, "Amount.divide"), "Amount.divide");
    return new Amount(Decimals.divide(value, divisor), asset);
  }

  public Amount abs() {
    return new Amount(value.abs(), asset);
  }

  public Amount negate() {
    return new Amount(value.negate(), asset);
  }

  public Amount percentageOf(Percentage percentage) {
    Objects.requireNonNull(percentage, "percentage must not be null");
    return percentage.portionOf(this);
  }

  public Amount min(Amount other) {
    return compareTo(other) <= 0 ? this : other;
  }

  public Amount max(Amount other) {
    return compareTo(other) >= 0 ? this : other;
  }

  public void requireAtLeast(Amount required) {
    assertSameAsset(required, "Amount.requireAtLeast");
    if (value.compareTo(required.value) < 0) {
      throw new InsufficientFundsException(required, this);
    }
  }

  /** Returns the remaining balance after taking {@code required} out of this one. */
  public Amount withdraw(Amount required) {
    requireAtLeast(required);
    return subtract(required);
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

  /** Order and position sizes must be strictly positive. */
  public boolean isValidSize() {
    return value.signum() > 0;
  }

  /** Volumes and fees may be zero but never negative. */
  public boolean isValidVolume() {
    return value.signum() >= 0;
  }

  public boolean isDenominatedIn(Asset other) {
    return asset.equals(other);
  }

  public boolean isGreaterThan(Amount other) {
    return compareTo(other) > 0;
  }

  public boolean isGreaterThanOrEqual(Amount other) {
    return compareTo(other) >= 0;
  }

  public boolean isLessThan(Amount other) {
    return compareTo(other) < 0;
  }

  public boolean isLessThanOrEqual(Amount other) {
    return compareTo(other) <= 0;
  }

  @Override
  public int compareTo(Amount other) {
    assertSameAsset(other, "Amount.compare");
    return value.compareTo(other.value);
  }

  public String format() {
    return value.toPlainString() + " " + asset.symbol();
  }

  public String format(int decimals) {
    return Decimals.scaleTo(value, decimals).toPlainString() + " " + asset.symbol();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof Amount amount
        && asset.equals(amount.asset)
        && value.compareTo(amount.value) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(asset, Decimals.hash(value));
  }

  @Override
  public String toString() {
    return format();
  }

  private void assertSameAsset(Amount other, String operation) {
    Objects.requireNonNull(other, "other amount must not be null");
    if (!asset.equals(other.asset)) {
      throw new InvalidOperationException(
          operation,
          "cannot operate on amounts with different assets: "
              + asset.symbol()
              + " vs "
              + other.asset.symbol(),
          other);
    }
  }
}
