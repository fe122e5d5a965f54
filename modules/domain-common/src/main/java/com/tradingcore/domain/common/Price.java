package com.tradingcore.domain.common;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Exchange rate of a pair, expressed as QUOTE per one BASE (50000 USDT per BTC). Two prices
 * cannot be added; their difference is an {@link Amount} in the quote asset.
 */
public record Price(BigDecimal value, TradingPair pair) implements Comparable<Price> {
  public Price {
    Decimals.requireValue(value, "Price");
    if (pair == null) {
      throw new InvalidValueException("Price", "pair must not be null", value);
    }
    if (value.signum() <= 0) {
      throw new InvalidValueException("Price", "value must be strictly positive", value);
    }
  }

  public static Price of(BigDecimal value, TradingPair pair) {
    return new Price(value, pair);
  }

  public static Price of(String value, TradingPair pair) {
    return new Price(Decimals.parse(value, "Price"), pair);
  }

  public static Price of(double value, TradingPair pair) {
    return new Price(Decimals.valueOf(value, "Price"), pair);
  }

  public double doubleValue() {
    return value.doubleValue();
  }

  public Asset base() {
    return pair.base();
  }

  public Asset quote() {
    return pair.quote();
  }

  /** 52000 - 50000 USDT/BTC = 2000 USDT. */
  public Amount subtract(Price other) {
    assertSamePair(other, "Price.subtract");
    return Amount.of(value.subtract(other.value), pair.quote());
  }

  public Amount absoluteDifference(Price other) {
    return subtract(other).abs();
  }

  public Price multiplyBy(double factor) {
    return multiplyBy(Decimals.operand(factor, "Price.multiplyBy"));
  }

  public Price multiplyBy(BigDecimal factor) {
    Decimals.operand(factor, "Price.multiplyBy");
    return positiveResult(value.multiply(factor), "Price.multiplyBy");
  }

  public Price divideBy(double divisor) {
    return divideBy(Decimals.operand(divisor, "Price.divideBy"));
  }

  public Price divideBy(BigDecimal divisor) {
    Decimals.nonZeroDivisor(Decimals.operand(divisor, "Price.divideBy"), "Price.divideBy");
    return positiveResult(Decimals.divide(value, divisor), "Price.divideBy");
  }

  /** 100 + 10% = 110. */
  public Price applyPercentageChange(Percentage change) {
    Objects.requireNonNull(change, "change must not be null");
    BigDecimal multiplier = BigDecimal.ONE.add(change.toRatio());
    return positiveResult(value.multiply(multiplier), "Price.applyPercentageChange");
  }

  /** ((target - this) / this) * 100. */
  public Percentage percentageChangeTo(Price target) {
    assertSamePair(target, "Price.percentageChangeTo");
    return changeBetween(this, target);
  }

  /** ((this - origin) / origin) * 100. */
  public Percentage percentageChangeFrom(Price origin) {
    assertSamePair(origin, "Price.percentageChangeFrom");
    return changeBetween(origin, this);
  }

  /** 1 BTC at 50000 USDT/BTC = 50000 USDT. */
  public Amount convertToQuote(Amount baseAmount) {
    Objects.requireNonNull(baseAmount, "baseAmount must not be null");
    if (!baseAmount.isDenominatedIn(pair.base())) {
      throw new InvalidOperationException(
          "Price.convertToQuote",
          "amount asset "
              + baseAmount.asset().symbol()
              + " does not match pair base "
              + pair.base().symbol(),
          baseAmount);
    }
    return Amount.of(baseAmount.value().multiply(value), pair.quote());
  }

  /** 50000 USDT at 50000 USDT/BTC = 1 BTC. */
  public Amount convertToBase(Amount quoteAmount) {
    Objects.requireNonNull(quoteAmount, "quoteAmount must not be null");
    if (!quoteAmount.isDenominatedIn(pair.quote())) {
      throw new InvalidOperationException(
          "Price.convertToBase",
          "amount asset "
              + quoteAmount.asset().symbol()
              + " does not match pair quote "
              + pair.quote().symbol(),
          quoteAmount);
    }
    return Amount.of(Decimals.divide(quoteAmount.value(), value), pair.base());
  }

  public Price roundToTickSize(BigDecimal tickSize) {
    return toTick(tickSize, RoundingMode.HALF_UP, "Price.roundToTickSize");
  }

  public Price floorToTickSize(BigDecimal tickSize) {
    return toTick(tickSize, RoundingMode.FLOOR, "Price.floorToTickSize");
  }

  public Price ceilToTickSize(BigDecimal tickSize) {
    return toTick(tickSize, RoundingMode.CEILING, "Price.ceilToTickSize");
  }

  public Price addTicks(long ticks, BigDecimal tickSize) {
    requirePositiveTick(tickSize, "Price.addTicks");
    return positiveResult(
        value.add(tickSize.multiply(BigDecimal.valueOf(ticks))), "Price.addTicks");
  }

  public boolean isGreaterThan(Price other) {
    return compareTo(other) > 0;
  }

  public boolean isGreaterThanOrEqual(Price other) {
    return compareTo(other) >= 0;
  }

  public boolean isLessThan(Price other) {
    return compareTo(other) < 0;
  }

  public boolean isLessThanOrEqual(Price other) {
    return compareTo(other) <= 0;
  }

  /** Inclusive on both ends. */
  public boolean isBetween(Price lower, Price upper) {
    return compareTo(lower) >= 0 && compareTo(upper) <= 0;
  }

  public Price min(Price other) {
    return compareTo(other) <= 0 ? this : other;
  }

  public Price max(Price other) {
    return compareTo(other) >= 0 ? this : other;
  }

  public boolean belongsTo(TradingPair other) {
    return pair.equals(other);
  }

  @Override
  public int compareTo(Price other) {
    assertSamePair(other, "Price.compare");
    return value.compareTo(other.value);
  }

  public String format() {
    return value.toPlainString();
  }

  public String format(int decimals) {
    return Decimals.scaleTo(value, decimals).toPlainString();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof Price price
        && pair.equals(price.pair)
        && value.compareTo(price.value) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(pair, Decimals.hash(value));
  }

  @Override
  public String toString() {
    return format() + " " + pair.symbol();
  }

  private Price toTick(BigDecimal tickSize, RoundingMode mode, String operation) {
    requirePositiveTick(tickSize, operation);
    BigDecimal ticks = value.divide(tickSize, 0, mode);
    return positiveResult(ticks.multiply(tickSize), operation);
  }

  private Price positiveResult(BigDecimal result, String operation) {
    if (result.signum() <= 0) {
      throw new InvalidOperationException(
          operation, "result would be non-positive: " + result.toPlainString(), result);
    }
    return new Price(result, pair);
  }

  private void assertSamePair(Price other, String operation) {
    Objects.requireNonNull(other, "other price must not be null");
    if (!pair.equals(other.pair)) {
      throw new InvalidOperationException(
          operation,
          "cannot operate on prices from different pairs: "
              + pair.symbol()
              + " vs "
              + other.pair.symbol(),
          other);
    }
  }

  private static void requirePositiveTick(BigDecimal tickSize, String operation) {
    if (tickSize == null || tickSize.signum() <= 0) {
      throw new InvalidOperationException(operation, "tick size must be positive", tickSize);
    }
  }

  private static Percentage changeBetween(Price from, Price to) {
    BigDecimal ratio = Decimals.divide(to.value.subtract(from.value), from.value);
    return Percentage.fromRatio(ratio);
  }
}
