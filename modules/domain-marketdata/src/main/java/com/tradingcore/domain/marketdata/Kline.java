package com.tradingcore.domain.marketdata;

import com.tradingcore.domain.common.Amount;
import com.tradingcore.domain.common.Decimals;
import com.tradingcore.domain.common.InvalidValueException;
import com.tradingcore.domain.common.Percentage;
import com.tradingcore.domain.common.Price;
import com.tradingcore.domain.common.TradingPair;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * OHLCV candle. High bounds every other price from above and low from below, volume is in the
 * base asset and the open time sits on a timeframe boundary.
 *
 * @param quoteVolume optional, quote asset
 * @param trades optional trade count
 */
public record Kline(
    TradingPair pair,
    Timeframe timeframe,
    Instant openTime,
    Instant closeTime,
    Price open,
    Price high,
    Price low,
    Price close,
    Amount volume,
    Amount quoteVolume,
    Long trades) {
  public Kline {
    if (pair == null || timeframe == null || openTime == null) {
      throw new InvalidValueException("Kline", "pair, timeframe and openTime must not be null");
    }
    if (open == null || high == null || low == null || close == null || volume == null) {
      throw new InvalidValueException("Kline", "OHLC prices and volume must not be null");
    }
    requireInPair(pair, open, "open");
    requireInPair(pair, high, "high");
    requireInPair(pair, low, "low");
    requireInPair(pair, close, "close");

    if (high.isLessThan(low)) {
      throw ohlc("high must be >= low", high, low);
    }
    if (high.isLessThan(open)) {
      throw ohlc("high must be >= open", high, open);
    }
    if (high.isLessThan(close)) {
      throw ohlc("high must be >= close", high, close);
    }
    if (low.isGreaterThan(open)) {
      throw ohlc("low must be <= open", low, open);
    }
    if (low.isGreaterThan(close)) {
      throw ohlc("low must be <= close", low, close);
    }

    if (!volume.isDenominatedIn(pair.base())) {
      throw new InvalidValueException(
          "Kline", "volume must be in base asset " + pair.base().symbol(), volume);
    }
    if (!volume.isValidVolume()) {
      throw new InvalidValueException("Kline", "volume cannot be negative", volume);
    }
    if (quoteVolume != null && !quoteVolume.isDenominatedIn(pair.quote())) {
      throw new InvalidValueException(
          "Kline", "quote volume must be in quote asset " + pair.quote().symbol(), quoteVolume);
    }
    if (!timeframe.isAligned(openTime)) {
      throw new InvalidValueException(
          "Kline", "open time must be aligned to " + timeframe.code(), openTime);
    }
    if (closeTime == null) {
      closeTime = openTime.plus(timeframe.duration()).minusMillis(1);
    } else if (closeTime.isBefore(openTime)) {
      throw new InvalidValueException("Kline", "close time must not precede open time", closeTime);
    }
    if (trades != null && trades < 0) {
      throw new InvalidValueException("Kline", "trades count cannot be negative", trades);
    }
  }

  public static Kline of(
      TradingPair pair,
      Timeframe timeframe,
      Instant openTime,
      Price open,
      Price high,
      Price low,
      Price close,
      Amount volume) {
    return new Kline(pair, timeframe, openTime, null, open, high, low, close, volume, null, null);
  }

  /** high - low. */
  public Amount range() {
    return high.subtract(low);
  }

  public Amount bodySize() {
    return close.absoluteDifference(open);
  }

  public Amount upperWick() {
    return high.subtract(open.max(close));
  }

  public Amount lowerWick() {
    return open.min(close).subtract(low);
  }

  public Price midpoint() {
    return averageOf(high, low);
  }

  public Price typicalPrice() {
    return averageOf(high, low, close);
  }

  public Price weightedClose() {
    return averageOf(high, low, close, close);
  }

  public Amount priceChange() {
    return close.subtract(open);
  }

  public Percentage priceChangePercent() {
    return open.percentageChangeTo(close);
  }

  /** quoteVolume / volume, when both are known and volume is non-zero. */
  public Optional<Price> averagePrice() {
    if (quoteVolume == null || volume.isZero() || !quoteVolume.isPositive()) {
      return Optional.empty();
    }
    return Optional.of(Price.of(Decimals.divide(quoteVolume.value(), volume.value()), pair));
  }

  public boolean isBullish() {
    return close.isGreaterThan(open);
  }

  public boolean isBearish() {
    return close.isLessThan(open);
  }

  public boolean isComplete(Instant now) {
    return now.isAfter(closeTime);
  }

  private Price averageOf(Price... prices) {
    BigDecimal sum = BigDecimal.ZERO;
    for (Price price : prices) {
      sum = sum.add(price.value());
    }
    return Price.of(Decimals.divide(sum, BigDecimal.valueOf(prices.length)), pair);
  }

  private static void requireInPair(TradingPair pair, Price price, String field) {
    if (!price.belongsTo(pair)) {
      throw new InvalidValueException(
          "Kline", field + " price must be in pair " + pair.symbol(), price.pair().symbol());
    }
  }

  private static InvalidValueException ohlc(String reason, Price left, Price right) {
    return new InvalidValueException(
        "Kline", reason, left.format() + " vs " + right.format());
  }
}
