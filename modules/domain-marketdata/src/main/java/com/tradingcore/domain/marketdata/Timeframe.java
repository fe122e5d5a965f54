package com.tradingcore.domain.marketdata;

import com.tradingcore.domain.common.InvalidValueException;
import java.time.Duration;
import java.time.Instant;

/** Candle periods. A month is approximated as 30 days. */
public enum Timeframe {
  ONE_SECOND("1s", Duration.ofSeconds(1)),
  ONE_MINUTE("1m", Duration.ofMinutes(1)),
  THREE_MINUTES("3m", Duration.ofMinutes(3)),
  FIVE_MINUTES("5m", Duration.ofMinutes(5)),
  FIFTEEN_MINUTES("15m", Duration.ofMinutes(15)),
  THIRTY_MINUTES("30m", Duration.ofMinutes(30)),
  ONE_HOUR("1h", Duration.ofHours(1)),
  TWO_HOURS("2h", Duration.ofHours(2)),
  FOUR_HOURS("4h", Duration.ofHours(4)),
  SIX_HOURS("6h", Duration.ofHours(6)),
  EIGHT_HOURS("8h", Duration.ofHours(8)),
  TWELVE_HOURS("12h", Duration.ofHours(12)),
  ONE_DAY("1d", Duration.ofDays(1)),
  THREE_DAYS("3d", Duration.ofDays(3)),
  ONE_WEEK("1w", Duration.ofDays(7)),
  ONE_MONTH("1M", Duration.ofDays(30));

  private final String code;
  private final Duration duration;

  Timeframe(String code, Duration duration) {
    this.code = code;
    this.duration = duration;
  }

  public static Timeframe fromCode(String code) {
    for (Timeframe timeframe : values()) {
      if (timeframe.code.equals(code)) {
        return timeframe;
      }
    }
    throw new InvalidValueException("Timeframe", "unknown timeframe code", code);
  }

  public String code() {
    return code;
  }

  public Duration duration() {
    return duration;
  }

  public boolean isAligned(Instant instant) {
    return instant.toEpochMilli() % duration.toMillis() == 0;
  }

  /** Start of the period containing {@code instant}. */
  public Instant align(Instant instant) {
    long millis = duration.toMillis();
    return Instant.ofEpochMilli(Math.floorDiv(instant.toEpochMilli(), millis) * millis);
  }

  public boolean isLongerThan(Timeframe other) {
    return duration.compareTo(other.duration) > 0;
  }
}
