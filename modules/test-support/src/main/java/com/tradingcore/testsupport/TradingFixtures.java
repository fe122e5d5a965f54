package com.tradingcore.testsupport;

import com.tradingcore.domain.common.Amount;
import com.tradingcore.domain.common.Asset;
import com.tradingcore.domain.common.Price;
import com.tradingcore.domain.common.TradingPair;
import java.time.Instant;

/** Assets, pairs and literals shared by the module test suites. */
public final class TradingFixtures {
  public static final Asset BTC = Asset.crypto("BTC");
  public static final Asset ETH = Asset.crypto("ETH");
  public static final Asset USDT = Asset.stablecoin("USDT");
  public static final Asset USDC = Asset.stablecoin("USDC");
  public static final Asset USD = Asset.fiat("USD");

  public static final TradingPair BTC_USDT = TradingPair.of(BTC, USDT);
  public static final TradingPair ETH_USDT = TradingPair.of(ETH, USDT);
  public static final TradingPair ETH_BTC = TradingPair.of(ETH, BTC);

  public static final Instant T0 = Instant.parse("2026-02-24T00:00:00Z");

  private TradingFixtures() {}

  public static Price btcUsdt(String value) {
    return Price.of(value, BTC_USDT);
  }

  public static Amount btc(String value) {
    return Amount.of(value, BTC);
  }

  public static Amount usdt(String value) {
    return Amount.of(value, USDT);
  }

  public static Instant at(long secondsAfterT0) {
    return T0.plusSeconds(secondsAfterT0);
  }
}
