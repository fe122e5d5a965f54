package com.tradingcore.infra.json;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "trading.json")
public class TradingJsonProperties {
  /** Write decimals as JSON strings instead of floating-point numbers. */
  private boolean writeDecimalsAsStrings = false;

  /** Ladder depth summarised in the liquidity block of an order-book snapshot. */
  private int orderBookSummaryLevels = 10;

  public boolean isWriteDecimalsAsStrings() {
    return writeDecimalsAsStrings;
  }

  public void setWriteDecimalsAsStrings(boolean writeDecimalsAsStrings) {
    this.writeDecimalsAsStrings = writeDecimalsAsStrings;
  }

  public int getOrderBookSummaryLevels() {
    return orderBookSummaryLevels;
  }

  public void setOrderBookSummaryLevels(int orderBookSummaryLevels) {
    this.orderBookSummaryLevels = orderBookSummaryLevels;
  }

  public int effectiveOrderBookSummaryLevels() {
    return orderBookSummaryLevels > 0 ? orderBookSummaryLevels : 10;
  }
}
