package com.tradingcore.domain.orders;

public enum OrderType {
  MARKET,
  STOP_LOSS,
  TAKE_PROFIT;

  /** Stop and take-profit orders rest on the book until triggered. */
  public boolean isResting() {
    return this != MARKET;
  }
}
