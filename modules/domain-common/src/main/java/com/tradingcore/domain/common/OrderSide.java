package com.tradingcore.domain.common;

/** BUY acquires the base asset of a pair, SELL disposes of it. */
public enum OrderSide {
  BUY,
  SELL;

  public OrderSide opposite() {
    return this == BUY ? SELL : BUY;
  }
}
