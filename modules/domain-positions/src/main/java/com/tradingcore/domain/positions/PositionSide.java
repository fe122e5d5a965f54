package com.tradingcore.domain.positions;

import com.tradingcore.domain.common.OrderSide;

public enum PositionSide {
  LONG,
  SHORT;

  /** Order side that opens exposure in this direction. */
  public OrderSide entrySide() {
    return this == LONG ? OrderSide.BUY : OrderSide.SELL;
  }

  /** Order side that closes it, and the side of its protective stop and target orders. */
  public OrderSide exitSide() {
    return entrySide().opposite();
  }
}
