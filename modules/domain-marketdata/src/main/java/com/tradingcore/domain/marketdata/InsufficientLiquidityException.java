package com.tradingcore.domain.marketdata;

import com.tradingcore.domain.common.Amount;
import com.tradingcore.domain.common.DomainException;
import com.tradingcore.domain.common.OrderSide;

public class InsufficientLiquidityException extends DomainException {
  private final OrderSide side;
  private final Amount requested;
  private final Amount available;

  public InsufficientLiquidityException(OrderSide side, Amount requested, Amount available) {
    super(
        String.format(
            "Insufficient liquidity for market %s: requested=%s, available=%s",
            side, requested.format(), available.format()));
    this.side = side;
    this.requested = requested;
    this.available = available;
  }

  public OrderSide side() {
    return side;
  }

  public Amount requested() {
    return requested;
  }

  public Amount available() {
    return available;
  }

  @Override
  public String errorCode() {
    return "insufficient-liquidity";
  }
}
