package com.tradingcore.domain.marketdata;

import com.tradingcore.domain.common.Amount;
import com.tradingcore.domain.common.InvalidOperationException;
import com.tradingcore.domain.common.OrderSide;
import com.tradingcore.domain.common.Percentage;
import com.tradingcore.domain.common.Price;
import java.util.Objects;

/**
 * Outcome of walking a depth ladder with a market order. {@code notional} is the quote-asset
 * cost of a buy or the proceeds of a sell; {@code slippage} is the adverse distance of the
 * average price from the touch.
 */
public record MarketOrderEstimate(
    OrderSide side,
    Amount requestedQuantity,
    Amount filledQuantity,
    Amount notional,
    Price averagePrice,
    Percentage slippage,
    int levelsConsumed) {
  public MarketOrderEstimate {
    Objects.requireNonNull(side, "side must not be null");
    Objects.requireNonNull(requestedQuantity, "requestedQuantity must not be null");
    Objects.requireNonNull(filledQuantity, "filledQuantity must not be null");
    Objects.requireNonNull(notional, "notional must not be null");
    Objects.requireNonNull(averagePrice, "averagePrice must not be null");
    Objects.requireNonNull(slippage, "slippage must not be null");
  }

  public boolean fullyFilled() {
    return filledQuantity.isGreaterThanOrEqual(requestedQuantity);
  }

  public Amount unfilledQuantity() {
    return requestedQuantity.subtractOrZero(filledQuantity);
  }

  public Amount totalCost() {
    if (side != OrderSide.BUY) {
      throw new InvalidOperationException(
          "MarketOrderEstimate.totalCost", "a sell estimate has proceeds, not cost", side);
    }
    return notional;
  }

  public Amount totalProceeds() {
    if (side != OrderSide.SELL) {
      throw new InvalidOperationException(
          "MarketOrderEstimate.totalProceeds", "a buy estimate has cost, not proceeds", side);
    }
    return notional;
  }
}
