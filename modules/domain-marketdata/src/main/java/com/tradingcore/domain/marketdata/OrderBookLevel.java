package com.tradingcore.domain.marketdata;

import com.tradingcore.domain.common.Amount;
import com.tradingcore.domain.common.InvalidValueException;
import com.tradingcore.domain.common.Price;

/** One rung of a depth ladder: resting base-asset quantity at a price. */
public record OrderBookLevel(Price price, Amount quantity) {
  public OrderBookLevel {
    if (price == null || quantity == null) {
      throw new InvalidValueException("OrderBookLevel", "price and quantity must not be null");
    }
    if (!quantity.isValidSize()) {
      throw new InvalidValueException("OrderBookLevel", "quantity must be positive", quantity);
    }
    if (!quantity.isDenominatedIn(price.base())) {
      throw new InvalidValueException(
          "OrderBookLevel",
          "quantity must be in base asset " + price.base().symbol(),
          quantity.asset().symbol());
    }
  }

  public static OrderBookLevel of(Price price, Amount quantity) {
    return new OrderBookLevel(price, quantity);
  }

  /** price x quantity, in the quote asset. */
  public Amount totalValue() {
    return price.convertToQuote(quantity);
  }

  @Override
  public String toString() {
    return price.format() + " x " + quantity.format();
  }
}
