package com.tradingcore.domain.orders;

import com.tradingcore.domain.common.Amount;
import com.tradingcore.domain.common.InvalidOperationException;
import com.tradingcore.domain.common.InvalidValueException;
import com.tradingcore.domain.common.OrderSide;
import com.tradingcore.domain.common.Price;
import com.tradingcore.domain.common.TradingPair;
import java.util.Optional;

/**
 * What an order asks the venue to do. {@code stopPrice} is the trigger of a stop-loss or
 * take-profit order and is absent for market orders.
 */
public record OrderParameters(
    TradingPair pair, OrderSide side, OrderType type, Amount quantity, Price stopPrice) {
  public OrderParameters {
    if (pair == null || side == null || type == null || quantity == null) {
      throw new InvalidValueException(
          "OrderParameters", "pair, side, type and quantity must not be null");
    }
    if (!quantity.isValidSize()) {
      throw new InvalidValueException(
          "OrderParameters", "order quantity must be positive", quantity);
    }
    if (!quantity.isDenominatedIn(pair.base())) {
      throw new InvalidValueException(
          "OrderParameters",
          "quantity asset "
              + quantity.asset().symbol()
              + " does not match pair base "
              + pair.base().symbol(),
          quantity);
    }
    if (type.isResting() && stopPrice == null) {
      throw new InvalidValueException("OrderParameters", "stop price required for " + type);
    }
    if (!type.isResting() && stopPrice != null) {
      throw new InvalidValueException(
          "OrderParameters", "market orders cannot carry a stop price", stopPrice);
    }
    if (stopPrice != null && !stopPrice.belongsTo(pair)) {
      throw new InvalidValueException(
          "OrderParameters", "stop price must be quoted in " + pair.symbol(), stopPrice);
    }
  }

  public static OrderParameters marketBuy(TradingPair pair, Amount quantity) {
    return new OrderParameters(pair, OrderSide.BUY, OrderType.MARKET, quantity, null);
  }

  public static OrderParameters marketSell(TradingPair pair, Amount quantity) {
    return new OrderParameters(pair, OrderSide.SELL, OrderType.MARKET, quantity, null);
  }

  /** SELL protects a long, BUY protects a short. */
  public static OrderParameters stopLoss(
      TradingPair pair, OrderSide side, Amount quantity, Price stopPrice) {
    return new OrderParameters(pair, side, OrderType.STOP_LOSS, quantity, stopPrice);
  }

  public static OrderParameters takeProfit(
      TradingPair pair, OrderSide side, Amount quantity, Price takeProfitPrice) {
    return new OrderParameters(pair, side, OrderType.TAKE_PROFIT, quantity, takeProfitPrice);
  }

  public Optional<Price> stopPriceIfPresent() {
    return Optional.ofNullable(stopPrice);
  }

  /** Quote-asset value at the stop price, or at {@code marketPrice} for market orders. */
  public Amount estimatedValue(Price marketPrice) {
    Price price = stopPrice != null ? stopPrice : marketPrice;
    if (price == null) {
      throw new InvalidOperationException(
          "OrderParameters.estimatedValue", "market price required to value a market order");
    }
    if (!price.belongsTo(pair)) {
      throw new InvalidOperationException(
          "OrderParameters.estimatedValue", "price must be quoted in " + pair.symbol(), price);
    }
    return price.convertToQuote(quantity);
  }

  public boolean isMarketOrder() {
    return type == OrderType.MARKET;
  }

  public boolean isStopOrder() {
    return type.isResting();
  }

  @Override
  public String toString() {
    String base = type + " " + side + " " + quantity.format() + " " + pair.symbol();
    return stopPrice == null ? base : base + " @ " + stopPrice.format();
  }
}
