package com.tradingcore.domain.orders;

import com.tradingcore.domain.common.Amount;
import com.tradingcore.domain.common.InvalidValueException;
import com.tradingcore.domain.common.Price;
import com.tradingcore.domain.common.TradingPair;
import java.time.Instant;

/**
 * One execution reported by the venue. The fee may be charged in either asset of the pair.
 *
 * @param tradeId venue-unique trade identifier
 */
public record Fill(
    TradingPair pair,
    ExchangeOrderId exchangeOrderId,
    Amount executedQuantity,
    Price executionPrice,
    Amount fee,
    Instant timestamp,
    String tradeId) {
  public Fill {
    if (pair == null || exchangeOrderId == null || timestamp == null) {
      throw new InvalidValueException(
          "Fill", "pair, exchangeOrderId and timestamp must not be null");
    }
    if (executedQuantity == null || executionPrice == null || fee == null) {
      throw new InvalidValueException("Fill", "quantity, price and fee must not be null");
    }
    if (!executedQuantity.isValidSize()) {
      throw new InvalidValueException(
          "Fill", "executed quantity must be positive", executedQuantity);
    }
    if (!executedQuantity.isDenominatedIn(pair.base())) {
      throw new InvalidValueException(
          "Fill",
          "executed quantity asset "
              + executedQuantity.asset().symbol()
              + " does not match pair base "
              + pair.base().symbol(),
          executedQuantity);
    }
    if (!executionPrice.belongsTo(pair)) {
      throw new InvalidValueException(
          "Fill",
          "execution price pair " + executionPrice.pair().symbol() + " does not match " + pair,
          executionPrice);
    }
    if (!fee.isValidVolume()) {
      throw new InvalidValueException("Fill", "fee cannot be negative", fee);
    }
    if (!pair.contains(fee.asset())) {
      throw new InvalidValueException(
          "Fill", "fee must be charged in " + pair.symbol() + " assets", fee);
    }
    if (tradeId == null || tradeId.isBlank()) {
      throw new InvalidValueException("Fill", "trade id must not be blank", tradeId);
    }
  }

  /** quantity x price, in the quote asset, before fees. */
  public Amount grossTotal() {
    return executionPrice.convertToQuote(executedQuantity);
  }

  public boolean matchesOrder(ExchangeOrderId orderId) {
    return exchangeOrderId.equals(orderId);
  }

  @Override
  public String toString() {
    return String.format(
        "Fill[%s %s @ %s, fee=%s, trade=%s]",
        pair.symbol(),
        executedQuantity.format(),
        executionPrice.format(),
        fee.format(),
        tradeId);
  }
}
