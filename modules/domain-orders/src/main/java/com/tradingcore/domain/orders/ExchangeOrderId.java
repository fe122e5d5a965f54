package com.tradingcore.domain.orders;

import com.tradingcore.domain.common.InvalidValueException;

/** Identifier assigned by the venue once an order is accepted; used to match fills. */
public record ExchangeOrderId(String value) {
  public ExchangeOrderId {
    if (value == null || value.isBlank()) {
      throw new InvalidValueException(
          "ExchangeOrderId", "exchange order id must not be blank", value);
    }
  }

  public static ExchangeOrderId of(String value) {
    return new ExchangeOrderId(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
