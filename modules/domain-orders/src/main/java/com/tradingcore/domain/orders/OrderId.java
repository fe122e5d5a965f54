package com.tradingcore.domain.orders;

import com.tradingcore.domain.common.InvalidValueException;
import java.util.UUID;

/** Internal order identifier. */
public record OrderId(String value) {
  public OrderId {
    if (value == null || value.isBlank()) {
      throw new InvalidValueException("OrderId", "order id must not be blank", value);
    }
  }

  public static OrderId generate() {
    return new OrderId(UUID.randomUUID().toString());
  }

  public static OrderId of(String value) {
    return new OrderId(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
