package com.tradingcore.domain.orders;

import com.tradingcore.domain.common.DomainException;

/** Cross-field order rule violated, such as a fill that belongs to another order. */
public class OrderValidationException extends DomainException {
  public OrderValidationException(String message) {
    super("Order validation failed: " + message);
  }

  @Override
  public String errorCode() {
    return "order-validation";
  }
}
