package com.tradingcore.domain.orders;

public enum OrderStatus {
  PENDING,
  SUBMITTED,
  OPEN,
  PARTIALLY_FILLED,
  FILLED,
  CANCELLED,
  REJECTED,
  FAILED;

  public boolean isTerminal() {
    return this == FILLED || this == CANCELLED || this == REJECTED || this == FAILED;
  }

  public boolean isActive() {
    return !isTerminal();
  }
}
