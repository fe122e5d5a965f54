package com.tradingcore.domain.common;

public class InsufficientFundsException extends DomainException {
  private final Amount required;
  private final Amount available;

  public InsufficientFundsException(Amount required, Amount available) {
    super(
        String.format(
            "Insufficient %s: required=%s, available=%s",
            available.asset().symbol(), required.format(), available.format()));
    this.required = required;
    this.available = available;
  }

  public Amount required() {
    return required;
  }

  public Amount available() {
    return available;
  }

  public Amount shortfall() {
    return required.subtract(available);
  }

  @Override
  public String errorCode() {
    return "insufficient-funds";
  }
}
