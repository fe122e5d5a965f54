package com.tradingcore.domain.common;

public class InvalidOperationException extends DomainException {
  private final String operation;
  private final String reason;
  private final Object providedValue;

  public InvalidOperationException(String operation, String reason) {
    this(operation, reason, null);
  }

  public InvalidOperationException(String operation, String reason, Object providedValue) {
    super("Invalid operation '" + operation + "': " + reason);
    this.operation = operation;
    this.reason = reason;
    this.providedValue = providedValue;
  }

  public String operation() {
    return operation;
  }

  public String reason() {
    return reason;
  }

  public Object providedValue() {
    return providedValue;
  }

  @Override
  public String errorCode() {
    return "invalid-operation";
  }
}
