package com.tradingcore.domain.common;

public class InvalidValueException extends DomainException {
  private final String valueType;
  private final String reason;
  private final Object providedValue;

  public InvalidValueException(String valueType, String reason) {
    this(valueType, reason, null);
  }

  public InvalidValueException(String valueType, String reason, Object providedValue) {
    super(
        providedValue == null
            ? "Invalid " + valueType + ": " + reason
            : "Invalid " + valueType + ": " + reason + " (provided=" + providedValue + ")");
    this.valueType = valueType;
    this.reason = reason;
    this.providedValue = providedValue;
  }

  public String valueType() {
    return valueType;
  }

  public String reason() {
    return reason;
  }

  public Object providedValue() {
    return providedValue;
  }

  @Override
  public String errorCode() {
    return "invalid-value";
  }
}
