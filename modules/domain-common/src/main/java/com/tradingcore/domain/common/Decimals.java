package com.tradingcore.domain.common;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/** Shared decimal policy: exact add/multiply, DECIMAL128 division. */
public final class Decimals {
  public static final MathContext DIVISION = MathContext.DECIMAL128;
  public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private Decimals() {}

  public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
    return dividend.divide(divisor, DIVISION);
  }

  /** Converts a construction input, rejecting NaN and infinities as an invalid value. */
  static BigDecimal valueOf(double value, String valueType) {
    if (!Double.isFinite(value)) {
      throw new InvalidValueException(valueType, "value must be a finite number", value);
    }
    return BigDecimal.valueOf(value);
  }

  static BigDecimal parse(String value, String valueType) {
    if (value == null || value.isBlank()) {
      throw new InvalidValueException(valueType, "value must not be blank", value);
    }
    try {
      return new BigDecimal(value.trim());
    } catch (NumberFormatException ex) {
      throw new InvalidValueException(valueType, "value must be a finite decimal number", value);
    }
  }

  static BigDecimal requireValue(BigDecimal value, String valueType) {
    if (value == null) {
      throw new InvalidValueException(valueType, "value must not be null");
    }
    return value;
  }

  /** Converts an operand of an arithmetic operation, rejecting NaN and infinities. */
  static BigDecimal operand(double value, String operation) {
    if (!Double.isFinite(value)) {
      throw new InvalidOperationException(operation, "operand must be finite", value);
    }
    return BigDecimal.valueOf(value);
  }

  static BigDecimal operand(BigDecimal value, String operation) {
    Objects.requireNonNull(value, "operand must not be null");
    return value;
  }

  static BigDecimal nonZeroDivisor(BigDecimal divisor, String operation) {
    if (divisor.signum() == 0) {
      throw new InvalidOperationException(operation, "cannot divide by zero", divisor);
    }
    return divisor;
  }

  static BigDecimal scaleTo(BigDecimal value, int decimals) {
    return value.setScale(decimals, RoundingMode.HALF_UP);
  }

  static int hash(BigDecimal value) {
    return value.signum() == 0 ? 0 : value.stripTrailingZeros().hashCode();
  }
}
