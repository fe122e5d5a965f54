package com.tradingcore.domain.positions;

import com.tradingcore.domain.common.DomainException;

public class PositionValidationException extends DomainException {
  public PositionValidationException(String message) {
    super("Position validation failed: " + message);
  }

  @Override
  public String errorCode() {
    return "position-validation";
  }
}
