package com.tradingcore.domain.common;

/**
 * Root of every business-rule violation raised by the trading core. Subtypes carry the context
 * needed to build a caller-facing message; {@link #errorCode()} is stable across releases.
 */
public abstract class DomainException extends RuntimeException {
  protected DomainException(String message) {
    super(message);
  }

  public abstract String errorCode();
}
