package com.tradingcore.domain.positions;

public enum PositionStatus {
  OPENING,
  OPEN,
  CLOSING,
  CLOSED,
  /** Force-closed by the venue. */
  LIQUIDATED;

  public boolean isClosed() {
    return this == CLOSED || this == LIQUIDATED;
  }
}
