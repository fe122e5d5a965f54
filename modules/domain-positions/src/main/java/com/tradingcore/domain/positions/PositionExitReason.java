package com.tradingcore.domain.positions;

public enum PositionExitReason {
  STOP_LOSS,
  TAKE_PROFIT,
  MANUAL_CLOSE,
  LIQUIDATION,
  EXPIRED
}
