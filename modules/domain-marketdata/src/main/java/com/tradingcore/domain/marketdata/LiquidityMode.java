package com.tradingcore.domain.marketdata;

/** How a market-order simulation reacts when the ladder runs out before the size is filled. */
public enum LiquidityMode {
  /** Report what could be filled and flag the estimate as not fully filled. */
  PARTIAL,
  /** Raise {@link InsufficientLiquidityException}. */
  STRICT
}
