package com.tradingcore.domain.common;

public enum AssetType {
  CRYPTOCURRENCY,
  STABLECOIN,
  FIAT,
  UNKNOWN
}
