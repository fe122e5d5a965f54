package com.tradingcore.domain.common;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identity of a tradable instrument. Equality is by symbol only; the type is metadata supplied
 * by whoever classifies assets.
 */
public record Asset(String symbol, AssetType type) {
  private static final Pattern SYMBOL = Pattern.compile("^[A-Z0-9]+$");
  private static final int MAX_SYMBOL_LENGTH = 10;

  public Asset {
    symbol = normalize(symbol);
    type = type == null ? AssetType.UNKNOWN : type;
  }

  public static Asset of(String symbol) {
    return new Asset(symbol, AssetType.UNKNOWN);
  }

  public static Asset of(String symbol, AssetType type) {
    return new Asset(symbol, type);
  }

  public static Asset crypto(String symbol) {
    return new Asset(symbol, AssetType.CRYPTOCURRENCY);
  }

  public static Asset stablecoin(String symbol) {
    return new Asset(symbol, AssetType.STABLECOIN);
  }

  public static Asset fiat(String symbol) {
    return new Asset(symbol, AssetType.FIAT);
  }

  public boolean isCrypto() {
    return type == AssetType.CRYPTOCURRENCY;
  }

  public boolean isStablecoin() {
    return type == AssetType.STABLECOIN;
  }

  public boolean isFiat() {
    return type == AssetType.FIAT;
  }

  public boolean isVolatile() {
    return isCrypto();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof Asset asset && symbol.equals(asset.symbol);
  }

  @Override
  public int hashCode() {
    return symbol.hashCode();
  }

  @Override
  public String toString() {
    return symbol;
  }

  private static String normalize(String symbol) {
    if (symbol == null) {
      throw new InvalidValueException("Asset", "symbol must not be null");
    }
    String normalized = symbol.trim().toUpperCase(Locale.ROOT);
    if (normalized.isEmpty()) {
      throw new InvalidValueException("Asset", "symbol cannot be empty", symbol);
    }
    if (!SYMBOL.matcher(normalized).matches()) {
      throw new InvalidValueException(
          "Asset", "symbol must contain only letters and digits", symbol);
    }
    if (normalized.length() > MAX_SYMBOL_LENGTH) {
      throw new InvalidValueException(
          "Asset", "symbol too long (max " + MAX_SYMBOL_LENGTH + " characters)", symbol);
    }
    return normalized;
  }
}
