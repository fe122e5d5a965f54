package com.tradingcore.domain.common;

/** A BASE/QUOTE pair. Prices in the pair are quoted as QUOTE per one BASE. */
public record TradingPair(Asset base, Asset quote) {
  public TradingPair {
    if (base == null || quote == null) {
      throw new InvalidValueException("TradingPair", "base and quote must not be null");
    }
    if (base.equals(quote)) {
      throw new InvalidValueException(
          "TradingPair", "base and quote assets must be different", base.symbol());
    }
  }

  public static TradingPair of(Asset base, Asset quote) {
    return new TradingPair(base, quote);
  }

  public static TradingPair parse(String symbol) {
    if (symbol == null) {
      throw new InvalidValueException("TradingPair", "symbol must not be null");
    }
    String[] parts = symbol.split("/", -1);
    if (parts.length != 2) {
      throw new InvalidValueException("TradingPair", "symbol must be in format BASE/QUOTE", symbol);
    }
    return new TradingPair(Asset.of(parts[0]), Asset.of(parts[1]));
  }

  public String symbol() {
    return base.symbol() + "/" + quote.symbol();
  }

  public TradingPair inverse() {
    return new TradingPair(quote, base);
  }

  public boolean contains(Asset asset) {
    return base.equals(asset) || quote.equals(asset);
  }

  public boolean isStablePair() {
    return base.isStablecoin() && quote.isStablecoin();
  }

  public boolean isStableQuoted() {
    return quote.isStablecoin();
  }

  public boolean isFiatQuoted() {
    return quote.isFiat();
  }

  public boolean isCryptoPair() {
    return base.isCrypto() && quote.isCrypto();
  }

  @Override
  public String toString() {
    return symbol();
  }
}
