package com.tradingcore.domain.positions;

import com.tradingcore.domain.common.Amount;
import com.tradingcore.domain.common.Price;
import com.tradingcore.domain.common.TradingPair;

/**
 * Levels a position is opened with. A long keeps its stop below and its target above the entry;
 * a short mirrors that.
 */
public record PositionPlan(
    TradingPair pair,
    PositionSide side,
    Price entryPrice,
    Price stopLoss,
    Price takeProfit,
    Amount size) {
  public PositionPlan {
    if (pair == null || side == null) {
      throw new PositionValidationException("pair and side are required");
    }
    if (entryPrice == null || stopLoss == null || takeProfit == null || size == null) {
      throw new PositionValidationException("entry, stop-loss, take-profit and size are required");
    }
    requireInPair(pair, entryPrice, "entry price");
    requireInPair(pair, stopLoss, "stop-loss");
    requireInPair(pair, takeProfit, "take-profit");
    if (!size.isDenominatedIn(pair.base())) {
      throw new PositionValidationException(
          "size must be in base asset " + pair.base().symbol() + ", got " + size.format());
    }
    if (!size.isValidSize()) {
      throw new PositionValidationException("size must be positive, got " + size.format());
    }
    requireStopOnLosingSide(side, entryPrice, stopLoss);
    requireTargetOnWinningSide(side, entryPrice, takeProfit);
  }

  public static PositionPlan longPosition(
      TradingPair pair, Price entryPrice, Price stopLoss, Price takeProfit, Amount size) {
    return new PositionPlan(pair, PositionSide.LONG, entryPrice, stopLoss, takeProfit, size);
  }

  public static PositionPlan shortPosition(
      TradingPair pair, Price entryPrice, Price stopLoss, Price takeProfit, Amount size) {
    return new PositionPlan(pair, PositionSide.SHORT, entryPrice, stopLoss, takeProfit, size);
  }

  /** Quote-asset notional at the planned entry. */
  public Amount notional() {
    return entryPrice.convertToQuote(size);
  }

  static void requireInPair(TradingPair pair, Price price, String field) {
    if (!price.belongsTo(pair)) {
      throw new PositionValidationException(
          field + " " + price + " is not quoted in " + pair.symbol());
    }
  }

  static void requireStopOnLosingSide(PositionSide side, Price entry, Price stopLoss) {
    boolean valid =
        side == PositionSide.LONG ? stopLoss.isLessThan(entry) : stopLoss.isGreaterThan(entry);
    if (!valid) {
      throw new PositionValidationException(
          String.format(
              "%s stop-loss %s must be %s entry %s",
              side,
              stopLoss.format(),
              side == PositionSide.LONG ? "below" : "above",
              entry.format()));
    }
  }

  static void requireTargetOnWinningSide(PositionSide side, Price entry, Price takeProfit) {
    boolean valid =
        side == PositionSide.LONG
            ? takeProfit.isGreaterThan(entry)
            : takeProfit.isLessThan(entry);
    if (!valid) {
      throw new PositionValidationException(
          String.format(
              "%s take-profit %s must be %s entry %s",
              side,
              takeProfit.format(),
              side == PositionSide.LONG ? "above" : "below",
              entry.format()));
    }
  }
}
