package com.tradingcore.domain.marketdata;

import com.tradingcore.domain.common.Amount;
import com.tradingcore.domain.common.Decimals;
import com.tradingcore.domain.common.InvalidOperationException;
import com.tradingcore.domain.common.InvalidValueException;
import com.tradingcore.domain.common.OrderSide;
import com.tradingcore.domain.common.Percentage;
import com.tradingcore.domain.common.Price;
import com.tradingcore.domain.common.TradingPair;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable view of both depth ladders of one pair at one instant. Bids are held best (highest)
 * first, asks best (lowest) first, and the book is never crossed. A new snapshot is built for
 * every update, so instances can be shared between threads.
 */
public final class OrderBookSnapshot {
  private static final Logger log = LoggerFactory.getLogger(OrderBookSnapshot.class);

  private static final BigDecimal TWO = BigDecimal.valueOf(2);

  private final TradingPair pair;
  private final List<OrderBookLevel> bids;
  private final List<OrderBookLevel> asks;
  private final Instant timestamp;

  private OrderBookSnapshot(
      TradingPair pair, List<OrderBookLevel> bids, List<OrderBookLevel> asks, Instant timestamp) {
    this.pair = pair;
    this.bids = bids;
    this.asks = asks;
    this.timestamp = timestamp;
  }

  public static OrderBookSnapshot of(
      TradingPair pair,
      List<OrderBookLevel> bids,
      List<OrderBookLevel> asks,
      Instant timestamp) {
    if (pair == null) {
      throw new InvalidValueException("OrderBookSnapshot", "pair must not be null");
    }
    if (timestamp == null) {
      throw new InvalidValueException("OrderBookSnapshot", "timestamp must not be null");
    }
    if (bids == null || bids.isEmpty()) {
      throw new InvalidValueException("OrderBookSnapshot", "must have at least one bid level");
    }
    if (asks == null || asks.isEmpty()) {
      throw new InvalidValueException("OrderBookSnapshot", "must have at least one ask level");
    }
    requireLevelsInPair(pair, bids, "bid");
    requireLevelsInPair(pair, asks, "ask");

    Comparator<OrderBookLevel> byPrice = Comparator.comparing(OrderBookLevel::price);
    List<OrderBookLevel> sortedBids = bids.stream().sorted(byPrice.reversed()).toList();
    List<OrderBookLevel> sortedAsks = asks.stream().sorted(byPrice).toList();

    Price bestBid = sortedBids.get(0).price();
    Price bestAsk = sortedAsks.get(0).price();
    if (bestBid.isGreaterThanOrEqual(bestAsk)) {
      throw new InvalidValueException(
          "OrderBookSnapshot",
          "crossed book detected: best bid >= best ask",
          "bestBid=" + bestBid.format() + ", bestAsk=" + bestAsk.format());
    }
    return new OrderBookSnapshot(pair, sortedBids, sortedAsks, timestamp);
  }

  public TradingPair pair() {
    return pair;
  }

  public Instant timestamp() {
    return timestamp;
  }

  /** Highest price first. */
  public List<OrderBookLevel> bids() {
    return bids;
  }

  /** Lowest price first. */
  public List<OrderBookLevel> asks() {
    return asks;
  }

  public int bidDepth() {
    return bids.size();
  }

  public int askDepth() {
    return asks.size();
  }

  public OrderBookLevel bestBid() {
    return bids.get(0);
  }

  public OrderBookLevel bestAsk() {
    return asks.get(0);
  }

  public Price midPrice() {
    BigDecimal sum = bestBid().price().value().add(bestAsk().price().value());
    return Price.of(Decimals.divide(sum, TWO), pair);
  }

  public Amount spread() {
    return bestAsk().price().subtract(bestBid().price());
  }

  /** Spread relative to the mid price. */
  public Percentage spreadPercent() {
    return Percentage.fromRatio(Decimals.divide(spread().value(), midPrice().value()));
  }

  public Amount bidLiquidity() {
    return liquidity(bids, bids.size());
  }

  public Amount bidLiquidity(int levels) {
    return liquidity(bids, requirePositiveLevels(levels));
  }

  public Amount askLiquidity() {
    return liquidity(asks, asks.size());
  }

  public Amount askLiquidity(int levels) {
    return liquidity(asks, requirePositiveLevels(levels));
  }

  /**
   * (bidLiquidity - askLiquidity) / (bidLiquidity + askLiquidity) over the first {@code levels}
   * of each side; positive values mean more resting buy interest.
   */
  public BigDecimal liquidityImbalance(int levels) {
    BigDecimal bid = bidLiquidity(levels).value();
    BigDecimal ask = askLiquidity(levels).value();
    return Decimals.divide(bid.subtract(ask), bid.add(ask));
  }

  public BigDecimal liquidityImbalance() {
    return liquidityImbalance(Math.max(bids.size(), asks.size()));
  }

  public MarketOrderEstimate estimateMarketBuy(Amount size) {
    return estimateMarketBuy(size, LiquidityMode.PARTIAL);
  }

  public MarketOrderEstimate estimateMarketBuy(Amount size, LiquidityMode mode) {
    return walk(OrderSide.BUY, asks, size, mode);
  }

  public MarketOrderEstimate estimateMarketSell(Amount size) {
    return estimateMarketSell(size, LiquidityMode.PARTIAL);
  }

  public MarketOrderEstimate estimateMarketSell(Amount size, LiquidityMode mode) {
    return walk(OrderSide.SELL, bids, size, mode);
  }

  @Override
  public String toString() {
    return String.format(
        "%s OrderBook: %s / %s (%s spread)",
        pair.symbol(),
        bestBid().price().format(),
        bestAsk().price().format(),
        spreadPercent().format(3));
  }

  private MarketOrderEstimate walk(
      OrderSide side, List<OrderBookLevel> ladder, Amount size, LiquidityMode mode) {
    String operation = side == OrderSide.BUY ? "estimateMarketBuy" : "estimateMarketSell";
    Objects.requireNonNull(mode, "mode must not be null");
    if (size == null || !size.isDenominatedIn(pair.base())) {
      throw new InvalidOperationException(
          operation, "size must be in base asset " + pair.base().symbol(), size);
    }
    if (!size.isValidSize()) {
      throw new InvalidOperationException(operation, "size must be positive", size);
    }

    BigDecimal remaining = size.value();
    BigDecimal filled = BigDecimal.ZERO;
    BigDecimal notional = BigDecimal.ZERO;
    int levelsConsumed = 0;
    for (OrderBookLevel level : ladder) {
      if (remaining.signum() <= 0) {
        break;
      }
      BigDecimal take = remaining.min(level.quantity().value());
      notional = notional.add(take.multiply(level.price().value()));
      filled = filled.add(take);
      remaining = remaining.subtract(take);
      levelsConsumed++;
    }

    Amount filledQuantity = Amount.of(filled, pair.base());
    if (remaining.signum() > 0) {
      if (mode == LiquidityMode.STRICT) {
        throw new InsufficientLiquidityException(side, size, filledQuantity);
      }
      log.debug(
          "Ladder exhausted for market {} pair={} requested={} filled={}",
          side,
          pair.symbol(),
          size.value().toPlainString(),
          filled.toPlainString());
    }

    Price averagePrice = Price.of(Decimals.divide(notional, filled), pair);
    Price touch = ladder.get(0).price();
    BigDecimal adverseMove =
        side == OrderSide.BUY
            ? averagePrice.value().subtract(touch.value())
            : touch.value().subtract(averagePrice.value());
    Percentage slippage = Percentage.fromRatio(Decimals.divide(adverseMove, touch.value()));

    return new MarketOrderEstimate(
        side,
        size,
        filledQuantity,
        Amount.of(notional, pair.quote()),
        averagePrice,
        slippage,
        levelsConsumed);
  }

  private Amount liquidity(List<OrderBookLevel> ladder, int levels) {
    Amount total = Amount.zero(pair.quote());
    for (OrderBookLevel level : ladder.subList(0, Math.min(levels, ladder.size()))) {
      total = total.add(level.totalValue());
    }
    return total;
  }

  private static int requirePositiveLevels(int levels) {
    if (levels <= 0) {
      throw new InvalidOperationException("liquidity", "levels must be positive", levels);
    }
    return levels;
  }

  private static void requireLevelsInPair(
      TradingPair pair, List<OrderBookLevel> levels, String side) {
    for (OrderBookLevel level : levels) {
      if (level == null) {
        throw new InvalidValueException("OrderBookSnapshot", side + " level must not be null");
      }
      if (!level.price().belongsTo(pair)) {
        throw new InvalidValueException(
            "OrderBookSnapshot",
            side + " level is not in pair " + pair.symbol(),
            level.price().pair().symbol());
      }
    }
  }
}
