package com.tradingcore.domain.positions;

import com.tradingcore.domain.common.Amount;
import com.tradingcore.domain.common.Decimals;
import com.tradingcore.domain.common.Percentage;
import com.tradingcore.domain.common.Price;
import com.tradingcore.domain.common.TradingPair;
import com.tradingcore.domain.orders.OrderId;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Directional exposure of one agent in one pair, from the entry order to the exit fill. The
 * planned levels stay untouched; the actual entry, the live protective levels and the exit are
 * recorded alongside them.
 *
 * <p>Fees are held in the quote asset. Not thread-safe.
 */
public final class Position {
  private static final Logger log = LoggerFactory.getLogger(Position.class);

  private final PositionId id;
  private final PositionPlan plan;
  private final OrderId entryOrderId;
  private final String agentId;
  private final String strategyId;
  private final Instant createdAt;
  private final Map<String, Object> metadata = new LinkedHashMap<>();

  private PositionStatus status;
  private Price stopLoss;
  private Price takeProfit;
  private Price entryPrice;
  private Amount size;
  private Amount entryFee;
  private OrderId stopLossOrderId;
  private OrderId takeProfitOrderId;
  private OrderId exitOrderId;
  private Price exitPrice;
  private Amount exitFee;
  private PositionExitReason exitReason;
  private Amount realizedPnL;
  private Instant openedAt;
  private Instant closedAt;
  private Instant updatedAt;

  private Position(
      PositionId id,
      PositionPlan plan,
      OrderId entryOrderId,
      String agentId,
      String strategyId,
      Instant now) {
    this.id = Objects.requireNonNull(id, "id must not be null");
    this.plan = Objects.requireNonNull(plan, "plan must not be null");
    this.entryOrderId = Objects.requireNonNull(entryOrderId, "entryOrderId must not be null");
    this.agentId = agentId;
    this.strategyId = strategyId;
    this.createdAt = Objects.requireNonNull(now, "now must not be null");
    this.updatedAt = now;
    this.status = PositionStatus.OPENING;
    this.stopLoss = plan.stopLoss();
    this.takeProfit = plan.takeProfit();
  }

  public static Position open(
      PositionPlan plan, OrderId entryOrderId, String agentId, String strategyId, Instant now) {
    return open(PositionId.generate(), plan, entryOrderId, agentId, strategyId, now);
  }

  public static Position open(
      PositionId id,
      PositionPlan plan,
      OrderId entryOrderId,
      String agentId,
      String strategyId,
      Instant now) {
    Position position = new Position(id, plan, entryOrderId, agentId, strategyId, now);
    log.debug(
        "Position opening id={} pair={} side={} entryOrderId={} agentId={}",
        id,
        plan.pair().symbol(),
        plan.side(),
        entryOrderId,
        agentId);
    return position;
  }

  /** OPENING -> OPEN once the entry order has filled. Protective order ids may be null. */
  public void markAsOpened(
      Price actualEntryPrice,
      Amount actualSize,
      Amount fee,
      OrderId stopLossOrderId,
      OrderId takeProfitOrderId,
      Instant now) {
    requirePrice(actualEntryPrice, "entry price");
    requireSize(actualSize);
    requireFee(fee, "entry fee");
    moveTo(PositionStatus.OPEN, "markAsOpened", now);

    this.entryPrice = actualEntryPrice;
    this.size = actualSize;
    this.entryFee = fee;
    this.stopLossOrderId = stopLossOrderId;
    this.takeProfitOrderId = takeProfitOrderId;
    this.openedAt = now;

    if (isBeyondStop(actualEntryPrice)) {
      log.warn(
          "Entry filled beyond stop-loss id={} side={} entry={} stopLoss={}",
          id,
          side(),
          actualEntryPrice.format(),
          stopLoss.format());
    }
  }

  /** OPEN -> CLOSING while the exit order is working. */
  public void markAsClosing(OrderId exitOrderId, Instant now) {
    Objects.requireNonNull(exitOrderId, "exitOrderId must not be null");
    moveTo(PositionStatus.CLOSING, "markAsClosing", now);
    this.exitOrderId = exitOrderId;
  }

  /**
   * Books the exit and the realized result. Allowed from OPEN when the exit filled without a
   * separate closing step. A {@link PositionExitReason#LIQUIDATION} exit ends in LIQUIDATED.
   */
  public void markAsClosed(
      Price actualExitPrice, Amount fee, PositionExitReason reason, Instant now) {
    Objects.requireNonNull(reason, "reason must not be null");
    requirePrice(actualExitPrice, "exit price");
    requireFee(fee, "exit fee");
    PositionStatus target =
        reason == PositionExitReason.LIQUIDATION
            ? PositionStatus.LIQUIDATED
            : PositionStatus.CLOSED;
    moveTo(target, "markAsClosed", now);

    this.exitPrice = actualExitPrice;
    this.exitFee = fee;
    this.exitReason = reason;
    this.closedAt = now;
    this.realizedPnL = pnlAt(actualExitPrice).subtract(entryFee).subtract(fee);
    log.debug(
        "Position result id={} reason={} realizedPnL={}", id, reason, realizedPnL.format());
  }

  public void markAsLiquidated(Price actualExitPrice, Amount fee, Instant now) {
    markAsClosed(actualExitPrice, fee, PositionExitReason.LIQUIDATION, now);
  }

  /** Moves the live stop; it must stay on the losing side of the actual entry. */
  public void updateStopLoss(Price newStopLoss, Instant now) {
    requireOpen("updateStopLoss");
    requirePrice(newStopLoss, "stop-loss");
    PositionPlan.requireStopOnLosingSide(side(), entryPrice, newStopLoss);
    log.debug(
        "Stop-loss moved id={} from={} to={}", id, stopLoss.format(), newStopLoss.format());
    this.stopLoss = newStopLoss;
    touch(now);
  }

  public void updateTakeProfit(Price newTakeProfit, Instant now) {
    requireOpen("updateTakeProfit");
    requirePrice(newTakeProfit, "take-profit");
    PositionPlan.requireTargetOnWinningSide(side(), entryPrice, newTakeProfit);
    log.debug(
        "Take-profit moved id={} from={} to={}",
        id,
        takeProfit.format(),
        newTakeProfit.format());
    this.takeProfit = newTakeProfit;
    touch(now);
  }

  /** Merges entries into the metadata; existing keys are overwritten. */
  public void updateMetadata(Map<String, ?> entries, Instant now) {
    Objects.requireNonNull(entries, "entries must not be null");
    metadata.putAll(entries);
    touch(now);
  }

  /**
   * Mark-to-market result net of the entry fee, so it lines up with {@link #realizedPnL()} before
   * the exit fee. Add the entry fee back for the gross mark-to-market figure.
   *
   * @throws PositionValidationException unless the position is OPEN
   */
  public Amount unrealizedPnL(Price markPrice) {
    requireOpen("unrealizedPnL");
    requirePrice(markPrice, "mark price");
    return pnlAt(markPrice).subtract(entryFee);
  }

  public Optional<Amount> realizedPnL() {
    return Optional.ofNullable(realizedPnL);
  }

  /**
   * Realized P&L relative to the entry notional, in percent. Not a {@link Percentage} because
   * fees can push a total loss below -100.
   */
  public Optional<BigDecimal> roi() {
    if (realizedPnL == null) {
      return Optional.empty();
    }
    BigDecimal invested = entryPrice.convertToQuote(size).value();
    return Optional.of(Decimals.divide(realizedPnL.value(), invested).multiply(Decimals.HUNDRED));
  }

  /** Time spent open, up to the close or to {@code now} while still running. */
  public Optional<Duration> duration(Instant now) {
    if (openedAt == null) {
      return Optional.empty();
    }
    Instant end = closedAt != null ? closedAt : Objects.requireNonNull(now, "now");
    return Optional.of(Duration.between(openedAt, end));
  }

  /** Actual minus planned entry, in the quote asset. */
  public Optional<Amount> entrySlippage() {
    return entryPrice == null
        ? Optional.empty()
        : Optional.of(entryPrice.subtract(plan.entryPrice()));
  }

  public Optional<Percentage> entrySlippagePercent() {
    return entryPrice == null
        ? Optional.empty()
        : Optional.of(entryPrice.percentageChangeFrom(plan.entryPrice()));
  }

  /**
   * Actual exit minus the level the exit was triggered by. Empty for exits that had no
   * reference level.
   */
  public Optional<Amount> exitSlippage() {
    return exitReference().map(reference -> exitPrice.subtract(reference));
  }

  public Optional<Percentage> exitSlippagePercent() {
    return exitReference().map(reference -> exitPrice.percentageChangeFrom(reference));
  }

  /** Entry plus exit fees paid so far, in the quote asset. */
  public Amount totalFees() {
    Amount total = Amount.zero(pair().quote());
    if (entryFee != null) {
      total = total.add(entryFee);
    }
    if (exitFee != null) {
      total = total.add(exitFee);
    }
    return total;
  }

  public boolean isOpen() {
    return status == PositionStatus.OPEN;
  }

  public boolean isClosed() {
    return status.isClosed();
  }

  public PositionId id() {
    return id;
  }

  public PositionPlan plan() {
    return plan;
  }

  public TradingPair pair() {
    return plan.pair();
  }

  public PositionSide side() {
    return plan.side();
  }

  public PositionStatus status() {
    return status;
  }

  public OrderId entryOrderId() {
    return entryOrderId;
  }

  public Optional<String> agentId() {
    return Optional.ofNullable(agentId);
  }

  public Optional<String> strategyId() {
    return Optional.ofNullable(strategyId);
  }

  /** Live stop-loss; starts at the planned level. */
  public Price stopLoss() {
    return stopLoss;
  }

  public Price takeProfit() {
    return takeProfit;
  }

  public Optional<Price> entryPrice() {
    return Optional.ofNullable(entryPrice);
  }

  public Optional<Amount> size() {
    return Optional.ofNullable(size);
  }

  public Optional<Amount> entryFee() {
    return Optional.ofNullable(entryFee);
  }

  public Optional<OrderId> stopLossOrderId() {
    return Optional.ofNullable(stopLossOrderId);
  }

  public Optional<OrderId> takeProfitOrderId() {
    return Optional.ofNullable(takeProfitOrderId);
  }

  public Optional<OrderId> exitOrderId() {
    return Optional.ofNullable(exitOrderId);
  }

  public Optional<Price> exitPrice() {
    return Optional.ofNullable(exitPrice);
  }

  public Optional<Amount> exitFee() {
    return Optional.ofNullable(exitFee);
  }

  public Optional<PositionExitReason> exitReason() {
    return Optional.ofNullable(exitReason);
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Optional<Instant> openedAt() {
    return Optional.ofNullable(openedAt);
  }

  public Optional<Instant> closedAt() {
    return Optional.ofNullable(closedAt);
  }

  public Instant updatedAt() {
    return updatedAt;
  }

  public Map<String, Object> metadata() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  @Override
  public String toString() {
    return "Position[" + id + " " + side() + " " + pair().symbol() + " " + status + "]";
  }

  private Amount pnlAt(Price price) {
    Amount move =
        side() == PositionSide.LONG ? price.subtract(entryPrice) : entryPrice.subtract(price);
    return move.multiply(size.value());
  }

  private boolean isBeyondStop(Price entry) {
    return side() == PositionSide.LONG
        ? entry.isLessThanOrEqual(stopLoss)
        : entry.isGreaterThanOrEqual(stopLoss);
  }

  private Optional<Price> exitReference() {
    if (exitPrice == null || exitReason == null) {
      return Optional.empty();
    }
    switch (exitReason) {
      case STOP_LOSS:
        return Optional.of(stopLoss);
      case TAKE_PROFIT:
        return Optional.of(takeProfit);
      default:
        return Optional.empty();
    }
  }

  private void requireOpen(String operation) {
    if (status != PositionStatus.OPEN) {
      throw new PositionValidationException(
          operation + " requires an OPEN position, current status is " + status);
    }
  }

  private void requirePrice(Price price, String field) {
    Objects.requireNonNull(price, field + " must not be null");
    PositionPlan.requireInPair(pair(), price, field);
  }

  private void requireSize(Amount amount) {
    Objects.requireNonNull(amount, "size must not be null");
    if (!amount.isDenominatedIn(pair().base()) || !amount.isValidSize()) {
      throw new PositionValidationException(
          "size must be a positive " + pair().base().symbol() + " amount, got " + amount.format());
    }
  }

  private void requireFee(Amount fee, String field) {
    Objects.requireNonNull(fee, field + " must not be null");
    if (!fee.isDenominatedIn(pair().quote()) || !fee.isValidVolume()) {
      throw new PositionValidationException(
          field
              + " must be a non-negative "
              + pair().quote().symbol()
              + " amount, got "
              + fee.format());
    }
  }

  private void moveTo(PositionStatus next, String operation, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    PositionStateMachine.validateTransition(status, next, operation);
    log.debug("Position transition id={} from={} to={} op={}", id, status, next, operation);
    status = next;
    updatedAt = now;
  }

  private void touch(Instant now) {
    updatedAt = Objects.requireNonNull(now, "now must not be null");
  }
}
