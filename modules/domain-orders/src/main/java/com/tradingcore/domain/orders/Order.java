package com.tradingcore.domain.orders;

import com.tradingcore.domain.common.Amount;
import com.tradingcore.domain.common.Asset;
import com.tradingcore.domain.common.Decimals;
import com.tradingcore.domain.common.InvalidOperationException;
import com.tradingcore.domain.common.InvalidStateTransitionException;
import com.tradingcore.domain.common.OrderSide;
import com.tradingcore.domain.common.Price;
import com.tradingcore.domain.common.TradingPair;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lifecycle of one order from creation to a terminal status. Fills are only ever appended and
 * every aggregate is recomputed from them on demand.
 *
 * <p>Not thread-safe: a single owner must serialize mutations of one instance.
 */
public final class Order {
  private static final Logger log = LoggerFactory.getLogger(Order.class);

  private static final EnumSet<OrderStatus> MARKET_FILLABLE =
      EnumSet.of(OrderStatus.PENDING, OrderStatus.SUBMITTED, OrderStatus.PARTIALLY_FILLED);
  private static final EnumSet<OrderStatus> RESTING_FILLABLE =
      EnumSet.of(OrderStatus.OPEN, OrderStatus.PARTIALLY_FILLED);

  private final OrderId id;
  private final OrderParameters parameters;
  private final List<Fill> fills = new ArrayList<>();
  private final Instant createdAt;
  private OrderStatus status;
  private ExchangeOrderId exchangeOrderId;
  private Instant updatedAt;
  private Instant submittedAt;
  private Instant completedAt;
  private String rejectionReason;

  private Order(OrderId id, OrderParameters parameters, Instant now) {
    this.id = Objects.requireNonNull(id, "id must not be null");
    this.parameters = Objects.requireNonNull(parameters, "parameters must not be null");
    this.createdAt = Objects.requireNonNull(now, "now must not be null");
    this.updatedAt = now;
    this.status = OrderStatus.PENDING;
  }

  public static Order create(OrderParameters parameters, Instant now) {
    return create(OrderId.generate(), parameters, now);
  }

  public static Order create(OrderId id, OrderParameters parameters, Instant now) {
    Order order = new Order(id, parameters, now);
    log.debug("Order created id={} parameters={}", id, parameters);
    return order;
  }

  /** PENDING -> SUBMITTED; records the venue's id so later fills can be matched against it. */
  public void submit(ExchangeOrderId exchangeOrderId, Instant now) {
    Objects.requireNonNull(exchangeOrderId, "exchangeOrderId must not be null");
    requireStatus(EnumSet.of(OrderStatus.PENDING), "submit");
    moveTo(OrderStatus.SUBMITTED, "submit", now);
    this.exchangeOrderId = exchangeOrderId;
    this.submittedAt = now;
  }

  /** SUBMITTED -> OPEN, for stop and take-profit orders resting on the venue. */
  public void open(Instant now) {
    requireStatus(EnumSet.of(OrderStatus.SUBMITTED), "open");
    moveTo(OrderStatus.OPEN, "open", now);
  }

  public void addFill(Fill fill, Instant now) {
    Objects.requireNonNull(fill, "fill must not be null");
    if (!fill.pair().equals(parameters.pair())) {
      throw new OrderValidationException(
          "fill pair " + fill.pair().symbol() + " does not match order pair " + pair().symbol());
    }
    if (exchangeOrderId != null && !fill.matchesOrder(exchangeOrderId)) {
      throw new OrderValidationException(
          "fill exchange order id "
              + fill.exchangeOrderId()
              + " does not match order "
              + exchangeOrderId);
    }
    requireStatus(parameters.isMarketOrder() ? MARKET_FILLABLE : RESTING_FILLABLE, "addFill");

    Amount filledAfter = totalFilledQuantity().add(fill.executedQuantity());
    OrderStatus next =
        filledAfter.isGreaterThanOrEqual(parameters.quantity())
            ? OrderStatus.FILLED
            : OrderStatus.PARTIALLY_FILLED;
    moveTo(next, "addFill", now);
    fills.add(fill);
    if (next == OrderStatus.FILLED) {
      completedAt = now;
    }
    log.debug(
        "Fill applied orderId={} tradeId={} filled={} requested={}",
        id,
        fill.tradeId(),
        filledAfter.format(),
        parameters.quantity().format());
  }

  /** Active or FAILED -> CANCELLED. FILLED, REJECTED and CANCELLED orders stay as they are. */
  public void cancel(Instant now) {
    requireStatus(
        EnumSet.of(
            OrderStatus.PENDING,
            OrderStatus.SUBMITTED,
            OrderStatus.OPEN,
            OrderStatus.PARTIALLY_FILLED,
            OrderStatus.FAILED),
        "cancel");
    moveTo(OrderStatus.CANCELLED, "cancel", now);
    completedAt = now;
  }

  public void reject(String reason, Instant now) {
    requireStatus(EnumSet.of(OrderStatus.PENDING, OrderStatus.SUBMITTED), "reject");
    moveTo(OrderStatus.REJECTED, "reject", now);
    rejectionReason = reason;
    completedAt = now;
  }

  /** Records a system error; allowed from every status except FILLED. */
  public void fail(String reason, Instant now) {
    moveTo(OrderStatus.FAILED, "fail", now);
    rejectionReason = reason;
    completedAt = now;
  }

  public Amount totalFilledQuantity() {
    Amount total = Amount.zero(pair().base());
    for (Fill fill : fills) {
      total = total.add(fill.executedQuantity());
    }
    return total;
  }

  public Amount remainingQuantity() {
    return parameters.quantity().subtractOrZero(totalFilledQuantity());
  }

  /** Quantity-weighted average execution price; empty until the first fill. */
  public Optional<Price> averageFillPrice() {
    if (fills.isEmpty()) {
      return Optional.empty();
    }
    BigDecimal notional = BigDecimal.ZERO;
    BigDecimal quantity = BigDecimal.ZERO;
    for (Fill fill : fills) {
      notional = notional.add(fill.grossTotal().value());
      quantity = quantity.add(fill.executedQuantity().value());
    }
    return Optional.of(Price.of(Decimals.divide(notional, quantity), pair()));
  }

  /**
   * Sum of all fees in the quote asset.
   *
   * @throws InvalidOperationException if any fill was charged in the base asset; use {@link
   *     #feesByAsset()} for mixed fee currencies
   */
  public Amount totalFees() {
    Asset quote = pair().quote();
    Amount total = Amount.zero(quote);
    for (Fill fill : fills) {
      if (!fill.fee().isDenominatedIn(quote)) {
        throw new InvalidOperationException(
            "Order.totalFees",
            "fee of trade " + fill.tradeId() + " is not in quote asset " + quote.symbol(),
            fill.fee());
      }
      total = total.add(fill.fee());
    }
    return total;
  }

  public Map<Asset, Amount> feesByAsset() {
    Map<Asset, Amount> fees = new LinkedHashMap<>();
    for (Fill fill : fills) {
      fees.merge(fill.fee().asset(), fill.fee(), Amount::add);
    }
    return Collections.unmodifiableMap(fees);
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }

  public boolean isActive() {
    return status.isActive();
  }

  public OrderId id() {
    return id;
  }

  public OrderParameters parameters() {
    return parameters;
  }

  public TradingPair pair() {
    return parameters.pair();
  }

  public OrderSide side() {
    return parameters.side();
  }

  public OrderType type() {
    return parameters.type();
  }

  public OrderStatus status() {
    return status;
  }

  public Optional<ExchangeOrderId> exchangeOrderId() {
    return Optional.ofNullable(exchangeOrderId);
  }

  /** Snapshot copy; later fills do not show up in it. */
  public List<Fill> fills() {
    return List.copyOf(fills);
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant updatedAt() {
    return updatedAt;
  }

  public Optional<Instant> submittedAt() {
    return Optional.ofNullable(submittedAt);
  }

  public Optional<Instant> completedAt() {
    return Optional.ofNullable(completedAt);
  }

  public Optional<String> rejectionReason() {
    return Optional.ofNullable(rejectionReason);
  }

  @Override
  public String toString() {
    return "Order[" + id + " " + status + " " + parameters + "]";
  }

  private void requireStatus(EnumSet<OrderStatus> allowed, String operation) {
    if (!allowed.contains(status)) {
      throw new InvalidStateTransitionException(
          "Order", status, operation + " requires one of " + allowed);
    }
  }

  private void moveTo(OrderStatus next, String operation, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    OrderStateMachine.validateTransition(status, next, operation);
    log.debug("Order transition id={} from={} to={} op={}", id, status, next, operation);
    status = next;
    updatedAt = now;
  }
}
