package com.tradingcore.domain.orders;

import com.tradingcore.domain.common.InvalidStateTransitionException;
import java.util.EnumSet;
import java.util.Map;

/**
 * Status graph of an {@link Order}. FAILED stays reachable from every state except FILLED so a
 * late system error can still be recorded against a cancelled or rejected order. A FAILED order
 * may still be cancelled.
 */
public final class OrderStateMachine {
  private static final Map<OrderStatus, EnumSet<OrderStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          OrderStatus.PENDING,
              EnumSet.of(
                  OrderStatus.SUBMITTED,
                  OrderStatus.PARTIALLY_FILLED,
                  OrderStatus.FILLED,
                  OrderStatus.CANCELLED,
                  OrderStatus.REJECTED,
                  OrderStatus.FAILED),
          OrderStatus.SUBMITTED,
              EnumSet.of(
                  OrderStatus.OPEN,
                  OrderStatus.PARTIALLY_FILLED,
                  OrderStatus.FILLED,
                  OrderStatus.CANCELLED,
                  OrderStatus.REJECTED,
                  OrderStatus.FAILED),
          OrderStatus.OPEN,
              EnumSet.of(
                  OrderStatus.PARTIALLY_FILLED,
                  OrderStatus.FILLED,
                  OrderStatus.CANCELLED,
                  OrderStatus.FAILED),
          OrderStatus.PARTIALLY_FILLED,
              EnumSet.of(
                  OrderStatus.PARTIALLY_FILLED,
                  OrderStatus.FILLED,
                  OrderStatus.CANCELLED,
                  OrderStatus.FAILED),
          OrderStatus.FILLED, EnumSet.noneOf(OrderStatus.class),
          OrderStatus.CANCELLED, EnumSet.of(OrderStatus.FAILED),
          OrderStatus.REJECTED, EnumSet.of(OrderStatus.FAILED),
          OrderStatus.FAILED, EnumSet.of(OrderStatus.FAILED, OrderStatus.CANCELLED));

  private OrderStateMachine() {}

  public static boolean canTransition(OrderStatus from, OrderStatus to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<OrderStatus> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  public static void validateTransition(OrderStatus from, OrderStatus to, String operation) {
    if (!canTransition(from, to)) {
      throw new InvalidStateTransitionException("Order", from, operation + " -> " + to);
    }
  }
}
