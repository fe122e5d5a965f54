package com.tradingcore.domain.positions;

import com.tradingcore.domain.common.InvalidStateTransitionException;
import java.util.EnumSet;
import java.util.Map;

public final class PositionStateMachine {
  private static final Map<PositionStatus, EnumSet<PositionStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          PositionStatus.OPENING, EnumSet.of(PositionStatus.OPEN),
          PositionStatus.OPEN,
              EnumSet.of(
                  PositionStatus.CLOSING, PositionStatus.CLOSED, PositionStatus.LIQUIDATED),
          PositionStatus.CLOSING, EnumSet.of(PositionStatus.CLOSED, PositionStatus.LIQUIDATED),
          PositionStatus.CLOSED, EnumSet.noneOf(PositionStatus.class),
          PositionStatus.LIQUIDATED, EnumSet.noneOf(PositionStatus.class));

  private PositionStateMachine() {}

  public static boolean canTransition(PositionStatus from, PositionStatus to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<PositionStatus> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  public static void validateTransition(PositionStatus from, PositionStatus to, String operation) {
    if (!canTransition(from, to)) {
      throw new InvalidStateTransitionException("Position", from, operation + " -> " + to);
    }
  }
}
