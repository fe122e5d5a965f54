package com.tradingcore.domain.positions;

import static com.tradingcore.testsupport.TradingFixtures.BTC_USDT;
import static com.tradingcore.testsupport.TradingFixtures.T0;
import static com.tradingcore.testsupport.TradingFixtures.at;
import static com.tradingcore.testsupport.TradingFixtures.btc;
import static com.tradingcore.testsupport.TradingFixtures.btcUsdt;
import static com.tradingcore.testsupport.TradingFixtures.usdt;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tradingcore.domain.common.InvalidStateTransitionException;
import com.tradingcore.domain.common.Percentage;
import com.tradingcore.domain.orders.OrderId;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PositionTest {
  private static final OrderId ENTRY_ORDER = OrderId.of("entry-1");

  private static Position openingLong() {
    PositionPlan plan =
        PositionPlan.longPosition(
            BTC_USDT, btcUsdt("50000"), btcUsdt("48000"), btcUsdt("55000"), btc("2"));
    return Position.open(plan, ENTRY_ORDER, "agent-7", "breakout", T0);
  }

  private static Position openLong(String entryPrice) {
    Position position = openingLong();
    position.markAsOpened(
        btcUsdt(entryPrice),
        btc("2"),
        usdt("5"),
        OrderId.of("sl-1"),
        OrderId.of("tp-1"),
        at(10));
    return position;
  }

  private static Position openShort() {
    PositionPlan plan =
        PositionPlan.shortPosition(
            BTC_USDT, btcUsdt("50000"), btcUsdt("52000"), btcUsdt("45000"), btc("2"));
    Position position = Position.open(plan, ENTRY_ORDER, null, null, T0);
    position.markAsOpened(btcUsdt("50000"), btc("2"), usdt("5"), null, null, at(10));
    return position;
  }

  @Test
  void shouldStartOpeningWithPlannedLevels() {
    Position position = openingLong();

    assertEquals(PositionStatus.OPENING, position.status());
    assertEquals(btcUsdt("48000"), position.stopLoss());
    assertEquals(btcUsdt("55000"), position.takeProfit());
    assertEquals(Optional.of("agent-7"), position.agentId());
    assertTrue(position.entryPrice().isEmpty());
    assertTrue(position.realizedPnL().isEmpty());
    assertEquals(usdt("0"), position.totalFees());
  }

  @Test
  void shouldRecordActualEntry() {
    Position position = openLong("50100");

    assertEquals(PositionStatus.OPEN, position.status());
    assertEquals(Optional.of(btcUsdt("50100")), position.entryPrice());
    assertEquals(Optional.of(OrderId.of("sl-1")), position.stopLossOrderId());
    assertEquals(Optional.of(at(10)), position.openedAt());
    assertEquals(Optional.of(usdt("100")), position.entrySlippage());
    assertEquals(Optional.of(Percentage.of("0.2")), position.entrySlippagePercent());
  }

  @Test
  void shouldOpenEvenWhenEntryFilledBeyondStop() {
    Position position = openLong("47000");

    assertTrue(position.isOpen());
  }

  @Test
  void shouldComputeRealizedPnlForLongNetOfFees() {
    Position position = openLong("50000");
    position.markAsClosing(OrderId.of("exit-1"), at(60));
    position.markAsClosed(btcUsdt("55000"), usdt("5"), PositionExitReason.TAKE_PROFIT, at(70));

    assertEquals(PositionStatus.CLOSED, position.status());
    assertEquals(Optional.of(usdt("9990")), position.realizedPnL());
    assertEquals(0, new BigDecimal("9.99").compareTo(position.roi().orElseThrow()));
    assertEquals(usdt("10"), position.totalFees());
    assertEquals(Optional.of(usdt("0")), position.exitSlippage());
    assertEquals(Optional.of(Duration.ofSeconds(60)), position.duration(at(500)));
    assertTrue(position.isClosed());
  }

  @Test
  void shouldComputeRealizedPnlForShortNetOfFees() {
    Position position = openShort();
    position.markAsClosed(btcUsdt("45000"), usdt("5"), PositionExitReason.TAKE_PROFIT, at(20));

    assertEquals(Optional.of(usdt("9990")), position.realizedPnL());
  }

  @Test
  void shouldMeasureExitSlippageAgainstTriggeredLevel() {
    Position stopped = openLong("50000");
    stopped.markAsClosed(btcUsdt("47900"), usdt("5"), PositionExitReason.STOP_LOSS, at(20));

    assertEquals(Optional.of(usdt("-100")), stopped.exitSlippage());
    assertEquals(Optional.of(usdt("-4210")), stopped.realizedPnL());

    Position manual = openLong("50000");
    manual.markAsClosed(btcUsdt("50500"), usdt("5"), PositionExitReason.MANUAL_CLOSE, at(20));
    assertTrue(manual.exitSlippage().isEmpty());
  }

  @Test
  void shouldLiquidateFromClosing() {
    Position position = openLong("50000");
    position.markAsClosing(OrderId.of("exit-1"), at(30));
    position.markAsLiquidated(btcUsdt("40000"), usdt("0"), at(40));

    assertEquals(PositionStatus.LIQUIDATED, position.status());
    assertEquals(Optional.of(PositionExitReason.LIQUIDATION), position.exitReason());
    assertEquals(Optional.of(usdt("-20005")), position.realizedPnL());
    assertTrue(position.isClosed());
  }

  @Test
  void shouldRejectClosingPositionThatNeverOpened() {
    Position position = openingLong();

    assertThrows(
        InvalidStateTransitionException.class,
        () ->
            position.markAsClosed(
                btcUsdt("51000"), usdt("1"), PositionExitReason.MANUAL_CLOSE, at(5)));
    assertThrows(
        InvalidStateTransitionException.class,
        () -> position.markAsClosing(OrderId.of("exit-1"), at(5)));
  }

  @Test
  void shouldRejectSecondClose() {
    Position position = openLong("50000");
    position.markAsClosed(btcUsdt("51000"), usdt("1"), PositionExitReason.MANUAL_CLOSE, at(20));

    assertThrows(
        InvalidStateTransitionException.class,
        () -> position.markAsLiquidated(btcUsdt("40000"), usdt("1"), at(30)));
  }

  @Test
  void shouldComputeUnrealizedPnlNetOfEntryFeeWhileOpenOnly() {
    Position position = openLong("50000");

    assertEquals(usdt("1995"), position.unrealizedPnL(btcUsdt("51000")));
    assertEquals(
        position.unrealizedPnL(btcUsdt("51000")), position.unrealizedPnL(btcUsdt("51000")));
    assertEquals(usdt("-2005"), position.unrealizedPnL(btcUsdt("49000")));
    assertEquals(
        usdt("2000"),
        position.unrealizedPnL(btcUsdt("51000")).add(position.entryFee().orElseThrow()));

    position.markAsClosing(OrderId.of("exit-1"), at(20));
    assertThrows(
        PositionValidationException.class, () -> position.unrealizedPnL(btcUsdt("51000")));
  }

  @Test
  void shouldRevalidateProtectiveLevelsAgainstActualEntry() {
    Position position = openLong("50200");

    position.updateStopLoss(btcUsdt("50100"), at(20));
    assertEquals(btcUsdt("50100"), position.stopLoss());
    assertEquals(btcUsdt("48000"), position.plan().stopLoss());

    assertThrows(
        PositionValidationException.class, () -> position.updateStopLoss(btcUsdt("50200"), at(21)));
    assertThrows(
        PositionValidationException.class,
        () -> position.updateTakeProfit(btcUsdt("50000"), at(21)));

    position.updateTakeProfit(btcUsdt("56000"), at(22));
    assertEquals(btcUsdt("56000"), position.takeProfit());
    assertEquals(at(22), position.updatedAt());
  }

  @Test
  void shouldRejectLevelUpdatesUnlessOpen() {
    Position position = openingLong();

    assertThrows(
        PositionValidationException.class, () -> position.updateStopLoss(btcUsdt("47000"), at(1)));
  }

  @Test
  void shouldRejectMutationInputsOutsideThePair() {
    Position position = openingLong();

    assertThrows(
        PositionValidationException.class,
        () -> position.markAsOpened(btcUsdt("50000"), usdt("2"), usdt("1"), null, null, at(1)));
    assertThrows(
        PositionValidationException.class,
        () -> position.markAsOpened(btcUsdt("50000"), btc("2"), btc("0.001"), null, null, at(1)));
    assertEquals(PositionStatus.OPENING, position.status());
  }

  @Test
  void shouldMergeMetadata() {
    Position position = openingLong();
    position.updateMetadata(Map.of("signal", "ema-cross"), at(1));
    position.updateMetadata(Map.of("confidence", 0.8), at(2));

    assertEquals("ema-cross", position.metadata().get("signal"));
    assertEquals(0.8, position.metadata().get("confidence"));
    assertEquals(at(2), position.updatedAt());
  }
}
