package com.tradingcore.domain.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class PercentageTest {
  private static final Asset USDT = Asset.stablecoin("USDT");

  @Test
  void shouldEnforceDefaultDomain() {
    assertThrows(InvalidValueException.class, () -> Percentage.of(100.01));
    assertThrows(InvalidValueException.class, () -> Percentage.of(-100.01));
    assertThrows(InvalidValueException.class, () -> Percentage.of(Double.NaN));
    assertEquals(Percentage.of("-100"), Percentage.of(-100));
  }

  @Test
  void shouldAllowValuesAboveHundredWhenRequested() {
    assertEquals(0, new BigDecimal("250").compareTo(Percentage.of(250, true).value()));
    assertThrows(InvalidValueException.class, () -> Percentage.of(-101, true));
  }

  @Test
  void shouldConvertRatiosAndBasisPoints() {
    assertEquals(Percentage.of(50), Percentage.fromRatio(0.5));
    assertEquals(Percentage.of(150, true), Percentage.fromRatio(1.5));
    assertEquals(Percentage.of("0.5"), Percentage.fromBasisPoints(50));
    assertEquals(0, new BigDecimal("0.25").compareTo(Percentage.of(25).toRatio()));
    assertEquals(0, new BigDecimal("1250").compareTo(Percentage.of("12.5").toBasisPoints()));
  }

  @Test
  void shouldTakePortionOfAmountOnlyWithinZeroToHundred() {
    Amount fee = Percentage.of("0.1").portionOf(Amount.of("5000", USDT));

    assertEquals(Amount.of("5", USDT), fee);
    assertThrows(
        InvalidOperationException.class,
        () -> Percentage.of(-5).portionOf(Amount.of("100", USDT)));
    assertThrows(
        InvalidOperationException.class,
        () -> Percentage.of(120, true).portionOf(Amount.of("100", USDT)));
  }

  @Test
  void shouldCombineAndFormat() {
    Percentage cumulative = Percentage.of(80).add(Percentage.of(40));

    assertTrue(cumulative.isGreaterThan(Percentage.of(100)));
    assertEquals("12.50%", Percentage.of("12.5").format(2));
    assertEquals(Percentage.of(-10), Percentage.of(10).subtract(Percentage.of(20)));
    assertThrows(
        InvalidValueException.class, () -> Percentage.of(-90).subtract(Percentage.of(20)));
  }
}
