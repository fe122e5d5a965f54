package com.tradingcore.domain.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class QuantityTest {
  @Test
  void shouldRejectNegativeAndNonFiniteValues() {
    assertThrows(InvalidValueException.class, () -> Quantity.of("-1"));
    assertThrows(InvalidValueException.class, () -> Quantity.of(Double.NaN));
    assertThrows(InvalidValueException.class, () -> Quantity.of(Double.POSITIVE_INFINITY));
  }

  @Test
  void shouldNeverSubtractBelowZero() {
    InvalidOperationException ex =
        assertThrows(
            InvalidOperationException.class, () -> Quantity.of("1").subtract(Quantity.of("1.5")));

    assertEquals("Quantity.subtract", ex.operation());
    assertEquals(Quantity.zero(), Quantity.of("2").subtract(Quantity.of("2.00")));
  }

  @Test
  void shouldMultiplyAndDivideExactly() {
    Quantity third = Quantity.one().divide(3);

    assertEquals(Quantity.of("0.3"), Quantity.of("0.1").add(Quantity.of("0.2")));
    assertEquals(Quantity.one(), Quantity.of("0.5").multiply(new BigDecimal("2")));
    assertTrue(third.multiply(3).isLessThanOrEqual(Quantity.one()));
  }

  @Test
  void shouldRejectInvalidOperands() {
    assertThrows(InvalidOperationException.class, () -> Quantity.one().divide(0));
    assertThrows(InvalidOperationException.class, () -> Quantity.one().divide(-2));
    assertThrows(InvalidOperationException.class, () -> Quantity.one().multiply(-1));
    assertThrows(InvalidOperationException.class, () -> Quantity.one().multiply(Double.NaN));
  }
}
