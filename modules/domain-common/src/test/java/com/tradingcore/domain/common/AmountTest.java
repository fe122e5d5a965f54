package com.tradingcore.domain.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class AmountTest {
  private static final Asset BTC = Asset.crypto("BTC");
  private static final Asset USDT = Asset.stablecoin("USDT");

  @Test
  void shouldRoundTripAddThenSubtract() {
    for (String[] pair :
        new String[][] {{"1.5", "0.25"}, {"-20", "7.125"}, {"0", "0.00000001"}, {"1e3", "3"}}) {
      Amount a = Amount.of(pair[0], USDT);
      Amount b = Amount.of(pair[1], USDT);

      assertEquals(a, a.add(b).subtract(b));
    }
  }

  @Test
  void shouldAvoidBinaryFloatingPointDrift() {
    Amount total = Amount.of("0.1", USDT).add(Amount.of("0.2", USDT));

    assertEquals(Amount.of("0.3", USDT), total);
  }

  @Test
  void shouldRejectMixedAssetArithmeticAndComparison() {
    Amount usdt = Amount.of("100", USDT);
    Amount btc = Amount.of("1", BTC);

    InvalidOperationException ex =
        assertThrows(InvalidOperationException.class, () -> usdt.add(btc));
    assertEquals("Amount.add", ex.operation());
    assertThrows(InvalidOperationException.class, () -> usdt.subtract(btc));
    assertThrows(InvalidOperationException.class, () -> usdt.subtractOrZero(btc));
    assertThrows(InvalidOperationException.class, () -> usdt.isGreaterThan(btc));
    assertFalse(usdt.equals(Amount.of("100", BTC)));
  }

  @Test
  void shouldFloorSubtractOrZeroAtZero() {
    Amount balance = Amount.of("3", USDT);

    assertEquals(Amount.zero(USDT), balance.subtractOrZero(Amount.of("5", USDT)));
    assertEquals(Amount.of("1", USDT), balance.subtractOrZero(Amount.of("2", USDT)));
    assertTrue(balance.subtract(Amount.of("5", USDT)).isNegative());
  }

  @Test
  void shouldRejectDivisionByZeroAndNonFiniteOperands() {
    Amount amount = Amount.of("10", USDT);

    assertThrows(InvalidOperationException.class, () -> amount.divide(0));
    assertThrows(InvalidOperationException.class, () -> amount.divide(BigDecimal.ZERO));
    assertThrows(InvalidOperationException.class, () -> amount.divide(Double.NaN));
    assertThrows(InvalidOperationException.class, () -> amount.multiply(Double.NEGATIVE_INFINITY));
    assertThrows(InvalidValueException.class, () -> Amount.of(Double.NaN, USDT));
    assertThrows(InvalidValueException.class, () -> Amount.of("abc", USDT));
  }

  @Test
  void shouldDivideWithDecimalPrecision() {
    Amount third = Amount.of("10", USDT).divide(3);

    assertEquals(34, third.value().precision());
    assertEquals(Amount.of("10", USDT), Amount.of("10", USDT).divide(4).multiply(4));
  }

  @Test
  void shouldRaiseInsufficientFundsWithContext() {
    Amount available = Amount.of("50", USDT);
    Amount required = Amount.of("75.5", USDT);

    InsufficientFundsException ex =
        assertThrows(InsufficientFundsException.class, () -> available.withdraw(required));

    assertEquals(required, ex.required());
    assertEquals(available, ex.available());
    assertEquals(Amount.of("25.5", USDT), ex.shortfall());
    assertEquals("insufficient-funds", ex.errorCode());
    assertEquals(Amount.of("10", USDT), Amount.of("85.5", USDT).withdraw(required));
  }

  @Test
  void shouldApplyPercentageAndSignHelpers() {
    Amount amount = Amount.of("-250", USDT);

    assertEquals(Amount.of("250", USDT), amount.abs());
    assertEquals(Amount.of("250", USDT), amount.negate());
    assertEquals(Amount.of("25", USDT), amount.abs().percentageOf(Percentage.of(10)));
    assertFalse(amount.isValidSize());
    assertTrue(Amount.zero(USDT).isValidVolume());
  }

  @Test
  void shouldSumAmountsOfOneAsset() {
    Amount total =
        Amount.sum(
            USDT,
            List.of(Amount.of("1.5", USDT), Amount.of("2", USDT), Amount.of("-0.5", USDT)));

    assertEquals(Amount.of("3", USDT), total);
    assertEquals("3.00 USDT", total.format(2));
  }

  @Test
  void shouldTreatNumericallyEqualValuesAsEqual() {
    assertEquals(Amount.of("1.50", BTC), Amount.of("1.5", BTC));
    assertEquals(Amount.of("1.50", BTC).hashCode(), Amount.of("1.5", BTC).hashCode());
  }
}
