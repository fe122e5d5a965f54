package com.tradingcore.domain.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class PriceTest {
  private static final Asset BTC = Asset.crypto("BTC");
  private static final Asset ETH = Asset.crypto("ETH");
  private static final Asset USDT = Asset.stablecoin("USDT");
  private static final TradingPair BTC_USDT = TradingPair.of(BTC, USDT);
  private static final TradingPair ETH_USDT = TradingPair.of(ETH, USDT);

  @Test
  void shouldRejectNonPositiveValues() {
    assertThrows(InvalidValueException.class, () -> Price.of("0", BTC_USDT));
    assertThrows(InvalidValueException.class, () -> Price.of(-1, BTC_USDT));
    assertThrows(InvalidValueException.class, () -> Price.of(Double.POSITIVE_INFINITY, BTC_USDT));
  }

  @Test
  void shouldSubtractIntoQuoteAmount() {
    Amount diff = Price.of("50000", BTC_USDT).subtract(Price.of("52000", BTC_USDT));

    assertEquals(Amount.of("-2000", USDT), diff);
    assertEquals(
        Amount.of("2000", USDT),
        Price.of("50000", BTC_USDT).absoluteDifference(Price.of("52000", BTC_USDT)));
  }

  @Test
  void shouldRejectCrossPairOperations() {
    Price btc = Price.of("50000", BTC_USDT);
    Price eth = Price.of("3000", ETH_USDT);

    assertThrows(InvalidOperationException.class, () -> btc.subtract(eth));
    assertThrows(InvalidOperationException.class, () -> btc.isGreaterThan(eth));
    assertThrows(InvalidOperationException.class, () -> btc.percentageChangeTo(eth));
    assertThrows(InvalidOperationException.class, () -> btc.min(eth));
  }

  @Test
  void shouldRoundTripScalarMultiplyAndDivide() {
    Price price = Price.of("50123.45", BTC_USDT);

    for (double factor : new double[] {0.3, 1.1, 2, 7, 1234.5678}) {
      assertEquals(price, price.multiplyBy(factor).divideBy(factor));
    }
  }

  @Test
  void shouldRejectInvalidScalars() {
    Price price = Price.of("100", BTC_USDT);

    assertThrows(InvalidOperationException.class, () -> price.divideBy(0));
    assertThrows(InvalidOperationException.class, () -> price.multiplyBy(Double.NaN));
    assertThrows(InvalidOperationException.class, () -> price.multiplyBy(-1));
    assertThrows(InvalidOperationException.class, () -> price.divideBy(-2));
  }

  @Test
  void shouldConvertBetweenBaseAndQuote() {
    Price price = Price.of("50000", BTC_USDT);

    assertEquals(Amount.of("25000", USDT), price.convertToQuote(Amount.of("0.5", BTC)));
    assertEquals(Amount.of("2", BTC), price.convertToBase(Amount.of("100000", USDT)));
    assertThrows(
        InvalidOperationException.class, () -> price.convertToQuote(Amount.of("1", USDT)));
    assertThrows(
        InvalidOperationException.class, () -> price.convertToBase(Amount.of("1", BTC)));
  }

  @Test
  void shouldComputePercentageChanges() {
    Price from = Price.of("50000", BTC_USDT);
    Price to = Price.of("55000", BTC_USDT);

    assertEquals(Percentage.of(10), from.percentageChangeTo(to));
    assertEquals(Percentage.of(10), to.percentageChangeFrom(from));
    assertEquals(
        Price.of("110", BTC_USDT),
        Price.of("100", BTC_USDT).applyPercentageChange(Percentage.of(10)));
    assertEquals(
        Percentage.of(200, true),
        Price.of("100", BTC_USDT).percentageChangeTo(Price.of("300", BTC_USDT)));
  }

  @Test
  void shouldAlignToTickSize() {
    Price price = Price.of("50123.456", BTC_USDT);
    BigDecimal tick = new BigDecimal("0.01");

    assertEquals(Price.of("50123.46", BTC_USDT), price.roundToTickSize(tick));
    assertEquals(Price.of("50123.45", BTC_USDT), price.floorToTickSize(tick));
    assertEquals(Price.of("50123.46", BTC_USDT), price.ceilToTickSize(tick));
    assertEquals(
        Price.of("100.5", BTC_USDT), Price.of("100", BTC_USDT).addTicks(5, new BigDecimal("0.1")));
    assertThrows(
        InvalidOperationException.class,
        () -> Price.of("1", BTC_USDT).addTicks(-20, new BigDecimal("0.1")));
    assertThrows(InvalidOperationException.class, () -> price.roundToTickSize(BigDecimal.ZERO));
  }

  @Test
  void shouldCompareWithinPair() {
    Price low = Price.of("49000", BTC_USDT);
    Price mid = Price.of("50000", BTC_USDT);
    Price high = Price.of("51000", BTC_USDT);

    assertTrue(mid.isBetween(low, high));
    assertTrue(mid.isBetween(mid, mid));
    assertSame(low, mid.min(low));
    assertSame(high, mid.max(high));
    assertEquals("50000 BTC/USDT", mid.toString());
  }
}
