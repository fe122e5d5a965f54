package com.tradingcore.domain.orders;

import static com.tradingcore.testsupport.TradingFixtures.BTC_USDT;
import static com.tradingcore.testsupport.TradingFixtures.ETH_USDT;
import static com.tradingcore.testsupport.TradingFixtures.btc;
import static com.tradingcore.testsupport.TradingFixtures.btcUsdt;
import static com.tradingcore.testsupport.TradingFixtures.usdt;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tradingcore.domain.common.InvalidOperationException;
import com.tradingcore.domain.common.InvalidValueException;
import com.tradingcore.domain.common.OrderSide;
import com.tradingcore.domain.common.Price;
import org.junit.jupiter.api.Test;

class OrderParametersTest {
  @Test
  void shouldBuildMarketOrders() {
    OrderParameters buy = OrderParameters.marketBuy(BTC_USDT, btc("0.5"));

    assertEquals(OrderSide.BUY, buy.side());
    assertTrue(buy.isMarketOrder());
    assertFalse(buy.isStopOrder());
    assertTrue(buy.stopPriceIfPresent().isEmpty());
    assertEquals(usdt("25000"), buy.estimatedValue(btcUsdt("50000")));
    assertEquals("MARKET BUY 0.5 BTC BTC/USDT", buy.toString());
  }

  @Test
  void shouldValueStopOrdersAtTheirTrigger() {
    OrderParameters stop =
        OrderParameters.stopLoss(BTC_USDT, OrderSide.SELL, btc("2"), btcUsdt("48000"));

    assertTrue(stop.isStopOrder());
    assertEquals(usdt("96000"), stop.estimatedValue(btcUsdt("50000")));
    assertEquals(usdt("96000"), stop.estimatedValue(null));
  }

  @Test
  void shouldRequireStopPriceOnRestingOrdersOnly() {
    assertThrows(
        InvalidValueException.class,
        () -> OrderParameters.takeProfit(BTC_USDT, OrderSide.SELL, btc("1"), null));
    assertThrows(
        InvalidValueException.class,
        () ->
            new OrderParameters(
                BTC_USDT, OrderSide.BUY, OrderType.MARKET, btc("1"), btcUsdt("50000")));
    assertThrows(
        InvalidValueException.class,
        () ->
            OrderParameters.stopLoss(
                BTC_USDT, OrderSide.SELL, btc("1"), Price.of("3000", ETH_USDT)));
  }

  @Test
  void shouldRejectQuantityOutsideBaseAsset() {
    assertThrows(InvalidValueException.class, () -> OrderParameters.marketBuy(BTC_USDT, btc("0")));
    assertThrows(
        InvalidValueException.class, () -> OrderParameters.marketBuy(BTC_USDT, usdt("100")));
  }

  @Test
  void shouldRequireMarketPriceForMarketOrderValue() {
    OrderParameters sell = OrderParameters.marketSell(BTC_USDT, btc("1"));

    assertThrows(InvalidOperationException.class, () -> sell.estimatedValue(null));
    assertThrows(
        InvalidOperationException.class, () -> sell.estimatedValue(Price.of("3000", ETH_USDT)));
  }
}
