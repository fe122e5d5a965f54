package com.tradingcore.infra.json;

import com.fasterxml.jackson.databind.module.SimpleModule;
import com.tradingcore.domain.common.Amount;
import com.tradingcore.domain.common.Asset;
import com.tradingcore.domain.common.Percentage;
import com.tradingcore.domain.common.Price;
import com.tradingcore.domain.common.Quantity;
import com.tradingcore.domain.common.TradingPair;
import com.tradingcore.domain.marketdata.Kline;
import com.tradingcore.domain.marketdata.OrderBookLevel;
import com.tradingcore.domain.marketdata.OrderBookSnapshot;
import com.tradingcore.domain.orders.Fill;
import com.tradingcore.domain.orders.Order;
import com.tradingcore.domain.positions.Position;

/**
 * Write-only projection of the trading domain. Registered as a bean by {@link
 * TradingJsonAutoConfiguration}, so Spring Boot's own {@code ObjectMapper} picks it up as well.
 */
public class TradingDomainJacksonModule extends SimpleModule {
  public TradingDomainJacksonModule() {
    this(new TradingJsonProperties());
  }

  public TradingDomainJacksonModule(TradingJsonProperties properties) {
    super("TradingDomainJacksonModule");
    DecimalWriter decimals = new DecimalWriter(properties.isWriteDecimalsAsStrings());

    addSerializer(Asset.class, new ValueSerializers.AssetSerializer());
    addSerializer(TradingPair.class, new ValueSerializers.TradingPairSerializer());
    addSerializer(Amount.class, new ValueSerializers.AmountSerializer(decimals));
    addSerializer(Price.class, new ValueSerializers.PriceSerializer(decimals));
    addSerializer(Quantity.class, new ValueSerializers.QuantitySerializer(decimals));
    addSerializer(Percentage.class, new ValueSerializers.PercentageSerializer(decimals));

    addSerializer(
        OrderBookLevel.class, new MarketDataSerializers.OrderBookLevelSerializer(decimals));
    addSerializer(
        OrderBookSnapshot.class,
        new MarketDataSerializers.OrderBookSnapshotSerializer(
            decimals, properties.effectiveOrderBookSummaryLevels()));
    addSerializer(Kline.class, new MarketDataSerializers.KlineSerializer(decimals));

    addSerializer(Fill.class, new EntitySerializers.FillSerializer());
    addSerializer(Order.class, new EntitySerializers.OrderSerializer());
    addSerializer(Position.class, new EntitySerializers.PositionSerializer(decimals));
  }
}
