package com.tradingcore.infra.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.tradingcore.domain.marketdata.Kline;
import com.tradingcore.domain.marketdata.OrderBookLevel;
import com.tradingcore.domain.marketdata.OrderBookSnapshot;
import java.io.IOException;
import java.util.List;

final class MarketDataSerializers {
  private MarketDataSerializers() {}

  /** Ladder rungs are written flat: {@code {price, quantity, total}}. */
  static final class OrderBookLevelSerializer extends StdSerializer<OrderBookLevel> {
    private final DecimalWriter decimals;

    OrderBookLevelSerializer(DecimalWriter decimals) {
      super(OrderBookLevel.class);
      this.decimals = decimals;
    }

    @Override
    public void serialize(OrderBookLevel value, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
      gen.writeStartObject();
      decimals.writeField(gen, "price", value.price().value());
      decimals.writeField(gen, "quantity", value.quantity().value());
      decimals.writeField(gen, "total", value.totalValue().value());
      gen.writeEndObject();
    }
  }

  static final class OrderBookSnapshotSerializer extends StdSerializer<OrderBookSnapshot> {
    private final DecimalWriter decimals;
    private final int summaryLevels;

    OrderBookSnapshotSerializer(DecimalWriter decimals, int summaryLevels) {
      super(OrderBookSnapshot.class);
      this.decimals = decimals;
      this.summaryLevels = summaryLevels;
    }

    @Override
    public void serialize(OrderBookSnapshot value, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
      gen.writeStartObject();
      gen.writeStringField("pair", value.pair().symbol());
      provider.defaultSerializeField("timestamp", value.timestamp(), gen);
      writeLadder(gen, provider, "bids", value.bids());
      writeLadder(gen, provider, "asks", value.asks());
      decimals.writeField(gen, "bestBid", value.bestBid().price().value());
      decimals.writeField(gen, "bestAsk", value.bestAsk().price().value());
      decimals.writeField(gen, "midPrice", value.midPrice().value());
      decimals.writeField(gen, "spread", value.spread().value());
      decimals.writeField(gen, "spreadPercent", value.spreadPercent().value());

      gen.writeObjectFieldStart("liquidity");
      gen.writeNumberField("levels", summaryLevels);
      decimals.writeField(gen, "bid", value.bidLiquidity(summaryLevels).value());
      decimals.writeField(gen, "ask", value.askLiquidity(summaryLevels).value());
      decimals.writeField(gen, "imbalance", value.liquidityImbalance(summaryLevels));
      gen.writeEndObject();

      gen.writeEndObject();
    }

    private static void writeLadder(
        JsonGenerator gen, SerializerProvider provider, String name, List<OrderBookLevel> ladder)
        throws IOException {
      gen.writeArrayFieldStart(name);
      for (OrderBookLevel level : ladder) {
        provider.defaultSerializeValue(level, gen);
      }
      gen.writeEndArray();
    }
  }

  static final class KlineSerializer extends StdSerializer<Kline> {
    private final DecimalWriter decimals;

    KlineSerializer(DecimalWriter decimals) {
      super(Kline.class);
      this.decimals = decimals;
    }

    @Override
    public void serialize(Kline value, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
      gen.writeStartObject();
      gen.writeStringField("pair", value.pair().symbol());
      gen.writeStringField("timeframe", value.timeframe().code());
      provider.defaultSerializeField("openTime", value.openTime(), gen);
      provider.defaultSerializeField("closeTime", value.closeTime(), gen);
      decimals.writeField(gen, "open", value.open().value());
      decimals.writeField(gen, "high", value.high().value());
      decimals.writeField(gen, "low", value.low().value());
      decimals.writeField(gen, "close", value.close().value());
      decimals.writeField(gen, "volume", value.volume().value());
      if (value.quoteVolume() != null) {
        decimals.writeField(gen, "quoteVolume", value.quoteVolume().value());
      }
      if (value.trades() != null) {
        gen.writeNumberField("trades", value.trades());
      }
      decimals.writeField(gen, "change", value.priceChange().value());
      decimals.writeField(gen, "changePercent", value.priceChangePercent().value());
      gen.writeEndObject();
    }
  }
}
