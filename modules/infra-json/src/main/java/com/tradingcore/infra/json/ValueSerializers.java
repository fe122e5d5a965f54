package com.tradingcore.infra.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.tradingcore.domain.common.Amount;
import com.tradingcore.domain.common.Asset;
import com.tradingcore.domain.common.Percentage;
import com.tradingcore.domain.common.Price;
import com.tradingcore.domain.common.Quantity;
import com.tradingcore.domain.common.TradingPair;
import java.io.IOException;

final class ValueSerializers {
  private ValueSerializers() {}

  static final class AssetSerializer extends StdSerializer<Asset> {
    AssetSerializer() {
      super(Asset.class);
    }

    @Override
    public void serialize(Asset value, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
      gen.writeStartObject();
      gen.writeStringField("symbol", value.symbol());
      gen.writeStringField("type", value.type().name());
      gen.writeEndObject();
    }
  }

  static final class TradingPairSerializer extends StdSerializer<TradingPair> {
    TradingPairSerializer() {
      super(TradingPair.class);
    }

    @Override
    public void serialize(TradingPair value, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
      gen.writeStartObject();
      gen.writeStringField("symbol", value.symbol());
      gen.writeStringField("base", value.base().symbol());
      gen.writeStringField("quote", value.quote().symbol());
      gen.writeEndObject();
    }
  }

  static final class AmountSerializer extends StdSerializer<Amount> {
    private final DecimalWriter decimals;

    AmountSerializer(DecimalWriter decimals) {
      super(Amount.class);
      this.decimals = decimals;
    }

    @Override
    public void serialize(Amount value, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
      gen.writeStartObject();
      decimals.writeField(gen, "value", value.value());
      gen.writeStringField("asset", value.asset().symbol());
      gen.writeEndObject();
    }
  }

  static final class PriceSerializer extends StdSerializer<Price> {
    private final DecimalWriter decimals;

    PriceSerializer(DecimalWriter decimals) {
      super(Price.class);
      this.decimals = decimals;
    }

    @Override
    public void serialize(Price value, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
      gen.writeStartObject();
      decimals.writeField(gen, "value", value.value());
      gen.writeStringField("pair", value.pair().symbol());
      gen.writeStringField("base", value.base().symbol());
      gen.writeStringField("quote", value.quote().symbol());
      gen.writeEndObject();
    }
  }

  static final class QuantitySerializer extends StdSerializer<Quantity> {
    private final DecimalWriter decimals;

    QuantitySerializer(DecimalWriter decimals) {
      super(Quantity.class);
      this.decimals = decimals;
    }

    @Override
    public void serialize(Quantity value, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
      decimals.write(gen, value.value());
    }
  }

  static final class PercentageSerializer extends StdSerializer<Percentage> {
    private final DecimalWriter decimals;

    PercentageSerializer(DecimalWriter decimals) {
      super(Percentage.class);
      this.decimals = decimals;
    }

    @Override
    public void serialize(Percentage value, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
      decimals.write(gen, value.value());
    }
  }
}
