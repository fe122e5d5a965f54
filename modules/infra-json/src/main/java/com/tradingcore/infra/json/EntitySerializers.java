package com.tradingcore.infra.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.tradingcore.domain.common.Amount;
import com.tradingcore.domain.common.Asset;
import com.tradingcore.domain.orders.ExchangeOrderId;
import com.tradingcore.domain.orders.Fill;
import com.tradingcore.domain.orders.Order;
import com.tradingcore.domain.orders.OrderId;
import com.tradingcore.domain.orders.OrderParameters;
import com.tradingcore.domain.positions.Position;
import com.tradingcore.domain.positions.PositionPlan;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;

final class EntitySerializers {
  private EntitySerializers() {}

  static final class FillSerializer extends StdSerializer<Fill> {
    FillSerializer() {
      super(Fill.class);
    }

    @Override
    public void serialize(Fill value, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
      gen.writeStartObject();
      gen.writeStringField("pair", value.pair().symbol());
      gen.writeStringField("exchangeOrderId", value.exchangeOrderId().value());
      gen.writeStringField("tradeId", value.tradeId());
      provider.defaultSerializeField("executedQuantity", value.executedQuantity(), gen);
      provider.defaultSerializeField("executionPrice", value.executionPrice(), gen);
      provider.defaultSerializeField("fee", value.fee(), gen);
      provider.defaultSerializeField("grossTotal", value.grossTotal(), gen);
      provider.defaultSerializeField("timestamp", value.timestamp(), gen);
      gen.writeEndObject();
    }
  }

  /**
   * Full order state with its fills and aggregates. {@code totalFees} is null when fees were
   * charged in more than one asset; {@code feesByAsset} always carries the breakdown.
   */
  static final class OrderSerializer extends StdSerializer<Order> {
    OrderSerializer() {
      super(Order.class);
    }

    @Override
    public void serialize(Order value, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
      OrderParameters parameters = value.parameters();
      gen.writeStartObject();
      gen.writeStringField("id", value.id().value());

      gen.writeObjectFieldStart("parameters");
      gen.writeStringField("pair", parameters.pair().symbol());
      gen.writeStringField("side", parameters.side().name());
      gen.writeStringField("type", parameters.type().name());
      provider.defaultSerializeField("quantity", parameters.quantity(), gen);
      provider.defaultSerializeField("stopPrice", parameters.stopPrice(), gen);
      gen.writeEndObject();

      gen.writeStringField("status", value.status().name());
      gen.writeStringField(
          "exchangeOrderId", value.exchangeOrderId().map(ExchangeOrderId::value).orElse(null));
      provider.defaultSerializeField("fills", value.fills(), gen);
      provider.defaultSerializeField("totalFilledQuantity", value.totalFilledQuantity(), gen);
      provider.defaultSerializeField("remainingQuantity", value.remainingQuantity(), gen);
      provider.defaultSerializeField(
          "averageFillPrice", value.averageFillPrice().orElse(null), gen);

      Map<Asset, Amount> fees = value.feesByAsset();
      Asset quote = value.pair().quote();
      boolean quoteOnly = fees.keySet().stream().allMatch(quote::equals);
      provider.defaultSerializeField("totalFees", quoteOnly ? value.totalFees() : null, gen);
      gen.writeArrayFieldStart("feesByAsset");
      for (Amount fee : fees.values()) {
        provider.defaultSerializeValue(fee, gen);
      }
      gen.writeEndArray();

      provider.defaultSerializeField("createdAt", value.createdAt(), gen);
      provider.defaultSerializeField("updatedAt", value.updatedAt(), gen);
      provider.defaultSerializeField("submittedAt", value.submittedAt().orElse(null), gen);
      provider.defaultSerializeField("completedAt", value.completedAt().orElse(null), gen);
      gen.writeStringField("rejectionReason", value.rejectionReason().orElse(null));
      gen.writeEndObject();
    }
  }

  /** Position grouped into intended, actual, orders, pnl, slippage and timestamps blocks. */
  static final class PositionSerializer extends StdSerializer<Position> {
    private final DecimalWriter decimals;

    PositionSerializer(DecimalWriter decimals) {
      super(Position.class);
      this.decimals = decimals;
    }

    @Override
    public void serialize(Position value, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
      PositionPlan plan = value.plan();
      gen.writeStartObject();
      gen.writeStringField("id", value.id().value());
      gen.writeStringField("pair", value.pair().symbol());
      gen.writeStringField("side", value.side().name());
      gen.writeStringField("status", value.status().name());
      gen.writeStringField("exitReason", value.exitReason().map(Enum::name).orElse(null));

      gen.writeObjectFieldStart("intended");
      provider.defaultSerializeField("entryPrice", plan.entryPrice(), gen);
      provider.defaultSerializeField("stopLoss", plan.stopLoss(), gen);
      provider.defaultSerializeField("takeProfit", plan.takeProfit(), gen);
      provider.defaultSerializeField("size", plan.size(), gen);
      gen.writeEndObject();

      gen.writeObjectFieldStart("actual");
      provider.defaultSerializeField("entryPrice", value.entryPrice().orElse(null), gen);
      provider.defaultSerializeField("size", value.size().orElse(null), gen);
      provider.defaultSerializeField("stopLoss", value.stopLoss(), gen);
      provider.defaultSerializeField("takeProfit", value.takeProfit(), gen);
      provider.defaultSerializeField("exitPrice", value.exitPrice().orElse(null), gen);
      gen.writeEndObject();

      gen.writeObjectFieldStart("orders");
      gen.writeStringField("entry", value.entryOrderId().value());
      writeId(gen, "stopLoss", value.stopLossOrderId().map(OrderId::value));
      writeId(gen, "takeProfit", value.takeProfitOrderId().map(OrderId::value));
      writeId(gen, "exit", value.exitOrderId().map(OrderId::value));
      gen.writeEndObject();

      gen.writeObjectFieldStart("pnl");
      provider.defaultSerializeField("realized", value.realizedPnL().orElse(null), gen);
      decimals.writeField(gen, "roi", value.roi().orElse(null));
      provider.defaultSerializeField("entryFee", value.entryFee().orElse(null), gen);
      provider.defaultSerializeField("exitFee", value.exitFee().orElse(null), gen);
      provider.defaultSerializeField("totalFees", value.totalFees(), gen);
      gen.writeEndObject();

      gen.writeObjectFieldStart("slippage");
      provider.defaultSerializeField("entry", value.entrySlippage().orElse(null), gen);
      provider.defaultSerializeField(
          "entryPercent", value.entrySlippagePercent().orElse(null), gen);
      provider.defaultSerializeField("exit", value.exitSlippage().orElse(null), gen);
      provider.defaultSerializeField(
          "exitPercent", value.exitSlippagePercent().orElse(null), gen);
      gen.writeEndObject();

      gen.writeObjectFieldStart("timestamps");
      provider.defaultSerializeField("createdAt", value.createdAt(), gen);
      provider.defaultSerializeField("openedAt", value.openedAt().orElse(null), gen);
      provider.defaultSerializeField("closedAt", value.closedAt().orElse(null), gen);
      provider.defaultSerializeField("updatedAt", value.updatedAt(), gen);
      gen.writeEndObject();

      gen.writeObjectFieldStart("metadata");
      gen.writeStringField("agentId", value.agentId().orElse(null));
      gen.writeStringField("strategyId", value.strategyId().orElse(null));
      provider.defaultSerializeField("attributes", value.metadata(), gen);
      gen.writeEndObject();

      gen.writeEndObject();
    }

    private static void writeId(JsonGenerator gen, String name, Optional<String> id)
        throws IOException {
      gen.writeStringField(name, id.orElse(null));
    }
  }
}
