package com.tradingcore.infra.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public final class DomainObjectMapperFactory {
  private DomainObjectMapperFactory() {}

  public static ObjectMapper create() {
    return create(new TradingJsonProperties());
  }

  public static ObjectMapper create(TradingJsonProperties properties) {
    return create(new TradingDomainJacksonModule(properties));
  }

  public static ObjectMapper create(TradingDomainJacksonModule module) {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .registerModule(module)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }
}
