package com.tradingcore.infra.json;

import static com.tradingcore.testsupport.TradingFixtures.btc;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class TradingJsonAutoConfigurationTest {
  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(TradingJsonAutoConfiguration.class));

  @Test
  void shouldRegisterCodecAndMapper() {
    contextRunner.run(
        context -> {
          assertEquals(1, context.getBeansOfType(DomainJsonCodec.class).size());
          assertEquals(1, context.getBeansOfType(TradingDomainJacksonModule.class).size());
          context.getBean("tradingDomainObjectMapper", ObjectMapper.class);

          JsonNode amount = context.getBean(DomainJsonCodec.class).encodeToTree(btc("1.5"));
          assertTrue(amount.get("value").isNumber());
        });
  }

  @Test
  void shouldBindDecimalsAsStringsProperty() {
    contextRunner
        .withPropertyValues(
            "trading.json.write-decimals-as-strings=true",
            "trading.json.order-book-summary-levels=3")
        .run(
            context -> {
              TradingJsonProperties properties = context.getBean(TradingJsonProperties.class);
              assertEquals(3, properties.getOrderBookSummaryLevels());

              JsonNode amount = context.getBean(DomainJsonCodec.class).encodeToTree(btc("1.5"));
              assertEquals("1.5", amount.get("value").textValue());
            });
  }

  @Test
  void shouldBackOffWhenCodecIsProvided() {
    contextRunner
        .withUserConfiguration(CustomCodecConfiguration.class)
        .run(
            context ->
                assertEquals(
                    CustomCodecConfiguration.CODEC, context.getBean(DomainJsonCodec.class)));
  }

  @Configuration(proxyBeanMethods = false)
  static class CustomCodecConfiguration {
    static final DomainJsonCodec CODEC = new DomainJsonCodec(new ObjectMapper());

    @Bean
    DomainJsonCodec customDomainJsonCodec() {
      return CODEC;
    }
  }
}
