package com.tradingcore.infra.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(TradingJsonProperties.class)
public class TradingJsonAutoConfiguration {
  private static final Logger log = LoggerFactory.getLogger(TradingJsonAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public TradingDomainJacksonModule tradingDomainJacksonModule(TradingJsonProperties properties) {
    log.info(
        "Trading domain JSON projection writeDecimalsAsStrings={} orderBookSummaryLevels={}",
        properties.isWriteDecimalsAsStrings(),
        properties.effectiveOrderBookSummaryLevels());
    return new TradingDomainJacksonModule(properties);
  }

  @Bean
  @ConditionalOnMissingBean(name = "tradingDomainObjectMapper")
  public ObjectMapper tradingDomainObjectMapper(TradingDomainJacksonModule module) {
    return DomainObjectMapperFactory.create(module);
  }

  @Bean
  @ConditionalOnMissingBean
  public DomainJsonCodec domainJsonCodec(
      @Qualifier("tradingDomainObjectMapper") ObjectMapper tradingDomainObjectMapper) {
    return new DomainJsonCodec(tradingDomainObjectMapper);
  }
}
