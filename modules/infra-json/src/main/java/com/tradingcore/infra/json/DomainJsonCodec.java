package com.tradingcore.infra.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class DomainJsonCodec {
  private final ObjectMapper objectMapper;

  public DomainJsonCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encode(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "Failed to encode " + value.getClass().getSimpleName(), ex);
    }
  }

  /** Projection as a tree, for adapters that embed it in a larger document. */
  public JsonNode encodeToTree(Object value) {
    return objectMapper.valueToTree(value);
  }
}
