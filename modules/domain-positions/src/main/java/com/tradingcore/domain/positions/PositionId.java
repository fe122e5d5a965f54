package com.tradingcore.domain.positions;

import com.tradingcore.domain.common.InvalidValueException;
import java.util.UUID;

public record PositionId(String value) {
  public PositionId {
    if (value == null || value.isBlank()) {
      throw new InvalidValueException("PositionId", "position id must not be blank", value);
    }
  }

  public static PositionId generate() {
    return new PositionId(UUID.randomUUID().toString());
  }

  public static PositionId of(String value) {
    return new PositionId(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
