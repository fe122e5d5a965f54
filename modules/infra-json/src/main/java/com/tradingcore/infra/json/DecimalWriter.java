package com.tradingcore.infra.json;

import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.math.BigDecimal;

/** Writes decimals either as plain strings or, by default, collapsed to JSON doubles. */
final class DecimalWriter {
  private final boolean asStrings;

  DecimalWriter(boolean asStrings) {
    this.asStrings = asStrings;
  }

  void write(JsonGenerator gen, BigDecimal value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (asStrings) {
      gen.writeString(value.toPlainString());
    } else {
      gen.writeNumber(value.doubleValue());
    }
  }

  void writeField(JsonGenerator gen, String name, BigDecimal value) throws IOException {
    gen.writeFieldName(name);
    write(gen, value);
  }
}
