package co.keyfmt.core.compile;

import co.keyfmt.core.conversion.KeyConversion;

/**
 * A piece of a compiled key: fixed text or a converted field.
 */
public sealed interface KeyPart permits KeyPart.Text, KeyPart.Field {

  record Text(String value) implements KeyPart {}

  record Field(KeyConversion conversion) implements KeyPart {
    public String parameterName() {
      return conversion.parameterName();
    }

    public String fieldPath() {
      return conversion.fieldRef().path();
    }
  }
}
