package com.gentoro.agentrelay.backend;

import com.gentoro.agentrelay.exception.ValidationException;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/** One named parameter of an {@link OperationDefinition}. */
public record ParameterSpec(String name, Type type, boolean required, String description) {

  public ParameterSpec {
    if (name == null || name.isBlank()) {
      throw new ValidationException("Parameter name must not be blank");
    }
    type = type == null ? Type.STRING : type;
  }

  public static ParameterSpec required(String name, Type type, String description) {
    return new ParameterSpec(name, type, true, description);
  }

  public static ParameterSpec optional(String name, Type type, String description) {
    return new ParameterSpec(name, type, false, description);
  }

  /** JSON-Schema style value types. */
  public enum Type {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    OBJECT,
    ARRAY;

    /** Whether a non-null argument value is acceptable for this type. */
    public boolean accepts(Object value) {
      return switch (this) {
        case STRING -> value instanceof CharSequence;
        case INTEGER -> value instanceof Integer
            || value instanceof Long
            || value instanceof Short
            || value instanceof Byte
            || value instanceof BigInteger;
        case NUMBER -> value instanceof Number;
        case BOOLEAN -> value instanceof Boolean;
        case OBJECT -> value instanceof Map<?, ?>;
        case ARRAY -> value instanceof Collection<?> || (value != null && value.getClass().isArray());
      };
    }

    public String schemaName() {
      return name().toLowerCase(Locale.ROOT);
    }

    public static Type parse(String value) {
      if (value == null || value.isBlank()) return STRING;
      try {
        return Type.valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new ValidationException("Unknown parameter type: " + value, e);
      }
    }
  }
}
