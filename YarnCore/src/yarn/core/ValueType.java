package yarn.core;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/** The kinds of {@link Value} a script can hold. */
public enum ValueType {
  STRING("String", String.class),
  NUMBER("Number", Double.class),
  BOOLEAN("Bool", Boolean.class);

  private final String displayName;
  private final Class<?> javaType;

  ValueType(String displayName, Class<?> javaType) {
    this.displayName = displayName;
    this.javaType = javaType;
  }

  /** The name used in scripts ({@code as Number}) and as the operator function prefix. */
  public String displayName() {
    return displayName;
  }

  public Class<?> javaType() {
    return javaType;
  }

  /** The value given to variables whose declaration was inferred from usage. */
  public Value defaultValue() {
    switch (this) {
      case STRING:
        return Value.of("");
      case NUMBER:
        return Value.of(0.0);
      case BOOLEAN:
        return Value.of(false);
    }
    throw new AssertionError(this);
  }

  private static final ImmutableMap<Class<?>, ValueType> BY_JAVA_TYPE =
      Maps.uniqueIndex(Arrays.asList(values()), ValueType::javaType);

  public static ValueType forJavaType(Class<?> javaType) {
    ValueType type = BY_JAVA_TYPE.get(javaType);
    if (type == null) {
      throw new IllegalArgumentException(
          String.format("%s cannot be passed to or returned from a script function", javaType));
    }
    return type;
  }

  public static Optional<ValueType> parse(String name) {
    for (ValueType type : values()) {
      if (type.displayName.equals(name)) return Optional.of(type);
    }
    if (name.equals("Boolean")) return Optional.of(BOOLEAN);
    return Optional.empty();
  }

  @Override
  public String toString() {
    return displayName;
  }
}
