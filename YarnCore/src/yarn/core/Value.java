package yarn.core;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

import com.google.common.base.Preconditions;

/** A string, number or boolean. The only kind of datum a running script deals in. */
public final class Value {
  private final ValueType type;
  private final Object value;

  private Value(ValueType type, Object value) {
    this.type = type;
    this.value = Preconditions.checkNotNull(value);
  }

  public static Value of(String value) {
    return new Value(ValueType.STRING, value);
  }

  public static Value of(double value) {
    return new Value(ValueType.NUMBER, value);
  }

  public static Value of(boolean value) {
    return new Value(ValueType.BOOLEAN, value);
  }

  /** Wraps the result of a native function, which must be of {@code expected}'s java type. */
  static Value fromJava(Object object, ValueType expected) {
    Preconditions.checkNotNull(object, "script functions must not return null");
    Preconditions.checkState(
        expected.javaType().isInstance(object),
        "expected a %s result, but was %s",
        expected,
        object.getClass());
    return new Value(expected, object);
  }

  public ValueType type() {
    return type;
  }

  public String asString() {
    Preconditions.checkState(type == ValueType.STRING, "%s is not a String", this);
    return (String) value;
  }

  public double asNumber() {
    Preconditions.checkState(type == ValueType.NUMBER, "%s is not a Number", this);
    return (Double) value;
  }

  public boolean asBoolean() {
    Preconditions.checkState(type == ValueType.BOOLEAN, "%s is not a Bool", this);
    return (Boolean) value;
  }

  /** The text used when this value is interpolated into a line or command. */
  public String convertToString() {
    switch (type) {
      case STRING:
        return (String) value;
      case NUMBER:
        return formatNumber((Double) value);
      case BOOLEAN:
        return value.toString();
    }
    throw new AssertionError(type);
  }

  public Optional<Double> convertToNumber() {
    switch (type) {
      case STRING:
        try {
          return Optional.of(Double.parseDouble(((String) value).trim()));
        } catch (NumberFormatException ex) {
          return Optional.empty();
        }
      case NUMBER:
        return Optional.of((Double) value);
      case BOOLEAN:
        return Optional.of((Boolean) value ? 1.0 : 0.0);
    }
    throw new AssertionError(type);
  }

  public Optional<Boolean> convertToBoolean() {
    switch (type) {
      case STRING:
        String s = ((String) value).trim();
        if (s.equalsIgnoreCase("true")) return Optional.of(true);
        if (s.equalsIgnoreCase("false")) return Optional.of(false);
        return Optional.empty();
      case NUMBER:
        double d = (Double) value;
        return Optional.of(d != 0.0 && !Double.isNaN(d));
      case BOOLEAN:
        return Optional.of((Boolean) value);
    }
    throw new AssertionError(type);
  }

  /** Converts to the java representation of {@code target}, if this value allows it. */
  public Optional<Object> convertTo(ValueType target) {
    switch (target) {
      case STRING:
        return Optional.of(convertToString());
      case NUMBER:
        return convertToNumber().map(d -> d);
      case BOOLEAN:
        return convertToBoolean().map(b -> b);
    }
    throw new AssertionError(target);
  }

  static String formatNumber(double d) {
    if (Double.isNaN(d) || Double.isInfinite(d)) return Double.toString(d);
    if (d == Math.rint(d) && Math.abs(d) < 1e15) return Long.toString((long) d);
    return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Value)) return false;
    Value other = (Value) o;
    return type == other.type && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, value);
  }

  @Override
  public String toString() {
    if (type == ValueType.STRING) return String.format("String(\"%s\")", value);
    return String.format("%s(%s)", type, convertToString());
  }
}
