package yarn.core;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class ValueTest {

  @Test
  public void numbersFormatWithoutTrailingZeros() {
    assertThat(Value.of(4.0).convertToString()).isEqualTo("4");
    assertThat(Value.of(-12.0).convertToString()).isEqualTo("-12");
    assertThat(Value.of(2.5).convertToString()).isEqualTo("2.5");
    assertThat(Value.of(0.1 + 0.2).convertToString()).isEqualTo("0.30000000000000004");
    assertThat(Value.of(Double.NaN).convertToString()).isEqualTo("NaN");
  }

  @Test
  public void stringConversions() {
    assertThat(Value.of(" 3.5 ").convertToNumber()).hasValue(3.5);
    assertThat(Value.of("three").convertToNumber()).isEmpty();
    assertThat(Value.of("TRUE").convertToBoolean()).hasValue(true);
    assertThat(Value.of("yes").convertToBoolean()).isEmpty();
  }

  @Test
  public void numberAndBooleanConversions() {
    assertThat(Value.of(true).convertToNumber()).hasValue(1.0);
    assertThat(Value.of(0.0).convertToBoolean()).hasValue(false);
    assertThat(Value.of(2.0).convertToBoolean()).hasValue(true);
    assertThat(Value.of(false).convertToString()).isEqualTo("false");
  }

  @Test
  public void accessorsCheckType() {
    assertThat(Value.of("x").asString()).isEqualTo("x");
    assertThrows(IllegalStateException.class, () -> Value.of("x").asNumber());
    assertThrows(IllegalStateException.class, () -> Value.of(1.0).asBoolean());
  }

  @Test
  public void equality() {
    assertThat(Value.of(4.0)).isEqualTo(Value.of(4));
    assertThat(Value.of("4")).isNotEqualTo(Value.of(4.0));
    assertThat(Value.of(4.0).toString()).isEqualTo("Number(4)");
    assertThat(Value.of("hi").toString()).isEqualTo("String(\"hi\")");
  }

  @Test
  public void defaultValues() {
    assertThat(ValueType.NUMBER.defaultValue()).isEqualTo(Value.of(0.0));
    assertThat(ValueType.STRING.defaultValue()).isEqualTo(Value.of(""));
    assertThat(ValueType.BOOLEAN.defaultValue()).isEqualTo(Value.of(false));
  }

  @Test
  public void parseTypeNames() {
    assertThat(ValueType.parse("Number")).hasValue(ValueType.NUMBER);
    assertThat(ValueType.parse("Bool")).hasValue(ValueType.BOOLEAN);
    assertThat(ValueType.parse("Boolean")).hasValue(ValueType.BOOLEAN);
    assertThat(ValueType.parse("Integer")).isEmpty();
  }
}
