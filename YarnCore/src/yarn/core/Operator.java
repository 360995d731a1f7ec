package yarn.core;

/**
 * Script operators. Each is implemented by a library function named after the operand type, for
 * example {@code Number.Add} or {@code String.EqualTo}.
 */
public enum Operator {
  EQUAL_TO("EqualTo"),
  NOT_EQUAL_TO("NotEqualTo"),
  GREATER_THAN("GreaterThan"),
  GREATER_THAN_OR_EQUAL_TO("GreaterThanOrEqualTo"),
  LESS_THAN("LessThan"),
  LESS_THAN_OR_EQUAL_TO("LessThanOrEqualTo"),
  ADD("Add"),
  MINUS("Minus"),
  MULTIPLY("Multiply"),
  DIVIDE("Divide"),
  MODULO("Modulo"),
  UNARY_MINUS("UnaryMinus"),
  AND("And"),
  OR("Or"),
  XOR("Xor"),
  NOT("Not");

  private final String functionSuffix;

  Operator(String functionSuffix) {
    this.functionSuffix = functionSuffix;
  }

  public String functionName(ValueType operandType) {
    return operandType.displayName() + "." + functionSuffix;
  }
}
