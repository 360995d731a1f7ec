package yarn.core;

public class ArgumentConversionException extends FunctionCallException {
  private static final long serialVersionUID = 1L;

  private final int index;
  private final ValueType expected;
  private final Value actual;

  public ArgumentConversionException(int index, ValueType expected, Value actual) {
    super(
        String.format(
            "argument %d: %s cannot be converted to %s", index + 1, actual, expected));
    this.index = index;
    this.expected = expected;
    this.actual = actual;
  }

  public int index() {
    return index;
  }

  public ValueType expected() {
    return expected;
  }

  public Value actual() {
    return actual;
  }
}
