package yarn.core;

public class ArgumentCountException extends FunctionCallException {
  private static final long serialVersionUID = 1L;

  private final int expected;
  private final int actual;

  public ArgumentCountException(int expected, int actual) {
    super(String.format("expected %d argument(s), but got %d", expected, actual));
    this.expected = expected;
    this.actual = actual;
  }

  public int expected() {
    return expected;
  }

  public int actual() {
    return actual;
  }
}
