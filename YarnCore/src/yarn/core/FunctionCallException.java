package yarn.core;

/** A script function was called with arguments it cannot accept. */
public class FunctionCallException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public FunctionCallException(String message) {
    super(message);
  }
}
