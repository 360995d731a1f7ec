package yarn.runtime;

/** The dialogue was misused, or the program it runs is malformed. */
public class DialogueException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public DialogueException(String message) {
    super(message);
  }
}
