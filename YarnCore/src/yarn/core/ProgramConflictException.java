package yarn.core;

/** Thrown when programs defining the same node are combined. */
public class ProgramConflictException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String nodeName;

  public ProgramConflictException(String nodeName) {
    super(String.format("node '%s' is defined by more than one program", nodeName));
    this.nodeName = nodeName;
  }

  public String nodeName() {
    return nodeName;
  }
}
