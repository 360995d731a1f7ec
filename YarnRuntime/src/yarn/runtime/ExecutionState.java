package yarn.runtime;

public enum ExecutionState {
  /** Nothing to run until a node is set. */
  STOPPED,
  RUNNING,
  /** Paused after a line, a command, or {@code setNode}. */
  WAITING_FOR_CONTINUE,
  /** Options were delivered; one must be selected before continuing. */
  WAITING_ON_OPTION_SELECTION;
}
