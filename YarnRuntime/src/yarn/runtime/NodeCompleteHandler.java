package yarn.runtime;

/** Called when a node finishes, after its visit count was incremented. */
@FunctionalInterface
public interface NodeCompleteHandler {
  void handle(String nodeName, ReadOnlyDialogue dialogue);
}
