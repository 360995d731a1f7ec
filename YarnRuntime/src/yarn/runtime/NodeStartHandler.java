package yarn.runtime;

@FunctionalInterface
public interface NodeStartHandler {
  void handle(String nodeName, ReadOnlyDialogue dialogue);
}
