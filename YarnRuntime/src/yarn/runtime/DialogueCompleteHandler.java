package yarn.runtime;

@FunctionalInterface
public interface DialogueCompleteHandler {
  void handle(ReadOnlyDialogue dialogue);
}
