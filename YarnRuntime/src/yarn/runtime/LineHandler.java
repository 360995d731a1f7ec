package yarn.runtime;

/** Receives each line the dialogue delivers. The dialogue pauses until continued. */
@FunctionalInterface
public interface LineHandler {
  void handle(Line line, ReadOnlyDialogue dialogue);
}
