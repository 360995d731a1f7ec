package yarn.runtime;

@FunctionalInterface
public interface CommandHandler {
  void handle(Command command, ReadOnlyDialogue dialogue);
}
