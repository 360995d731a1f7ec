package yarn.runtime;

import com.google.common.collect.ImmutableList;

/**
 * Receives each set of options, in script order. One of them must be passed to {@link
 * Dialogue#setSelectedOption} before the dialogue continues.
 */
@FunctionalInterface
public interface OptionsHandler {
  void handle(ImmutableList<DialogueOption> options, ReadOnlyDialogue dialogue);
}
