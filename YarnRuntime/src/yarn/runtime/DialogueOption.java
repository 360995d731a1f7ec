package yarn.runtime;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class DialogueOption {
  public abstract OptionId id();

  public abstract Line line();

  /** The label in the current node that selecting this option continues from. */
  public abstract String destination();

  /**
   * False when the option's {@code <<if>>} condition failed. Unavailable options are still
   * delivered, so the game may show them disabled, but cannot be selected.
   */
  public abstract boolean isAvailable();

  public static DialogueOption create(
      OptionId id, Line line, String destination, boolean isAvailable) {
    return new AutoValue_DialogueOption(id, line, destination, isAvailable);
  }
}
