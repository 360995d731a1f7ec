package yarn.runtime;

import com.google.auto.value.AutoValue;

/** Identifies an option within the set last delivered to an {@link OptionsHandler}. */
@AutoValue
public abstract class OptionId {
  public abstract int index();

  public static OptionId of(int index) {
    return new AutoValue_OptionId(index);
  }

  @Override
  public String toString() {
    return Integer.toString(index());
  }
}
