package yarn.runtime;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

import yarn.core.LineId;

/**
 * A line of dialogue, as delivered to a {@link LineHandler}.
 *
 * <p>The text itself is not part of the line: look it up by {@link #id()}, for example with a
 * {@link TextProvider}, and fill in the {@code {0}}, {@code {1}}, ... markers with the
 * substitutions.
 */
@AutoValue
public abstract class Line {
  public abstract LineId id();

  public abstract ImmutableList<String> substitutions();

  public static Line create(LineId id, List<String> substitutions) {
    return new AutoValue_Line(id, ImmutableList.copyOf(substitutions));
  }
}
