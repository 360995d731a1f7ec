package yarn.runtime;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * A {@code <<command>>} for the game to carry out, with its substitutions already expanded.
 *
 * <p>The text is split on whitespace into a name and parameters; double quotes group a parameter
 * that contains spaces.
 */
@AutoValue
public abstract class Command {
  private static final Splitter WHITESPACE =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  public abstract String text();

  public static Command create(String text) {
    return new AutoValue_Command(text);
  }

  public String name() {
    List<String> parts = split();
    return parts.isEmpty() ? "" : parts.get(0);
  }

  public ImmutableList<String> parameters() {
    List<String> parts = split();
    if (parts.isEmpty()) return ImmutableList.of();
    return ImmutableList.copyOf(parts.subList(1, parts.size()));
  }

  private ImmutableList<String> split() {
    ImmutableList.Builder<String> parts = ImmutableList.builder();
    String text = text();
    int quote = text.indexOf('"');
    while (quote >= 0) {
      int close = text.indexOf('"', quote + 1);
      if (close < 0) break;
      parts.addAll(WHITESPACE.split(text.substring(0, quote)));
      parts.add(text.substring(quote + 1, close));
      text = text.substring(close + 1);
      quote = text.indexOf('"');
    }
    parts.addAll(WHITESPACE.split(text));
    return parts.build();
  }
}
