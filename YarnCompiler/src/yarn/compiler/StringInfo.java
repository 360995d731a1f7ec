package yarn.compiler;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** A string table entry: the text of a line or option, and where it came from. */
@AutoValue
public abstract class StringInfo {
  /**
   * The text, with {@code {0}}, {@code {1}}... marking substitutions. Literal braces and
   * backslashes are escaped with a backslash.
   */
  public abstract String text();

  public abstract String nodeName();

  public abstract String fileName();

  /** One-based. */
  public abstract int lineNumber();

  /** Hashtags of the line, minus its {@code #line:} id. */
  public abstract ImmutableList<String> metadata();

  /** Whether the id was generated rather than written in the script. */
  public abstract boolean isImplicitTag();

  public static StringInfo create(
      String text,
      String nodeName,
      Tokenizer.Pos pos,
      Iterable<String> metadata,
      boolean isImplicitTag) {
    return new AutoValue_StringInfo(
        text,
        nodeName,
        pos.file(),
        pos.lineNumber() + 1,
        ImmutableList.copyOf(metadata),
        isImplicitTag);
  }
}
