package yarn.core;

import com.google.auto.value.AutoValue;

/** Identifies one entry of a string table: a line, an option, or a raw-text node body. */
@AutoValue
public abstract class LineId implements Comparable<LineId> {
  public abstract String value();

  public static LineId of(String value) {
    return new AutoValue_LineId(value);
  }

  /** The id under which a {@code rawText} node's body is stored. */
  public static LineId forNode(String nodeName) {
    return of("line:" + nodeName);
  }

  @Override
  public int compareTo(LineId other) {
    return value().compareTo(other.value());
  }

  @Override
  public String toString() {
    return value();
  }
}
