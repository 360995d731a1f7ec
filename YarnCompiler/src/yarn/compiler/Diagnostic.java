package yarn.compiler;

import java.util.Comparator;

import com.google.auto.value.AutoValue;

/** A problem found in a script. Only errors stop a program from being produced. */
@AutoValue
public abstract class Diagnostic implements Comparable<Diagnostic> {
  public enum Severity {
    ERROR,
    WARNING,
    INFO;
  }

  public abstract Severity severity();

  public abstract String message();

  public abstract Tokenizer.Pos pos();

  public static Diagnostic create(Severity severity, Tokenizer.Pos pos, String message) {
    return new AutoValue_Diagnostic(severity, message, pos);
  }

  public static Diagnostic error(Tokenizer.Pos pos, String message) {
    return create(Severity.ERROR, pos, message);
  }

  public static Diagnostic warning(Tokenizer.Pos pos, String message) {
    return create(Severity.WARNING, pos, message);
  }

  public boolean isError() {
    return severity() == Severity.ERROR;
  }

  private static final Comparator<Diagnostic> ORDER =
      Comparator.comparing(Diagnostic::pos)
          .thenComparing(Diagnostic::severity)
          .thenComparing(Diagnostic::message);

  @Override
  public int compareTo(Diagnostic other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return String.format("%s: %s %s", severity(), pos(), message());
  }
}
