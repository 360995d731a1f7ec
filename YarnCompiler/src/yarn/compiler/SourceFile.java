package yarn.compiler;

import com.google.auto.value.AutoValue;

/** A script to compile, and the name diagnostics and line ids refer to it by. */
@AutoValue
public abstract class SourceFile {
  public abstract String fileName();

  public abstract String source();

  public static SourceFile create(String fileName, String source) {
    return new AutoValue_SourceFile(fileName, source);
  }
}
