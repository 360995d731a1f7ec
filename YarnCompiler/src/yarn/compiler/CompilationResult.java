package yarn.compiler;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import yarn.core.LineId;
import yarn.core.Program;

@AutoValue
public abstract class CompilationResult {
  /** Absent when there were errors, or the compilation type stops before code generation. */
  public abstract Optional<Program> program();

  /** Sorted, without duplicates. */
  public abstract ImmutableList<Diagnostic> diagnostics();

  public abstract ImmutableMap<LineId, StringInfo> stringTable();

  /** Declarations the compilation created: explicit, inferred and derived. */
  public abstract ImmutableList<Declaration> declarations();

  public abstract ImmutableMap<String, DebugInfo> debugInfos();

  /** File name to the hashtags written before its first node. */
  public abstract ImmutableMap<String, ImmutableList<String>> fileTags();

  /** Whether some line has no {@code #line:} id, so its id was generated. */
  public abstract boolean containsImplicitStringTags();

  public ImmutableList<Diagnostic> errors() {
    return diagnostics()
        .stream()
        .filter(Diagnostic::isError)
        .collect(ImmutableList.toImmutableList());
  }

  public boolean hasErrors() {
    return diagnostics().stream().anyMatch(Diagnostic::isError);
  }

  public Optional<Declaration> declaration(String name) {
    return declarations().stream().filter(d -> d.name().equals(name)).findFirst();
  }

  static Builder builder() {
    return new AutoValue_CompilationResult.Builder();
  }

  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder setProgram(Optional<Program> program);

    abstract Builder setDiagnostics(Iterable<Diagnostic> diagnostics);

    abstract Builder setStringTable(ImmutableMap<LineId, StringInfo> stringTable);

    abstract Builder setDeclarations(Iterable<Declaration> declarations);

    abstract Builder setDebugInfos(ImmutableMap<String, DebugInfo> debugInfos);

    abstract Builder setFileTags(ImmutableMap<String, ImmutableList<String>> fileTags);

    abstract Builder setContainsImplicitStringTags(boolean containsImplicitStringTags);

    abstract CompilationResult build();
  }
}
