package yarn.compiler;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

abstract class ErrorCollectingVisitor extends VoidDefaultASTVisitor {
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  protected ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  protected void logError(Tokenizer.Pos pos, String msg) {
    diagnostics.add(Diagnostic.error(pos, msg));
  }

  protected void logError(CompilerException ex) {
    diagnostics.add(ex.toDiagnostic());
  }

  protected void logWarning(Tokenizer.Pos pos, String msg) {
    diagnostics.add(Diagnostic.warning(pos, msg));
  }
}
