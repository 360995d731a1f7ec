package yarn.compiler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import yarn.core.LineId;
import yarn.core.Program;
import yarn.core.ValueType;

/** The state the compiler passes share. Each pass reads what earlier passes left and adds to it. */
final class CompilationIntermediate {
  final CompilationJob job;
  final CompilerSettings settings;

  final List<YarnFile> parsedFiles = new ArrayList<>();
  final Map<String, ImmutableList<String>> fileTags = new LinkedHashMap<>();
  final List<Diagnostic> diagnostics = new ArrayList<>();

  final Map<LineId, StringInfo> stringTable = new LinkedHashMap<>();
  final Map<LineText, LineId> lineIds = new HashMap<>();

  final Map<String, Declaration> knownDeclarations = new LinkedHashMap<>();
  final Map<String, Declaration> derivedDeclarations = new LinkedHashMap<>();
  final Map<Expression, ValueType> expressionTypes = new HashMap<>();

  final Set<String> trackingNodes = new LinkedHashSet<>();
  final Set<String> ignoringTrackingNodes = new LinkedHashSet<>();

  Optional<Program> program = Optional.empty();
  final Map<String, DebugInfo> debugInfos = new LinkedHashMap<>();

  CompilationIntermediate(CompilationJob job, CompilerSettings settings) {
    this.job = job;
    this.settings = settings;
  }

  void addDeclaration(Declaration declaration) {
    knownDeclarations.put(declaration.name(), declaration);
    if (declaration.provenance() != Declaration.Provenance.EXTERNAL) {
      derivedDeclarations.put(declaration.name(), declaration);
    }
  }

  boolean hasErrors() {
    return diagnostics.stream().anyMatch(Diagnostic::isError);
  }

  boolean containsImplicitStringTags() {
    return stringTable.values().stream().anyMatch(StringInfo::isImplicitTag);
  }
}
