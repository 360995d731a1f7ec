package yarn.compiler;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import yarn.core.Node;

@AutoValue
abstract class FileCompilation {
  abstract String fileName();

  abstract ImmutableList<Node> nodes();

  abstract ImmutableMap<String, Tokenizer.Pos> nodePositions();

  abstract ImmutableMap<String, DebugInfo> debugInfos();

  abstract ImmutableList<Diagnostic> diagnostics();

  static FileCompilation create(
      String fileName,
      ImmutableList<Node> nodes,
      ImmutableMap<String, Tokenizer.Pos> nodePositions,
      ImmutableMap<String, DebugInfo> debugInfos,
      ImmutableList<Diagnostic> diagnostics) {
    return new AutoValue_FileCompilation(fileName, nodes, nodePositions, debugInfos, diagnostics);
  }
}
