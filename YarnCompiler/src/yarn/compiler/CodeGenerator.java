package yarn.compiler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import yarn.core.LineId;
import yarn.core.Node;
import yarn.core.ValueType;

class CodeGenerator extends ErrorCollectingVisitor {
  private final YarnFile file;
  private final Map<Expression, ValueType> expressionTypes;
  private final Map<LineText, LineId> lineIds;
  private final Set<String> trackedNodes;

  private final ImmutableList.Builder<Node> nodes = ImmutableList.builder();
  private final Map<String, Tokenizer.Pos> nodePositions = new LinkedHashMap<>();
  private final Map<String, DebugInfo> debugInfos = new LinkedHashMap<>();

  CodeGenerator(
      YarnFile file,
      Map<Expression, ValueType> expressionTypes,
      Map<LineText, LineId> lineIds,
      Set<String> trackedNodes) {
    this.file = file;
    this.expressionTypes = expressionTypes;
    this.lineIds = lineIds;
    this.trackedNodes = trackedNodes;
  }

  FileCompilation compile() {
    file.accept(this, null);
    return FileCompilation.create(
        file.fileName(),
        nodes.build(),
        ImmutableMap.copyOf(nodePositions),
        ImmutableMap.copyOf(debugInfos),
        diagnostics());
  }

  @Override
  public void visitImpl(NodeDefinition definition) {
    String name = definition.title();
    if (nodePositions.containsKey(name)) {
      logError(
          definition.pos(),
          String.format("duplicate node '%s', first defined at %s", name, nodePositions.get(name)));
      return;
    }

    Node.Builder builder =
        Node.builder(name).setTags(definition.tags()).setTracked(trackedNodes.contains(name));
    if (definition.rawText().isPresent()) {
      builder.setSourceTextStringId(LineId.forNode(name));
    }

    NodeEmitter emitter = new NodeEmitter(name, file.fileName(), expressionTypes, lineIds);
    Statement.compileAll(definition.body(), emitter);
    nodes.add(emitter.build(builder).build());
    nodePositions.put(name, definition.pos());
    debugInfos.put(name, emitter.debugInfo());
  }
}
