package yarn.compiler;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

import yarn.core.LineId;

class StringTableGenerator extends ErrorCollectingVisitor {
  private final String fileName;
  private final String implicitPrefix;
  private final Map<LineId, StringInfo> stringTable;
  private final Map<LineText, LineId> lineIds;
  // Lines numbered so far per node title, so a repeated title keeps its ids distinct.
  private final Map<String, Integer> lineCounts = new HashMap<>();

  private String nodeName = null;
  private int lineCount = 0;

  StringTableGenerator(
      String fileName,
      String implicitPrefix,
      Map<LineId, StringInfo> stringTable,
      Map<LineText, LineId> lineIds) {
    this.fileName = fileName;
    this.implicitPrefix = implicitPrefix;
    this.stringTable = stringTable;
    this.lineIds = lineIds;
  }

  @Override
  public void visitImpl(NodeDefinition node) {
    nodeName = node.title();
    lineCount = lineCounts.getOrDefault(nodeName, 0);

    // A repeated title is reported as a duplicate node when code is generated.
    if (node.rawText().isPresent() && !stringTable.containsKey(LineId.forNode(nodeName))) {
      register(
          LineId.forNode(node.title()),
          StringInfo.create(node.rawText().get(), nodeName, node.pos(), ImmutableList.of(), false),
          node.pos());
    }
    node.visitChildren(this, null);
    lineCounts.put(nodeName, lineCount);
  }

  @Override
  public void visitImpl(Statement.Line line) {
    register(line.text());
  }

  @Override
  public void visitImpl(Statement.Option option) {
    register(option.text());
    option.visitChildren(this, null);
  }

  private void register(LineText text) {
    lineCount++;

    Optional<String> explicitId = text.explicitLineId();
    LineId id =
        LineId.of(
            explicitId.orElse(
                String.format("%s%s-%s-%d", implicitPrefix, fileName, nodeName, lineCount)));
    lineIds.put(text, id);
    register(
        id,
        StringInfo.create(
            text.template(), nodeName, text.pos(), text.metadata(), !explicitId.isPresent()),
        text.pos());
  }

  private void register(LineId id, StringInfo info, Tokenizer.Pos pos) {
    StringInfo existing = stringTable.putIfAbsent(id, info);
    if (existing != null) {
      logError(
          pos,
          String.format(
              "duplicate line id '%s', already used in %s line %d",
              id, existing.fileName(), existing.lineNumber()));
    }
  }
}
