package yarn.compiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import yarn.core.Instruction;
import yarn.core.LineId;
import yarn.core.Node;
import yarn.core.OpCode;
import yarn.core.ValueType;

class NodeEmitter {
  private final String nodeName;
  private final String fileName;
  private final Map<Expression, ValueType> expressionTypes;
  private final Map<LineText, LineId> lineIds;

  private final List<Instruction> instructions = new ArrayList<>();
  private final Map<String, Integer> labels = new LinkedHashMap<>();
  private final Map<Integer, Tokenizer.Pos> positions = new LinkedHashMap<>();
  private int labelCount = 0;

  NodeEmitter(
      String nodeName,
      String fileName,
      Map<Expression, ValueType> expressionTypes,
      Map<LineText, LineId> lineIds) {
    this.nodeName = nodeName;
    this.fileName = fileName;
    this.expressionTypes = expressionTypes;
    this.lineIds = lineIds;
  }

  String newLabel(String hint) {
    return String.format("L%d_%s", labelCount++, hint);
  }

  void markLabel(String label) {
    Preconditions.checkState(!labels.containsKey(label), "label %s marked twice", label);
    labels.put(label, instructions.size());
  }

  void emit(Instruction instruction, Tokenizer.Pos pos) {
    positions.put(instructions.size(), pos);
    instructions.add(instruction);
  }

  ValueType typeOf(Expression expression) {
    ValueType type = expressionTypes.get(expression);
    Verify.verifyNotNull(
        type, "expression '%s' at %s was never typed", expression, expression.pos());
    return type;
  }

  LineId lineId(LineText text) {
    LineId id = lineIds.get(text);
    Verify.verifyNotNull(id, "line '%s' at %s has no string table entry", text, text.pos());
    return id;
  }

  Node.Builder build(Node.Builder node) {
    emit(
        Instruction.create(OpCode.STOP),
        positions.isEmpty() ? Tokenizer.Pos.internal() : lastPos());
    for (Instruction instruction : instructions) {
      if (instruction.opCode() == OpCode.JUMP_TO
          || instruction.opCode() == OpCode.JUMP_IF_FALSE
          || instruction.opCode() == OpCode.ADD_OPTION) {
        String label = instruction.stringOperand(instruction.opCode() == OpCode.ADD_OPTION ? 1 : 0);
        Verify.verify(labels.containsKey(label), "label %s was never marked", label);
      }
    }
    return node
        .setInstructions(ImmutableList.copyOf(instructions))
        .setLabels(ImmutableMap.copyOf(labels));
  }

  DebugInfo debugInfo() {
    return DebugInfo.fromPositions(nodeName, fileName, positions);
  }

  private Tokenizer.Pos lastPos() {
    return positions.get(instructions.size() - 1);
  }
}
