package yarn.core;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The instruction set of the virtual machine.
 *
 * <p>Operands are stored in the instruction. Anything the instruction pops comes from the stack
 * and is not listed here.
 */
public enum OpCode {
  /** Jump to the label operand. */
  JUMP_TO(ValueType.STRING),
  /** Pop a label and jump to it. */
  JUMP,
  /** Deliver a line. Pops {@code substitutionCount} values, first substitution deepest. */
  RUN_LINE(ValueType.STRING, ValueType.NUMBER),
  /** Deliver a command. Pops {@code substitutionCount} values, as for RUN_LINE. */
  RUN_COMMAND(ValueType.STRING, ValueType.NUMBER),
  /**
   * Queue an option: line id, destination label, substitution count, has condition. With a
   * condition, a Bool is popped first and the substitutions after it.
   */
  ADD_OPTION(ValueType.STRING, ValueType.STRING, ValueType.NUMBER, ValueType.BOOLEAN),
  /** Offer the queued options and wait for a selection, which pushes its destination label. */
  SHOW_OPTIONS,
  PUSH_STRING(ValueType.STRING),
  PUSH_NUMBER(ValueType.NUMBER),
  PUSH_BOOL(ValueType.BOOLEAN),
  POP,
  /** Pop a Bool and jump to the label operand when it is false. */
  JUMP_IF_FALSE(ValueType.STRING),
  /** Call a library function: name, argument count. Pops the arguments, pushes the result. */
  CALL_FUNCTION(ValueType.STRING, ValueType.NUMBER),
  PUSH_VARIABLE(ValueType.STRING),
  /** Pop a value into the named variable. */
  STORE_VARIABLE(ValueType.STRING),
  STOP,
  /** Pop a node name, complete the current node and start the named one. */
  RUN_NODE;

  private final ImmutableList<ValueType> operandTypes;

  OpCode(ValueType... operandTypes) {
    this.operandTypes = ImmutableList.copyOf(operandTypes);
  }

  public ImmutableList<ValueType> operandTypes() {
    return operandTypes;
  }

  void checkOperands(List<Value> operands) {
    Preconditions.checkArgument(
        operands.size() == operandTypes.size(),
        "%s takes %s operands, got %s",
        this,
        operandTypes.size(),
        operands.size());
    for (int i = 0; i < operands.size(); i++) {
      Preconditions.checkArgument(
          operands.get(i).type() == operandTypes.get(i),
          "%s operand %s must be a %s, got %s",
          this,
          i,
          operandTypes.get(i),
          operands.get(i));
    }
  }
}
