package yarn.core;

import java.util.Arrays;
import java.util.stream.Collectors;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

@AutoValue
public abstract class Instruction {
  public abstract OpCode opCode();

  public abstract ImmutableList<Value> operands();

  public static Instruction create(OpCode opCode, Value... operands) {
    ImmutableList<Value> list = ImmutableList.copyOf(Arrays.asList(operands));
    opCode.checkOperands(list);
    return new AutoValue_Instruction(opCode, list);
  }

  public static Instruction jumpTo(String label) {
    return create(OpCode.JUMP_TO, Value.of(label));
  }

  public static Instruction runLine(LineId lineId, int substitutionCount) {
    return create(OpCode.RUN_LINE, Value.of(lineId.value()), Value.of(substitutionCount));
  }

  public static Instruction runCommand(String text, int substitutionCount) {
    return create(OpCode.RUN_COMMAND, Value.of(text), Value.of(substitutionCount));
  }

  public static Instruction addOption(
      LineId lineId, String destinationLabel, int substitutionCount, boolean hasCondition) {
    return create(
        OpCode.ADD_OPTION,
        Value.of(lineId.value()),
        Value.of(destinationLabel),
        Value.of(substitutionCount),
        Value.of(hasCondition));
  }

  public static Instruction push(Value value) {
    switch (value.type()) {
      case STRING:
        return create(OpCode.PUSH_STRING, value);
      case NUMBER:
        return create(OpCode.PUSH_NUMBER, value);
      case BOOLEAN:
        return create(OpCode.PUSH_BOOL, value);
    }
    throw new AssertionError(value.type());
  }

  public static Instruction jumpIfFalse(String label) {
    return create(OpCode.JUMP_IF_FALSE, Value.of(label));
  }

  public static Instruction callFunction(String name, int argumentCount) {
    return create(OpCode.CALL_FUNCTION, Value.of(name), Value.of(argumentCount));
  }

  public static Instruction pushVariable(String name) {
    return create(OpCode.PUSH_VARIABLE, Value.of(name));
  }

  public static Instruction storeVariable(String name) {
    return create(OpCode.STORE_VARIABLE, Value.of(name));
  }

  public Value operand(int index) {
    return operands().get(index);
  }

  public String stringOperand(int index) {
    return operand(index).asString();
  }

  public int intOperand(int index) {
    return (int) operand(index).asNumber();
  }

  public boolean boolOperand(int index) {
    return operand(index).asBoolean();
  }

  @Override
  public String toString() {
    if (operands().isEmpty()) return opCode().toString();
    return operands()
        .stream()
        .map(Value::toString)
        .collect(Collectors.joining(", ", opCode() + " ", ""));
  }
}
