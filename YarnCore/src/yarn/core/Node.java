package yarn.core;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/** A compiled node: its instructions and the labels jumping into them. */
@AutoValue
public abstract class Node {
  public abstract String name();

  public abstract ImmutableList<Instruction> instructions();

  public abstract ImmutableMap<String, Integer> labels();

  public abstract ImmutableList<String> tags();

  /** Whether completing this node increments its visit count. */
  public abstract boolean tracked();

  /** Set for {@code rawText} nodes, whose body is kept as a single string table entry. */
  public abstract Optional<LineId> sourceTextStringId();

  public abstract Builder toBuilder();

  public static Builder builder(String name) {
    return new AutoValue_Node.Builder()
        .setName(name)
        .setLabels(ImmutableMap.of())
        .setTags(ImmutableList.of())
        .setTracked(false);
  }

  public int labelIndex(String label) {
    Integer index = labels().get(label);
    Preconditions.checkArgument(index != null, "node '%s' has no label '%s'", name(), label);
    return index;
  }

  /** The ids of every line and option this node can deliver. */
  public ImmutableList<LineId> lineIds() {
    ImmutableList.Builder<LineId> builder = ImmutableList.builder();
    for (Instruction instruction : instructions()) {
      if (instruction.opCode() == OpCode.RUN_LINE || instruction.opCode() == OpCode.ADD_OPTION) {
        builder.add(LineId.of(instruction.stringOperand(0)));
      }
    }
    return builder.build();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String name);

    public abstract Builder setInstructions(Iterable<Instruction> instructions);

    public abstract Builder setLabels(ImmutableMap<String, Integer> labels);

    public abstract Builder setTags(Iterable<String> tags);

    public abstract Builder setTracked(boolean tracked);

    public abstract Builder setSourceTextStringId(LineId sourceTextStringId);

    public abstract Node build();
  }
}
