package yarn.core;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;

/** A compiled set of nodes, plus the values variables start with. */
@AutoValue
public abstract class Program {
  private static final Program EMPTY = create(ImmutableMap.of(), ImmutableMap.of());

  public abstract ImmutableMap<String, Node> nodes();

  public abstract ImmutableMap<String, Value> initialValues();

  public static Program create(Map<String, Node> nodes, Map<String, Value> initialValues) {
    return new AutoValue_Program(ImmutableMap.copyOf(nodes), ImmutableMap.copyOf(initialValues));
  }

  public static Program empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Merges programs in order. Initial values of later programs replace earlier ones.
   *
   * @throws ProgramConflictException if two programs define a node with the same name
   */
  public static Program combine(Iterable<Program> programs) {
    Builder builder = builder();
    for (Program program : programs) {
      builder.addProgram(program);
    }
    return builder.build();
  }

  public static Program combine(Program... programs) {
    Builder builder = builder();
    for (Program program : programs) {
      builder.addProgram(program);
    }
    return builder.build();
  }

  public Program combineWith(Program other) {
    return combine(this, other);
  }

  public boolean isEmpty() {
    return nodes().isEmpty();
  }

  public static final class Builder {
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, Value> initialValues = new LinkedHashMap<>();

    private Builder() {}

    public Builder addNode(Node node) {
      if (nodes.putIfAbsent(node.name(), node) != null) {
        throw new ProgramConflictException(node.name());
      }
      return this;
    }

    public Builder setInitialValue(String variable, Value value) {
      initialValues.put(variable, value);
      return this;
    }

    public Builder addProgram(Program program) {
      program.nodes().values().forEach(this::addNode);
      initialValues.putAll(program.initialValues());
      return this;
    }

    public boolean hasNode(String name) {
      return nodes.containsKey(name);
    }

    public Program build() {
      return create(nodes, initialValues);
    }
  }
}
