package yarn.core;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

public final class MemoryVariableStorage implements VariableStorage {
  private final Map<String, Value> variables = new ConcurrentHashMap<>();

  public MemoryVariableStorage() {}

  public MemoryVariableStorage(Map<String, Value> initial) {
    extend(initial);
  }

  @Override
  public Optional<Value> get(String name) {
    return Optional.ofNullable(variables.get(name));
  }

  @Override
  public void set(String name, Value value) {
    Preconditions.checkArgument(
        name.startsWith("$"), "variable name '%s' must start with '$'", name);
    variables.put(name, Preconditions.checkNotNull(value));
  }

  @Override
  public ImmutableMap<String, Value> variables() {
    return ImmutableMap.copyOf(variables);
  }

  @Override
  public void clear() {
    variables.clear();
  }

  @Override
  public String toString() {
    return "MemoryVariableStorage" + variables;
  }
}
