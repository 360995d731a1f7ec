package yarn.core;

import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

/**
 * Where script variables live between node transitions.
 *
 * <p>One instance is shared by a dialogue's virtual machine, the library functions that read visit
 * counts, and the embedding game, so implementations must be thread-safe. Names include the
 * {@code $} sigil.
 */
public interface VariableStorage {
  Optional<Value> get(String name);

  void set(String name, Value value);

  default boolean contains(String name) {
    return get(name).isPresent();
  }

  /** Sets every entry of {@code values}, overwriting existing ones. */
  default void extend(Map<String, Value> values) {
    values.forEach(this::set);
  }

  ImmutableMap<String, Value> variables();

  void clear();
}
