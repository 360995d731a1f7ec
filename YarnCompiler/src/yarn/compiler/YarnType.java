package yarn.compiler;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import yarn.core.ValueType;
import yarn.core.YarnFunction;

/** The type of a declaration: a value type, or a function signature. */
@AutoValue
public abstract class YarnType {
  abstract Optional<ValueType> value();

  public abstract ImmutableList<ValueType> parameterTypes();

  abstract Optional<ValueType> functionReturnType();

  public static YarnType of(ValueType type) {
    return new AutoValue_YarnType(Optional.of(type), ImmutableList.of(), Optional.empty());
  }

  public static YarnType function(ValueType returnType, List<ValueType> parameterTypes) {
    return new AutoValue_YarnType(
        Optional.empty(), ImmutableList.copyOf(parameterTypes), Optional.of(returnType));
  }

  public static YarnType function(YarnFunction function) {
    return function(function.returnType(), function.parameterTypes());
  }

  public boolean isFunction() {
    return functionReturnType().isPresent();
  }

  public ValueType valueType() {
    Preconditions.checkState(!isFunction(), "%s is a function type", this);
    return value().get();
  }

  public ValueType returnType() {
    Preconditions.checkState(isFunction(), "%s is not a function type", this);
    return functionReturnType().get();
  }

  @Override
  public String toString() {
    if (!isFunction()) return valueType().toString();
    return parameterTypes()
            .stream()
            .map(ValueType::toString)
            .collect(Collectors.joining(", ", "(", ")"))
        + " -> "
        + returnType();
  }
}
