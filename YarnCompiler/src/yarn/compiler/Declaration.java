package yarn.compiler;

import java.util.Optional;

import com.google.auto.value.AutoValue;

import yarn.core.Value;

/** A variable or function known to the compiler. */
@AutoValue
public abstract class Declaration {
  public enum Provenance {
    /** Written with {@code <<declare>>}. */
    EXPLICIT,
    /** Created from the first use of an undeclared variable. */
    INFERRED,
    /** Created by the compiler itself, such as visit tracking variables. */
    DERIVED,
    /** Supplied with the compilation job, or a library function. */
    EXTERNAL;
  }

  public abstract String name();

  public abstract YarnType type();

  public abstract Optional<Value> defaultValue();

  public abstract String description();

  public abstract Optional<String> sourceFile();

  public abstract Optional<String> sourceNode();

  public abstract Optional<Tokenizer.Pos> pos();

  public abstract Provenance provenance();

  public boolean isVariable() {
    return !type().isFunction();
  }

  public abstract Builder toBuilder();

  public static Builder builder(String name, YarnType type, Provenance provenance) {
    return new AutoValue_Declaration.Builder()
        .setName(name)
        .setType(type)
        .setProvenance(provenance)
        .setDescription("");
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String name);

    public abstract Builder setType(YarnType type);

    public abstract Builder setDefaultValue(Value defaultValue);

    public abstract Builder setDescription(String description);

    public abstract Builder setSourceFile(String sourceFile);

    public abstract Builder setSourceNode(String sourceNode);

    public abstract Builder setPos(Tokenizer.Pos pos);

    public abstract Builder setProvenance(Provenance provenance);

    public abstract Declaration build();
  }
}
