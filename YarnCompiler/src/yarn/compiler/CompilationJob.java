package yarn.compiler;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

import yarn.core.Library;

/** What to compile, and against which functions and variables. */
@AutoValue
public abstract class CompilationJob {
  public abstract ImmutableList<SourceFile> files();

  /** The functions scripts may call. The standard library if absent. */
  public abstract Optional<Library> library();

  /** The configured compilation type if absent. */
  public abstract Optional<CompilationType> compilationType();

  /** Variables and functions known before compiling, such as those the game defines. */
  public abstract ImmutableList<Declaration> declarations();

  public static Builder builder() {
    return new AutoValue_CompilationJob.Builder();
  }

  public static CompilationJob fromString(String fileName, String source) {
    return builder().addFile(fileName, source).build();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    abstract ImmutableList.Builder<SourceFile> filesBuilder();

    public Builder addFile(SourceFile file) {
      filesBuilder().add(file);
      return this;
    }

    public Builder addFile(String fileName, String source) {
      return addFile(SourceFile.create(fileName, source));
    }

    public abstract Builder setLibrary(Library library);

    public abstract Builder setCompilationType(CompilationType compilationType);

    abstract ImmutableList.Builder<Declaration> declarationsBuilder();

    public Builder addDeclaration(Declaration declaration) {
      declarationsBuilder().add(declaration);
      return this;
    }

    public abstract CompilationJob build();
  }
}
