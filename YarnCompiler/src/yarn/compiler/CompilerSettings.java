package yarn.compiler;

import com.google.auto.value.AutoValue;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/** Compiler defaults, read from the {@code yarn.compiler} block of a Typesafe config. */
@AutoValue
public abstract class CompilerSettings {
  static final String PATH = "yarn.compiler";

  /** Used when a job doesn't name its compilation type. */
  public abstract CompilationType compilationType();

  /** Prepended to generated line ids. */
  public abstract String implicitLineIdPrefix();

  public static CompilerSettings create(
      CompilationType compilationType, String implicitLineIdPrefix) {
    return new AutoValue_CompilerSettings(compilationType, implicitLineIdPrefix);
  }

  /** Settings from {@code application.conf}, falling back on the bundled {@code reference.conf}. */
  public static CompilerSettings load() {
    return fromConfig(ConfigFactory.load());
  }

  public static CompilerSettings fromConfig(Config config) {
    Config compiler = config.withFallback(ConfigFactory.defaultReference()).getConfig(PATH);
    return create(
        compiler.getEnum(CompilationType.class, "compilation-type"),
        compiler.getString("implicit-line-id-prefix"));
  }
}
