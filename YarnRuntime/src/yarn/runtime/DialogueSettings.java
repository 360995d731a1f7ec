package yarn.runtime;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/** Dialogue defaults, read from the {@code yarn.dialogue} block of a Typesafe config. */
@AutoValue
public abstract class DialogueSettings {
  static final String PATH = "yarn.dialogue";

  public abstract String startNode();

  /** The dialogue's locale as an IETF BCP 47 code, e.g. {@code en-US}. */
  public abstract Optional<String> languageCode();

  public static DialogueSettings create(String startNode, Optional<String> languageCode) {
    return new AutoValue_DialogueSettings(startNode, languageCode);
  }

  public static DialogueSettings load() {
    return fromConfig(ConfigFactory.load());
  }

  public static DialogueSettings fromConfig(Config config) {
    Config dialogue = config.withFallback(ConfigFactory.defaultReference()).getConfig(PATH);
    return create(
        dialogue.getString("start-node"),
        dialogue.hasPath("language-code")
            ? Optional.of(dialogue.getString("language-code"))
            : Optional.empty());
  }
}
