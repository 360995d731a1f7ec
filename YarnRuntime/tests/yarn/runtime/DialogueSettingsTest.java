package yarn.runtime;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigFactory;

public class DialogueSettingsTest {

  @Test
  public void defaults() {
    DialogueSettings settings = DialogueSettings.load();

    assertThat(settings.startNode()).isEqualTo("Start");
    assertThat(settings.languageCode()).isEmpty();
  }

  @Test
  public void fromConfig() {
    DialogueSettings settings =
        DialogueSettings.fromConfig(
            ConfigFactory.parseString(
                "yarn.dialogue { start-node = Intro, language-code = \"en-GB\" }"));

    assertThat(settings.startNode()).isEqualTo("Intro");
    assertThat(settings.languageCode()).hasValue("en-GB");
  }
}
