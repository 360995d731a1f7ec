package yarn.runtime;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

public class CommandTest {

  @Test
  public void nameAndParameters() {
    Command command = Command.create("  fade_out   2.5 fast ");

    assertThat(command.name()).isEqualTo("fade_out");
    assertThat(command.parameters()).containsExactly("2.5", "fast").inOrder();
  }

  @Test
  public void quotedParameters() {
    Command command = Command.create("say \"hello there\" loudly \"\"");

    assertThat(command.name()).isEqualTo("say");
    assertThat(command.parameters()).containsExactly("hello there", "loudly", "").inOrder();
  }

  @Test
  public void empty() {
    Command command = Command.create("   ");

    assertThat(command.name()).isEmpty();
    assertThat(command.parameters()).isEmpty();
  }
}
