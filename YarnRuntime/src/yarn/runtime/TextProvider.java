package yarn.runtime;

import java.util.Optional;

import yarn.core.LineId;

/** Resolves delivered lines to the text the player sees. */
public interface TextProvider {
  Optional<String> text(LineId id);

  /** The language the text is in, as an IETF BCP 47 code. */
  String languageCode();

  /** The line's text with its substitutions expanded, if the line is known. */
  default Optional<String> render(Line line) {
    return text(line.id())
        .map(text -> ReadOnlyDialogue.expandSubstitutions(text, line.substitutions()));
  }
}
