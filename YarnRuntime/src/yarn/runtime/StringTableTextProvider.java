package yarn.runtime;

import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

import yarn.core.LineId;

/** A {@link TextProvider} over a compiled string table, in a single language. */
public final class StringTableTextProvider implements TextProvider {
  private final String languageCode;
  private final ImmutableMap<LineId, String> strings;

  public StringTableTextProvider(String languageCode, Map<LineId, String> strings) {
    this.languageCode = languageCode;
    this.strings = ImmutableMap.copyOf(strings);
  }

  @Override
  public Optional<String> text(LineId id) {
    return Optional.ofNullable(strings.get(id));
  }

  @Override
  public String languageCode() {
    return languageCode;
  }

  public ImmutableMap<LineId, String> strings() {
    return strings;
  }
}
