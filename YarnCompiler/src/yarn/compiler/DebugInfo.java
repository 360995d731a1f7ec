package yarn.compiler;

import java.util.Map;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;

/** Maps a compiled node's instructions back to the script. */
@AutoValue
public abstract class DebugInfo {
  /** A line and column in the script, both one-based like {@link StringInfo#lineNumber()}. */
  @AutoValue
  public abstract static class LineInfo {
    public abstract int lineNumber();

    public abstract int column();

    public static LineInfo create(int lineNumber, int column) {
      return new AutoValue_DebugInfo_LineInfo(lineNumber, column);
    }

    static LineInfo of(Tokenizer.Pos pos) {
      return create(pos.lineNumber() + 1, pos.column() + 1);
    }
  }

  public abstract String nodeName();

  public abstract String fileName();

  /** Instruction index to source position. */
  public abstract ImmutableMap<Integer, LineInfo> positions();

  public static DebugInfo create(
      String nodeName, String fileName, ImmutableMap<Integer, LineInfo> positions) {
    return new AutoValue_DebugInfo(nodeName, fileName, positions);
  }

  static DebugInfo fromPositions(
      String nodeName, String fileName, Map<Integer, Tokenizer.Pos> positions) {
    ImmutableMap.Builder<Integer, LineInfo> lines = ImmutableMap.builder();
    positions.forEach((index, pos) -> lines.put(index, LineInfo.of(pos)));
    return create(nodeName, fileName, lines.build());
  }

  public Optional<LineInfo> position(int instructionIndex) {
    return Optional.ofNullable(positions().get(instructionIndex));
  }
}
