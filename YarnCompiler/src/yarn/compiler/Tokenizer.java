package yarn.compiler;

import java.util.Comparator;
import java.util.Objects;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/** Splits a script into source lines, and expression text into atoms. */
public class Tokenizer {
  public static class Pos implements Comparable<Pos> {
    private static final Pos INTERNAL = new Pos("<internal>", -1, -1);

    public static Pos internal() {
      return INTERNAL;
    }

    private final String file;
    private final int lineNumber;
    private final int column;

    public Pos(String file, int lineNumber, int column) {
      this.file = file;
      this.lineNumber = lineNumber;
      this.column = column;
    }

    public String file() {
      return file;
    }

    /** Zero-based. */
    public int lineNumber() {
      return lineNumber;
    }

    /** Zero-based. */
    public int column() {
      return column;
    }

    public Pos addColumns(int columns) {
      return new Pos(file, lineNumber, column + columns);
    }

    @Override
    public int compareTo(Pos pos) {
      return Comparator.comparing(Pos::file)
          .thenComparing(Pos::lineNumber)
          .thenComparing(Pos::column)
          .compare(this, pos);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Pos)) return false;
      Pos other = (Pos) o;
      return file.equals(other.file) && lineNumber == other.lineNumber && column == other.column;
    }

    @Override
    public int hashCode() {
      return Objects.hash(file, lineNumber, column);
    }

    @Override
    public String toString() {
      return String.format("%s@%d:%d", file, lineNumber + 1, column + 1);
    }
  }

  /** One line of a script. Comments are removed from {@link #text()} but kept in {@link #raw()}. */
  public static class SourceLine {
    private final String raw;
    private final String text;
    private final int indent;
    private final Pos pos;

    private SourceLine(String raw, String text, int indent, Pos pos) {
      this.raw = raw;
      this.text = text;
      this.indent = indent;
      this.pos = pos;
    }

    public String raw() {
      return raw;
    }

    public String text() {
      return text;
    }

    public int indent() {
      return indent;
    }

    public Pos pos() {
      return pos;
    }

    public boolean isBlank() {
      return text.isEmpty();
    }

    @Override
    public String toString() {
      return pos + " " + text;
    }
  }

  public static class Atom {
    private final String text;
    private final Pos pos;

    public Atom(String text, Pos pos) {
      this.text = text;
      this.pos = pos;
    }

    public String text() {
      return text;
    }

    public Pos pos() {
      return pos;
    }

    @Override
    public String toString() {
      return text;
    }
  }

  public static final char QUOTE = '"';
  private static final int TAB_WIDTH = 8;

  private final String file;
  private final ImmutableList<String> lines;

  public Tokenizer(String file, String content) {
    this.file = file;
    this.lines =
        ImmutableList.copyOf(
            Splitter.on('\n').split(CharMatcher.is('\r').removeFrom(content)));
  }

  public ImmutableList<SourceLine> tokenize() {
    ImmutableList.Builder<SourceLine> builder = ImmutableList.builder();
    for (int i = 0; i < lines.size(); i++) {
      String raw = lines.get(i);
      int start = 0;
      int indent = 0;
      while (start < raw.length() && Character.isWhitespace(raw.charAt(start))) {
        indent = raw.charAt(start) == '\t' ? (indent / TAB_WIDTH + 1) * TAB_WIDTH : indent + 1;
        start++;
      }

      String text = stripComment(raw.substring(start)).trim();
      builder.add(new SourceLine(raw, text, indent, new Pos(file, i, start)));
    }
    return builder.build();
  }

  // '//' starts a comment, except inside {expressions}, <<commands>> and the strings they hold.
  private static String stripComment(String line) {
    int braceDepth = 0;
    boolean inCommand = false;
    boolean inString = false;
    for (int i = 0; i < line.length(); i++) {
      char ch = line.charAt(i);
      boolean code = braceDepth > 0 || inCommand;
      if (ch == '\\') {
        i++;
      } else if (inString) {
        if (ch == QUOTE) inString = false;
      } else if (code && ch == QUOTE) {
        inString = true;
      } else if (ch == '{') {
        braceDepth++;
      } else if (ch == '}' && braceDepth > 0) {
        braceDepth--;
      } else if (line.startsWith("<<", i)) {
        inCommand = true;
        i++;
      } else if (inCommand && line.startsWith(">>", i)) {
        inCommand = false;
        i++;
      } else if (!code && line.startsWith("//", i)) {
        return line.substring(0, i);
      }
    }
    return line;
  }

  private static final ImmutableSet<String> OPERATORS =
      ImmutableSet.of(
          "<=", ">=", "==", "!=", "&&", "||", "<", ">", "+", "-", "*", "/", "%", "!", "^");

  private static boolean isWordChar(char ch) {
    return Character.isLetterOrDigit(ch) || ch == '_' || ch == '.' || ch == '$';
  }

  public static ImmutableList<Atom> splitExpression(String text, Pos pos)
      throws CompilerException {
    ImmutableList.Builder<Atom> atoms = ImmutableList.builder();
    int i = 0;
    while (i < text.length()) {
      char ch = text.charAt(i);
      Pos atomPos = pos.addColumns(i);
      if (Character.isWhitespace(ch)) {
        i++;
      } else if (ch == QUOTE) {
        int end = i + 1;
        while (end < text.length() && text.charAt(end) != QUOTE) {
          if (text.charAt(end) == '\\') end++;
          end++;
        }
        if (end >= text.length()) throw new CompilerException(atomPos, "unterminated string");

        atoms.add(new Atom(text.substring(i, end + 1), atomPos));
        i = end + 1;
      } else if (ch == '(' || ch == ')' || ch == ',') {
        atoms.add(new Atom(Character.toString(ch), atomPos));
        i++;
      } else if (isWordChar(ch)) {
        int end = i;
        while (end < text.length() && isWordChar(text.charAt(end))) end++;
        atoms.add(new Atom(text.substring(i, end), atomPos));
        i = end;
      } else {
        // Greediest operator match.
        String op = null;
        if (i + 2 <= text.length() && OPERATORS.contains(text.substring(i, i + 2))) {
          op = text.substring(i, i + 2);
        } else if (OPERATORS.contains(Character.toString(ch))) {
          op = Character.toString(ch);
        }
        if (op == null) {
          throw new CompilerException(atomPos, String.format("unexpected character '%c'", ch));
        }

        atoms.add(new Atom(op, atomPos));
        i += op.length();
      }
    }
    return atoms.build();
  }
}
