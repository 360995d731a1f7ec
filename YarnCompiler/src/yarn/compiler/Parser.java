package yarn.compiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import yarn.core.ValueType;

/**
 * Builds the syntax tree of one script file.
 *
 * <p>Errors don't stop parsing: a bad header skips its node, and a bad statement skips its line.
 * Everything found is available from {@link #errors()} afterwards.
 */
public class Parser {
  private static final String HEADER_END = "---";
  private static final String NODE_END = "===";
  private static final String OPTION_PREFIX = "->";

  private static final ImmutableSet<String> CLAUSE_KEYWORDS =
      ImmutableSet.of("elseif", "else", "endif");

  private static final Pattern SET_PATTERN =
      Pattern.compile("^(\\$[A-Za-z_][\\w.]*)\\s*(to\\s|\\+=|-=|\\*=|/=|%=|=)\\s*(.+)$");
  private static final Pattern DECLARE_PATTERN =
      Pattern.compile("^(\\$[A-Za-z_][\\w.]*)\\s*(to\\s|=)\\s*(.+?)(?:\\s+as\\s+(\\w+))?$");

  private static final Splitter WHITESPACE =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private final String fileName;
  private final ImmutableList<Tokenizer.SourceLine> lines;
  private final List<CompilerException> errors = new ArrayList<>();

  public Parser(String fileName, String source) {
    this.fileName = fileName;
    this.lines = new Tokenizer(fileName, source).tokenize();
  }

  public ImmutableList<CompilerException> errors() {
    return ImmutableList.copyOf(errors);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  public YarnFile parse() {
    ImmutableList.Builder<String> fileTags = ImmutableList.builder();
    ImmutableList.Builder<NodeDefinition> nodes = ImmutableList.builder();

    int cursor = 0;
    for (; cursor < lines.size(); cursor++) {
      Tokenizer.SourceLine line = lines.get(cursor);
      if (line.isBlank()) continue;
      if (!line.text().startsWith("#")) break;

      try {
        fileTags.addAll(parseHashtags(line.text(), line.pos()));
      } catch (CompilerException ex) {
        errors.add(ex);
      }
    }

    while (true) {
      while (cursor < lines.size() && lines.get(cursor).isBlank()) cursor++;
      if (cursor >= lines.size()) break;

      int end = cursor;
      while (end < lines.size() && !lines.get(end).text().equals(NODE_END)) end++;
      if (end == lines.size()) {
        errors.add(
            new CompilerException(
                lines.get(end - 1).pos(),
                String.format("expected '%s' to end the node", NODE_END)));
      }

      try {
        nodes.add(parseNode(lines.subList(cursor, end)));
      } catch (CompilerException ex) {
        errors.add(ex);
      }
      cursor = end + 1;
    }

    return new YarnFile(fileName, fileTags.build(), nodes.build());
  }

  private NodeDefinition parseNode(List<Tokenizer.SourceLine> nodeLines) throws CompilerException {
    Map<String, String> headers = new LinkedHashMap<>();
    Map<String, Tokenizer.Pos> headerPositions = new LinkedHashMap<>();

    int bodyStart = -1;
    for (int i = 0; i < nodeLines.size(); i++) {
      Tokenizer.SourceLine line = nodeLines.get(i);
      if (line.isBlank()) continue;
      if (line.text().equals(HEADER_END)) {
        bodyStart = i + 1;
        break;
      }

      int colon = line.text().indexOf(':');
      if (colon <= 0) {
        throw new CompilerException(
            line.pos(), String.format("expected a 'key: value' header or '%s'", HEADER_END));
      }
      String key = line.text().substring(0, colon).trim();
      if (headers.containsKey(key)) {
        throw new CompilerException(line.pos(), String.format("duplicate header '%s'", key));
      }

      String value = line.text().substring(colon + 1);
      int valueOffset = colon + 1 + leadingWhitespace(value);
      headers.put(key, value.trim());
      headerPositions.put(key, line.pos().addColumns(valueOffset));
    }

    Tokenizer.Pos nodePos = nodeLines.get(0).pos();
    if (bodyStart < 0) {
      throw new CompilerException(
          nodePos, String.format("expected '%s' after the headers", HEADER_END));
    }
    if (!headers.containsKey("title")) {
      throw new CompilerException(nodePos, "node is missing a 'title' header");
    }

    Tokenizer.Pos titlePos = headerPositions.get("title");
    String title = Expression.validateId(headers.get("title"), titlePos);
    ImmutableList<String> tags =
        ImmutableList.copyOf(WHITESPACE.split(headers.getOrDefault("tags", "")));

    Optional<NodeDefinition.Tracking> tracking = Optional.empty();
    if (headers.containsKey("tracking")) {
      String value = headers.get("tracking");
      if (value.equals("always")) {
        tracking = Optional.of(NodeDefinition.Tracking.ALWAYS);
      } else if (value.equals("never")) {
        tracking = Optional.of(NodeDefinition.Tracking.NEVER);
      } else {
        throw new CompilerException(
            headerPositions.get("tracking"),
            String.format("tracking must be 'always' or 'never', but was '%s'", value));
      }
    }

    List<Tokenizer.SourceLine> bodyLines = nodeLines.subList(bodyStart, nodeLines.size());
    if (tags.contains(NodeDefinition.RAW_TEXT_TAG)) {
      String rawText =
          bodyLines.stream().map(Tokenizer.SourceLine::raw).collect(Collectors.joining("\n"));
      return new NodeDefinition(
          title,
          titlePos,
          ImmutableMap.copyOf(headers),
          tags,
          tracking,
          Optional.of(rawText),
          ImmutableList.of());
    }

    return new NodeDefinition(
        title,
        titlePos,
        ImmutableMap.copyOf(headers),
        tags,
        tracking,
        Optional.empty(),
        new BodyParser(bodyLines).parseBody());
  }

  private static ImmutableList<String> parseHashtags(String text, Tokenizer.Pos pos)
      throws CompilerException {
    ImmutableList.Builder<String> hashtags = ImmutableList.builder();
    for (String token : WHITESPACE.split(text)) {
      if (!token.startsWith("#") || token.length() == 1) {
        throw new CompilerException(
            pos.addColumns(text.indexOf(token)),
            String.format("expected a hashtag, got '%s'", token));
      }
      hashtags.add(token.substring(1));
    }
    return hashtags.build();
  }

  private static final class ParsedText {
    private final LineText text;
    private final Optional<Expression> condition;

    private ParsedText(LineText text, Optional<Expression> condition) {
      this.text = text;
      this.condition = condition;
    }
  }

  // Index of the '}' closing the '{' at 'open', skipping over strings.
  private static int findClosingBrace(String text, int open) {
    boolean inString = false;
    for (int i = open + 1; i < text.length(); i++) {
      char ch = text.charAt(i);
      if (ch == '\\') {
        i++;
      } else if (ch == Tokenizer.QUOTE) {
        inString = !inString;
      } else if (!inString && ch == '}') {
        return i;
      }
    }
    return -1;
  }

  /**
   * Parses line, option or command text: {@code {expression}} substitutions, and for lines and
   * options a trailing {@code <<if condition>>} and hashtags.
   */
  private static ParsedText parseText(String text, Tokenizer.Pos pos, boolean isLine)
      throws CompilerException {
    StringBuilder template = new StringBuilder();
    ImmutableList.Builder<Expression> substitutions = ImmutableList.builder();
    List<String> hashtags = new ArrayList<>();
    Optional<Expression> condition = Optional.empty();
    int substitutionCount = 0;

    int i = 0;
    while (i < text.length()) {
      char ch = text.charAt(i);
      if (ch == '\\' && i + 1 < text.length()) {
        // Escaped markers stay escaped so they cannot be mistaken for substitutions.
        char escaped = text.charAt(i + 1);
        if (escaped == '{' || escaped == '}' || escaped == '\\') template.append('\\');
        template.append(escaped);
        i += 2;
      } else if (ch == '{') {
        int close = findClosingBrace(text, i);
        if (close < 0) throw new CompilerException(pos.addColumns(i), "unterminated '{'");

        substitutions.add(Expression.parse(text.substring(i + 1, close), pos.addColumns(i + 1)));
        template.append('{').append(substitutionCount++).append('}');
        i = close + 1;
      } else if (ch == '}') {
        throw new CompilerException(pos.addColumns(i), "unexpected '}'");
      } else if (isLine && text.startsWith("<<", i)) {
        if (condition.isPresent()) {
          throw new CompilerException(pos.addColumns(i), "a line can only have one condition");
        }
        int close = text.indexOf(">>", i);
        if (close < 0) throw new CompilerException(pos.addColumns(i), "expected '>>'");

        String command = text.substring(i + 2, close);
        String trimmed = command.trim();
        if (!trimmed.startsWith("if ")) {
          throw new CompilerException(
              pos.addColumns(i), "only an <<if>> condition may follow the text of a line");
        }
        int conditionStart = i + 2 + command.indexOf("if") + 2;
        condition =
            Optional.of(
                Expression.parse(
                    text.substring(conditionStart, close), pos.addColumns(conditionStart)));
        i = close + 2;
      } else if (isLine && ch == '#') {
        hashtags.addAll(parseHashtags(text.substring(i), pos.addColumns(i)));
        break;
      } else if (condition.isPresent() && !Character.isWhitespace(ch)) {
        throw new CompilerException(pos.addColumns(i), "unexpected text after the condition");
      } else {
        template.append(ch);
        i++;
      }
    }

    return new ParsedText(
        new LineText(template.toString().trim(), substitutions.build(), hashtags, pos), condition);
  }

  // Parses the statements of one node body, tracking indentation for option bodies.
  private final class BodyParser {
    private final List<Tokenizer.SourceLine> body;
    private int index = 0;

    private BodyParser(List<Tokenizer.SourceLine> body) {
      this.body = body;
    }

    private ImmutableList<Statement> parseBody() {
      ImmutableList.Builder<Statement> statements = ImmutableList.builder();
      while (true) {
        statements.addAll(parseStatements(-1));

        int next = nextNonBlank();
        if (next >= body.size()) break;

        // Only a stray <<elseif>>, <<else>> or <<endif>> stops the top level early.
        Tokenizer.SourceLine line = body.get(next);
        errors.add(
            new CompilerException(
                line.pos(), String.format("unexpected <<%s>>", commandKeyword(line).orElse(""))));
        index = next + 1;
      }
      return statements.build();
    }

    private int nextNonBlank() {
      int next = index;
      while (next < body.size() && body.get(next).isBlank()) next++;
      return next;
    }

    private ImmutableList<Statement> parseStatements(int parentIndent) {
      ImmutableList.Builder<Statement> statements = ImmutableList.builder();
      while (true) {
        int next = nextNonBlank();
        if (next >= body.size()) break;

        Tokenizer.SourceLine line = body.get(next);
        if (line.indent() <= parentIndent) break;
        if (commandKeyword(line).filter(CLAUSE_KEYWORDS::contains).isPresent()) break;

        index = next;
        try {
          statements.add(parseStatement(line, parentIndent));
        } catch (CompilerException ex) {
          errors.add(ex);
          index = next + 1;
        }
      }
      return statements.build();
    }

    private Statement parseStatement(Tokenizer.SourceLine line, int parentIndent)
        throws CompilerException {
      String text = line.text();
      if (text.startsWith(OPTION_PREFIX)) return parseOptionGroup(line.indent());

      Optional<String> keyword = commandKeyword(line);
      if (!keyword.isPresent()) {
        index++;
        ParsedText parsed = parseText(text, line.pos(), true);
        return new Statement.Line(parsed.text, parsed.condition);
      }

      if (keyword.get().equals("if")) return parseIf(line, parentIndent);

      index++;
      int argsStart = argsStart(text, keyword.get());
      String args = text.substring(argsStart, text.length() - 2).trim();
      Tokenizer.Pos argsPos = line.pos().addColumns(argsStart);
      switch (keyword.get()) {
        case "set":
          return parseSet(line, args, argsPos);
        case "declare":
          return parseDeclare(line, args, argsPos);
        case "jump":
          return parseJump(line, args, argsPos);
        case "stop":
          if (!args.isEmpty()) throw new CompilerException(argsPos, "<<stop>> takes no arguments");
          return new Statement.Stop(line.pos());
        default:
          {
            String command = text.substring(2, text.length() - 2);
            int offset = 2 + leadingWhitespace(command);
            ParsedText parsed = parseText(command.trim(), line.pos().addColumns(offset), false);
            return new Statement.Command(parsed.text);
          }
      }
    }

    private Statement parseOptionGroup(int indent) throws CompilerException {
      ImmutableList.Builder<Statement.Option> options = ImmutableList.builder();
      while (true) {
        Tokenizer.SourceLine line = body.get(index++);
        String text = line.text().substring(OPTION_PREFIX.length());
        int offset = OPTION_PREFIX.length() + leadingWhitespace(text);
        ParsedText parsed = parseText(text.trim(), line.pos().addColumns(offset), true);
        options.add(new Statement.Option(parsed.text, parsed.condition, parseStatements(indent)));

        // A blank line ends the group.
        if (index < body.size()
            && body.get(index).text().startsWith(OPTION_PREFIX)
            && body.get(index).indent() == indent) {
          continue;
        }
        return new Statement.OptionGroup(options.build());
      }
    }

    private Statement parseIf(Tokenizer.SourceLine line, int parentIndent)
        throws CompilerException {
      ImmutableList.Builder<Statement.Clause> clauses = ImmutableList.builder();
      index++;
      clauses.add(
          new Statement.Clause(
              line.pos(), Optional.of(parseCondition(line, "if")), parseStatements(parentIndent)));

      boolean seenElse = false;
      while (true) {
        int next = nextNonBlank();
        if (next >= body.size()) {
          throw new CompilerException(line.pos(), "<<if>> is missing its <<endif>>");
        }

        Tokenizer.SourceLine clauseLine = body.get(next);
        String keyword = commandKeyword(clauseLine).orElse("");
        if (!CLAUSE_KEYWORDS.contains(keyword)) {
          throw new CompilerException(clauseLine.pos(), "expected <<endif>>");
        }
        index = next + 1;
        if (keyword.equals("endif")) break;
        if (seenElse) {
          throw new CompilerException(
              clauseLine.pos(), String.format("<<%s>> after <<else>>", keyword));
        }

        Optional<Expression> condition = Optional.empty();
        if (keyword.equals("elseif")) {
          condition = Optional.of(parseCondition(clauseLine, "elseif"));
        } else {
          seenElse = true;
        }
        clauses.add(
            new Statement.Clause(clauseLine.pos(), condition, parseStatements(parentIndent)));
      }
      return new Statement.If(clauses.build());
    }

    private Expression parseCondition(Tokenizer.SourceLine line, String keyword)
        throws CompilerException {
      String text = line.text();
      int argsStart = argsStart(text, keyword);
      return Expression.parse(
          text.substring(argsStart, text.length() - 2), line.pos().addColumns(argsStart));
    }

    private Statement parseSet(Tokenizer.SourceLine line, String args, Tokenizer.Pos pos)
        throws CompilerException {
      Matcher matcher = SET_PATTERN.matcher(args);
      if (!matcher.matches()) {
        throw new CompilerException(pos, "expected <<set $variable to expression>>");
      }

      Statement.Set.Operation operation =
          Statement.Set.Operation.parse(matcher.group(2).trim()).get();
      return new Statement.Set(
          line.pos(),
          Expression.Variable.parse(matcher.group(1), pos),
          operation,
          Expression.parse(matcher.group(3), pos.addColumns(matcher.start(3))));
    }

    private Statement parseDeclare(Tokenizer.SourceLine line, String args, Tokenizer.Pos pos)
        throws CompilerException {
      Matcher matcher = DECLARE_PATTERN.matcher(args);
      if (!matcher.matches()) {
        throw new CompilerException(pos, "expected <<declare $variable = value>>");
      }

      Optional<ValueType> explicitType = Optional.empty();
      if (matcher.group(4) != null) {
        explicitType = ValueType.parse(matcher.group(4));
        if (!explicitType.isPresent()) {
          throw new CompilerException(
              pos.addColumns(matcher.start(4)),
              String.format("unknown type '%s'", matcher.group(4)));
        }
      }

      return new Statement.Declare(
          line.pos(),
          Expression.Variable.parse(matcher.group(1), pos),
          Expression.parse(matcher.group(3), pos.addColumns(matcher.start(3))),
          explicitType);
    }

    private Statement parseJump(Tokenizer.SourceLine line, String args, Tokenizer.Pos pos)
        throws CompilerException {
      if (args.startsWith("{") && args.endsWith("}")) {
        return new Statement.Jump(
            line.pos(), Expression.parse(args.substring(1, args.length() - 1), pos.addColumns(1)));
      }
      return new Statement.Jump(
          line.pos(), Expression.StringLiteral.of(Expression.validateId(args, pos), pos));
    }
  }

  // The first word of a <<command>> line.
  private static Optional<String> commandKeyword(Tokenizer.SourceLine line) {
    String text = line.text();
    if (!text.startsWith("<<") || !text.endsWith(">>") || text.length() < 4) {
      return Optional.empty();
    }

    String content = text.substring(2, text.length() - 2).trim();
    int end = 0;
    while (end < content.length() && !Character.isWhitespace(content.charAt(end))) end++;
    return Optional.of(content.substring(0, end));
  }

  private static int leadingWhitespace(String text) {
    return text.length() - CharMatcher.whitespace().trimLeadingFrom(text).length();
  }

  // Index of the first argument after the keyword of a <<command>> line.
  private static int argsStart(String text, String keyword) {
    int start = text.indexOf(keyword) + keyword.length();
    while (start < text.length() - 2 && Character.isWhitespace(text.charAt(start))) start++;
    return start;
  }
}
