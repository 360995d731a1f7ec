package yarn.compiler;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.truth.Correspondence;

import yarn.core.ValueType;

public class ParserTest {

  private static final Correspondence<String, String> CONTAINS =
      Correspondence.from(String::contains, "contains");

  private StringBuilder file = new StringBuilder();
  private ImmutableList<CompilerException> errors = ImmutableList.of();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private void node(String title, String... body) {
    println("title: " + title);
    println("---");
    for (String line : body) println(line);
    println("===");
  }

  private YarnFile parse() {
    Parser parser = new Parser("test.yarn", file.toString());
    YarnFile yarnFile = parser.parse();
    errors = parser.errors();
    return yarnFile;
  }

  private ImmutableList<Statement> parseBody(String... body) {
    node("Start", body);
    YarnFile yarnFile = parse();
    assertThat(errors).isEmpty();
    return yarnFile.nodes().get(0).body();
  }

  private void assertErrors(String errorSubstr) {
    parse();
    assertThat(Lists.transform(errors, CompilerException::errorMsg))
        .comparingElementsUsing(CONTAINS)
        .contains(errorSubstr);
  }

  @Test
  public void emptyFile() {
    YarnFile yarnFile = parse();

    assertThat(errors).isEmpty();
    assertThat(yarnFile.nodes()).isEmpty();
  }

  @Test
  public void headers() {
    println("title: Start");
    println("tags: intro  chapter1");
    println("colour: blue");
    println("tracking: always");
    println("---");
    println("Hello there.");
    println("===");

    NodeDefinition node = parse().nodes().get(0);

    assertThat(errors).isEmpty();
    assertThat(node.title()).isEqualTo("Start");
    assertThat(node.tags()).containsExactly("intro", "chapter1").inOrder();
    assertThat(node.headers()).containsEntry("colour", "blue");
    assertThat(node.tracking()).hasValue(NodeDefinition.Tracking.ALWAYS);
    assertThat(node.pos().column()).isEqualTo(7);
    assertThat(node.body()).hasSize(1);
  }

  @Test
  public void fileTags() {
    println("#chapter1 #draft");
    println("");
    node("Start", "Hi.");

    YarnFile yarnFile = parse();

    assertThat(errors).isEmpty();
    assertThat(yarnFile.fileTags()).containsExactly("chapter1", "draft").inOrder();
    assertThat(yarnFile.nodes()).hasSize(1);
  }

  @Test
  public void multipleNodes() {
    node("A", "One.");
    println("");
    node("B", "Two.");

    YarnFile yarnFile = parse();

    assertThat(errors).isEmpty();
    assertThat(Lists.transform(yarnFile.nodes(), NodeDefinition::title))
        .containsExactly("A", "B")
        .inOrder();
  }

  @Test
  public void lineParts() {
    ImmutableList<Statement> body =
        parseBody("You have {$gold + 1} coins. <<if $rich>> #line:coins #happy");

    Statement.Line line = body.get(0).cast();
    assertThat(line.text().template()).isEqualTo("You have {0} coins.");
    assertThat(line.text().substitutions()).hasSize(1);
    assertThat(line.text().substitutions().get(0).raw()).isEqualTo("$gold + 1");
    assertThat(line.condition().get().raw()).isEqualTo("$rich");
    assertThat(line.text().explicitLineId()).hasValue("line:coins");
    assertThat(line.text().metadata()).containsExactly("happy");
  }

  @Test
  public void escapes() {
    Statement.Line line = parseBody("Braces \\{not code\\} and \\#not a tag").get(0).cast();

    assertThat(line.text().template()).isEqualTo("Braces {not code} and #not a tag");
    assertThat(line.text().substitutions()).isEmpty();
    assertThat(line.text().hashtags()).isEmpty();
  }

  @Test
  public void optionGroup() {
    ImmutableList<Statement> body =
        parseBody(
            "Pick one.",
            "-> Red",
            "    You chose red.",
            "-> Blue <<if $unlocked>> #line:blue",
            "    You chose blue.",
            "    Nice.",
            "After.");

    assertThat(Lists.transform(body, Statement::type))
        .containsExactly(Statement.Type.LINE, Statement.Type.OPTION_GROUP, Statement.Type.LINE)
        .inOrder();

    Statement.OptionGroup group = body.get(1).cast();
    assertThat(group.options()).hasSize(2);
    assertThat(group.options().get(0).text().template()).isEqualTo("Red");
    assertThat(group.options().get(0).condition()).isEmpty();
    assertThat(group.options().get(0).body()).hasSize(1);
    assertThat(group.options().get(1).text().template()).isEqualTo("Blue");
    assertThat(group.options().get(1).condition()).isPresent();
    assertThat(group.options().get(1).text().explicitLineId()).hasValue("line:blue");
    assertThat(group.options().get(1).body()).hasSize(2);
  }

  @Test
  public void nestedOptions() {
    ImmutableList<Statement> body =
        parseBody("-> Outer", "    -> Inner A", "    -> Inner B", "        Deep.", "-> Other");

    assertThat(body).hasSize(1);
    Statement.OptionGroup outer = body.get(0).cast();
    assertThat(outer.options()).hasSize(2);

    ImmutableList<Statement> outerBody = outer.options().get(0).body();
    assertThat(outerBody).hasSize(1);
    Statement.OptionGroup inner = outerBody.get(0).cast();
    assertThat(inner.options()).hasSize(2);
    assertThat(inner.options().get(1).body()).hasSize(1);
  }

  @Test
  public void blankLineEndsOptionGroup() {
    ImmutableList<Statement> body = parseBody("-> A", "", "-> B");

    assertThat(Lists.transform(body, Statement::type))
        .containsExactly(Statement.Type.OPTION_GROUP, Statement.Type.OPTION_GROUP);
  }

  @Test
  public void ifElseChain() {
    ImmutableList<Statement> body =
        parseBody(
            "<<if $x > 1>>",
            "  Big.",
            "<<elseif $x == 1>>",
            "  One.",
            "  Exactly one.",
            "<<else>>",
            "  Small.",
            "<<endif>>",
            "Done.");

    assertThat(body).hasSize(2);
    Statement.If ifStatement = body.get(0).cast();
    assertThat(ifStatement.clauses()).hasSize(3);
    assertThat(ifStatement.clauses().get(0).condition().get().raw()).isEqualTo("$x > 1");
    assertThat(ifStatement.clauses().get(1).body()).hasSize(2);
    assertThat(ifStatement.clauses().get(2).condition()).isEmpty();
  }

  @Test
  public void commands() {
    ImmutableList<Statement> body =
        parseBody(
            "<<set $x to 5>>",
            "<<set $x += 2>>",
            "<<declare $name = \"Bob\" as String>>",
            "<<declare $count to -1>>",
            "<<jump Other>>",
            "<<jump {$destination}>>",
            "<<stop>>",
            "<<play_sound {$x} loud>>");

    Statement.Set set = body.get(0).cast();
    assertThat(set.variable().name()).isEqualTo("$x");
    assertThat(set.operation()).isEqualTo(Statement.Set.Operation.ASSIGN);
    assertThat(set.value().raw()).isEqualTo("5");
    assertThat(body.get(1).<Statement.Set>cast().operation())
        .isEqualTo(Statement.Set.Operation.ADD);

    Statement.Declare name = body.get(2).cast();
    assertThat(name.variable().name()).isEqualTo("$name");
    assertThat(name.explicitType()).hasValue(ValueType.STRING);
    assertThat(name.value().raw()).isEqualTo("\"Bob\"");
    Statement.Declare count = body.get(3).cast();
    assertThat(count.explicitType()).isEmpty();
    assertThat(count.value().type()).isEqualTo(Expression.Type.NUMBER_LITERAL);

    assertThat(body.get(4).<Statement.Jump>cast().literalDestination()).hasValue("Other");
    assertThat(body.get(5).<Statement.Jump>cast().literalDestination()).isEmpty();
    assertThat(body.get(6).type()).isEqualTo(Statement.Type.STOP);

    Statement.Command command = body.get(7).cast();
    assertThat(command.text().template()).isEqualTo("play_sound {0} loud");
    assertThat(command.text().substitutions()).hasSize(1);
  }

  @Test
  public void rawTextNode() {
    println("title: Notes");
    println("tags: rawText");
    println("---");
    println("Some {raw} text");
    println("<<not parsed>>");
    println("===");

    NodeDefinition node = parse().nodes().get(0);

    assertThat(errors).isEmpty();
    assertThat(node.rawText()).hasValue("Some {raw} text\n<<not parsed>>");
    assertThat(node.body()).isEmpty();
  }

  @Test
  public void errorsDoNotStopParsing() {
    println("tags: broken");
    println("---");
    println("===");
    node("Good", "Fine.", "{unclosed", "Also fine.");

    YarnFile yarnFile = parse();

    assertThat(errors).hasSize(2);
    assertThat(yarnFile.nodes()).hasSize(1);
    assertThat(yarnFile.nodes().get(0).body()).hasSize(2);
  }

  @Test
  public void missingTitle() {
    println("tags: a");
    println("---");
    println("===");
    assertErrors("missing a 'title' header");
  }

  @Test
  public void badTitle() {
    node("Bad Title", "Hi.");
    assertErrors("illegal character ' '");
  }

  @Test
  public void missingNodeEnd() {
    println("title: Start");
    println("---");
    println("Hello.");
    assertErrors("expected '===' to end the node");
  }

  @Test
  public void missingHeaderEnd() {
    println("title: Start");
    println("===");
    assertErrors("expected '---' after the headers");
  }

  @Test
  public void badTracking() {
    println("title: Start");
    println("tracking: sometimes");
    println("---");
    println("===");
    assertErrors("tracking must be 'always' or 'never'");
  }

  @Test
  public void missingEndif() {
    node("Start", "<<if true>>", "Hi.");
    assertErrors("<<if>> is missing its <<endif>>");
  }

  @Test
  public void strayEndif() {
    node("Start", "Hi.", "<<endif>>");
    assertErrors("unexpected <<endif>>");
  }

  @Test
  public void elseAfterElse() {
    node("Start", "<<if true>>", "<<else>>", "<<else>>", "<<endif>>");
    assertErrors("<<else>> after <<else>>");
  }

  @Test
  public void commandAfterLineText() {
    node("Start", "Hello <<set $x to 1>>");
    assertErrors("only an <<if>> condition may follow the text of a line");
  }

  @Test
  public void badSet() {
    node("Start", "<<set x to 1>>");
    assertErrors("expected <<set $variable to expression>>");
  }

  @Test
  public void badDeclareType() {
    node("Start", "<<declare $x = 1 as Integer>>");
    assertErrors("unknown type 'Integer'");
  }

  @Test
  public void stopTakesNoArguments() {
    node("Start", "<<stop now>>");
    assertErrors("<<stop>> takes no arguments");
  }
}
