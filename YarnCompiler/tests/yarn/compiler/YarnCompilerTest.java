package yarn.compiler;

import static com.google.common.truth.Truth.assertThat;

import java.util.Arrays;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.common.collect.Lists;
import com.google.common.truth.Correspondence;
import com.typesafe.config.ConfigFactory;

import yarn.core.Instruction;
import yarn.core.Library;
import yarn.core.LineId;
import yarn.core.Node;
import yarn.core.OpCode;
import yarn.core.Program;
import yarn.core.Value;
import yarn.core.ValueType;

public class YarnCompilerTest {

  private static final Correspondence<Diagnostic, String> MESSAGE_CONTAINS =
      Correspondence.from(
          (Diagnostic actual, String expected) -> actual.message().contains(expected),
          "has a message containing");

  private final YarnCompiler compiler =
      new YarnCompiler(CompilerSettings.create(CompilationType.FULL_COMPILATION, "line:"));

  private static String lines(String... lines) {
    return Arrays.asList(lines).stream().collect(Collectors.joining("\n"));
  }

  private static String node(String title, String... body) {
    return lines("title: " + title, "---", lines(body), "===");
  }

  private CompilationResult compile(String... lines) {
    return compiler.compileString("test.yarn", lines(lines));
  }

  private CompilationResult compileNode(String... body) {
    return compiler.compileString("test.yarn", node("Start", body));
  }

  private static Program assertCompiles(CompilationResult result) {
    assertThat(result.errors()).isEmpty();
    assertThat(result.program()).isPresent();
    return result.program().get();
  }

  private static void assertErrors(CompilationResult result, String errorSubstr) {
    assertThat(result.errors()).comparingElementsUsing(MESSAGE_CONTAINS).contains(errorSubstr);
    assertThat(result.program()).isEmpty();
  }

  private static long count(Node node, OpCode opCode) {
    return node.instructions().stream().filter(i -> i.opCode() == opCode).count();
  }

  @Test
  public void emptyJob() {
    CompilationResult result = compiler.compile(CompilationJob.builder().build());

    assertThat(result.diagnostics()).isEmpty();
    assertThat(result.stringTable()).isEmpty();
    assertThat(result.program()).hasValue(Program.empty());
  }

  @Test
  public void sample() {
    CompilationResult result =
        compile("title: test", "---", "foo", "bar", "a {1 + 3} cool expression", "===");

    Program program = assertCompiles(result);
    assertThat(program.nodes().keySet()).containsExactly("test");

    Node node = program.nodes().get("test");
    assertThat(count(node, OpCode.RUN_LINE)).isAtLeast(3);
    assertThat(node.instructions())
        .containsAtLeast(
            Instruction.push(Value.of(1)),
            Instruction.push(Value.of(3)),
            Instruction.callFunction("Number.Add", 2),
            Instruction.runLine(LineId.of("line:test.yarn-test-3"), 1))
        .inOrder();
    assertThat(node.instructions().get(node.instructions().size() - 1).opCode())
        .isEqualTo(OpCode.STOP);

    assertThat(result.stringTable().keySet())
        .containsExactly(
            LineId.of("line:test.yarn-test-1"),
            LineId.of("line:test.yarn-test-2"),
            LineId.of("line:test.yarn-test-3"))
        .inOrder();
    StringInfo third = result.stringTable().get(LineId.of("line:test.yarn-test-3"));
    assertThat(third.text()).isEqualTo("a {0} cool expression");
    assertThat(third.lineNumber()).isEqualTo(5);
    assertThat(third.nodeName()).isEqualTo("test");
    assertThat(third.isImplicitTag()).isTrue();
    assertThat(result.containsImplicitStringTags()).isTrue();
  }

  @Test
  public void nodeSetMatchesSources() {
    CompilationResult result =
        compiler.compile(
            CompilationJob.builder()
                .addFile("a.yarn", lines(node("A", "One."), node("B", "Two.")))
                .addFile("b.yarn", node("C", "Three."))
                .build());

    assertThat(assertCompiles(result).nodes().keySet()).containsExactly("A", "B", "C");
  }

  @Test
  public void duplicateNodes() {
    CompilationResult sameFile = compile(node("A", "One."), node("A", "Two."));
    assertErrors(sameFile, "duplicate node 'A'");
    assertThat(sameFile.errors()).hasSize(1);
    assertThat(sameFile.stringTable().keySet())
        .containsExactly(LineId.of("line:test.yarn-A-1"), LineId.of("line:test.yarn-A-2"));

    CompilationResult rawText =
        compile(
            "title: A", "tags: rawText", "---", "One", "===",
            "title: A", "tags: rawText", "---", "Two", "===");
    assertErrors(rawText, "duplicate node 'A'");
    assertThat(rawText.errors()).hasSize(1);

    assertErrors(
        compiler.compile(
            CompilationJob.builder()
                .addFile("a.yarn", node("A", "One."))
                .addFile("b.yarn", node("A", "Two."))
                .build()),
        "duplicate node 'A'");
  }

  @Test
  public void identicalDiagnosticsCollapse() {
    String source = node("Start", "<<jump Nowhere>>");
    CompilationResult result =
        compiler.compile(
            CompilationJob.builder().addFile("a.yarn", source).addFile("a.yarn", source).build());

    assertThat(
            result
                .diagnostics()
                .stream()
                .filter(d -> d.message().equals("jump to unknown node 'Nowhere'"))
                .count())
        .isEqualTo(1);
    assertThat(result.diagnostics()).isInStrictOrder();
  }

  @Test
  public void lastLineBeforeOptions() {
    CompilationResult result = compileNode("Intro.", "Pick one. #line:pick", "-> A", "-> B");

    assertCompiles(result);
    assertThat(result.stringTable().get(LineId.of("line:pick")).metadata())
        .containsExactly(LastLineBeforeOptionsTagger.LAST_LINE_TAG);
    assertThat(result.stringTable().get(LineId.of("line:test.yarn-Start-1")).metadata())
        .isEmpty();
  }

  @Test
  public void explicitLineIds() {
    CompilationResult result = compileNode("Hello. #line:hello #sad");

    assertCompiles(result);
    StringInfo info = result.stringTable().get(LineId.of("line:hello"));
    assertThat(info.isImplicitTag()).isFalse();
    assertThat(info.metadata()).containsExactly("sad");
    assertThat(result.containsImplicitStringTags()).isFalse();

    assertErrors(compileNode("One. #line:x", "Two. #line:x"), "duplicate line id 'line:x'");
  }

  @Test
  public void options() {
    Program program =
        assertCompiles(
            compileNode(
                "-> Red",
                "    Red it is.",
                "-> Blue {1 + 1} <<if $likesBlue>>",
                "    Blue it is.",
                "Done."));

    Node node = program.nodes().get("Start");
    assertThat(count(node, OpCode.ADD_OPTION)).isEqualTo(2);
    assertThat(count(node, OpCode.SHOW_OPTIONS)).isEqualTo(1);
    assertThat(count(node, OpCode.RUN_LINE)).isEqualTo(3);

    for (Instruction instruction : node.instructions()) {
      if (instruction.opCode() == OpCode.ADD_OPTION) {
        assertThat(node.labels()).containsKey(instruction.stringOperand(1));
      }
      if (instruction.opCode() == OpCode.JUMP_TO || instruction.opCode() == OpCode.JUMP_IF_FALSE) {
        assertThat(node.labels()).containsKey(instruction.stringOperand(0));
      }
    }
    assertThat(node.instructions())
        .contains(
            Instruction.addOption(
                LineId.of("line:test.yarn-Start-3"), "L2_option_2", 1, true));
  }

  @Test
  public void explicitDeclarations() {
    CompilationResult result =
        compileNode("<<declare $gold = 10>>", "<<declare $name = \"Bob\" as String>>", "Hi.");

    Program program = assertCompiles(result);
    Declaration gold = result.declaration("$gold").get();
    assertThat(gold.provenance()).isEqualTo(Declaration.Provenance.EXPLICIT);
    assertThat(gold.type()).isEqualTo(YarnType.of(ValueType.NUMBER));
    assertThat(gold.sourceNode()).hasValue("Start");
    assertThat(program.initialValues()).containsEntry("$gold", Value.of(10));
    assertThat(program.initialValues()).containsEntry("$name", Value.of("Bob"));
  }

  @Test
  public void declarationErrors() {
    assertErrors(
        compileNode("<<declare $x = 1>>", "<<declare $x = 2>>"), "'$x' was already declared at");
    assertErrors(
        compileNode("<<declare $x = 1 as String>>"),
        "'$x' is declared as String, but its default value is Number");
    assertErrors(compileNode("<<declare $x = 1 + 2>>"), "must be a literal");
  }

  @Test
  public void inferredDeclarations() {
    CompilationResult result =
        compileNode(
            "<<set $name to \"Bob\">>",
            "<<if $flag>>",
            "  {$count + 1}",
            "<<endif>>",
            "<<set $score -= 2>>");

    Program program = assertCompiles(result);
    assertThat(result.declaration("$name").get().type()).isEqualTo(YarnType.of(ValueType.STRING));
    assertThat(result.declaration("$flag").get().type()).isEqualTo(YarnType.of(ValueType.BOOLEAN));
    assertThat(result.declaration("$count").get().type()).isEqualTo(YarnType.of(ValueType.NUMBER));
    assertThat(result.declaration("$score").get().provenance())
        .isEqualTo(Declaration.Provenance.INFERRED);

    assertThat(program.initialValues()).containsEntry("$name", Value.of(""));
    assertThat(program.initialValues()).containsEntry("$flag", Value.of(false));
    assertThat(program.initialValues()).containsEntry("$count", Value.of(0));
  }

  @Test
  public void inferenceAcrossFiles() {
    CompilationResult result =
        compiler.compile(
            CompilationJob.builder()
                .addFile("a.yarn", node("A", "You have {$gold}."))
                .addFile("b.yarn", node("B", "<<set $gold to 5>>"))
                .build());

    assertCompiles(result);
    assertThat(result.declaration("$gold").get().type()).isEqualTo(YarnType.of(ValueType.NUMBER));
  }

  @Test
  public void undeterminedType() {
    assertErrors(compileNode("Who is {$mystery}?"), "can't determine the type of '$mystery'");
  }

  @Test
  public void typeErrors() {
    assertErrors(
        compileNode("<<set $x to 1>>", "<<set $x to \"a\">>"),
        "can't assign String to '$x', which is Number");
    assertErrors(compileNode("<<if 1>>", "<<endif>>"), "expected Bool, but '1' is Number");
    assertErrors(compileNode("{1 + \"a\"}"), "operator '+'");
    assertErrors(compileNode("{nope()}"), "undefined function 'nope'");
    assertErrors(compileNode("{round(1, 2)}"), "expects 1 argument(s), but was given 2");
    assertErrors(compileNode("<<set $b to true>>", "<<set $b += true>>"), "'+=' is not defined");
    assertErrors(compileNode("<<jump {1}>>"), "expected String");
  }

  @Test
  public void parseErrorsAreDiagnostics() {
    CompilationResult result = compile("title: Start", "---", "<<if true>>", "===");

    assertErrors(result, "<<if>> is missing its <<endif>>");
    assertThat(result.errors().get(0).pos().file()).isEqualTo("test.yarn");
  }

  @Test
  public void warningsKeepTheProgram() {
    CompilationResult result = compileNode("<<jump Nowhere>>");

    assertCompiles(result);
    assertThat(result.diagnostics()).hasSize(1);
    assertThat(result.diagnostics().get(0).severity()).isEqualTo(Diagnostic.Severity.WARNING);
  }

  @Test
  public void visitTracking() {
    CompilationResult result =
        compile(
            node(
                "Start",
                "<<if visited(\"Other\") and visited_count(\"Never\") > 0>>",
                "  Again.",
                "<<endif>>"),
            node("Other", "Hi."),
            lines("title: Never", "tracking: never", "---", "Hi.", "==="),
            lines("title: Always", "tracking: always", "---", "Hi.", "==="));

    Program program = assertCompiles(result);
    assertThat(program.nodes().get("Other").tracked()).isTrue();
    assertThat(program.nodes().get("Always").tracked()).isTrue();
    assertThat(program.nodes().get("Never").tracked()).isFalse();
    assertThat(program.nodes().get("Start").tracked()).isFalse();

    String otherVariable = Library.generateUniqueVisitedVariableForNode("Other");
    Declaration declaration = result.declaration(otherVariable).get();
    assertThat(declaration.provenance()).isEqualTo(Declaration.Provenance.DERIVED);
    assertThat(declaration.defaultValue()).hasValue(Value.of(0));
    assertThat(program.initialValues()).containsEntry(otherVariable, Value.of(0));
    assertThat(program.initialValues())
        .doesNotContainKey(Library.generateUniqueVisitedVariableForNode("Never"));
  }

  @Test
  public void rawTextNodes() {
    CompilationResult result =
        compile("title: Notes", "tags: rawText", "---", "Just {text}", "===");

    Node node = assertCompiles(result).nodes().get("Notes");
    assertThat(node.sourceTextStringId()).hasValue(LineId.forNode("Notes"));
    assertThat(node.tags()).containsExactly(NodeDefinition.RAW_TEXT_TAG);
    assertThat(node.instructions()).containsExactly(Instruction.create(OpCode.STOP));
    assertThat(result.stringTable().get(LineId.forNode("Notes")).text()).isEqualTo("Just {text}");
  }

  @Test
  public void stringsOnly() {
    CompilationResult result =
        compiler.compile(
            CompilationJob.builder()
                .addFile("test.yarn", node("Start", "Hi {$anything}.", "<<set $x to 1>>"))
                .setCompilationType(CompilationType.STRINGS_ONLY)
                .build());

    assertThat(result.program()).isEmpty();
    assertThat(result.diagnostics()).isEmpty();
    assertThat(result.stringTable()).hasSize(1);
    assertThat(result.declarations()).isEmpty();
  }

  @Test
  public void typeCheckOnly() {
    CompilationResult result =
        compiler.compile(
            CompilationJob.builder()
                .addFile("test.yarn", node("Start", "<<set $x to 1>>"))
                .setCompilationType(CompilationType.TYPE_CHECK)
                .build());

    assertThat(result.program()).isEmpty();
    assertThat(result.diagnostics()).isEmpty();
    assertThat(Lists.transform(result.declarations(), Declaration::name)).containsExactly("$x");
  }

  @Test
  public void seedDeclarations() {
    CompilationResult result =
        compiler.compile(
            CompilationJob.builder()
                .addFile("test.yarn", node("Start", "<<set $external to $external + 1>>"))
                .addDeclaration(
                    Declaration.builder(
                            "$external",
                            YarnType.of(ValueType.NUMBER),
                            Declaration.Provenance.EXPLICIT)
                        .setDefaultValue(Value.of(3))
                        .build())
                .build());

    Program program = assertCompiles(result);
    assertThat(result.declaration("$external")).isEmpty();
    assertThat(program.initialValues()).containsEntry("$external", Value.of(3));
  }

  @Test
  public void seedDeclarationWithoutDefault() {
    CompilationResult result =
        compiler.compile(
            CompilationJob.builder()
                .addFile("test.yarn", node("Start", "Hi."))
                .addDeclaration(
                    Declaration.builder(
                            "$missing",
                            YarnType.of(ValueType.NUMBER),
                            Declaration.Provenance.EXTERNAL)
                        .build())
                .build());

    assertThat(result.errors())
        .comparingElementsUsing(MESSAGE_CONTAINS)
        .containsExactly("'$missing' has no default value");
    assertThat(result.program()).isPresent();
    assertThat(result.program().get().initialValues()).doesNotContainKey("$missing");
  }

  @Test
  public void customLibrary() {
    Library library =
        Library.standardLibrary().register("dice", Double.class, Double.class, sides -> 4.0);
    CompilationResult result =
        compiler.compile(
            CompilationJob.builder()
                .addFile("test.yarn", node("Start", "You rolled {dice(6)}."))
                .setLibrary(library)
                .build());

    Node node = assertCompiles(result).nodes().get("Start");
    assertThat(node.instructions()).contains(Instruction.callFunction("dice", 1));

    assertErrors(compileNode("You rolled {dice(6)}."), "undefined function 'dice'");
  }

  @Test
  public void debugInfo() {
    CompilationResult result = compileNode("Hi.", "<<stop>>");

    assertCompiles(result);
    DebugInfo info = result.debugInfos().get("Start");
    assertThat(info.fileName()).isEqualTo("test.yarn");
    assertThat(info.position(0).get().lineNumber()).isEqualTo(3);
    assertThat(info.position(1).get().lineNumber()).isEqualTo(4);
    assertThat(info.position(0).get().column()).isAtLeast(1);
    assertThat(info.position(0).get().lineNumber())
        .isEqualTo(result.stringTable().get(LineId.of("line:test.yarn-Start-1")).lineNumber());
  }

  @Test
  public void fileTags() {
    CompilationResult result = compile("#chapter1 #draft", node("Start", "Hi."));

    assertCompiles(result);
    assertThat(result.fileTags().get("test.yarn")).containsExactly("chapter1", "draft").inOrder();
  }

  @Test
  public void deterministic() {
    String source =
        lines(
            node("Start", "<<set $x to 1>>", "-> A", "    <<jump Other>>", "-> B {$x}"),
            node("Other", "<<if visited(\"Start\")>>", "Back.", "<<endif>>", "<<jump Missing>>"));

    CompilationResult first = compiler.compileString("test.yarn", source);
    CompilationResult second = compiler.compileString("test.yarn", source);

    assertThat(first.program()).isEqualTo(second.program());
    assertThat(first.diagnostics()).isEqualTo(second.diagnostics());
    assertThat(first.stringTable()).isEqualTo(second.stringTable());
  }

  @Test
  public void settings() {
    CompilerSettings defaults = CompilerSettings.load();
    assertThat(defaults.compilationType()).isEqualTo(CompilationType.FULL_COMPILATION);
    assertThat(defaults.implicitLineIdPrefix()).isEqualTo("line:");

    CompilerSettings custom =
        CompilerSettings.fromConfig(
            ConfigFactory.parseString(
                "yarn.compiler { compilation-type = TYPE_CHECK, "
                    + "implicit-line-id-prefix = \"id-\" }"));
    assertThat(custom.compilationType()).isEqualTo(CompilationType.TYPE_CHECK);

    CompilationResult result =
        new YarnCompiler(custom).compileString("test.yarn", node("Start", "Hi."));
    assertThat(result.program()).isEmpty();
    assertThat(result.stringTable()).containsKey(LineId.of("id-test.yarn-Start-1"));
  }
}
