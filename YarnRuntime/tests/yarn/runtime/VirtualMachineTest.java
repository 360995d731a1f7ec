package yarn.runtime;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import yarn.core.FunctionCallException;
import yarn.core.Instruction;
import yarn.core.Library;
import yarn.core.LineId;
import yarn.core.MemoryVariableStorage;
import yarn.core.Node;
import yarn.core.OpCode;
import yarn.core.Program;
import yarn.core.Value;
import yarn.core.VariableStorage;

public class VirtualMachineTest {

  private final VariableStorage storage = new MemoryVariableStorage();
  private final VirtualMachine vm = new VirtualMachine(Library.standardLibrary(storage), storage);
  private final List<Line> lines = new ArrayList<>();
  private final List<String> completed = new ArrayList<>();
  private int dialoguesCompleted = 0;

  private VirtualMachine run(Node... nodes) {
    return run(ImmutableMap.of(), nodes);
  }

  private VirtualMachine run(ImmutableMap<String, Value> initialValues, Node... nodes) {
    Program.Builder program = Program.builder();
    for (Node node : nodes) program.addNode(node);
    initialValues.forEach(program::setInitialValue);

    vm.lineHandler = (line, view) -> lines.add(line);
    vm.nodeCompleteHandler = (node, view) -> completed.add(node);
    vm.dialogueCompleteHandler = view -> dialoguesCompleted++;
    vm.setProgram(program.build());
    vm.setNode(nodes[0].name());
    return vm;
  }

  private static Node node(String name, Instruction... instructions) {
    return Node.builder(name).setInstructions(ImmutableList.copyOf(instructions)).build();
  }

  private static Instruction line(String id, int substitutions) {
    return Instruction.runLine(LineId.of(id), substitutions);
  }

  @Test
  public void endOfInstructionsEndsTheNode() {
    run(node("Start", line("a", 0))).continueDialogue();
    vm.continueDialogue();

    assertThat(completed).containsExactly("Start");
    assertThat(dialoguesCompleted).isEqualTo(1);
    assertThat(vm.state()).isEqualTo(ExecutionState.STOPPED);
  }

  @Test
  public void substitutionsKeepTheirOrder() {
    run(
            node(
                "Start",
                Instruction.push(Value.of("first")),
                Instruction.push(Value.of(2)),
                Instruction.push(Value.of(false)),
                line("a", 3)))
        .continueDialogue();

    assertThat(lines.get(0).substitutions()).containsExactly("first", "2", "false").inOrder();
  }

  @Test
  public void variablesFallBackOnInitialValues() {
    run(
            ImmutableMap.of("$x", Value.of(7), "$y", Value.of(1)),
            node(
                "Start",
                Instruction.pushVariable("$x"),
                Instruction.pushVariable("$y"),
                line("a", 2),
                Instruction.push(Value.of(3)),
                Instruction.storeVariable("$x")))
        .continueDialogue();
    assertThat(lines.get(0).substitutions()).containsExactly("7", "1").inOrder();
    assertThat(storage.variables()).isEmpty();

    vm.continueDialogue();
    assertThat(storage.get("$x")).hasValue(Value.of(3));
  }

  @Test
  public void storedValuesWinOverInitialValues() {
    storage.set("$x", Value.of("stored"));
    run(
            ImmutableMap.of("$x", Value.of("initial")),
            node("Start", Instruction.pushVariable("$x"), line("a", 1)))
        .continueDialogue();

    assertThat(lines.get(0).substitutions()).containsExactly("stored");
  }

  @Test
  public void undefinedVariableIsFatal() {
    run(node("Start", Instruction.pushVariable("$nope"), line("a", 1)));

    DialogueException ex = assertThrows(DialogueException.class, vm::continueDialogue);
    assertThat(ex).hasMessageThat().contains("$nope");
    assertThat(vm.state()).isEqualTo(ExecutionState.STOPPED);
  }

  @Test
  public void stackUnderflowIsFatal() {
    run(node("Start", Instruction.create(OpCode.POP)));

    assertThrows(DialogueException.class, vm::continueDialogue);
    assertThat(vm.state()).isEqualTo(ExecutionState.STOPPED);
  }

  @Test
  public void unknownFunctionIsFatal() {
    run(node("Start", Instruction.callFunction("nope", 0)));

    assertThrows(FunctionCallException.class, vm::continueDialogue);
    assertThat(vm.state()).isEqualTo(ExecutionState.STOPPED);
  }

  @Test
  public void functionCalls() {
    run(
            node(
                "Start",
                Instruction.push(Value.of(1)),
                Instruction.push(Value.of(3)),
                Instruction.callFunction("Number.Add", 2),
                Instruction.push(Value.of(2)),
                Instruction.callFunction("Number.Minus", 2),
                line("a", 1)))
        .continueDialogue();

    assertThat(lines.get(0).substitutions()).containsExactly("2");
  }

  @Test
  public void jumps() {
    run(
            Node.builder("Start")
                .setInstructions(
                    ImmutableList.of(
                        Instruction.push(Value.of(false)),
                        Instruction.jumpIfFalse("skip"),
                        line("skipped", 0),
                        line("kept", 0),
                        Instruction.push(Value.of("end")),
                        Instruction.create(OpCode.JUMP),
                        line("also skipped", 0),
                        Instruction.create(OpCode.STOP)))
                .setLabels(ImmutableMap.of("skip", 3, "end", 7))
                .build())
        .continueDialogue();
    vm.continueDialogue();

    assertThat(lines).hasSize(1);
    assertThat(lines.get(0).id()).isEqualTo(LineId.of("kept"));
    assertThat(completed).containsExactly("Start");
  }

  @Test
  public void unknownLabelIsFatal() {
    run(node("Start", Instruction.jumpTo("nowhere")));

    assertThrows(DialogueException.class, vm::continueDialogue);
  }

  @Test
  public void runNode() {
    run(
            node("Start", Instruction.push(Value.of("Next")), Instruction.create(OpCode.RUN_NODE)),
            node("Next", line("b", 0)))
        .continueDialogue();

    assertThat(completed).containsExactly("Start");
    assertThat(lines).hasSize(1);
    assertThat(vm.currentNodeName()).hasValue("Next");
    assertThat(dialoguesCompleted).isEqualTo(0);
  }

  @Test
  public void runUnknownNodeIsFatal() {
    run(node("Start", Instruction.push(Value.of("Nowhere")), Instruction.create(OpCode.RUN_NODE)));

    assertThrows(DialogueException.class, vm::continueDialogue);
    assertThat(vm.state()).isEqualTo(ExecutionState.STOPPED);
  }

  @Test
  public void showingNoOptionsEndsTheDialogue() {
    run(node("Start", Instruction.create(OpCode.SHOW_OPTIONS), line("a", 0))).continueDialogue();

    assertThat(lines).isEmpty();
    assertThat(completed).containsExactly("Start");
    assertThat(dialoguesCompleted).isEqualTo(1);
  }

  @Test
  public void optionSubstitutionsSitBelowTheCondition() {
    List<DialogueOption> delivered = new ArrayList<>();
    vm.optionsHandler = (options, view) -> delivered.addAll(options);
    run(
            Node.builder("Start")
                .setInstructions(
                    ImmutableList.of(
                        Instruction.push(Value.of("sub")),
                        Instruction.push(Value.of(true)),
                        Instruction.addOption(LineId.of("a"), "dest", 1, true),
                        Instruction.create(OpCode.SHOW_OPTIONS),
                        Instruction.create(OpCode.JUMP),
                        line("chosen", 0)))
                .setLabels(ImmutableMap.of("dest", 5))
                .build())
        .continueDialogue();

    assertThat(delivered)
        .containsExactly(
            DialogueOption.create(
                OptionId.of(0),
                Line.create(LineId.of("a"), ImmutableList.of("sub")),
                "dest",
                true));
    assertThat(vm.state()).isEqualTo(ExecutionState.WAITING_ON_OPTION_SELECTION);

    vm.setSelectedOption(OptionId.of(0));
    vm.continueDialogue();
    assertThat(lines.get(0).id()).isEqualTo(LineId.of("chosen"));
  }

  @Test
  public void trackedNodesCountVisits() {
    String variable = Library.generateUniqueVisitedVariableForNode("Start");
    List<Value> seenByHandler = new ArrayList<>();
    run(Node.builder("Start").setInstructions(ImmutableList.of()).setTracked(true).build());
    vm.nodeCompleteHandler = (node, view) -> seenByHandler.add(storage.get(variable).get());

    vm.continueDialogue();
    vm.setNode("Start");
    vm.continueDialogue();

    assertThat(seenByHandler).containsExactly(Value.of(1), Value.of(2)).inOrder();
  }

  @Test
  public void caughtMisuseInsideAHandlerKeepsRunning() {
    run(node("Start", line("a", 0), line("b", 0)));
    vm.lineHandler =
        (line, view) -> {
          lines.add(line);
          assertThrows(DialogueException.class, vm::stop);
        };

    vm.continueDialogue();
    assertThat(vm.state()).isEqualTo(ExecutionState.WAITING_FOR_CONTINUE);
    assertThat(vm.currentNodeName()).hasValue("Start");

    vm.continueDialogue();
    assertThat(lines).hasSize(2);
  }

  @Test
  public void setProgramStops() {
    run(node("Start", line("a", 0), line("b", 0))).continueDialogue();

    vm.setProgram(Program.empty());
    assertThat(vm.state()).isEqualTo(ExecutionState.STOPPED);
    assertThat(vm.currentNodeName()).isEmpty();
  }
}
