package yarn.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import yarn.core.Instruction;
import yarn.core.Library;
import yarn.core.LineId;
import yarn.core.Node;
import yarn.core.Program;
import yarn.core.Value;
import yarn.core.ValueType;
import yarn.core.VariableStorage;

/**
 * Runs the nodes of a {@link Program}, pausing whenever the game has to act.
 *
 * <p>{@link #continueDialogue()} executes instructions until a line, a command or a set of options
 * is delivered, or the node ends. Handlers are called while the state is {@link
 * ExecutionState#RUNNING}; a nested {@code continueDialogue()} does nothing. Any exception that
 * escapes an instruction, and any misuse of the machine, leaves it {@link ExecutionState#STOPPED}.
 */
final class VirtualMachine {
  private static final Logger log = LoggerFactory.getLogger(VirtualMachine.class);

  private final Library library;
  private final VariableStorage storage;
  private final ReadOnlyDialogue view;

  private Optional<Program> program = Optional.empty();
  private ExecutionState state = ExecutionState.STOPPED;

  private Node currentNode = null;
  private int programCounter = 0;
  private boolean nodeStartPending = false;
  private final Deque<Value> stack = new ArrayDeque<>();
  private final List<DialogueOption> pendingOptions = new ArrayList<>();
  private ImmutableList<DialogueOption> deliveredOptions = ImmutableList.of();

  LineHandler lineHandler = (line, dialogue) -> {};
  OptionsHandler optionsHandler = (options, dialogue) -> {};
  CommandHandler commandHandler = (command, dialogue) -> {};
  NodeStartHandler nodeStartHandler = (node, dialogue) -> {};
  NodeCompleteHandler nodeCompleteHandler = (node, dialogue) -> {};
  DialogueCompleteHandler dialogueCompleteHandler = dialogue -> {};
  PrepareForLinesHandler prepareForLinesHandler = (lineIds, dialogue) -> {};

  VirtualMachine(Library library, VariableStorage storage) {
    this.library = library;
    this.storage = storage;
    this.view = new ReadOnlyDialogue(this);
  }

  ReadOnlyDialogue view() {
    return view;
  }

  ExecutionState state() {
    return state;
  }

  Optional<Program> program() {
    return program;
  }

  Optional<String> currentNodeName() {
    return currentNode == null ? Optional.empty() : Optional.of(currentNode.name());
  }

  void setProgram(Program program) {
    checkNotRunning("set the program");
    this.program = Optional.of(program);
    reset();
    log.debug("Loaded a program with {} node(s)", program.nodes().size());
  }

  void setNode(String nodeName) {
    checkNotRunning("set the node");
    reset();
    enterNode(nodeName);
    state = ExecutionState.WAITING_FOR_CONTINUE;
  }

  void stop() {
    checkNotRunning("stop");
    boolean wasActive = state != ExecutionState.STOPPED;
    reset();
    if (wasActive) dialogueCompleteHandler.handle(view);
  }

  void continueDialogue() {
    if (state == ExecutionState.RUNNING) {
      log.debug("Ignoring continue: already running");
      return;
    }
    if (!program.isPresent()) throw fatal("Cannot continue: no program is loaded");
    if (state == ExecutionState.WAITING_ON_OPTION_SELECTION) {
      throw fatal("Cannot continue: an option must be selected first");
    }
    if (currentNode == null) throw fatal("Cannot continue: no node is set");

    state = ExecutionState.RUNNING;
    try {
      while (state == ExecutionState.RUNNING) {
        if (nodeStartPending) {
          nodeStartPending = false;
          nodeStartHandler.handle(currentNode.name(), view);
          continue;
        }
        if (programCounter >= currentNode.instructions().size()) {
          finishDialogue();
          break;
        }
        Instruction instruction = currentNode.instructions().get(programCounter++);
        execute(instruction);
      }
    } catch (RuntimeException ex) {
      reset();
      throw ex;
    }
  }

  void setSelectedOption(OptionId id) {
    if (state != ExecutionState.WAITING_ON_OPTION_SELECTION) {
      throw fatal("Cannot select option %s: not waiting for an option selection", id);
    }
    DialogueOption selected = null;
    for (DialogueOption option : deliveredOptions) {
      if (option.id().equals(id)) selected = option;
    }
    if (selected == null) {
      throw fatal("Cannot select option %s: it was not among the options delivered", id);
    }
    if (!selected.isAvailable()) {
      throw fatal("Cannot select option %s: it is unavailable", id);
    }

    log.debug("Selected option {} of node '{}'", id, currentNode.name());
    stack.push(Value.of(selected.destination()));
    deliveredOptions = ImmutableList.of();
    state = ExecutionState.WAITING_FOR_CONTINUE;
  }

  private void execute(Instruction instruction) {
    switch (instruction.opCode()) {
      case JUMP_TO:
        jumpTo(instruction.stringOperand(0));
        return;
      case JUMP:
        jumpTo(pop(ValueType.STRING).asString());
        return;
      case RUN_LINE:
        {
          Line line =
              Line.create(
                  LineId.of(instruction.stringOperand(0)),
                  popSubstitutions(instruction.intOperand(1)));
          lineHandler.handle(line, view);
          pause();
          return;
        }
      case RUN_COMMAND:
        {
          String text =
              ReadOnlyDialogue.expandSubstitutions(
                  instruction.stringOperand(0), popSubstitutions(instruction.intOperand(1)));
          commandHandler.handle(Command.create(text), view);
          pause();
          return;
        }
      case ADD_OPTION:
        {
          boolean available =
              !instruction.boolOperand(3) || pop(ValueType.BOOLEAN).asBoolean();
          Line line =
              Line.create(
                  LineId.of(instruction.stringOperand(0)),
                  popSubstitutions(instruction.intOperand(2)));
          pendingOptions.add(
              DialogueOption.create(
                  OptionId.of(pendingOptions.size()),
                  line,
                  instruction.stringOperand(1),
                  available));
          return;
        }
      case SHOW_OPTIONS:
        if (pendingOptions.isEmpty()) {
          log.debug("No options to show in node '{}'; ending the dialogue", currentNode.name());
          finishDialogue();
          return;
        }
        deliveredOptions = ImmutableList.copyOf(pendingOptions);
        pendingOptions.clear();
        optionsHandler.handle(deliveredOptions, view);
        if (state == ExecutionState.RUNNING) state = ExecutionState.WAITING_ON_OPTION_SELECTION;
        return;
      case PUSH_STRING:
      case PUSH_NUMBER:
      case PUSH_BOOL:
        stack.push(instruction.operand(0));
        return;
      case POP:
        pop();
        return;
      case JUMP_IF_FALSE:
        if (!pop(ValueType.BOOLEAN).asBoolean()) jumpTo(instruction.stringOperand(0));
        return;
      case CALL_FUNCTION:
        {
          List<Value> arguments = pop(instruction.intOperand(1));
          stack.push(library.call(instruction.stringOperand(0), arguments));
          return;
        }
      case PUSH_VARIABLE:
        stack.push(readVariable(instruction.stringOperand(0)));
        return;
      case STORE_VARIABLE:
        storage.set(instruction.stringOperand(0), pop());
        return;
      case STOP:
        finishDialogue();
        return;
      case RUN_NODE:
        {
          String next = pop(ValueType.STRING).asString();
          completeNode();
          enterNode(next);
          return;
        }
    }
    throw new AssertionError(instruction.opCode());
  }

  private void enterNode(String nodeName) {
    if (!program.isPresent()) throw fatal("Cannot run node '%s': no program is loaded", nodeName);
    Node node = program.get().nodes().get(nodeName);
    if (node == null) throw fatal("No node named '%s'", nodeName);

    log.debug("Entering node '{}'", nodeName);
    currentNode = node;
    programCounter = 0;
    stack.clear();
    pendingOptions.clear();
    deliveredOptions = ImmutableList.of();
    nodeStartPending = true;
    prepareForLinesHandler.handle(node.lineIds(), view);
  }

  private void completeNode() {
    String name = currentNode.name();
    if (currentNode.tracked()) {
      String variable = Library.generateUniqueVisitedVariableForNode(name);
      double count =
          storage
              .get(variable)
              .filter(v -> v.type() == ValueType.NUMBER)
              .map(Value::asNumber)
              .orElse(0.0);
      storage.set(variable, Value.of(count + 1));
    }
    log.debug("Completed node '{}'", name);
    nodeCompleteHandler.handle(name, view);
  }

  private void finishDialogue() {
    completeNode();
    reset();
    dialogueCompleteHandler.handle(view);
  }

  private void pause() {
    if (state == ExecutionState.RUNNING) state = ExecutionState.WAITING_FOR_CONTINUE;
  }

  private void reset() {
    state = ExecutionState.STOPPED;
    currentNode = null;
    programCounter = 0;
    nodeStartPending = false;
    stack.clear();
    pendingOptions.clear();
    deliveredOptions = ImmutableList.of();
  }

  private void jumpTo(String label) {
    Integer index = currentNode.labels().get(label);
    if (index == null) throw fatal("Node '%s' has no label '%s'", currentNode.name(), label);
    programCounter = index;
  }

  private Value readVariable(String name) {
    Optional<Value> value = storage.get(name);
    if (value.isPresent()) return value.get();

    Value initial = program.get().initialValues().get(name);
    if (initial == null) throw fatal("Undefined variable '%s'", name);
    return initial;
  }

  private Value pop() {
    if (stack.isEmpty()) throw fatal("Stack underflow in node '%s'", currentNode.name());
    return stack.pop();
  }

  private Value pop(ValueType type) {
    Value value = pop();
    if (value.type() != type) {
      throw fatal("Expected %s on the stack in node '%s', got %s", type, currentNode.name(), value);
    }
    return value;
  }

  // The deepest value comes first.
  private List<Value> pop(int count) {
    List<Value> values = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      values.add(pop());
    }
    return Lists.reverse(values);
  }

  private List<String> popSubstitutions(int count) {
    return Lists.transform(pop(count), Value::convertToString);
  }

  private void checkNotRunning(String action) {
    if (state == ExecutionState.RUNNING) {
      throw fatal("Cannot %s while the dialogue is running", action);
    }
  }

  // Misuse stops the machine as well as failing the call. While running, the step in progress
  // owns the state: it stops the machine if the exception escapes.
  private DialogueException fatal(String format, Object... args) {
    String message = String.format(format, args);
    log.error(message);
    if (state != ExecutionState.RUNNING) reset();
    return new DialogueException(message);
  }
}
