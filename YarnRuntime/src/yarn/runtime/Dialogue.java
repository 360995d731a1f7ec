package yarn.runtime;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import yarn.core.Library;
import yarn.core.MemoryVariableStorage;
import yarn.core.Program;
import yarn.core.VariableStorage;

/**
 * Runs compiled dialogue for a game.
 *
 * <p>Typical use:
 *
 * <pre>{@code
 * Dialogue dialogue =
 *     new Dialogue()
 *         .withLineHandler((line, view) -> show(line))
 *         .withOptionsHandler((options, view) -> offer(options));
 * dialogue.setProgram(program);
 * dialogue.setStartNode();
 * dialogue.continueDialogue();
 * }</pre>
 *
 * After each line or command, call {@link #continueDialogue()} again. After options, call {@link
 * #setSelectedOption} first.
 *
 * <p>A dialogue is not thread-safe: calls must come from one thread at a time. Its {@link
 * VariableStorage} may be shared freely.
 */
public final class Dialogue {
  private static final Logger log = LoggerFactory.getLogger(Dialogue.class);

  private final VariableStorage variableStorage;
  private final Library library;
  private final DialogueSettings settings;
  private final VirtualMachine vm;

  private Optional<String> languageCode;

  public Dialogue() {
    this(new MemoryVariableStorage());
  }

  public Dialogue(VariableStorage variableStorage) {
    this(variableStorage, DialogueSettings.load());
  }

  /**
   * The dialogue's library starts as {@link Library#standardLibrary(VariableStorage)} over {@code
   * variableStorage}; more functions may be registered through {@link #library()}.
   */
  public Dialogue(VariableStorage variableStorage, DialogueSettings settings) {
    this.variableStorage = Preconditions.checkNotNull(variableStorage);
    this.library = Library.standardLibrary(variableStorage);
    this.settings = settings;
    this.languageCode = settings.languageCode();
    this.vm = new VirtualMachine(library, variableStorage);
  }

  public VariableStorage variableStorage() {
    return variableStorage;
  }

  public Library library() {
    return library;
  }

  public DialogueSettings settings() {
    return settings;
  }

  public Optional<String> languageCode() {
    return languageCode;
  }

  public Dialogue withLanguageCode(String languageCode) {
    this.languageCode = Optional.of(languageCode);
    return this;
  }

  public Dialogue withLineHandler(LineHandler handler) {
    vm.lineHandler = Preconditions.checkNotNull(handler);
    return this;
  }

  public Dialogue withOptionsHandler(OptionsHandler handler) {
    vm.optionsHandler = Preconditions.checkNotNull(handler);
    return this;
  }

  public Dialogue withCommandHandler(CommandHandler handler) {
    vm.commandHandler = Preconditions.checkNotNull(handler);
    return this;
  }

  public Dialogue withNodeStartHandler(NodeStartHandler handler) {
    vm.nodeStartHandler = Preconditions.checkNotNull(handler);
    return this;
  }

  public Dialogue withNodeCompleteHandler(NodeCompleteHandler handler) {
    vm.nodeCompleteHandler = Preconditions.checkNotNull(handler);
    return this;
  }

  public Dialogue withDialogueCompleteHandler(DialogueCompleteHandler handler) {
    vm.dialogueCompleteHandler = Preconditions.checkNotNull(handler);
    return this;
  }

  public Dialogue withPrepareForLinesHandler(PrepareForLinesHandler handler) {
    vm.prepareForLinesHandler = Preconditions.checkNotNull(handler);
    return this;
  }

  public Dialogue withTextProvider(TextProvider textProvider) {
    vm.view().setTextProvider(Preconditions.checkNotNull(textProvider));
    if (!languageCode.isPresent()) languageCode = Optional.of(textProvider.languageCode());
    return this;
  }

  /** Replaces the program and stops the dialogue. Fatal while running. */
  public Dialogue setProgram(Program program) {
    vm.setProgram(Preconditions.checkNotNull(program));
    return this;
  }

  /**
   * Adds {@code program}'s nodes to the loaded ones, or loads it if there are none.
   *
   * @throws yarn.core.ProgramConflictException if both programs have a node of the same name
   */
  public Dialogue addProgram(Program program) {
    Optional<Program> existing = vm.program();
    vm.setProgram(existing.isPresent() ? existing.get().combineWith(program) : program);
    return this;
  }

  /**
   * Prepares to run {@code nodeName} from its start; {@link #continueDialogue()} begins it. The
   * {@link PrepareForLinesHandler} is called with the node's lines. Variables are left alone.
   *
   * @throws DialogueException if there is no such node, or the dialogue is running
   */
  public void setNode(String nodeName) {
    log.debug("Starting node '{}'", nodeName);
    vm.setNode(nodeName);
  }

  public void setStartNode() {
    setNode(settings.startNode());
  }

  /**
   * Runs until the next line, command or set of options is delivered, or the dialogue ends. Does
   * nothing if already running, e.g. when called from a handler.
   *
   * @throws DialogueException if no node is set or an option must be selected first
   */
  public void continueDialogue() {
    vm.continueDialogue();
  }

  /**
   * Chooses one of the options just delivered. The dialogue then continues from it on the next
   * {@link #continueDialogue()}.
   *
   * @throws DialogueException if no options are waiting, or {@code id} is not one of them or is
   *     unavailable
   */
  public void setSelectedOption(OptionId id) {
    vm.setSelectedOption(id);
  }

  public void stop() {
    vm.stop();
  }

  public boolean isActive() {
    return vm.state() != ExecutionState.STOPPED;
  }

  public ExecutionState executionState() {
    return vm.state();
  }

  public ReadOnlyDialogue readOnly() {
    return vm.view();
  }
}
