package yarn.compiler;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import yarn.core.Instruction;
import yarn.core.OpCode;
import yarn.core.ValueType;
import yarn.processor.ASTChild;
import yarn.processor.ASTNode;

public abstract class Statement implements ASTNodeInterface {
  public enum Type {
    LINE,
    OPTION_GROUP,
    IF,
    SET,
    DECLARE,
    JUMP,
    STOP,
    COMMAND;
  }

  private final Type type;
  private final Tokenizer.Pos pos;

  private Statement(Type type, Tokenizer.Pos pos) {
    this.type = type;
    this.pos = pos;
  }

  public Type type() {
    return type;
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  abstract void compile(NodeEmitter emitter);

  @SuppressWarnings("unchecked")
  public <T extends Statement> T cast() {
    return (T) this;
  }

  static void compileAll(Iterable<Statement> statements, NodeEmitter emitter) {
    statements.forEach(statement -> statement.compile(emitter));
  }

  @ASTNode
  public static class Line extends Statement implements Statement_Line_ASTNode {
    private final LineText text;
    private final Optional<Expression> condition;

    Line(LineText text, Optional<Expression> condition) {
      super(Type.LINE, text.pos());
      this.text = text;
      this.condition = condition;
    }

    @ASTChild
    @Override
    public LineText text() {
      return text;
    }

    @ASTChild
    @Override
    public Optional<Expression> condition() {
      return condition;
    }

    @Override
    void compile(NodeEmitter emitter) {
      String skip = null;
      if (condition.isPresent()) {
        skip = emitter.newLabel("skip_line");
        condition.get().compile(emitter);
        emitter.emit(Instruction.jumpIfFalse(skip), pos());
      }

      text.compileSubstitutions(emitter);
      emitter.emit(
          Instruction.runLine(emitter.lineId(text), text.substitutions().size()), pos());
      if (skip != null) emitter.markLabel(skip);
    }
  }

  @ASTNode
  public static class Option implements Statement_Option_ASTNode {
    private final LineText text;
    private final Optional<Expression> condition;
    private final ImmutableList<Statement> body;

    Option(LineText text, Optional<Expression> condition, ImmutableList<Statement> body) {
      this.text = text;
      this.condition = condition;
      this.body = body;
    }

    @ASTChild
    @Override
    public LineText text() {
      return text;
    }

    @ASTChild
    @Override
    public Optional<Expression> condition() {
      return condition;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }

    public Tokenizer.Pos pos() {
      return text.pos();
    }
  }

  // Consecutive options at the same indentation, offered together.
  @ASTNode
  public static class OptionGroup extends Statement implements Statement_OptionGroup_ASTNode {
    private final ImmutableList<Option> options;

    OptionGroup(ImmutableList<Option> options) {
      super(Type.OPTION_GROUP, options.get(0).pos());
      this.options = options;
    }

    @ASTChild
    @Override
    public ImmutableList<Option> options() {
      return options;
    }

    @Override
    void compile(NodeEmitter emitter) {
      String end = emitter.newLabel("options_end");
      String[] destinations = new String[options.size()];
      for (int i = 0; i < options.size(); i++) {
        Option option = options.get(i);
        destinations[i] = emitter.newLabel("option_" + (i + 1));

        // The condition goes on top, above the substitutions.
        option.text().compileSubstitutions(emitter);
        option.condition().ifPresent(condition -> condition.compile(emitter));
        emitter.emit(
            Instruction.addOption(
                emitter.lineId(option.text()),
                destinations[i],
                option.text().substitutions().size(),
                option.condition().isPresent()),
            option.pos());
      }

      emitter.emit(Instruction.create(OpCode.SHOW_OPTIONS), pos());
      emitter.emit(Instruction.create(OpCode.JUMP), pos());

      for (int i = 0; i < options.size(); i++) {
        emitter.markLabel(destinations[i]);
        compileAll(options.get(i).body(), emitter);
        emitter.emit(Instruction.jumpTo(end), options.get(i).pos());
      }
      emitter.markLabel(end);
    }
  }

  @ASTNode
  public static class Clause implements Statement_Clause_ASTNode {
    private final Tokenizer.Pos pos;
    private final Optional<Expression> condition;
    private final ImmutableList<Statement> body;

    Clause(Tokenizer.Pos pos, Optional<Expression> condition, ImmutableList<Statement> body) {
      this.pos = pos;
      this.condition = condition;
      this.body = body;
    }

    public Tokenizer.Pos pos() {
      return pos;
    }

    /** Empty for {@code <<else>>}. */
    @ASTChild
    @Override
    public Optional<Expression> condition() {
      return condition;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }
  }

  @ASTNode
  public static class If extends Statement implements Statement_If_ASTNode {
    private final ImmutableList<Clause> clauses;

    If(ImmutableList<Clause> clauses) {
      super(Type.IF, clauses.get(0).pos());
      this.clauses = clauses;
    }

    @ASTChild
    @Override
    public ImmutableList<Clause> clauses() {
      return clauses;
    }

    @Override
    void compile(NodeEmitter emitter) {
      String end = emitter.newLabel("endif");
      for (Clause clause : clauses) {
        String next = emitter.newLabel("next_clause");
        if (clause.condition().isPresent()) {
          clause.condition().get().compile(emitter);
          emitter.emit(Instruction.jumpIfFalse(next), clause.pos());
        }
        compileAll(clause.body(), emitter);
        emitter.emit(Instruction.jumpTo(end), clause.pos());
        emitter.markLabel(next);
      }
      emitter.markLabel(end);
    }
  }

  @ASTNode
  public static class Set extends Statement implements Statement_Set_ASTNode {
    public enum Operation {
      ASSIGN(null, "=", "to"),
      ADD(Expression.BinaryOperator.ADD, "+="),
      SUBTRACT(Expression.BinaryOperator.SUBTRACT, "-="),
      MULTIPLY(Expression.BinaryOperator.MULTIPLY, "*="),
      DIVIDE(Expression.BinaryOperator.DIVIDE, "/="),
      MODULO(Expression.BinaryOperator.MODULO, "%=");

      private final Optional<Expression.BinaryOperator> binaryOperator;
      private final ImmutableList<String> reprs;

      Operation(Expression.BinaryOperator binaryOperator, String... reprs) {
        this.binaryOperator = Optional.ofNullable(binaryOperator);
        this.reprs = ImmutableList.copyOf(reprs);
      }

      /** The operator combining the old and new values, empty for plain assignment. */
      public Optional<Expression.BinaryOperator> binaryOperator() {
        return binaryOperator;
      }

      private static final ImmutableMap<String, Operation> REPR_MAP;

      static {
        ImmutableMap.Builder<String, Operation> builder = ImmutableMap.builder();
        Arrays.asList(values()).forEach(op -> op.reprs.forEach(r -> builder.put(r, op)));
        REPR_MAP = builder.build();
      }

      public static Optional<Operation> parse(String repr) {
        return Optional.ofNullable(REPR_MAP.get(repr));
      }
    }

    private final Expression.Variable variable;
    private final Operation operation;
    private final Expression value;

    Set(Tokenizer.Pos pos, Expression.Variable variable, Operation operation, Expression value) {
      super(Type.SET, pos);
      this.variable = variable;
      this.operation = operation;
      this.value = value;
    }

    @ASTChild
    @Override
    public Expression.Variable variable() {
      return variable;
    }

    public Operation operation() {
      return operation;
    }

    @ASTChild
    @Override
    public Expression value() {
      return value;
    }

    @Override
    void compile(NodeEmitter emitter) {
      if (operation.binaryOperator().isPresent()) {
        ValueType type = emitter.typeOf(variable);
        variable.compile(emitter);
        value.compile(emitter);
        emitter.emit(
            Instruction.callFunction(
                operation.binaryOperator().get().operator().functionName(type), 2),
            pos());
      } else {
        value.compile(emitter);
      }
      emitter.emit(Instruction.storeVariable(variable.name()), pos());
    }
  }

  @ASTNode
  public static class Declare extends Statement implements Statement_Declare_ASTNode {
    private final Expression.Variable variable;
    private final Expression value;
    private final Optional<ValueType> explicitType;

    Declare(
        Tokenizer.Pos pos,
        Expression.Variable variable,
        Expression value,
        Optional<ValueType> explicitType) {
      super(Type.DECLARE, pos);
      this.variable = variable;
      this.value = value;
      this.explicitType = explicitType;
    }

    public Expression.Variable variable() {
      return variable;
    }

    @ASTChild
    @Override
    public Expression value() {
      return value;
    }

    public Optional<ValueType> explicitType() {
      return explicitType;
    }

    @Override
    void compile(NodeEmitter emitter) {
      // Declarations become initial values of the program, not instructions.
    }
  }

  @ASTNode
  public static class Jump extends Statement implements Statement_Jump_ASTNode {
    private final Expression destination;

    Jump(Tokenizer.Pos pos, Expression destination) {
      super(Type.JUMP, pos);
      this.destination = destination;
    }

    @ASTChild
    @Override
    public Expression destination() {
      return destination;
    }

    /** The node name, when it is written out rather than computed. */
    public Optional<String> literalDestination() {
      if (destination.type() != Expression.Type.STRING_LITERAL) return Optional.empty();
      return Optional.of(destination.<Expression.StringLiteral>cast().value());
    }

    @Override
    void compile(NodeEmitter emitter) {
      destination.compile(emitter);
      emitter.emit(Instruction.create(OpCode.RUN_NODE), pos());
    }
  }

  @ASTNode
  public static class Stop extends Statement implements Statement_Stop_ASTNode {
    Stop(Tokenizer.Pos pos) {
      super(Type.STOP, pos);
    }

    @Override
    void compile(NodeEmitter emitter) {
      emitter.emit(Instruction.create(OpCode.STOP), pos());
    }
  }

  @ASTNode
  public static class Command extends Statement implements Statement_Command_ASTNode {
    private final LineText text;

    Command(LineText text) {
      super(Type.COMMAND, text.pos());
      this.text = text;
    }

    @ASTChild
    @Override
    public LineText text() {
      return text;
    }

    @Override
    void compile(NodeEmitter emitter) {
      text.compileSubstitutions(emitter);
      emitter.emit(
          Instruction.runCommand(text.template(), text.substitutions().size()), pos());
    }
  }
}
