package yarn.compiler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import yarn.core.Instruction;
import yarn.core.Operator;
import yarn.core.Value;
import yarn.core.ValueType;
import yarn.processor.ASTChild;
import yarn.processor.ASTNode;

// AST and infix parser for script expressions
public abstract class Expression implements ASTNodeInterface {

  public enum Type {
    // Intermediary nodes, gone once parsing completes.
    PARENTHESIS,
    COMMA,
    ARGUMENTS,
    FUNCTION_NAME,
    UNARY_OPERATOR,
    BINARY_OPERATOR,

    // Atoms
    NUMBER_LITERAL,
    STRING_LITERAL,
    BOOLEAN_LITERAL,
    VARIABLE,
    FUNCTION_CALL,

    // Compounds
    UNARY,
    BINARY;

    public boolean isOperator() {
      return this == UNARY_OPERATOR || this == BINARY_OPERATOR;
    }

    public boolean isIntermediary() {
      return ordinal() <= BINARY_OPERATOR.ordinal();
    }
  }

  public enum UnaryOperator {
    NEGATE(Operator.UNARY_MINUS, ValueType.NUMBER, "-"),
    NOT(Operator.NOT, ValueType.BOOLEAN, "!", "not");

    private final Operator operator;
    private final ValueType operandType;
    private final ImmutableList<String> reprs;

    UnaryOperator(Operator operator, ValueType operandType, String... reprs) {
      this.operator = operator;
      this.operandType = operandType;
      this.reprs = ImmutableList.copyOf(reprs);
    }

    public Operator operator() {
      return operator;
    }

    public ValueType operandType() {
      return operandType;
    }

    public String repr() {
      return reprs.get(0);
    }
  }

  public enum BinaryOperator {
    MULTIPLY(Operator.MULTIPLY, Category.ARITHMETIC, "*"),
    DIVIDE(Operator.DIVIDE, Category.ARITHMETIC, "/"),
    MODULO(Operator.MODULO, Category.ARITHMETIC, "%"),
    ADD(Operator.ADD, Category.CONCATENATION, "+"),
    SUBTRACT(Operator.MINUS, Category.ARITHMETIC, "-"),
    LESS_THAN(Operator.LESS_THAN, Category.COMPARISON, "<", "lt"),
    LESS_THAN_OR_EQUAL(Operator.LESS_THAN_OR_EQUAL_TO, Category.COMPARISON, "<=", "lte"),
    GREATER_THAN(Operator.GREATER_THAN, Category.COMPARISON, ">", "gt"),
    GREATER_THAN_OR_EQUAL(Operator.GREATER_THAN_OR_EQUAL_TO, Category.COMPARISON, ">=", "gte"),
    EQUAL(Operator.EQUAL_TO, Category.EQUALITY, "==", "eq", "is"),
    NOT_EQUAL(Operator.NOT_EQUAL_TO, Category.EQUALITY, "!=", "neq"),
    AND(Operator.AND, Category.LOGICAL, "&&", "and"),
    OR(Operator.OR, Category.LOGICAL, "||", "or"),
    XOR(Operator.XOR, Category.LOGICAL, "^", "xor");

    public enum Category {
      // Number operands, Number result.
      ARITHMETIC,
      // Number or String operands of the same type, result of that type.
      CONCATENATION,
      // Number operands, Bool result.
      COMPARISON,
      // Operands of any one type, Bool result.
      EQUALITY,
      // Bool operands, Bool result.
      LOGICAL;
    }

    private final Operator operator;
    private final Category category;
    private final ImmutableList<String> reprs;

    BinaryOperator(Operator operator, Category category, String... reprs) {
      this.operator = operator;
      this.category = category;
      this.reprs = ImmutableList.copyOf(reprs);
    }

    public Operator operator() {
      return operator;
    }

    public Category category() {
      return category;
    }

    public String repr() {
      return reprs.get(0);
    }

    private static final ImmutableMap<String, BinaryOperator> REPR_MAP;

    static {
      ImmutableMap.Builder<String, BinaryOperator> builder = ImmutableMap.builder();
      for (BinaryOperator op : values()) {
        op.reprs.forEach(repr -> builder.put(repr, op));
      }
      REPR_MAP = builder.build();
    }

    public static Optional<BinaryOperator> parse(String atom) {
      return Optional.ofNullable(REPR_MAP.get(atom));
    }

    private static final ImmutableList<ImmutableSet<BinaryOperator>> ORDER_OF_OPERATIONS =
        ImmutableList.of(
            ImmutableSet.of(MULTIPLY, DIVIDE, MODULO),
            ImmutableSet.of(ADD, SUBTRACT),
            ImmutableSet.of(LESS_THAN, LESS_THAN_OR_EQUAL, GREATER_THAN, GREATER_THAN_OR_EQUAL),
            ImmutableSet.of(EQUAL, NOT_EQUAL),
            ImmutableSet.of(AND, OR, XOR));

    static {
      // Ensure each operator is listed exactly once.
      Verify.verify(
          Arrays.asList(values())
              .stream()
              .allMatch(b -> ORDER_OF_OPERATIONS.stream().filter(s -> s.contains(b)).count() == 1));
    }

    public static ImmutableList<ImmutableSet<BinaryOperator>> orderOfOperations() {
      return ORDER_OF_OPERATIONS;
    }
  }

  interface TypeContext {
    Optional<Declaration> declaration(String name);

    // Adds an inferred declaration for a variable used as 'type' before any declaration.
    ValueType infer(Variable variable, ValueType type);

    // Called when nothing constrains a variable's type yet. Either defers the check or fails it.
    Optional<ValueType> unresolved(Variable variable) throws CompilerException;

    ValueType record(Expression expression, ValueType type);
  }

  // Validates a node or function name.
  public static String validateId(String id, Tokenizer.Pos pos) throws CompilerException {
    if (id.isEmpty()) throw new CompilerException(pos, "expected a name");
    for (int i = 0; i < id.length(); i++) {
      char ch = id.charAt(i);
      if (Character.isLetter(ch) || ch == '_') continue;
      if (i > 0 && (Character.isDigit(ch) || ch == '.')) continue;

      throw new CompilerException(
          pos.addColumns(i), String.format("illegal character '%c' in name '%s'", ch, id));
    }
    return id;
  }

  // Parses a singular expression atom.
  private static Expression parseAtom(Tokenizer.Atom atom) throws CompilerException {
    String text = atom.text();
    Tokenizer.Pos pos = atom.pos();

    if (text.equals("(") || text.equals(")")) return new Parenthesis(text.equals("("), pos);
    if (text.equals(",")) return new Comma(pos);
    if (text.equals("!") || text.equals("not"))
      return new UnaryOperatorAtom(UnaryOperator.NOT, text, pos);

    Optional<BinaryOperator> binary = BinaryOperator.parse(text);
    if (binary.isPresent()) return new BinaryOperatorAtom(binary.get(), text, pos);

    if (text.equals("true") || text.equals("false"))
      return new BooleanLiteral(Boolean.parseBoolean(text), pos);
    if (text.charAt(0) == Tokenizer.QUOTE) return StringLiteral.parse(text, pos);
    if (text.charAt(0) == '$') return Variable.parse(text, pos);
    if (Character.isDigit(text.charAt(0))) return NumberLiteral.parse(text, pos);

    return new FunctionName(validateId(text, pos), pos);
  }

  public static Expression parse(String text, Tokenizer.Pos pos) throws CompilerException {
    ImmutableList<Tokenizer.Atom> atoms = Tokenizer.splitExpression(text, pos);
    if (atoms.isEmpty()) throw new CompilerException(pos, "expected an expression");
    return parseExpression(atoms);
  }

  public static Expression parseExpression(List<Tokenizer.Atom> args) throws CompilerException {
    Preconditions.checkArgument(!args.isEmpty());

    List<Expression> atoms = new ArrayList<>();
    for (Tokenizer.Atom arg : args) {
      atoms.add(parseAtom(arg));
    }

    // Parse parenthesis
    ArrayDeque<Integer> stack = new ArrayDeque<>();
    for (int i = 0; i < atoms.size(); i++) {
      Expression expr = atoms.get(i);
      if (expr.type() != Type.PARENTHESIS) continue;

      Parenthesis paren = expr.cast();
      if (paren.isOpen()) {
        stack.push(i);
      } else {
        if (stack.isEmpty()) throw new CompilerException(paren.pos(), "unmatched parenthesis");

        int start = stack.pop();
        Arguments arguments = Arguments.parse(atoms.subList(start + 1, i), atoms.get(start).pos());
        atoms.subList(start + 1, i + 1).clear();
        atoms.set(start, arguments);
        i = start;
      }
    }

    if (!stack.isEmpty())
      throw new CompilerException(atoms.get(stack.pop()).pos(), "unmatched parenthesis");

    return parseNoSeparators(atoms);
  }

  private static void parseBinaryOperators(ImmutableSet<BinaryOperator> ops, List<Expression> atoms)
      throws CompilerException {
    for (int i = 0; i < atoms.size(); i++) {
      Expression expr = atoms.get(i);
      if (expr.type() != Type.BINARY_OPERATOR) continue;

      BinaryOperatorAtom binary = expr.cast();
      if (!ops.contains(binary.op())) continue;

      // Consume the previous and subsequent arguments.
      if (i - 1 < 0
          || i + 1 >= atoms.size()
          || atoms.get(i - 1).type().isOperator()
          || atoms.get(i + 1).type().isOperator()) {
        throw new CompilerException(
            binary.pos(), "binary operator is missing left or right arguments");
      }

      // Removal of 'i - 1' shifts 'i + 1' to 'i'
      atoms.set(i - 1, new Binary(atoms.remove(i - 1), binary, atoms.remove(i)));
      i--;
    }
  }

  private static Expression parseNoSeparators(List<Expression> atoms) throws CompilerException {
    if (atoms.isEmpty()) throw new CompilerException(Tokenizer.Pos.internal(), "empty expression");

    // Pass 1: function calls, then plain grouping.
    for (int i = atoms.size() - 1; i >= 0; i--) {
      Expression expr = atoms.get(i);
      if (expr.type() != Type.ARGUMENTS) continue;

      Arguments arguments = expr.cast();
      if (i > 0 && atoms.get(i - 1).type() == Type.FUNCTION_NAME) {
        FunctionName name = atoms.get(i - 1).cast();
        atoms.remove(i);
        atoms.set(i - 1, new FunctionCall(name.name(), arguments.elements(), name.pos()));
        i--;
      } else if (arguments.elements().size() == 1) {
        atoms.set(i, arguments.elements().get(0));
      } else {
        throw new CompilerException(
            arguments.pos(), "parenthesis must hold exactly one expression here");
      }
    }

    for (Expression atom : atoms) {
      if (atom.type() == Type.FUNCTION_NAME)
        throw new CompilerException(
            atom.pos(),
            String.format("'%s' is not a variable or a function call; did you mean '$%s'?",
                atom.raw(), atom.raw()));
      if (atom.type() == Type.COMMA) throw new CompilerException(atom.pos(), "unexpected comma");
    }

    // Pass 2: prefix operators, innermost first.
    for (int i = atoms.size() - 1; i >= 0; i--) {
      Expression expr = atoms.get(i);
      UnaryOperator op;
      if (expr.type() == Type.UNARY_OPERATOR) {
        op = ((UnaryOperatorAtom) expr).op();
      } else if (expr.type() == Type.BINARY_OPERATOR
          && ((BinaryOperatorAtom) expr).op() == BinaryOperator.SUBTRACT
          && (i == 0 || atoms.get(i - 1).type().isOperator())) {
        op = UnaryOperator.NEGATE;
      } else {
        continue;
      }

      if (i + 1 >= atoms.size() || atoms.get(i + 1).type().isOperator())
        throw new CompilerException(expr.pos(), "unary operator has no argument");

      Expression arg = atoms.remove(i + 1);
      if (op == UnaryOperator.NEGATE && arg.type() == Type.NUMBER_LITERAL) {
        NumberLiteral literal = arg.cast();
        atoms.set(i, new NumberLiteral(-literal.value(), "-" + literal.raw(), expr.pos()));
      } else {
        atoms.set(i, new Unary(op, expr.raw(), arg, expr.pos()));
      }
    }

    // Pass 3: binary operators
    for (ImmutableSet<BinaryOperator> ops : BinaryOperator.orderOfOperations()) {
      parseBinaryOperators(ops, atoms);
    }

    // In the end, we should be left with a single expression.
    if (atoms.size() > 1) {
      throw new CompilerException(
          atoms.get(1).pos(), "unexpected token: expected end of expression");
    }
    return atoms.get(0);
  }

  private final Type type;
  private final String raw;
  private final Tokenizer.Pos pos;

  private Expression(Type type, String raw, Tokenizer.Pos pos) {
    this.type = type;
    this.raw = raw;
    this.pos = pos;
  }

  public Type type() {
    return type;
  }

  public String raw() {
    return raw;
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  @Override
  public String toString() {
    return raw;
  }

  /** The value of a literal; empty for anything computed at run time. */
  public Optional<Value> constantValue() {
    return Optional.empty();
  }

  /**
   * Works out the type of this expression and records it with {@code context}.
   *
   * @param expected the type the surrounding code wants, used to infer undeclared variables
   * @return empty if the type cannot be determined yet
   */
  abstract Optional<ValueType> checkType(TypeContext context, Optional<ValueType> expected)
      throws CompilerException;

  abstract void compile(NodeEmitter emitter);

  @SuppressWarnings("unchecked")
  public <T extends Expression> T cast() {
    return (T) this;
  }

  private abstract static class IntermediaryExpression extends Expression {
    protected IntermediaryExpression(Type type, String raw, Tokenizer.Pos pos) {
      super(type, raw, pos);
    }

    @Override
    public final <V> V accept(ASTVisitor<V> visitor, V value) {
      throw new UnsupportedOperationException();
    }

    @Override
    public final <V> V visitChildren(ASTVisitor<V> visitor, V value) {
      throw new UnsupportedOperationException();
    }

    @Override
    final Optional<ValueType> checkType(TypeContext context, Optional<ValueType> expected) {
      throw new UnsupportedOperationException();
    }

    @Override
    final void compile(NodeEmitter emitter) {
      throw new UnsupportedOperationException();
    }
  }

  private static class Parenthesis extends IntermediaryExpression {
    private final boolean open;

    private Parenthesis(boolean open, Tokenizer.Pos pos) {
      super(Type.PARENTHESIS, open ? "(" : ")", pos);
      this.open = open;
    }

    public boolean isOpen() {
      return open;
    }
  }

  private static class Comma extends IntermediaryExpression {
    private Comma(Tokenizer.Pos pos) {
      super(Type.COMMA, ",", pos);
    }
  }

  // A function name waiting for its argument list.
  private static class FunctionName extends IntermediaryExpression {
    private final String name;

    private FunctionName(String name, Tokenizer.Pos pos) {
      super(Type.FUNCTION_NAME, name, pos);
      this.name = name;
    }

    public String name() {
      return name;
    }
  }

  // The comma-separated contents of a pair of parenthesis.
  private static class Arguments extends IntermediaryExpression {
    private final ImmutableList<Expression> elements;

    private Arguments(ImmutableList<Expression> elements, Tokenizer.Pos pos) {
      super(
          Type.ARGUMENTS,
          elements.stream().map(Expression::raw).collect(Collectors.joining(", ", "(", ")")),
          pos);
      this.elements = elements;
    }

    public ImmutableList<Expression> elements() {
      return elements;
    }

    private static Arguments parse(List<Expression> atoms, Tokenizer.Pos pos)
        throws CompilerException {
      if (atoms.isEmpty()) return new Arguments(ImmutableList.of(), pos);

      // Separate by comma
      ImmutableList.Builder<Expression> builder = ImmutableList.builder();
      List<Expression> arg = new ArrayList<>();
      for (Expression atom : atoms) {
        if (atom.type() == Type.COMMA) {
          if (arg.isEmpty()) throw new CompilerException(atom.pos(), "unexpected comma");

          builder.add(Expression.parseNoSeparators(arg));
          arg = new ArrayList<>();
        } else {
          arg.add(atom);
        }
      }

      if (arg.isEmpty())
        throw new CompilerException(atoms.get(atoms.size() - 1).pos(), "unexpected comma");
      else builder.add(Expression.parseNoSeparators(arg));

      return new Arguments(builder.build(), pos);
    }
  }

  private static class UnaryOperatorAtom extends IntermediaryExpression {
    private final UnaryOperator op;

    private UnaryOperatorAtom(UnaryOperator op, String raw, Tokenizer.Pos pos) {
      super(Type.UNARY_OPERATOR, raw, pos);
      this.op = op;
    }

    public UnaryOperator op() {
      return op;
    }
  }

  private static class BinaryOperatorAtom extends IntermediaryExpression {
    private final BinaryOperator op;

    private BinaryOperatorAtom(BinaryOperator op, String raw, Tokenizer.Pos pos) {
      super(Type.BINARY_OPERATOR, raw, pos);
      this.op = op;
    }

    public BinaryOperator op() {
      return op;
    }
  }

  @ASTNode
  public static class NumberLiteral extends Expression implements Expression_NumberLiteral_ASTNode {
    private final double value;

    private NumberLiteral(double value, String raw, Tokenizer.Pos pos) {
      super(Type.NUMBER_LITERAL, raw, pos);
      this.value = value;
    }

    public double value() {
      return value;
    }

    @Override
    public Optional<Value> constantValue() {
      return Optional.of(Value.of(value));
    }

    public static NumberLiteral parse(String in, Tokenizer.Pos pos) throws CompilerException {
      try {
        return new NumberLiteral(Double.parseDouble(in), in, pos);
      } catch (NumberFormatException ex) {
        throw new CompilerException(pos, String.format("'%s' is not a valid number", in));
      }
    }

    @Override
    Optional<ValueType> checkType(TypeContext context, Optional<ValueType> expected) {
      return Optional.of(context.record(this, ValueType.NUMBER));
    }

    @Override
    void compile(NodeEmitter emitter) {
      emitter.emit(Instruction.push(Value.of(value)), pos());
    }
  }

  @ASTNode
  public static class StringLiteral extends Expression implements Expression_StringLiteral_ASTNode {
    private final String value;

    private StringLiteral(String value, String raw, Tokenizer.Pos pos) {
      super(Type.STRING_LITERAL, raw, pos);
      this.value = value;
    }

    /** A literal not written in source, such as the node name of {@code <<jump Node>>}. */
    public static StringLiteral of(String value, Tokenizer.Pos pos) {
      return new StringLiteral(value, Tokenizer.QUOTE + value + Tokenizer.QUOTE, pos);
    }

    public String value() {
      return value;
    }

    @Override
    public Optional<Value> constantValue() {
      return Optional.of(Value.of(value));
    }

    public static StringLiteral parse(String atom, Tokenizer.Pos pos) throws CompilerException {
      Preconditions.checkArgument(atom.length() >= 2 && atom.charAt(0) == Tokenizer.QUOTE);

      StringBuilder sb = new StringBuilder();
      for (int i = 1; i < atom.length() - 1; i++) {
        char ch = atom.charAt(i);
        if (ch != '\\') {
          sb.append(ch);
          continue;
        }

        if (++i >= atom.length() - 1) throw new CompilerException(pos.addColumns(i), "bad escape");
        char escaped = atom.charAt(i);
        if (escaped == 'n') {
          sb.append('\n');
        } else if (escaped == Tokenizer.QUOTE || escaped == '\\') {
          sb.append(escaped);
        } else {
          throw new CompilerException(
              pos.addColumns(i - 1), String.format("illegal escape '\\%c'", escaped));
        }
      }
      return new StringLiteral(sb.toString(), atom, pos);
    }

    @Override
    Optional<ValueType> checkType(TypeContext context, Optional<ValueType> expected) {
      return Optional.of(context.record(this, ValueType.STRING));
    }

    @Override
    void compile(NodeEmitter emitter) {
      emitter.emit(Instruction.push(Value.of(value)), pos());
    }
  }

  @ASTNode
  public static class BooleanLiteral extends Expression
      implements Expression_BooleanLiteral_ASTNode {
    private final boolean value;

    private BooleanLiteral(boolean value, Tokenizer.Pos pos) {
      super(Type.BOOLEAN_LITERAL, Boolean.toString(value), pos);
      this.value = value;
    }

    public boolean value() {
      return value;
    }

    @Override
    public Optional<Value> constantValue() {
      return Optional.of(Value.of(value));
    }

    @Override
    Optional<ValueType> checkType(TypeContext context, Optional<ValueType> expected) {
      return Optional.of(context.record(this, ValueType.BOOLEAN));
    }

    @Override
    void compile(NodeEmitter emitter) {
      emitter.emit(Instruction.push(Value.of(value)), pos());
    }
  }

  @ASTNode
  public static class Variable extends Expression implements Expression_Variable_ASTNode {
    private Variable(String name, Tokenizer.Pos pos) {
      super(Type.VARIABLE, name, pos);
    }

    public String name() {
      return raw();
    }

    public static Variable parse(String atom, Tokenizer.Pos pos) throws CompilerException {
      Preconditions.checkArgument(atom.startsWith("$"));
      validateId(atom.substring(1), pos.addColumns(1));
      return new Variable(atom, pos);
    }

    @Override
    Optional<ValueType> checkType(TypeContext context, Optional<ValueType> expected)
        throws CompilerException {
      Optional<Declaration> declaration = context.declaration(name());
      if (declaration.isPresent()) {
        if (declaration.get().type().isFunction()) {
          throw new CompilerException(pos(), String.format("'%s' is a function", name()));
        }
        return Optional.of(context.record(this, declaration.get().type().valueType()));
      }

      if (expected.isPresent()) {
        return Optional.of(context.record(this, context.infer(this, expected.get())));
      }
      return context.unresolved(this);
    }

    @Override
    void compile(NodeEmitter emitter) {
      emitter.emit(Instruction.pushVariable(name()), pos());
    }
  }

  @ASTNode
  public static class FunctionCall extends Expression implements Expression_FunctionCall_ASTNode {
    private final String name;
    private final ImmutableList<Expression> arguments;

    private FunctionCall(String name, ImmutableList<Expression> arguments, Tokenizer.Pos pos) {
      super(
          Type.FUNCTION_CALL,
          name
              + arguments
                  .stream()
                  .map(Expression::raw)
                  .collect(Collectors.joining(", ", "(", ")")),
          pos);
      this.name = name;
      this.arguments = arguments;
    }

    public String name() {
      return name;
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> arguments() {
      return arguments;
    }

    @Override
    Optional<ValueType> checkType(TypeContext context, Optional<ValueType> expected)
        throws CompilerException {
      Optional<Declaration> declaration = context.declaration(name);
      if (!declaration.isPresent() || !declaration.get().type().isFunction()) {
        throw new CompilerException(pos(), String.format("undefined function '%s'", name));
      }

      YarnType signature = declaration.get().type();
      if (signature.parameterTypes().size() != arguments.size()) {
        throw new CompilerException(
            pos(),
            String.format(
                "function '%s' expects %d argument(s), but was given %d",
                name, signature.parameterTypes().size(), arguments.size()));
      }

      boolean resolved = true;
      for (int i = 0; i < arguments.size(); i++) {
        Expression argument = arguments.get(i);
        ValueType parameterType = signature.parameterTypes().get(i);
        Optional<ValueType> argumentType = argument.checkType(context, Optional.of(parameterType));
        if (!argumentType.isPresent()) {
          resolved = false;
        } else if (argumentType.get() != parameterType) {
          throw new CompilerException(
              argument.pos(),
              String.format(
                  "argument %d of '%s' must be %s, but was %s",
                  i + 1, name, parameterType, argumentType.get()));
        }
      }

      ValueType returnType = signature.returnType();
      return resolved ? Optional.of(context.record(this, returnType)) : Optional.empty();
    }

    @Override
    void compile(NodeEmitter emitter) {
      arguments.forEach(argument -> argument.compile(emitter));
      emitter.emit(Instruction.callFunction(name, arguments.size()), pos());
    }
  }

  @ASTNode
  public static class Unary extends Expression implements Expression_Unary_ASTNode {
    private final UnaryOperator op;
    private final Expression arg;

    private Unary(UnaryOperator op, String opRaw, Expression arg, Tokenizer.Pos pos) {
      super(Type.UNARY, opRaw + (Character.isLetter(opRaw.charAt(0)) ? " " : "") + arg.raw(), pos);
      this.op = op;
      this.arg = arg;
    }

    public UnaryOperator op() {
      return op;
    }

    @ASTChild
    @Override
    public Expression arg() {
      return arg;
    }

    @Override
    Optional<ValueType> checkType(TypeContext context, Optional<ValueType> expected)
        throws CompilerException {
      Optional<ValueType> argType = arg.checkType(context, Optional.of(op.operandType()));
      if (!argType.isPresent()) return Optional.empty();
      if (argType.get() != op.operandType()) {
        throw new CompilerException(
            pos(),
            String.format(
                "operator '%s' requires %s, but was %s",
                op.repr(),
                op.operandType(),
                argType.get()));
      }
      return Optional.of(context.record(this, op.operandType()));
    }

    @Override
    void compile(NodeEmitter emitter) {
      arg.compile(emitter);
      emitter.emit(
          Instruction.callFunction(op.operator().functionName(emitter.typeOf(arg)), 1), pos());
    }
  }

  @ASTNode
  public static class Binary extends Expression implements Expression_Binary_ASTNode {
    private final Expression lhs;
    private final BinaryOperator op;
    private final Expression rhs;

    private Binary(Expression lhs, BinaryOperatorAtom op, Expression rhs) {
      super(Type.BINARY, lhs.raw() + " " + op.raw() + " " + rhs.raw(), op.pos());
      this.lhs = lhs;
      this.op = op.op();
      this.rhs = rhs;
    }

    @ASTChild
    @Override
    public Expression lhs() {
      return lhs;
    }

    public BinaryOperator op() {
      return op;
    }

    @ASTChild
    @Override
    public Expression rhs() {
      return rhs;
    }

    private Optional<ValueType> operandHint(Optional<ValueType> expected) {
      switch (op.category()) {
        case ARITHMETIC:
        case COMPARISON:
          return Optional.of(ValueType.NUMBER);
        case LOGICAL:
          return Optional.of(ValueType.BOOLEAN);
        case CONCATENATION:
          return expected.filter(t -> t != ValueType.BOOLEAN);
        case EQUALITY:
          return Optional.empty();
      }
      throw new AssertionError(op.category());
    }

    private CompilerException undefined(ValueType lValue, ValueType rValue) {
      return new CompilerException(
          pos(),
          String.format(
              "operator '%s' is not defined for %s and %s", op.repr(), lValue, rValue));
    }

    @Override
    Optional<ValueType> checkType(TypeContext context, Optional<ValueType> expected)
        throws CompilerException {
      Optional<ValueType> hint = operandHint(expected);
      Optional<ValueType> lValue = lhs.checkType(context, hint);
      Optional<ValueType> rValue = rhs.checkType(context, lValue.isPresent() ? lValue : hint);
      if (!lValue.isPresent() && rValue.isPresent()) {
        // The right hand side decides what an undeclared left hand side is.
        lValue = lhs.checkType(context, rValue);
      }
      if (!lValue.isPresent() || !rValue.isPresent()) return Optional.empty();

      ValueType l = lValue.get();
      ValueType r = rValue.get();
      if (l != r) throw undefined(l, r);

      switch (op.category()) {
        case ARITHMETIC:
          if (l != ValueType.NUMBER) throw undefined(l, r);
          return Optional.of(context.record(this, ValueType.NUMBER));
        case CONCATENATION:
          if (l == ValueType.BOOLEAN) throw undefined(l, r);
          return Optional.of(context.record(this, l));
        case COMPARISON:
          if (l != ValueType.NUMBER) throw undefined(l, r);
          return Optional.of(context.record(this, ValueType.BOOLEAN));
        case EQUALITY:
          return Optional.of(context.record(this, ValueType.BOOLEAN));
        case LOGICAL:
          if (l != ValueType.BOOLEAN) throw undefined(l, r);
          return Optional.of(context.record(this, ValueType.BOOLEAN));
      }
      throw new AssertionError(op.category());
    }

    @Override
    void compile(NodeEmitter emitter) {
      lhs.compile(emitter);
      rhs.compile(emitter);
      emitter.emit(
          Instruction.callFunction(op.operator().functionName(emitter.typeOf(lhs)), 2), pos());
    }
  }
}
