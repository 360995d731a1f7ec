package yarn.compiler;

import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import yarn.core.ValueType;

/**
 * Works out the type of every expression in a file and checks each statement uses them correctly.
 *
 * <p>A variable used before any declaration gets its type from where it is used, and is declared
 * with that type's default value. When nothing about a use says what type it has, the file is
 * marked {@link #deferred()} so it can be checked again once every other file has had its say. In
 * the final round such uses are errors.
 */
class TypeCheckVisitor extends ErrorCollectingVisitor implements Expression.TypeContext {
  private static final Logger log = LoggerFactory.getLogger(TypeCheckVisitor.class);

  private final String fileName;
  private final CompilationIntermediate intermediate;
  private final Set<String> nodeNames;
  private final boolean finalRound;

  private String nodeName = null;
  private boolean deferred = false;

  TypeCheckVisitor(
      String fileName,
      CompilationIntermediate intermediate,
      Set<String> nodeNames,
      boolean finalRound) {
    this.fileName = fileName;
    this.intermediate = intermediate;
    this.nodeNames = nodeNames;
    this.finalRound = finalRound;
  }

  boolean deferred() {
    return deferred;
  }

  @Override
  public Optional<Declaration> declaration(String name) {
    return Optional.ofNullable(intermediate.knownDeclarations.get(name));
  }

  @Override
  public ValueType infer(Expression.Variable variable, ValueType type) {
    log.debug("Inferred {} for {} at {}", type, variable.name(), variable.pos());
    intermediate.addDeclaration(
        Declaration.builder(variable.name(), YarnType.of(type), Declaration.Provenance.INFERRED)
            .setDefaultValue(type.defaultValue())
            .setDescription(String.format("Implicitly declared in %s, node %s", fileName, nodeName))
            .setSourceFile(fileName)
            .setSourceNode(nodeName)
            .setPos(variable.pos())
            .build());
    return type;
  }

  @Override
  public Optional<ValueType> unresolved(Expression.Variable variable) throws CompilerException {
    if (finalRound) {
      throw new CompilerException(
          variable.pos(), String.format("can't determine the type of '%s'", variable.name()));
    }
    deferred = true;
    return Optional.empty();
  }

  @Override
  public ValueType record(Expression expression, ValueType type) {
    intermediate.expressionTypes.put(expression, type);
    return type;
  }

  @Override
  public void visitImpl(NodeDefinition node) {
    nodeName = node.title();
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(LineText text) {
    text.substitutions().forEach(substitution -> check(substitution, Optional.empty()));
  }

  @Override
  public void visitImpl(Statement.Line line) {
    line.condition().ifPresent(condition -> expect(condition, ValueType.BOOLEAN));
    line.text().accept(this, null);
  }

  @Override
  public void visitImpl(Statement.Option option) {
    option.condition().ifPresent(condition -> expect(condition, ValueType.BOOLEAN));
    option.text().accept(this, null);
    option.body().forEach(statement -> statement.accept(this, null));
  }

  @Override
  public void visitImpl(Statement.Clause clause) {
    clause.condition().ifPresent(condition -> expect(condition, ValueType.BOOLEAN));
    clause.body().forEach(statement -> statement.accept(this, null));
  }

  @Override
  public void visitImpl(Statement.Declare declare) {
    // Checked when collected.
  }

  @Override
  public void visitImpl(Statement.Set set) {
    try {
      checkSet(set);
    } catch (CompilerException ex) {
      logError(ex);
    }
  }

  private void checkSet(Statement.Set set) throws CompilerException {
    Expression.Variable variable = set.variable();
    Optional<ValueType> hint = Optional.empty();
    if (set.operation().binaryOperator().isPresent()
        && set.operation() != Statement.Set.Operation.ADD) {
      hint = Optional.of(ValueType.NUMBER);
    }

    Optional<ValueType> variableType = Optional.empty();
    if (declaration(variable.name()).isPresent() || hint.isPresent()) {
      variableType = variable.checkType(this, hint);
    }

    Optional<ValueType> valueType =
        set.value().checkType(this, variableType.isPresent() ? variableType : hint);
    if (!variableType.isPresent()) {
      // The value decides what an undeclared variable is.
      variableType = variable.checkType(this, valueType);
    }
    if (!variableType.isPresent() || !valueType.isPresent()) return;

    if (variableType.get() != valueType.get()) {
      throw new CompilerException(
          set.value().pos(),
          String.format(
              "can't assign %s to '%s', which is %s",
              valueType.get(), variable.name(), variableType.get()));
    }
    if (set.operation() == Statement.Set.Operation.ADD
        && variableType.get() == ValueType.BOOLEAN) {
      throw new CompilerException(set.pos(), "'+=' is not defined for Bool");
    }
  }

  @Override
  public void visitImpl(Statement.Jump jump) {
    Optional<String> destination = jump.literalDestination();
    if (destination.isPresent()) {
      if (!nodeNames.contains(destination.get())) {
        logWarning(jump.pos(), String.format("jump to unknown node '%s'", destination.get()));
      }
      record(jump.destination(), ValueType.STRING);
      return;
    }
    expect(jump.destination(), ValueType.STRING);
  }

  @Override
  public void visitImpl(Statement.Command command) {
    command.text().accept(this, null);
  }

  private void check(Expression expression, Optional<ValueType> expected) {
    try {
      expression.checkType(this, expected);
    } catch (CompilerException ex) {
      logError(ex);
    }
  }

  private void expect(Expression expression, ValueType type) {
    try {
      Optional<ValueType> actual = expression.checkType(this, Optional.of(type));
      if (actual.isPresent() && actual.get() != type) {
        logError(
            expression.pos(),
            String.format("expected %s, but '%s' is %s", type, expression.raw(), actual.get()));
      }
    } catch (CompilerException ex) {
      logError(ex);
    }
  }
}
