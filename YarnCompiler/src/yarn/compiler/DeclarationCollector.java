package yarn.compiler;

import java.util.Optional;

import yarn.core.Value;
import yarn.core.ValueType;

class DeclarationCollector extends ErrorCollectingVisitor {
  private final String fileName;
  private final CompilationIntermediate intermediate;

  private String nodeName = null;

  DeclarationCollector(String fileName, CompilationIntermediate intermediate) {
    this.fileName = fileName;
    this.intermediate = intermediate;
  }

  @Override
  public void visitImpl(NodeDefinition node) {
    nodeName = node.title();
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Statement.Declare declare) {
    String name = declare.variable().name();
    Optional<Value> value = declare.value().constantValue();
    if (!value.isPresent()) {
      logError(
          declare.value().pos(),
          String.format("the default value of '%s' must be a literal", name));
      return;
    }

    ValueType type = declare.explicitType().orElse(value.get().type());
    if (type != value.get().type()) {
      logError(
          declare.value().pos(),
          String.format(
              "'%s' is declared as %s, but its default value is %s",
              name, type, value.get().type()));
      return;
    }

    Declaration existing = intermediate.knownDeclarations.get(name);
    if (existing != null) {
      logError(
          declare.pos(),
          existing.pos().isPresent()
              ? String.format("'%s' was already declared at %s", name, existing.pos().get())
              : String.format("'%s' is already declared", name));
      return;
    }

    intermediate.addDeclaration(
        Declaration.builder(name, YarnType.of(type), Declaration.Provenance.EXPLICIT)
            .setDefaultValue(value.get())
            .setSourceFile(fileName)
            .setSourceNode(nodeName)
            .setPos(declare.pos())
            .build());
  }
}
