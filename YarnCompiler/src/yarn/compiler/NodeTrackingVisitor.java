package yarn.compiler;

import java.util.Set;

import yarn.core.Library;

/**
 * Finds the nodes whose visits must be counted: those passed by name to {@code visited} or
 * {@code visited_count}, and those with a {@code tracking: always} header. Nodes with {@code
 * tracking: never} are collected separately, since opting out wins.
 */
class NodeTrackingVisitor extends VoidDefaultASTVisitor {
  private final Set<String> trackingNodes;
  private final Set<String> ignoringTrackingNodes;

  NodeTrackingVisitor(Set<String> trackingNodes, Set<String> ignoringTrackingNodes) {
    this.trackingNodes = trackingNodes;
    this.ignoringTrackingNodes = ignoringTrackingNodes;
  }

  @Override
  public void visitImpl(NodeDefinition node) {
    if (node.tracking().isPresent()) {
      switch (node.tracking().get()) {
        case ALWAYS:
          trackingNodes.add(node.title());
          break;
        case NEVER:
          ignoringTrackingNodes.add(node.title());
          break;
      }
    }
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Expression.FunctionCall call) {
    if ((call.name().equals(Library.VISITED) || call.name().equals(Library.VISITED_COUNT))
        && call.arguments().size() == 1
        && call.arguments().get(0).type() == Expression.Type.STRING_LITERAL) {
      trackingNodes.add(call.arguments().get(0).<Expression.StringLiteral>cast().value());
    }
    call.visitChildren(this, null);
  }
}
