package yarn.compiler;

import java.util.List;

/**
 * Tags the line shown just before an option group with {@value #LAST_LINE_TAG}, so a game can keep
 * it on screen while the options are offered.
 */
class LastLineBeforeOptionsTagger extends VoidDefaultASTVisitor {
  static final String LAST_LINE_TAG = "lastline";

  @Override
  public void visitImpl(NodeDefinition node) {
    tag(node.body());
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Statement.Option option) {
    tag(option.body());
    option.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Statement.Clause clause) {
    tag(clause.body());
    clause.visitChildren(this, null);
  }

  private static void tag(List<Statement> statements) {
    for (int i = 1; i < statements.size(); i++) {
      if (statements.get(i).type() == Statement.Type.OPTION_GROUP
          && statements.get(i - 1).type() == Statement.Type.LINE) {
        statements.get(i - 1).<Statement.Line>cast().text().addHashtag(LAST_LINE_TAG);
      }
    }
  }
}
