package yarn.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

import yarn.processor.ASTChild;
import yarn.processor.ASTNode;

/**
 * The text of a line, option or command. Each {@code {expression}} of the source is replaced by
 * its index in braces, {@code {0}} for the first.
 */
@ASTNode
public class LineText implements LineText_ASTNode {
  public static final String LINE_ID_PREFIX = "line:";

  private final String template;
  private final ImmutableList<Expression> substitutions;
  private final List<String> hashtags;
  private final Tokenizer.Pos pos;

  public LineText(
      String template,
      ImmutableList<Expression> substitutions,
      List<String> hashtags,
      Tokenizer.Pos pos) {
    this.template = template;
    this.substitutions = substitutions;
    this.hashtags = new ArrayList<>(hashtags);
    this.pos = pos;
  }

  public String template() {
    return template;
  }

  @ASTChild
  @Override
  public ImmutableList<Expression> substitutions() {
    return substitutions;
  }

  public ImmutableList<String> hashtags() {
    return ImmutableList.copyOf(hashtags);
  }

  void addHashtag(String hashtag) {
    if (!hashtags.contains(hashtag)) hashtags.add(hashtag);
  }

  /** The id given with a {@code #line:} hashtag. */
  public Optional<String> explicitLineId() {
    return hashtags.stream().filter(h -> h.startsWith(LINE_ID_PREFIX)).findFirst();
  }

  public ImmutableList<String> metadata() {
    return hashtags
        .stream()
        .filter(h -> !h.startsWith(LINE_ID_PREFIX))
        .collect(ImmutableList.toImmutableList());
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  void compileSubstitutions(NodeEmitter emitter) {
    substitutions.forEach(substitution -> substitution.compile(emitter));
  }

  @Override
  public String toString() {
    return template;
  }
}
