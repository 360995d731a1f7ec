package yarn.compiler;

import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import yarn.processor.ASTChild;
import yarn.processor.ASTNode;

@ASTNode
public class NodeDefinition implements NodeDefinition_ASTNode {
  public static final String RAW_TEXT_TAG = "rawText";

  public enum Tracking {
    ALWAYS,
    NEVER;
  }

  private final String title;
  private final Tokenizer.Pos pos;
  private final ImmutableMap<String, String> headers;
  private final ImmutableList<String> tags;
  private final Optional<Tracking> tracking;
  private final Optional<String> rawText;
  private final ImmutableList<Statement> body;

  NodeDefinition(
      String title,
      Tokenizer.Pos pos,
      ImmutableMap<String, String> headers,
      ImmutableList<String> tags,
      Optional<Tracking> tracking,
      Optional<String> rawText,
      ImmutableList<Statement> body) {
    this.title = title;
    this.pos = pos;
    this.headers = headers;
    this.tags = tags;
    this.tracking = tracking;
    this.rawText = rawText;
    this.body = body;
  }

  public String title() {
    return title;
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  public ImmutableMap<String, String> headers() {
    return headers;
  }

  public ImmutableList<String> tags() {
    return tags;
  }

  public Optional<Tracking> tracking() {
    return tracking;
  }

  /** The unparsed body, for nodes tagged {@value #RAW_TEXT_TAG}. */
  public Optional<String> rawText() {
    return rawText;
  }

  @ASTChild
  @Override
  public ImmutableList<Statement> body() {
    return body;
  }

  @Override
  public String toString() {
    return title;
  }
}
