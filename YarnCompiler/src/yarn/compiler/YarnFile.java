package yarn.compiler;

import com.google.common.collect.ImmutableList;

import yarn.processor.ASTChild;
import yarn.processor.ASTNode;

@ASTNode
public class YarnFile implements YarnFile_ASTNode {
  private final String fileName;
  private final ImmutableList<String> fileTags;
  private final ImmutableList<NodeDefinition> nodes;

  YarnFile(String fileName, ImmutableList<String> fileTags, ImmutableList<NodeDefinition> nodes) {
    this.fileName = fileName;
    this.fileTags = fileTags;
    this.nodes = nodes;
  }

  public String fileName() {
    return fileName;
  }

  /** Hashtags written before the first node, without their '#'. */
  public ImmutableList<String> fileTags() {
    return fileTags;
  }

  @ASTChild
  @Override
  public ImmutableList<NodeDefinition> nodes() {
    return nodes;
  }
}
