package yarn.runtime;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Ints;

import yarn.core.LineId;
import yarn.core.Node;
import yarn.core.Program;

/**
 * What handlers may look at while the dialogue runs. Nothing here changes the dialogue's state.
 */
public final class ReadOnlyDialogue {
  private static final Logger log = LoggerFactory.getLogger(ReadOnlyDialogue.class);

  private final VirtualMachine vm;
  private Optional<TextProvider> textProvider = Optional.empty();

  ReadOnlyDialogue(VirtualMachine vm) {
    this.vm = vm;
  }

  void setTextProvider(TextProvider textProvider) {
    this.textProvider = Optional.of(textProvider);
  }

  public ImmutableSet<String> nodeNames() {
    Optional<Program> program = vm.program();
    if (!program.isPresent()) {
      log.warn("Tried to get the node names, but no program is loaded");
      return ImmutableSet.of();
    }
    return program.get().nodes().keySet();
  }

  public boolean nodeExists(String nodeName) {
    Optional<Program> program = vm.program();
    if (!program.isPresent()) {
      log.warn("Tried to look up node '{}', but no program is loaded", nodeName);
      return false;
    }
    return program.get().nodes().containsKey(nodeName);
  }

  public Optional<ImmutableList<String>> tagsForNode(String nodeName) {
    return node(nodeName).map(Node::tags);
  }

  /**
   * The string table id of a node's source text. Only {@code rawText} nodes keep their source
   * text, and whether the string table really has the entry is not checked.
   */
  public Optional<LineId> stringIdForNode(String nodeName) {
    return node(nodeName).map(node -> LineId.forNode(node.name()));
  }

  public Optional<String> currentNode() {
    return vm.currentNodeName();
  }

  public ExecutionState executionState() {
    return vm.state();
  }

  /** The text of {@code line}, if a {@link TextProvider} is set and knows it. */
  public Optional<String> lineText(Line line) {
    return textProvider.flatMap(provider -> provider.render(line));
  }

  /**
   * Replaces each {@code {i}} marker in {@code text} with {@code substitutions.get(i)}, reading
   * the text once so substituted values are never expanded again. Markers without a substitution
   * are left alone, and a backslash makes the character after it literal.
   */
  public static String expandSubstitutions(String text, List<String> substitutions) {
    StringBuilder sb = new StringBuilder(text.length());
    int i = 0;
    while (i < text.length()) {
      char ch = text.charAt(i);
      if (ch == '\\' && i + 1 < text.length()) {
        sb.append(text.charAt(i + 1));
        i += 2;
        continue;
      }
      if (ch == '{') {
        int close = text.indexOf('}', i);
        if (close > i + 1) {
          String marker = text.substring(i + 1, close);
          if (CharMatcher.inRange('0', '9').matchesAllOf(marker)) {
            Integer index = Ints.tryParse(marker);
            if (index != null && index < substitutions.size()) {
              sb.append(substitutions.get(index));
              i = close + 1;
              continue;
            }
          }
        }
      }
      sb.append(ch);
      i++;
    }
    return sb.toString();
  }

  private Optional<Node> node(String nodeName) {
    Optional<Program> program = vm.program();
    if (!program.isPresent()) {
      log.warn("Tried to look up node '{}', but no program is loaded", nodeName);
      return Optional.empty();
    }
    Node node = program.get().nodes().get(nodeName);
    if (node == null) log.warn("No node named '{}'", nodeName);
    return Optional.ofNullable(node);
  }
}
