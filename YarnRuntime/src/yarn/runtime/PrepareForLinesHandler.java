package yarn.runtime;

import com.google.common.collect.ImmutableList;

import yarn.core.LineId;

/**
 * Called when a node is set, with every line it may deliver, so the game can load their text or
 * audio ahead of time.
 */
@FunctionalInterface
public interface PrepareForLinesHandler {
  void handle(ImmutableList<LineId> lineIds, ReadOnlyDialogue dialogue);
}
