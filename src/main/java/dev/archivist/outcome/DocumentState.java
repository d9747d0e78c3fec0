package dev.archivist.outcome;

/**
 * Stage a document is in while a run processes it.
 *
 * <p>Transitions are strictly sequential: {@code PENDING -> EXTRACTING -> CHUNKING -> EMBEDDING ->
 * WRITING -> TRANSITIONING -> COMPLETED}, with a transition to {@code FAILED} from any non-terminal
 * state.
 */
public enum DocumentState {
  PENDING,
  EXTRACTING,
  CHUNKING,
  EMBEDDING,
  WRITING,
  TRANSITIONING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /** Whether a document in this state may move to {@code next}. */
  public boolean canTransitionTo(DocumentState next) {
    if (isTerminal()) {
      return false;
    }
    return next == FAILED || next.ordinal() == ordinal() + 1;
  }
}
