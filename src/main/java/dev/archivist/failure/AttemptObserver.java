package dev.archivist.failure;

/** Receives the 1-based attempt number each time a retried operation is invoked. */
@FunctionalInterface
public interface AttemptObserver {

  AttemptObserver NONE = attempt -> {};

  void attempted(int attempt);
}
