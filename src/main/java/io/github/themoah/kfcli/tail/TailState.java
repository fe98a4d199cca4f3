package io.github.themoah.kfcli.tail;

/**
 * Lifecycle of a tail.
 */
public enum TailState {
  IDLE,
  SUBSCRIBED,
  POLLING,
  EMITTING,
  /** Terminal. */
  STOPPED
}
