package io.github.themoah.kfcli.tail;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal shared between the caller and a running tail.
 * Safe to cancel from any thread, including a shutdown hook.
 */
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  /**
   * Requests cancellation.
   *
   * @return true if this call changed the token, false if it was already cancelled
   */
  public boolean cancel() {
    return cancelled.compareAndSet(false, true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
