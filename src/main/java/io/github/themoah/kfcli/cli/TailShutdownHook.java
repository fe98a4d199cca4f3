package io.github.themoah.kfcli.cli;

import io.github.themoah.kfcli.tail.CancellationToken;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stops a running tail on Ctrl-C: cancels the token, waits for the writer to drain and the
 * clients to close, then ends the process with the tail's own exit code.
 */
final class TailShutdownHook {

  private static final Logger log = LoggerFactory.getLogger(TailShutdownHook.class);

  private final CancellationToken token;
  private final long waitMs;
  private final Thread thread;
  private final CountDownLatch finished = new CountDownLatch(1);
  private final AtomicInteger exitCode = new AtomicInteger(ExitCodes.OK);

  TailShutdownHook(CancellationToken token, long waitMs) {
    this.token = token;
    this.waitMs = waitMs;
    this.thread = new Thread(this::onShutdown, "kfcli-tail-shutdown");
  }

  void install() {
    Runtime.getRuntime().addShutdownHook(thread);
  }

  /**
   * Signals that the tail finished and resources are released.
   */
  void finished(int code) {
    exitCode.set(code);
    finished.countDown();
    try {
      Runtime.getRuntime().removeShutdownHook(thread);
    } catch (IllegalStateException e) {
      // JVM is already shutting down, the hook is running
      log.debug("Shutdown in progress, tail finished with exit code {}", code);
    }
  }

  private void onShutdown() {
    log.info("Shutdown requested, stopping tail");
    token.cancel();
    try {
      if (!finished.await(waitMs, TimeUnit.MILLISECONDS)) {
        log.warn("Tail did not stop within {}ms", waitMs);
        return;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return;
    }
    Runtime.getRuntime().halt(exitCode.get());
  }
}
