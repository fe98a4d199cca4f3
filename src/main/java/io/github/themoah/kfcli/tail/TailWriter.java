package io.github.themoah.kfcli.tail;

import io.github.themoah.kfcli.model.TailMessage;
import java.io.PrintWriter;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single consumer of the output channel: prints one line per message on the calling thread.
 */
public class TailWriter {

  private static final Logger log = LoggerFactory.getLogger(TailWriter.class);

  private static final Duration POLL_INTERVAL = Duration.ofMillis(100);

  private final OutputChannel<TailMessage> channel;
  private final MessageFormatter formatter;
  private final PrintWriter out;

  public TailWriter(OutputChannel<TailMessage> channel, MessageFormatter formatter, PrintWriter out) {
    this.channel = channel;
    this.formatter = formatter;
    this.out = out;
  }

  /**
   * Blocks until the channel is closed and drained.
   *
   * @return number of lines written
   */
  public long run() {
    long written = 0;
    try {
      while (!channel.isDrained()) {
        Optional<TailMessage> next = channel.poll(POLL_INTERVAL);
        if (next.isPresent()) {
          out.println(formatter.format(next.get()));
          written++;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Tail writer interrupted after {} messages", written);
    }
    out.flush();
    log.debug("Tail writer finished, {} messages written", written);
    return written;
  }
}
