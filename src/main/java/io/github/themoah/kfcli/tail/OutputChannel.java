package io.github.themoah.kfcli.tail;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded queue between the partition loops and the single writer.
 * Producers never block: {@link #offer} reports a full channel and the producer retries later.
 *
 * @param <T> item type
 */
public final class OutputChannel<T> {

  private final BlockingQueue<T> queue;
  private final int capacity;
  private volatile boolean closed;

  public OutputChannel(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
    }
    this.capacity = capacity;
    this.queue = new ArrayBlockingQueue<>(capacity);
  }

  /**
   * Offers an item without blocking.
   *
   * @return false if the channel is full
   * @throws IllegalStateException if the channel is closed
   */
  public boolean offer(T item) {
    if (closed) {
      throw new IllegalStateException("Output channel is closed");
    }
    return queue.offer(item);
  }

  /**
   * Takes the next item, waiting up to the timeout.
   *
   * @return the item, or empty if none arrived in time
   */
  public Optional<T> poll(Duration timeout) throws InterruptedException {
    return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
  }

  /**
   * Marks the channel closed. Items already queued can still be taken.
   */
  public void close() {
    closed = true;
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * True once the channel is closed and every queued item was taken.
   */
  public boolean isDrained() {
    return closed && queue.isEmpty();
  }

  public int size() {
    return queue.size();
  }

  public int capacity() {
    return capacity;
  }
}
