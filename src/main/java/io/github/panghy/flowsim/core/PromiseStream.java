package io.github.panghy.flowsim.core;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;

/**
 * An unbounded multi-producer channel. Values are handed directly to a waiting
 * consumer future or buffered in send order.
 *
 * <p>Each worker clock owns two of these (master to worker and worker to master);
 * the real-time clock uses one as its command mailbox.</p>
 *
 * @param <T> The type of value flowing through this stream
 */
public class PromiseStream<T> {

  private final Object lock = new Object();
  private final Queue<T> buffer = new ArrayDeque<>();
  private final Queue<CompletableFuture<T>> nextFutures = new ArrayDeque<>();
  private final Queue<CompletableFuture<Boolean>> hasNextFutures = new ArrayDeque<>();
  private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();
  private final FutureStream<T> futureStream = new Consumer();
  private boolean closed;
  private Throwable closeException;

  /**
   * Gets the consumer view of this stream.
   *
   * @return The FutureStream for this stream
   */
  public FutureStream<T> getFutureStream() {
    return futureStream;
  }

  /**
   * Sends a value. A pending consumer future gets it directly; otherwise it is buffered.
   *
   * @param value The value to send
   * @return true if accepted, false if the stream is closed
   */
  public boolean send(T value) {
    CompletableFuture<T> waiting;
    Queue<CompletableFuture<Boolean>> hasNext;
    synchronized (lock) {
      if (closed) {
        return false;
      }
      waiting = nextFutures.poll();
      if (waiting == null) {
        buffer.add(value);
      }
      hasNext = new ArrayDeque<>(hasNextFutures);
      hasNextFutures.clear();
    }
    // complete outside the lock, the consumer may send right back
    if (waiting != null) {
      waiting.complete(value);
    }
    hasNext.forEach(f -> f.complete(true));
    return true;
  }

  /**
   * Closes the stream normally. Buffered values remain readable.
   *
   * @return true if this call closed the stream
   */
  public boolean close() {
    return closeExceptionally(new StreamClosedException());
  }

  /**
   * Closes the stream with a cause. Waiting consumers fail with it once the buffer is drained.
   *
   * @param exception The cause delivered to waiting consumers
   * @return true if this call closed the stream
   */
  public boolean closeExceptionally(Throwable exception) {
    Queue<CompletableFuture<T>> next;
    Queue<CompletableFuture<Boolean>> hasNext;
    synchronized (lock) {
      if (closed) {
        return false;
      }
      closed = true;
      closeException = exception;
      next = new ArrayDeque<>(nextFutures);
      hasNext = new ArrayDeque<>(hasNextFutures);
      nextFutures.clear();
      hasNextFutures.clear();
    }
    next.forEach(f -> f.completeExceptionally(exception));
    hasNext.forEach(f -> f.complete(false));
    if (exception instanceof StreamClosedException) {
      closeFuture.complete(null);
    } else {
      closeFuture.completeExceptionally(exception);
    }
    return true;
  }

  public boolean isClosed() {
    synchronized (lock) {
      return closed;
    }
  }

  /**
   * @return The number of buffered, unconsumed values
   */
  public int size() {
    synchronized (lock) {
      return buffer.size();
    }
  }

  private class Consumer implements FutureStream<T> {

    @Override
    public CompletableFuture<T> nextAsync() {
      synchronized (lock) {
        T value = buffer.poll();
        if (value != null) {
          return CompletableFuture.completedFuture(value);
        }
        if (closed) {
          return CompletableFuture.failedFuture(closeException);
        }
        CompletableFuture<T> future = new CompletableFuture<>();
        nextFutures.add(future);
        return future;
      }
    }

    @Override
    public CompletableFuture<Boolean> hasNextAsync() {
      synchronized (lock) {
        if (!buffer.isEmpty()) {
          return CompletableFuture.completedFuture(true);
        }
        if (closed) {
          if (!(closeException instanceof StreamClosedException)) {
            return CompletableFuture.failedFuture(closeException);
          }
          return CompletableFuture.completedFuture(false);
        }
        CompletableFuture<Boolean> future = new CompletableFuture<>();
        hasNextFutures.add(future);
        return future;
      }
    }

    @Override
    public T poll() {
      synchronized (lock) {
        return buffer.poll();
      }
    }

    @Override
    public boolean isClosed() {
      return PromiseStream.this.isClosed();
    }

    @Override
    public CompletableFuture<Void> onClose() {
      return closeFuture;
    }
  }
}
