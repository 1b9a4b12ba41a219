package io.github.panghy.flowsim.core;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * The consumer side of a {@link PromiseStream}.
 *
 * <p>Clock workers block on {@link #take()} between commands; simulated processes
 * never block on a stream directly but suspend on {@link #nextAsync()} through the
 * clock so that delivery stays ordered with virtual time.</p>
 *
 * @param <T> The type of value provided by this stream
 */
public interface FutureStream<T> {

  /**
   * Returns a future for the next value. The future is already complete when a value
   * is buffered, and fails with the close cause once the stream is closed and drained.
   *
   * @return The future of the next value
   */
  CompletableFuture<T> nextAsync();

  /**
   * Returns a future that completes with true when a value is available and false when
   * the stream was closed normally and has been drained.
   *
   * @return The future indicating whether another value will arrive
   */
  CompletableFuture<Boolean> hasNextAsync();

  /**
   * Removes the next buffered value without waiting.
   *
   * @return The value, or null if none is buffered
   */
  T poll();

  /**
   * @return true if the producer closed the stream
   */
  boolean isClosed();

  /**
   * @return A future completing when the stream is closed
   */
  CompletableFuture<Void> onClose();

  /**
   * Blocks the calling thread until a value is available.
   *
   * @return The next value
   * @throws StreamClosedException if the stream is closed and drained
   */
  default T take() {
    try {
      return nextAsync().get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for stream", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof StreamClosedException) {
        throw (StreamClosedException) cause;
      }
      throw new StreamClosedException(cause);
    }
  }
}
