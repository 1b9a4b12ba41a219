package io.github.panghy.flowsim.core;

/**
 * Thrown when a value is requested from a closed channel, for instance a worker
 * mailbox after the worker was collapsed.
 */
public class StreamClosedException extends RuntimeException {

  public StreamClosedException() {
    super("Stream has been closed");
  }

  /**
   * @param cause The fault the stream was closed with
   */
  public StreamClosedException(Throwable cause) {
    super("Stream has been closed: " + cause.getMessage(), cause);
  }
}
