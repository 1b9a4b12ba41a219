package io.github.panghy.flowsim.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PromiseStreamTest {

  @Test
  void testBufferedValuesInOrder() {
    PromiseStream<Integer> stream = new PromiseStream<>();
    FutureStream<Integer> consumer = stream.getFutureStream();
    stream.send(1);
    stream.send(2);
    assertEquals(2, stream.size());
    assertEquals(1, consumer.take());
    assertEquals(2, consumer.poll());
    assertNull(consumer.poll());
  }

  @Test
  void testWaitingConsumerGetsValueDirectly() {
    PromiseStream<String> stream = new PromiseStream<>();
    CompletableFuture<String> next = stream.getFutureStream().nextAsync();
    CompletableFuture<Boolean> hasNext = stream.getFutureStream().hasNextAsync();
    assertFalse(next.isDone());

    stream.send("x");

    assertEquals("x", next.join());
    assertTrue(hasNext.join());
    assertEquals(0, stream.size());
  }

  @Test
  void testCloseDrainsBufferFirst() {
    PromiseStream<String> stream = new PromiseStream<>();
    FutureStream<String> consumer = stream.getFutureStream();
    stream.send("last");
    assertTrue(stream.close());
    assertFalse(stream.close());
    assertFalse(stream.send("late"));

    assertTrue(consumer.isClosed());
    assertEquals("last", consumer.take());
    assertThrows(StreamClosedException.class, consumer::take);
    assertFalse(consumer.hasNextAsync().join());
    assertTrue(consumer.onClose().isDone());
  }

  @Test
  void testCloseExceptionallyFailsWaiters() {
    PromiseStream<String> stream = new PromiseStream<>();
    CompletableFuture<String> next = stream.getFutureStream().nextAsync();
    IllegalStateException cause = new IllegalStateException("gone");

    stream.closeExceptionally(cause);

    ExecutionException e = assertThrows(ExecutionException.class, next::get);
    assertSame(cause, e.getCause());
    StreamClosedException closed = assertThrows(StreamClosedException.class,
        () -> stream.getFutureStream().take());
    assertSame(cause, closed.getCause());
    assertTrue(stream.getFutureStream().onClose().isCompletedExceptionally());
  }

  @Test
  @Timeout(value = 10, unit = TimeUnit.SECONDS)
  void testTakeBlocksUntilSend() throws InterruptedException {
    PromiseStream<Integer> stream = new PromiseStream<>();
    CompletableFuture<Integer> taken = CompletableFuture.supplyAsync(
        () -> stream.getFutureStream().take());
    Thread.sleep(50);
    assertFalse(taken.isDone());
    stream.send(42);
    assertThat(taken.join()).isEqualTo(42);
  }

  @Test
  void testStreamClosedExceptionCause() {
    Throwable cause = new RuntimeException("x");
    assertInstanceOf(RuntimeException.class, new StreamClosedException(cause).getCause());
    assertNull(new StreamClosedException().getCause());
  }
}
