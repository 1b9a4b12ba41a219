package io.github.panghy.flowsim.resource;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.NoSuchElementException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A bounded deque for cooperative use by simulated processes, for instance a queue of
 * customers or a pool of servers.
 *
 * <p>The deque itself is not synchronized. Code sharing a resource across threads must
 * bracket its operations with {@link #lock()} and {@link #unlock()}.</p>
 *
 * @param <T> The element type
 */
public class Resource<T> {

  private final Deque<T> items = new ArrayDeque<>();
  private final ReentrantLock lock = new ReentrantLock();
  private final int capacity;

  /**
   * Creates an unbounded resource.
   */
  public Resource() {
    this(Integer.MAX_VALUE);
  }

  /**
   * @param capacity The maximum number of items, at least 1
   */
  public Resource(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("Capacity must be at least 1: " + capacity);
    }
    this.capacity = capacity;
  }

  /**
   * Appends an item at the back.
   *
   * @param item The item
   * @throws IllegalStateException if the resource is full
   */
  public void push(T item) {
    checkNotFull();
    items.addLast(item);
  }

  /**
   * Inserts an item at the front.
   *
   * @param item The item
   * @throws IllegalStateException if the resource is full
   */
  public void pushFirst(T item) {
    checkNotFull();
    items.addFirst(item);
  }

  private void checkNotFull() {
    if (isFull()) {
      throw new IllegalStateException("Resource is full, capacity " + capacity);
    }
  }

  /**
   * Removes the item at the back.
   *
   * @throws NoSuchElementException if the resource is empty
   */
  public T pop() {
    return items.removeLast();
  }

  /**
   * Removes the item at the front.
   *
   * @throws NoSuchElementException if the resource is empty
   */
  public T popFirst() {
    return items.removeFirst();
  }

  public T first() {
    return items.getFirst();
  }

  public T last() {
    return items.getLast();
  }

  public int size() {
    return items.size();
  }

  public int getCapacity() {
    return capacity;
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  public boolean isFull() {
    return items.size() >= capacity;
  }

  /**
   * @return true if an item can be taken
   */
  public boolean isReady() {
    return !items.isEmpty();
  }

  public void clear() {
    items.clear();
  }

  public void lock() {
    lock.lock();
  }

  public void unlock() {
    lock.unlock();
  }

  public boolean tryLock() {
    return lock.tryLock();
  }

  public boolean isLocked() {
    return lock.isLocked();
  }

  @Override
  public String toString() {
    return "Resource{size=" + items.size() + ", capacity=" + capacity + '}';
  }
}
