/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.ReentrantLock;
import org.querypipe.data.Tuple;

/**
 * The queue and signal state of one operator.
 *
 * <p>An exchange has two halves. The value half is a bounded ring buffer of items that producers
 * send into and the consumer reads from; it may be written by an operator other than its owner.
 * The operator half belongs to the owner alone and holds its stop flag and the completion signals
 * posted by its children.
 *
 * <p>Sending and receiving lock the value half of the other exchange, then the operator half of
 * the caller's own. Waiters queue on the value half and release both locks before blocking; a
 * thread that changes the state only wakes the first waiter, and the woken thread re-examines the
 * queue itself. Only that waiter's operator lock is taken to wake it, so no thread holds a lock
 * while another is blocked on a queue.
 */
public class ValueExchange {

  public static final int NO_CHILD = -1;

  private static final int HEARTBEAT_THRESHOLD =
      Math.min(Runtime.getRuntime().availableProcessors(), 16);

  /** An item, a child signal, or neither. */
  public record Received(Tuple item, int child, boolean ok) {
    static final Received STOPPED = new Received(null, NO_CHILD, false);
    static final Received END = new Received(null, NO_CHILD, true);
  }

  // value half
  private final ReentrantLock vLock = new ReentrantLock();
  private Tuple[] items;
  private int head;
  private int tail;
  private int count;
  private long size;
  private long maxSize;
  private int heartbeat;
  private boolean closed;
  private final ArrayDeque<ValueExchange> readWaiters = new ArrayDeque<>(2);
  private final ArrayDeque<ValueExchange> writeWaiters = new ArrayDeque<>(2);

  // operator half
  private final ReentrantLock oLock = new ReentrantLock();
  private volatile boolean stop;
  private final ArrayDeque<Integer> children = new ArrayDeque<>(4);
  private boolean mustSignal;
  private final Semaphore wakeUp = new Semaphore(0);
  private int memYields;
  private int beatYields;

  public ValueExchange(int capacity) {
    this.items = new Tuple[Math.max(1, capacity)];
  }

  public int capacity() {
    return items.length;
  }

  /**
   * Sends an item into {@code dest}, blocking while it is full. With a non zero quota the sender
   * also yields while the bytes queued in {@code dest} exceed the quota. An empty queue always
   * accepts an item.
   *
   * @return false if this exchange was stopped or {@code dest} closed
   */
  public boolean sendItem(ValueExchange dest, Tuple item, long quota) {
    if (stop) {
      return false;
    }
    dest.vLock.lock();
    oLock.lock();
    if (quota > 0) {
      dest.size += item.estimatedSize();
      if (dest.size > dest.maxSize) {
        dest.maxSize = dest.size;
      }
    }
    while (true) {
      if (stop) {
        oLock.unlock();
        dest.vLock.unlock();
        return false;
      }
      if (dest.closed) {
        oLock.unlock();
        signal(dest.readWaiters);
        signal(dest.writeWaiters);
        dest.vLock.unlock();
        return false;
      }

      // never throttle an empty queue, the consumer could be waiting on it
      if (dest.count == 0) {
        break;
      }
      if (dest.count >= dest.items.length) {
        await(dest, dest.writeWaiters);
        continue;
      }
      if (!dest.readWaiters.isEmpty()) {
        dest.heartbeat++;
        if (dest.heartbeat > HEARTBEAT_THRESHOLD) {
          beatYields++;
          await(dest, dest.writeWaiters);
          continue;
        }
      }
      if (quota != 0 && dest.size > quota) {
        memYields++;
        await(dest, dest.writeWaiters);
        continue;
      }
      break;
    }
    oLock.unlock();
    dest.items[dest.head] = item;
    dest.head = (dest.head + 1) % dest.items.length;
    dest.count++;
    signal(dest.readWaiters);
    if (dest.count < dest.items.length) {
      signal(dest.writeWaiters);
    }
    dest.vLock.unlock();
    return true;
  }

  /**
   * Receives the next item from {@code from}, blocking while it is empty.
   *
   * @return the item, or null if this exchange was stopped or {@code from} is closed and drained
   */
  public Tuple getItem(ValueExchange from) {
    Received received = receive(from, false);
    return received.item();
  }

  /**
   * Receives the next item from {@code from} or the next child signal posted to this exchange,
   * whichever comes first. A stop takes precedence over child signals, which take precedence over
   * items.
   */
  public Received getItemChildren(ValueExchange from) {
    return receive(from, true);
  }

  private Received receive(ValueExchange from, boolean withChildren) {
    if (stop) {
      return Received.STOPPED;
    }
    from.vLock.lock();
    oLock.lock();
    while (true) {
      if (stop) {
        oLock.unlock();
        from.vLock.unlock();
        return Received.STOPPED;
      }
      if (withChildren && !children.isEmpty()) {
        int child = children.pollFirst();
        oLock.unlock();
        from.vLock.unlock();
        return new Received(null, child, true);
      }
      if (from.count > 0) {
        break;
      }
      if (from.closed) {
        oLock.unlock();
        signal(from.readWaiters);
        signal(from.writeWaiters);
        from.vLock.unlock();
        return Received.END;
      }
      await(from, from.readWaiters);
    }
    oLock.unlock();
    Tuple item = from.items[from.tail];
    from.items[from.tail] = null;
    from.tail = (from.tail + 1) % from.items.length;
    from.count--;
    if (from.size > 0) {
      from.size = Math.max(0, from.size - item.estimatedSize());
    }
    from.heartbeat = 0;
    signal(from.writeWaiters);
    if (from.count > 0) {
      signal(from.readWaiters);
    }
    from.vLock.unlock();
    return new Received(item, NO_CHILD, true);
  }

  /** Items queued in {@code from}. */
  public int queuedItems(ValueExchange from) {
    from.vLock.lock();
    try {
      return from.count;
    } finally {
      from.vLock.unlock();
    }
  }

  /** Queues this exchange on {@code queue} and blocks until signalled. Entered and left locked. */
  private void await(ValueExchange other, ArrayDeque<ValueExchange> queue) {
    mustSignal = true;
    queue.addLast(this);
    oLock.unlock();
    other.vLock.unlock();
    wakeUp.acquireUninterruptibly();
    other.vLock.lock();
    oLock.lock();
    queue.remove(this);
  }

  private static void signal(ArrayDeque<ValueExchange> queue) {
    ValueExchange waiter = queue.peekFirst();
    if (waiter != null) {
      waiter.wake();
    }
  }

  private void wake() {
    oLock.lock();
    try {
      if (mustSignal) {
        mustSignal = false;
        wakeUp.release();
      }
    } finally {
      oLock.unlock();
    }
  }

  /** Marks the queue closed: readers drain it and then see the end, writers fail. */
  public void close() {
    vLock.lock();
    try {
      closed = true;
      signal(readWaiters);
      signal(writeWaiters);
    } finally {
      vLock.unlock();
    }
  }

  /**
   * Waits for the next child signal, ignoring stops. Blocks forever if no child is left to send
   * one.
   */
  public int retrieveChildNoStop() {
    oLock.lock();
    try {
      while (children.isEmpty()) {
        mustSignal = true;
        oLock.unlock();
        wakeUp.acquireUninterruptibly();
        oLock.lock();
      }
      return children.pollFirst();
    } finally {
      oLock.unlock();
    }
  }

  /**
   * Waits for the next child signal.
   *
   * @return the child's bit, or {@link #NO_CHILD} if a stop arrived first
   */
  public int retrieveChild() {
    if (stop) {
      return NO_CHILD;
    }
    oLock.lock();
    try {
      while (true) {
        if (stop) {
          return NO_CHILD;
        }
        if (!children.isEmpty()) {
          return children.pollFirst();
        }
        mustSignal = true;
        oLock.unlock();
        wakeUp.acquireUninterruptibly();
        oLock.lock();
      }
    } finally {
      oLock.unlock();
    }
  }

  /** Posts a child completion signal. Never blocks. */
  public void sendChild(int child) {
    oLock.lock();
    try {
      children.addLast(child);
      if (mustSignal) {
        mustSignal = false;
        wakeUp.release();
      }
    } finally {
      oLock.unlock();
    }
  }

  /** Posts a stop. Never blocks; posting again while one is pending has no further effect. */
  public void sendStop() {
    oLock.lock();
    try {
      stop = true;
      if (mustSignal) {
        mustSignal = false;
        wakeUp.release();
      }
    } finally {
      oLock.unlock();
    }
  }

  public boolean isStopped() {
    return stop;
  }

  /** True while the owner is blocked on this exchange. */
  public boolean isWaiting() {
    oLock.lock();
    try {
      return mustSignal;
    } finally {
      oLock.unlock();
    }
  }

  /** Back to the initial state. No reader or writer may be active. */
  public void reset() {
    vLock.lock();
    oLock.lock();
    try {
      stop = false;
      closed = false;
      drain();
      children.clear();
      size = 0;
      heartbeat = 0;
      wakeUp.drainPermits();
      mustSignal = false;
    } finally {
      oLock.unlock();
      vLock.unlock();
    }
  }

  /** Recycles queued items and drops the buffer. */
  public void dispose() {
    vLock.lock();
    try {
      drain();
      items = new Tuple[1];
    } finally {
      vLock.unlock();
    }
  }

  private void drain() {
    while (count > 0) {
      items[tail].recycle();
      items[tail] = null;
      tail = (tail + 1) % items.length;
      count--;
    }
    Arrays.fill(items, null);
    head = 0;
    tail = 0;
  }

  /** Largest number of bytes queued, tracked only when producers throttle on a quota. */
  public long getMaxSize() {
    return maxSize;
  }

  public int getMemYields() {
    return memYields;
  }

  public int getBeatYields() {
    return beatYields;
  }
}
