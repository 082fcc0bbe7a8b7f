package dev.aahmedlab.slotpool;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A bounded blocking pool of integer slot identifiers.
 *
 * <p>The pool hands out the identifiers {@code 0 .. capacity-1} to concurrently running units of
 * work, one identifier per holder. {@link #acquire()} blocks while every identifier is checked
 * out; {@link #release(int)} puts an identifier back at the tail of the free list and wakes one
 * blocked caller. Identifiers are handed out in the order they became free, starting with the
 * ascending initial order.
 *
 * <p>Identifier order is FIFO, caller order is not: when several threads are blocked, the one that
 * gets the next released identifier is up to the lock, and a thread arriving at that moment may
 * take it first.
 *
 * <p>The pool never spawns threads. Callers must not hold one slot while blocking for another
 * unless the capacity covers the whole nesting; otherwise the pool can starve itself. Prefer
 * {@link #lease()} or {@link #runWithSlot(IntConsumer)} which release on every exit path.
 *
 * @author Abdullah Ahmed
 * @since 1.0.0
 */
public final class SlotPool implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(SlotPool.class);

  /**
   * Returned by {@link #tryAcquire()} when no slot is free.
   *
   * @since 1.0.0
   */
  public static final int NO_SLOT = -1;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition slotAvailable = lock.newCondition();
  private final int capacity;
  private final Deque<Integer> available;
  private final boolean[] checkedOut;
  private int checkedOutCount;
  private PoolState state;

  /**
   * Creates a pool with every identifier in {@code [0, capacity)} available, in ascending order.
   *
   * @param capacity the number of slots
   * @throws IllegalArgumentException if capacity is less than or equal to 0
   * @since 1.0.0
   */
  public SlotPool(int capacity) {
    if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
    this.capacity = capacity;
    this.available = new ArrayDeque<>(capacity);
    this.checkedOut = new boolean[capacity];
    for (int i = 0; i < capacity; i++) {
      available.addLast(i);
    }
    this.state = PoolState.OPEN;
    logger.debug("Created slot pool with capacity {}", capacity);
  }

  /**
   * Creates a pool with the given number of slots.
   *
   * @param capacity the number of slots
   * @return a new SlotPool instance
   * @throws IllegalArgumentException if capacity is less than or equal to 0
   * @since 1.0.0
   */
  public static SlotPool create(int capacity) {
    return new SlotPool(capacity);
  }

  /**
   * Creates a pool with one slot per available processor, matching the worker count of a
   * CPU-bound executor.
   *
   * @return a new SlotPool instance
   * @since 1.0.0
   */
  public static SlotPool forAvailableProcessors() {
    return new SlotPool(Runtime.getRuntime().availableProcessors());
  }

  /**
   * Takes the earliest freed slot, blocking until one is available.
   *
   * @return a slot identifier in {@code [0, capacity)}
   * @throws InterruptedException if the thread is interrupted while waiting
   * @throws IllegalStateException if the pool is closed, before or during the wait
   * @since 1.0.0
   */
  public int acquire() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      ensureOpen();
      while (available.isEmpty()) {
        slotAvailable.await();
        ensureOpen();
      }
      return checkOut();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Takes the earliest freed slot, waiting at most the given time for one to become available.
   *
   * @param timeout the maximum time to wait
   * @param unit the time unit of the timeout argument
   * @return a slot identifier in {@code [0, capacity)}
   * @throws InterruptedException if the thread is interrupted while waiting
   * @throws TimeoutException if no slot became available in time
   * @throws IllegalStateException if the pool is closed, before or during the wait
   * @since 1.0.0
   */
  public int acquire(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
    long remainingNanos = unit.toNanos(timeout);
    lock.lockInterruptibly();
    try {
      ensureOpen();
      while (available.isEmpty()) {
        if (remainingNanos <= 0) {
          throw new TimeoutException("No slot available within " + timeout + " " + unit);
        }
        remainingNanos = slotAvailable.awaitNanos(remainingNanos);
        ensureOpen();
      }
      return checkOut();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Takes the earliest freed slot if one is available right now.
   *
   * @return a slot identifier, or {@link #NO_SLOT} if every slot is checked out
   * @throws IllegalStateException if the pool is closed
   * @since 1.0.0
   */
  @SuppressFBWarnings(
      value = "CWO_CLOSED_WITHOUT_OPENED",
      justification = "Lock is properly acquired before the try block and released in finally")
  public int tryAcquire() {
    lock.lock();
    try {
      ensureOpen();
      if (available.isEmpty()) {
        return NO_SLOT;
      }
      return checkOut();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns a slot to the pool and wakes one blocked acquirer.
   *
   * @param id a slot previously returned by an acquire call and not yet released
   * @throws IllegalArgumentException if id is outside {@code [0, capacity)}
   * @throws IllegalStateException if id is not checked out or the pool is closed
   * @since 1.0.0
   */
  @SuppressFBWarnings(
      value = "CWO_CLOSED_WITHOUT_OPENED",
      justification = "Lock is properly acquired before the try block and released in finally")
  public void release(int id) {
    if (id < 0 || id >= capacity) {
      logger.warn("Rejected release of slot {} outside [0, {})", id, capacity);
      throw new IllegalArgumentException("slot " + id + " is outside [0, " + capacity + ")");
    }
    lock.lock();
    try {
      ensureOpen();
      if (!checkedOut[id]) {
        logger.warn("Rejected release of slot {} which is not checked out", id);
        throw new IllegalStateException("slot " + id + " is not checked out");
      }
      checkedOut[id] = false;
      checkedOutCount--;
      available.addLast(id);
      // one slot in, one waiter out
      slotAvailable.signal();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Acquires a slot wrapped in a lease that releases it when closed. Intended for
   * try-with-resources.
   *
   * @return a lease holding the acquired slot
   * @throws InterruptedException if the thread is interrupted while waiting
   * @throws IllegalStateException if the pool is closed
   * @since 1.0.0
   */
  public SlotLease lease() throws InterruptedException {
    return new SlotLease(this, acquire());
  }

  /**
   * Acquires a slot wrapped in a lease, waiting at most the given time.
   *
   * @param timeout the maximum time to wait
   * @param unit the time unit of the timeout argument
   * @return a lease holding the acquired slot
   * @throws InterruptedException if the thread is interrupted while waiting
   * @throws TimeoutException if no slot became available in time
   * @throws IllegalStateException if the pool is closed
   * @since 1.0.0
   */
  public SlotLease lease(long timeout, TimeUnit unit)
      throws InterruptedException, TimeoutException {
    return new SlotLease(this, acquire(timeout, unit));
  }

  /**
   * Runs the work while holding a slot. The slot is released however the work exits.
   *
   * @param work receives the acquired slot
   * @throws InterruptedException if the thread is interrupted while waiting for a slot
   * @since 1.0.0
   */
  public void runWithSlot(IntConsumer work) throws InterruptedException {
    if (work == null) throw new NullPointerException("work");
    try (SlotLease lease = lease()) {
      work.accept(lease.id());
    }
  }

  /**
   * Calls the task while holding a slot and returns its result. The slot is released however the
   * task exits; exceptions thrown by the task propagate unchanged.
   *
   * @param task receives the acquired slot
   * @param <T> the result type
   * @return the task's result
   * @throws Exception whatever the task throws, or InterruptedException while waiting for a slot
   * @since 1.0.0
   */
  public <T> T callWithSlot(SlotTask<T> task) throws Exception {
    if (task == null) throw new NullPointerException("task");
    try (SlotLease lease = lease()) {
      return task.call(lease.id());
    }
  }

  /**
   * Closes the pool. Blocked acquirers wake up and fail with {@link IllegalStateException}; any
   * later acquire or release fails the same way. Closing an already closed pool has no effect.
   *
   * @since 1.0.0
   */
  @Override
  public void close() {
    lock.lock();
    try {
      if (state == PoolState.CLOSED) {
        return;
      }
      state = PoolState.CLOSED;
      if (checkedOutCount > 0) {
        logger.warn("Closing slot pool with {} slot(s) still checked out", checkedOutCount);
      }
      available.clear();
      slotAvailable.signalAll();
    } finally {
      lock.unlock();
    }
    logger.debug("Closed slot pool with capacity {}", capacity);
  }

  /**
   * Returns the number of slots this pool was created with.
   *
   * @return the capacity
   * @since 1.0.0
   */
  public int capacity() {
    return capacity;
  }

  /**
   * Returns the number of slots that can be acquired without blocking.
   *
   * @return the number of free slots
   * @since 1.0.0
   */
  public int availableCount() {
    lock.lock();
    try {
      return available.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of slots currently held by callers.
   *
   * @return the number of checked-out slots
   * @since 1.0.0
   */
  public int checkedOutCount() {
    lock.lock();
    try {
      return checkedOutCount;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns true if the slot is currently held by a caller.
   *
   * @param id the slot to check
   * @return true if the slot is checked out
   * @throws IllegalArgumentException if id is outside {@code [0, capacity)}
   * @since 1.0.0
   */
  public boolean isCheckedOut(int id) {
    if (id < 0 || id >= capacity) {
      throw new IllegalArgumentException("slot " + id + " is outside [0, " + capacity + ")");
    }
    lock.lock();
    try {
      return checkedOut[id];
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the free slots in the order they will be handed out.
   *
   * @return a copy of the free list
   * @since 1.0.0
   */
  public List<Integer> availableSnapshot() {
    lock.lock();
    try {
      return new ArrayList<>(available);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns true if this pool has been closed.
   *
   * @return true if this pool has been closed
   * @since 1.0.0
   */
  public boolean isClosed() {
    lock.lock();
    try {
      return state == PoolState.CLOSED;
    } finally {
      lock.unlock();
    }
  }

  PoolState getPoolState() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  // Caller must hold the lock.
  private void ensureOpen() {
    if (state == PoolState.CLOSED) {
      throw new IllegalStateException("slot pool is closed");
    }
  }

  // Caller must hold the lock and have checked that a slot is available.
  private int checkOut() {
    int id = available.removeFirst();
    checkedOut[id] = true;
    checkedOutCount++;
    return id;
  }
}
