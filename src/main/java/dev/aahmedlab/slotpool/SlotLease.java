package dev.aahmedlab.slotpool;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A checked-out slot that goes back to its pool when closed.
 *
 * <p>Closing a lease more than once has no effect, so a lease can never release its slot twice.
 *
 * @since 1.0.0
 */
public final class SlotLease implements AutoCloseable {
  private final SlotPool pool;
  private final int id;
  private final AtomicBoolean released = new AtomicBoolean(false);

  SlotLease(SlotPool pool, int id) {
    this.pool = pool;
    this.id = id;
  }

  /**
   * Returns the leased slot.
   *
   * @return the slot identifier
   * @since 1.0.0
   */
  public int id() {
    return id;
  }

  public boolean isReleased() {
    return released.get();
  }

  /**
   * Releases the slot back to the pool if this lease still holds it.
   *
   * @throws IllegalStateException if the pool was closed while the lease was held
   * @since 1.0.0
   */
  @Override
  public void close() {
    if (released.compareAndSet(false, true)) {
      pool.release(id);
    }
  }

  @Override
  public String toString() {
    return "SlotLease[id=" + id + ", released=" + released.get() + "]";
  }
}
