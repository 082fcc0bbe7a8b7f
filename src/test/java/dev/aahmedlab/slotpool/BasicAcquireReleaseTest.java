package dev.aahmedlab.slotpool;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class BasicAcquireReleaseTest {

  private SlotPool pool;

  @AfterEach
  void tearDown() {
    if (pool != null) {
      pool.close();
    }
  }

  @Test
  void singleSlotRoundTrips() throws Exception {
    pool = SlotPool.create(1);

    assertEquals(0, pool.acquire());
    pool.release(0);
    assertEquals(0, pool.acquire());
  }

  @Test
  void initialSlotsComeOutAscending() throws Exception {
    pool = SlotPool.create(3);

    assertEquals(0, pool.acquire());
    assertEquals(1, pool.acquire());
    assertEquals(2, pool.acquire());
    assertEquals(0, pool.availableCount());
  }

  @Test
  void releasedSlotsComeBackInReleaseOrder() throws Exception {
    pool = SlotPool.create(4);
    SlotPoolTestSupport.drain(pool);

    pool.release(2);
    pool.release(0);
    pool.release(3);
    pool.release(1);

    assertEquals(List.of(2, 0, 3, 1), pool.availableSnapshot());
    assertEquals(2, pool.acquire());
    assertEquals(0, pool.acquire());
    assertEquals(3, pool.acquire());
    assertEquals(1, pool.acquire());
  }

  @Test
  void releasedSlotQueuesBehindNeverUsedSlots() throws Exception {
    pool = SlotPool.create(3);

    int first = pool.acquire();
    pool.release(first);

    // 1 and 2 were never handed out and are still ahead of 0
    assertEquals(List.of(1, 2, 0), pool.availableSnapshot());
    assertEquals(1, pool.acquire());
  }

  @Test
  void tryAcquireReturnsNoSlotWhenExhausted() throws Exception {
    pool = SlotPool.create(2);

    assertEquals(0, pool.tryAcquire());
    assertEquals(1, pool.tryAcquire());
    assertEquals(SlotPool.NO_SLOT, pool.tryAcquire());

    pool.release(1);
    assertEquals(1, pool.tryAcquire());
  }

  @Test
  void countersTrackCheckedOutSlots() throws Exception {
    pool = SlotPool.create(3);

    assertEquals(3, pool.capacity());
    assertEquals(3, pool.availableCount());
    assertEquals(0, pool.checkedOutCount());

    int id = pool.acquire();
    assertTrue(pool.isCheckedOut(id));
    assertEquals(2, pool.availableCount());
    assertEquals(1, pool.checkedOutCount());

    pool.release(id);
    assertFalse(pool.isCheckedOut(id));
    assertEquals(3, pool.availableCount());
    assertEquals(0, pool.checkedOutCount());
  }

  @Test
  void newPoolIsOpen() {
    pool = SlotPool.create(1);

    assertEquals(PoolState.OPEN, pool.getPoolState());
    assertFalse(pool.isClosed());
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new SlotPool(0));
    assertThrows(IllegalArgumentException.class, () -> SlotPool.create(-3));
  }

  @Test
  void forAvailableProcessorsMatchesProcessorCount() {
    pool = SlotPool.forAvailableProcessors();

    assertEquals(Runtime.getRuntime().availableProcessors(), pool.capacity());
    assertEquals(pool.capacity(), pool.availableCount());
  }

  @Test
  void independentPoolsDoNotShareSlots() throws Exception {
    pool = SlotPool.create(1);
    try (SlotPool other = SlotPool.create(1)) {
      assertEquals(0, pool.acquire());
      assertEquals(0, other.acquire());
      assertEquals(SlotPool.NO_SLOT, pool.tryAcquire());
      assertEquals(SlotPool.NO_SLOT, other.tryAcquire());
    }
  }
}
