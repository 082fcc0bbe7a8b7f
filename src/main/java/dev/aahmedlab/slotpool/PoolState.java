package dev.aahmedlab.slotpool;

/**
 * Internal state of the slot pool. This enum is package-private and not part of the public API.
 * Use {@link SlotPool#isClosed()} to check pool state.
 */
enum PoolState {
  OPEN,
  CLOSED
}
