package dev.aahmedlab.slotpool;

/**
 * A unit of work that runs while holding a slot.
 *
 * @param <T> the result type
 * @since 1.0.0
 */
@FunctionalInterface
public interface SlotTask<T> {
  T call(int slot) throws Exception;
}
