package io.ringcluster.cluster.timer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ring of {@code size} buckets, one per tick. An entry inserted now is reported by the
 * {@code size}-th following {@link #expire()} unless it is removed first, so the timeout window is
 * {@code size * tick} with an accuracy of one tick.
 * <p>
 * Callers keep the slot returned by {@link #insert(Object)} and hand it back on removal, which keeps
 * every operation O(1). Not thread-safe.
 */
public final class TimingWheel<T> {

    private final List<Set<T>> slots;
    private int current;

    public TimingWheel(final int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be > 0");
        }
        this.slots = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            slots.add(new HashSet<>());
        }
    }

    public int size() {
        return slots.size();
    }

    /**
     * Places {@code key} in the freshest bucket, the one that expires last.
     *
     * @return slot index to pass to {@link #remove(Object, int)}
     */
    public int insert(final T key) {
        final int slot = current == 0 ? slots.size() - 1 : current - 1;
        slots.get(slot).add(key);
        return slot;
    }

    /** @return true if the key was in the given slot */
    public boolean remove(final T key, final int slot) {
        if (slot < 0 || slot >= slots.size()) return false;
        return slots.get(slot).remove(key);
    }

    /** Removes and re-inserts, i.e. restarts the timeout window for {@code key}. */
    public int reset(final T key, final int slot) {
        remove(key, slot);
        return insert(key);
    }

    /**
     * Advances the wheel one tick.
     *
     * @return every key left in the bucket that just went past its window
     */
    public Set<T> expire() {
        final Set<T> expired = slots.get(current);
        slots.set(current, new HashSet<>());
        current = (current + 1) % slots.size();
        return expired;
    }
}
