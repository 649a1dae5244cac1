package io.ringcluster.cluster.timer;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class TimingWheelTest {

    @Test
    void rejectsEmptyWheel() {
        assertThrows(IllegalArgumentException.class, () -> new TimingWheel<Long>(0));
    }

    @Test
    void expiresExactlyOnceAfterFullWindow() {
        final TimingWheel<Long> wheel = new TimingWheel<>(5);
        wheel.insert(1L);

        for (int i = 0; i < 4; i++) {
            assertEquals(Set.of(), wheel.expire(), "tick " + i);
        }
        assertEquals(Set.of(1L), wheel.expire());

        for (int i = 0; i < 10; i++) {
            assertEquals(Set.of(), wheel.expire(), "reported twice at tick " + i);
        }
    }

    @Test
    void entryResetEveryTickNeverExpires() {
        final TimingWheel<Long> wheel = new TimingWheel<>(3);
        int slot = wheel.insert(7L);

        for (int i = 0; i < 50; i++) {
            assertFalse(wheel.expire().contains(7L));
            slot = wheel.reset(7L, slot);
        }
    }

    @Test
    void removedEntryIsNotReported() {
        final TimingWheel<Long> wheel = new TimingWheel<>(2);
        final int slot = wheel.insert(3L);
        assertTrue(wheel.remove(3L, slot));
        assertFalse(wheel.remove(3L, slot));

        assertEquals(Set.of(), wheel.expire());
        assertEquals(Set.of(), wheel.expire());
    }

    @Test
    void entriesInsertedAtDifferentTicksExpireInOrder() {
        final TimingWheel<Long> wheel = new TimingWheel<>(3);
        wheel.insert(1L);
        wheel.expire();
        wheel.insert(2L);

        assertEquals(Set.of(), wheel.expire());
        assertEquals(Set.of(1L), wheel.expire());
        assertEquals(Set.of(2L), wheel.expire());
    }

    @Test
    void removeWithOutOfRangeSlotIsIgnored() {
        final TimingWheel<Long> wheel = new TimingWheel<>(2);
        assertFalse(wheel.remove(1L, -1));
        assertFalse(wheel.remove(1L, 2));
    }
}
