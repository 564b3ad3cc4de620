package com.cardtally.engine.store;

import com.cardtally.common.model.Suit;
import com.cardtally.common.model.TallySnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CounterStoreTest {

    private final CounterStore store = new CounterStore();

    @Test
    @DisplayName("increment reflects +n on one suit and leaves the others")
    void incrementOneSuit() {
        store.increment("c1", Suit.CLUBS, 2);
        store.increment("c1", Suit.CLUBS, 3);

        TallySnapshot now = store.get("c1");
        assertEquals(5, now.count(Suit.CLUBS));
        assertEquals(0, now.count(Suit.HEARTS));
        assertEquals(0, now.count(Suit.DIAMONDS));
        assertEquals(0, now.count(Suit.SPADES));
    }

    @Test
    @DisplayName("channels are independent")
    void channelsIsolated() {
        store.increment("c1", Suit.HEARTS, 1);
        store.increment("c2", Suit.HEARTS, 7);

        assertEquals(1, store.get("c1").count(Suit.HEARTS));
        assertEquals(7, store.get("c2").count(Suit.HEARTS));
    }

    @Test
    @DisplayName("snapshotAndReset returns the pre-call mapping and zeroes the channel")
    void snapshotAndReset() {
        store.incrementAll("c1", Map.of(Suit.HEARTS, 2, Suit.DIAMONDS, 1));

        TallySnapshot before = store.snapshotAndReset("c1");

        assertEquals(2, before.count(Suit.HEARTS));
        assertEquals(1, before.count(Suit.DIAMONDS));
        assertTrue(store.get("c1").isEmpty());
    }

    @Test
    @DisplayName("unknown channel reads as all zeros")
    void unknownChannel() {
        assertTrue(store.get("nobody").isEmpty());
        assertTrue(store.snapshotAndReset("nobody").isEmpty());
    }

    @Test
    @DisplayName("non-positive amounts are rejected")
    void rejectsNonPositive() {
        assertThrows(IllegalArgumentException.class, () -> store.increment("c1", Suit.SPADES, 0));
        assertThrows(IllegalArgumentException.class, () -> store.incrementAll("c1", Map.of(Suit.SPADES, -1)));
        assertTrue(store.get("c1").isEmpty());
    }

    @Test
    @DisplayName("increments racing resets are never lost")
    void concurrentIncrementsAndResets() throws Exception {
        int writers = 4;
        int perWriter = 5_000;
        ExecutorService pool = Executors.newFixedThreadPool(writers + 1);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < perWriter; i++) {
                        store.increment("c1", Suit.HEARTS, 1);
                    }
                    return null;
                }));
            }
            Future<Long> drained = pool.submit(() -> {
                go.await();
                long sum = 0;
                for (int i = 0; i < 200; i++) {
                    sum += store.snapshotAndReset("c1").count(Suit.HEARTS);
                }
                return sum;
            });

            go.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
            long total = drained.get(30, TimeUnit.SECONDS) + store.get("c1").count(Suit.HEARTS);

            assertEquals((long) writers * perWriter, total);
        } finally {
            pool.shutdownNow();
        }
    }
}
