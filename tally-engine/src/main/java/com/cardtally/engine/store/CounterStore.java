package com.cardtally.engine.store;

import com.cardtally.common.model.Suit;
import com.cardtally.common.model.TallySnapshot;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-channel suit counters.
 *
 * <p>Each channel's record is created lazily on first write and guarded by its own
 * monitor, so increments and {@link #snapshotAndReset} on the same channel are
 * serialized: a reset observes every increment that completed before it and none that
 * start after it. Channels never contend with each other.
 */
public class CounterStore {

    private final ConcurrentHashMap<String, ChannelCounters> channels = new ConcurrentHashMap<>();

    /**
     * Adds {@code amount} to one suit.
     *
     * @return the channel's counters immediately after the increment
     * @throws IllegalArgumentException if {@code amount} is not positive
     */
    public TallySnapshot increment(String channel, Suit suit, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive, got " + amount);
        }
        return record(channel).add(Map.of(suit, amount));
    }

    /**
     * Applies several suit increments as one step; no reset can land between them.
     *
     * @return the channel's counters immediately after the increments
     */
    public TallySnapshot incrementAll(String channel, Map<Suit, Integer> amounts) {
        EnumMap<Suit, Long> deltas = new EnumMap<>(Suit.class);
        amounts.forEach((suit, amount) -> {
            if (amount == null || amount <= 0) {
                throw new IllegalArgumentException("amount must be positive, got " + amount + " for " + suit);
            }
            deltas.put(suit, amount.longValue());
        });
        return record(channel).add(deltas);
    }

    /** Returns the pre-reset counters and zeroes every suit in the same step. */
    public TallySnapshot snapshotAndReset(String channel) {
        ChannelCounters counters = channels.get(channel);
        if (counters == null) {
            return TallySnapshot.empty(channel);
        }
        return counters.drain();
    }

    /** Read-only view; never creates a record. */
    public TallySnapshot get(String channel) {
        ChannelCounters counters = channels.get(channel);
        return counters == null ? TallySnapshot.empty(channel) : counters.snapshot();
    }

    private ChannelCounters record(String channel) {
        return channels.computeIfAbsent(channel, ChannelCounters::new);
    }

    private static final class ChannelCounters {
        private final String channel;
        private final EnumMap<Suit, Long> counts = new EnumMap<>(Suit.class);

        ChannelCounters(String channel) {
            this.channel = channel;
        }

        synchronized TallySnapshot add(Map<Suit, Long> deltas) {
            deltas.forEach((suit, delta) -> counts.merge(suit, delta, Long::sum));
            return new TallySnapshot(channel, counts);
        }

        synchronized TallySnapshot drain() {
            TallySnapshot before = new TallySnapshot(channel, counts);
            counts.clear();
            return before;
        }

        synchronized TallySnapshot snapshot() {
            return new TallySnapshot(channel, counts);
        }
    }
}
