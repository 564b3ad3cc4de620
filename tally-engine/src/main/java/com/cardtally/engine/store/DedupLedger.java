package com.cardtally.engine.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Set of {@code (channel, sequence number)} pairs that have already been counted.
 *
 * <p>{@link #tryMark} is the only gate for re-processing. Keys live until the owning
 * channel is purged; there is no other eviction.
 */
public class DedupLedger {

    private static final Logger log = LoggerFactory.getLogger(DedupLedger.class);

    private final Set<DedupKey> keys = ConcurrentHashMap.newKeySet();

    /**
     * Records the key if absent.
     *
     * @return {@code true} when this call inserted the key, {@code false} when it was
     *         already present (nothing changes)
     */
    public boolean tryMark(String channel, long sequenceNumber) {
        return keys.add(new DedupKey(channel, sequenceNumber));
    }

    public boolean contains(String channel, long sequenceNumber) {
        return keys.contains(new DedupKey(channel, sequenceNumber));
    }

    /**
     * Removes every key that belongs to {@code channel}.
     *
     * @return number of keys removed
     */
    public int purge(String channel) {
        int[] removed = {0};
        keys.removeIf(key -> {
            if (key.channel().equals(channel)) {
                removed[0]++;
                return true;
            }
            return false;
        });
        log.debug("Dedup ledger purged. channel={} removed={}", channel, removed[0]);
        return removed[0];
    }

    public int size() {
        return keys.size();
    }

    record DedupKey(String channel, long sequenceNumber) {}
}
