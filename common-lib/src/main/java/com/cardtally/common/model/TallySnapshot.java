package com.cardtally.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable point-in-time copy of one channel's counters.
 *
 * <p>Every {@link Suit} is always present; missing suits in the source map read as zero.
 */
public record TallySnapshot(
    @JsonProperty("channel") String channel,
    @JsonProperty("counts")  Map<Suit, Long> counts
) {

    public TallySnapshot {
        EnumMap<Suit, Long> copy = new EnumMap<>(Suit.class);
        for (Suit suit : Suit.values()) {
            Long value = counts == null ? null : counts.get(suit);
            copy.put(suit, value == null ? 0L : value);
        }
        counts = Collections.unmodifiableMap(copy);
    }

    public static TallySnapshot empty(String channel) {
        return new TallySnapshot(channel, Map.of());
    }

    public long count(Suit suit) {
        return counts.get(suit);
    }

    @JsonIgnore
    public long total() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return total() == 0L;
    }
}
