package com.cardtally.engine;

/**
 * Notified after an event changed a channel's counters, whether it arrived as a plain
 * message or as a settled edit.
 */
@FunctionalInterface
public interface CountedEventListener {

    CountedEventListener NONE = (channel, eventId, reply) -> {};

    void onCounted(String channel, long eventId, String reply);
}
