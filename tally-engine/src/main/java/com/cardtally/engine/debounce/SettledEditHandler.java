package com.cardtally.engine.debounce;

/**
 * Receives the final text of an edit burst once its quiet window has elapsed.
 * Invoked while the channel's lock is held.
 */
@FunctionalInterface
public interface SettledEditHandler {

    void onSettled(String channel, long eventId, String text);
}
