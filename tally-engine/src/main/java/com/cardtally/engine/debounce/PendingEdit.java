package com.cardtally.engine.debounce;

import reactor.core.Disposable;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Debounce slot for one edited event: the latest text plus the timer that will process it.
 *
 * <p>State only moves forward, {@code PENDING → FIRED} or {@code PENDING → CANCELLED},
 * and exactly one of the two transitions can win. The slot owns its timer and disposes
 * it on cancellation.
 */
public final class PendingEdit {

    public enum State { PENDING, FIRED, CANCELLED }

    private final String channel;
    private final long eventId;
    private final String text;
    private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);

    private Disposable timer;

    PendingEdit(String channel, long eventId, String text) {
        this.channel = channel;
        this.eventId = eventId;
        this.text    = text;
    }

    public String channel() { return channel; }
    public long   eventId() { return eventId; }
    public String text()    { return text; }
    public State  state()   { return state.get(); }

    /** Attaches the timer; disposes it right away if the slot was cancelled first. */
    synchronized void arm(Disposable timer) {
        this.timer = timer;
        if (state.get() != State.PENDING) {
            timer.dispose();
        }
    }

    /** @return {@code true} if this call moved the slot to CANCELLED */
    synchronized boolean cancel() {
        if (!state.compareAndSet(State.PENDING, State.CANCELLED)) {
            return false;
        }
        if (timer != null) {
            timer.dispose();
        }
        return true;
    }

    /** @return {@code true} if this call moved the slot to FIRED */
    boolean markFired() {
        return state.compareAndSet(State.PENDING, State.FIRED);
    }
}
