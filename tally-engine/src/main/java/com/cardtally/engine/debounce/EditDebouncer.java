package com.cardtally.engine.debounce;

import com.cardtally.engine.ChannelLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Holds back edited events until they stop changing.
 *
 * <p>Each {@code (channel, eventId)} has at most one live {@link PendingEdit}. A new edit
 * for the same event cancels the previous slot and starts a fresh quiet window, so only
 * the last edit of a burst is ever handed to the {@link SettledEditHandler}:
 * <pre>
 *   edit(t=0,"a") → edit(t=1,"ab") → edit(t=2,"abc") → [quiet window] → onSettled("abc")
 * </pre>
 *
 * <p>Firing runs under the channel lock and re-checks the slot state there, so a slot
 * cancelled by a channel reset can never reach the handler afterwards.
 */
public class EditDebouncer {

    private static final Logger log = LoggerFactory.getLogger(EditDebouncer.class);

    public static final Duration DEFAULT_QUIET_WINDOW = Duration.ofSeconds(3);

    private final ConcurrentHashMap<EditKey, PendingEdit> slots = new ConcurrentHashMap<>();

    private final Scheduler scheduler;
    private final Duration quietWindow;
    private final ChannelLocks locks;
    private final SettledEditHandler handler;

    private volatile boolean closed;

    public EditDebouncer(Scheduler scheduler, Duration quietWindow,
                         ChannelLocks locks, SettledEditHandler handler) {
        if (quietWindow.isNegative()) {
            throw new IllegalArgumentException("quiet window must not be negative: " + quietWindow);
        }
        this.scheduler   = scheduler;
        this.quietWindow = quietWindow;
        this.locks       = locks;
        this.handler     = handler;
    }

    /**
     * Replaces any pending slot for the event with {@code text} and restarts its quiet window.
     *
     * @throws IllegalStateException after {@link #cancelAll()} closed the debouncer
     */
    public void submit(String channel, long eventId, String text) {
        if (closed) {
            throw new IllegalStateException("edit debouncer is shut down");
        }
        EditKey key = new EditKey(channel, eventId);
        PendingEdit slot = new PendingEdit(channel, eventId, text);

        PendingEdit previous = slots.put(key, slot);
        if (previous != null && previous.cancel()) {
            log.debug("Superseded pending edit. channel={} eventId={}", channel, eventId);
        }
        slot.arm(scheduler.schedule(() -> fire(key, slot), quietWindow.toMillis(), TimeUnit.MILLISECONDS));
        log.info("Scheduled delayed processing for edit. channel={} eventId={} quietWindowMs={}",
                 channel, eventId, quietWindow.toMillis());
    }

    /** Cancels one pending edit without processing it. */
    public boolean cancel(String channel, long eventId) {
        PendingEdit slot = slots.remove(new EditKey(channel, eventId));
        return slot != null && slot.cancel();
    }

    /**
     * Cancels every pending edit of the channel without processing any of them.
     *
     * @return number of slots cancelled
     */
    public int cancelChannel(String channel) {
        List<EditKey> keys = slots.keySet().stream()
            .filter(k -> k.channel().equals(channel))
            .collect(Collectors.toList());
        int cancelled = 0;
        for (EditKey key : keys) {
            PendingEdit slot = slots.remove(key);
            if (slot != null && slot.cancel()) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("Cancelled pending edits. channel={} count={}", channel, cancelled);
        }
        return cancelled;
    }

    /** Cancels every slot and refuses further submissions. */
    public int cancelAll() {
        closed = true;
        int cancelled = 0;
        for (EditKey key : List.copyOf(slots.keySet())) {
            PendingEdit slot = slots.remove(key);
            if (slot != null && slot.cancel()) {
                cancelled++;
            }
        }
        return cancelled;
    }

    public int pendingCount() {
        return slots.size();
    }

    public Optional<PendingEdit> pending(String channel, long eventId) {
        return Optional.ofNullable(slots.get(new EditKey(channel, eventId)));
    }

    private void fire(EditKey key, PendingEdit slot) {
        locks.runLocked(key.channel(), () -> {
            if (!slot.markFired()) {
                return;
            }
            slots.remove(key, slot);
            try {
                handler.onSettled(slot.channel(), slot.eventId(), slot.text());
                log.info("Processed edit after quiet window. channel={} eventId={}", slot.channel(), slot.eventId());
            } catch (RuntimeException e) {
                log.error("Error processing delayed edit. channel={} eventId={}", slot.channel(), slot.eventId(), e);
            }
        });
    }

    /** Event ids are only unique within a channel. */
    record EditKey(String channel, long eventId) {}
}
