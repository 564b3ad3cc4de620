package com.cardtally.engine;

import com.cardtally.common.event.InboundEvent;
import com.cardtally.common.extraction.CardExtractor;
import com.cardtally.common.model.TallySnapshot;
import com.cardtally.common.render.DisplayStyle;
import com.cardtally.common.reply.ReplySink;
import com.cardtally.engine.debounce.EditDebouncer;
import com.cardtally.engine.pipeline.EventProcessor;
import com.cardtally.engine.report.AutoReportScheduler;
import com.cardtally.engine.store.CounterStore;
import com.cardtally.engine.store.DedupLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns all per-channel state and the timers that act on it.
 *
 * <p>Inbound flow:
 * <pre>
 *   onEvent(edit=false) ─────────────────────────→ EventProcessor ─→ ReplySink
 *   onEvent(edit=true)  → EditDebouncer [quiet] ─→ EventProcessor ─→ ReplySink
 *   AutoReportScheduler [interval] → snapshotAndReset ──────────────→ ReplySink
 * </pre>
 *
 * <p>Both counting paths end in {@link CountedEventListener#onCounted}, after the reply.
 *
 * <p>Every state mutation for a channel happens under that channel's lock from
 * {@link ChannelLocks}. {@link #reset(String)} takes the same lock for its whole
 * duration, so cancelling the channel's timers is ordered before the ledger purge and
 * no in-flight edit can put a dedup key back afterwards.
 */
public class TallyEngine {

    private static final Logger log = LoggerFactory.getLogger(TallyEngine.class);

    private final ChannelLocks locks = new ChannelLocks();
    private final CounterStore counterStore = new CounterStore();
    private final DedupLedger dedupLedger = new DedupLedger();
    private final EventProcessor processor;
    private final EditDebouncer editDebouncer;
    private final AutoReportScheduler autoReports;
    private final ReplySink replySink;
    private final CountedEventListener countedListener;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public TallyEngine(CardExtractor extractor,
                       ReplySink replySink,
                       Scheduler scheduler,
                       Clock clock,
                       Duration quietWindow,
                       DisplayStyle displayStyle,
                       boolean purgeLedgerOnReport) {
        this(extractor, replySink, CountedEventListener.NONE, scheduler, clock,
             quietWindow, displayStyle, purgeLedgerOnReport);
    }

    public TallyEngine(CardExtractor extractor,
                       ReplySink replySink,
                       CountedEventListener countedListener,
                       Scheduler scheduler,
                       Clock clock,
                       Duration quietWindow,
                       DisplayStyle displayStyle,
                       boolean purgeLedgerOnReport) {
        this.replySink       = replySink;
        this.countedListener = countedListener;
        this.processor       = new EventProcessor(counterStore, dedupLedger, extractor, displayStyle);
        this.editDebouncer   = new EditDebouncer(scheduler, quietWindow, locks, this::processSettledEdit);
        this.autoReports     = new AutoReportScheduler(
            counterStore, dedupLedger, locks, replySink, scheduler, clock, purgeLedgerOnReport);
    }

    /**
     * Routes one delivery. Plain events are processed now; edits wait for the quiet window.
     *
     * @return the reply sent for a plain event, empty for rejected events and for edits
     */
    public Optional<String> onEvent(InboundEvent event) {
        Objects.requireNonNull(event.eventId(), "eventId");
        if (event.text() == null || event.text().isEmpty()) {
            return Optional.empty();
        }
        if (event.edit()) {
            editDebouncer.submit(event.channel(), event.eventId(), event.text());
            return Optional.empty();
        }
        Optional<String> response = locks.callLocked(event.channel(),
            () -> processor.process(event.channel(), event.text()));
        response.ifPresent(text -> counted(event.channel(), event.eventId(), text));
        return response;
    }

    /**
     * Clears the channel: stops its auto-report, drops its pending edits, forgets its
     * sequence numbers and zeroes its counters.
     *
     * @return counters as they were just before the reset
     */
    public TallySnapshot reset(String channel) {
        TallySnapshot before = locks.callLocked(channel, () -> {
            autoReports.cancel(channel);
            editDebouncer.cancelChannel(channel);
            dedupLedger.purge(channel);
            return counterStore.snapshotAndReset(channel);
        });
        log.info("Channel reset. channel={} previousTotals={}", channel, before.counts());
        return before;
    }

    /** @see AutoReportScheduler#configure(String, int) */
    public void configureAutoReport(String channel, int intervalMinutes) {
        autoReports.configure(channel, intervalMinutes);
    }

    public boolean cancelAutoReport(String channel) {
        return autoReports.cancel(channel);
    }

    public TallySnapshot counters(String channel) {
        return counterStore.get(channel);
    }

    /** Cancels every timer. Safe to call more than once. */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        int reports = autoReports.cancelAll();
        int edits   = editDebouncer.cancelAll();
        log.info("Tally engine stopped. autoReportsCancelled={} pendingEditsCancelled={}", reports, edits);
    }

    public CounterStore counterStore()              { return counterStore; }
    public DedupLedger dedupLedger()                { return dedupLedger; }
    public EditDebouncer editDebouncer()            { return editDebouncer; }
    public AutoReportScheduler autoReportScheduler() { return autoReports; }

    private void processSettledEdit(String channel, long eventId, String text) {
        processor.process(channel, text).ifPresent(response -> counted(channel, eventId, response));
    }

    private void counted(String channel, long eventId, String response) {
        deliver(channel, response);
        try {
            countedListener.onCounted(channel, eventId, response);
        } catch (RuntimeException e) {
            log.warn("Counted-event listener failed. channel={} eventId={}", channel, eventId, e);
        }
    }

    private void deliver(String channel, String text) {
        try {
            replySink.reply(channel, text);
        } catch (RuntimeException e) {
            log.warn("Reply delivery failed; state change kept. channel={}", channel, e);
        }
    }
}
