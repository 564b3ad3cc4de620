package com.cardtally.engine.report;

import com.cardtally.common.exception.InvalidIntervalException;
import com.cardtally.common.model.TallySnapshot;
import com.cardtally.common.render.TallyRenderer;
import com.cardtally.common.reply.ReplySink;
import com.cardtally.engine.ChannelLocks;
import com.cardtally.engine.store.CounterStore;
import com.cardtally.engine.store.DedupLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Periodic per-channel report: every interval, drain the channel's counters and send
 * the pre-reset totals to the channel.
 *
 * <pre>
 *   configure(c, 15) → [15 min] → snapshotAndReset(c) → render → reply(c, report) → [15 min] → …
 * </pre>
 *
 * <p>At most one {@link ReportTask} is live per channel; configuring again replaces it.
 * The drain happens under the channel lock; rendering and delivery happen outside it,
 * and a failure in either is logged without stopping the task.
 */
public class AutoReportScheduler {

    private static final Logger log = LoggerFactory.getLogger(AutoReportScheduler.class);

    public static final int MIN_INTERVAL_MINUTES = 5;
    public static final int MAX_INTERVAL_MINUTES = 32;

    private final ConcurrentHashMap<String, ReportTask> tasks = new ConcurrentHashMap<>();

    private final CounterStore counterStore;
    private final DedupLedger dedupLedger;
    private final ChannelLocks locks;
    private final ReplySink replySink;
    private final Scheduler scheduler;
    private final Clock clock;
    private final boolean purgeLedgerOnReport;

    private volatile boolean closed;

    public AutoReportScheduler(CounterStore counterStore,
                               DedupLedger dedupLedger,
                               ChannelLocks locks,
                               ReplySink replySink,
                               Scheduler scheduler,
                               Clock clock,
                               boolean purgeLedgerOnReport) {
        this.counterStore        = counterStore;
        this.dedupLedger         = dedupLedger;
        this.locks               = locks;
        this.replySink           = replySink;
        this.scheduler           = scheduler;
        this.clock               = clock;
        this.purgeLedgerOnReport = purgeLedgerOnReport;
    }

    /**
     * Starts (or restarts) the channel's report cycle. The first report fires one full
     * interval from now.
     *
     * @throws InvalidIntervalException if {@code intervalMinutes} is outside
     *         [{@value #MIN_INTERVAL_MINUTES}, {@value #MAX_INTERVAL_MINUTES}]; nothing changes
     * @throws IllegalStateException after {@link #cancelAll()}
     */
    public void configure(String channel, int intervalMinutes) {
        validate(channel, intervalMinutes);
        if (closed) {
            throw new IllegalStateException("auto-report scheduler is shut down");
        }
        ReportTask task = new ReportTask(channel, intervalMinutes, this::runCycle);
        ReportTask previous = tasks.put(channel, task);
        if (previous != null) {
            previous.shutdown();
            log.info("Replaced auto-report. channel={} previousIntervalMinutes={}", channel, previous.intervalMinutes());
        }
        task.start(scheduler);
        log.info("Auto-report configured. channel={} intervalMinutes={}", channel, intervalMinutes);
    }

    /** Idempotent: returns {@code false} when the channel had no live task. */
    public boolean cancel(String channel) {
        ReportTask task = tasks.remove(channel);
        if (task == null) {
            return false;
        }
        boolean stopped = task.shutdown();
        if (stopped) {
            log.info("Auto-report cancelled. channel={}", channel);
        }
        return stopped;
    }

    /** Stops every task and refuses further configuration. */
    public int cancelAll() {
        closed = true;
        int stopped = 0;
        for (String channel : List.copyOf(tasks.keySet())) {
            if (cancel(channel)) {
                stopped++;
            }
        }
        return stopped;
    }

    public OptionalInt interval(String channel) {
        ReportTask task = tasks.get(channel);
        return task == null ? OptionalInt.empty() : OptionalInt.of(task.intervalMinutes());
    }

    public static void validate(String channel, int intervalMinutes) {
        if (intervalMinutes < MIN_INTERVAL_MINUTES || intervalMinutes > MAX_INTERVAL_MINUTES) {
            throw new InvalidIntervalException(channel, intervalMinutes, MIN_INTERVAL_MINUTES, MAX_INTERVAL_MINUTES);
        }
    }

    private void runCycle(ReportTask task) {
        String channel = task.channel();
        TallySnapshot snapshot = locks.callLocked(channel, () -> {
            if (!task.isActive()) {
                return null;
            }
            TallySnapshot drained = counterStore.snapshotAndReset(channel);
            if (purgeLedgerOnReport) {
                dedupLedger.purge(channel);
            }
            return drained;
        });
        if (snapshot == null) {
            return;
        }

        String report = TallyRenderer.renderAutoReport(snapshot, ZonedDateTime.now(clock));
        try {
            replySink.reply(channel, report);
            log.info("Auto report sent and counters reset. channel={} totals={}", channel, snapshot.counts());
        } catch (RuntimeException e) {
            log.warn("Auto report delivery failed; counters stay reset. channel={}", channel, e);
        }
    }
}
