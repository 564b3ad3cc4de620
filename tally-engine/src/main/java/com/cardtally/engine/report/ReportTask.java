package com.cardtally.engine.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/**
 * One channel's recurring report: owns the tick subscription and stops it on
 * {@link #shutdown()}.
 *
 * <p>Cancellation is cooperative. A tick that is already inside the channel lock
 * finishes its snapshot; a tick that has not reached it yet sees {@link #isActive()}
 * return {@code false} and does nothing.
 */
public final class ReportTask {

    private static final Logger log = LoggerFactory.getLogger(ReportTask.class);

    private final String channel;
    private final int intervalMinutes;
    private final ReportCycle cycle;

    private volatile boolean active = true;
    private Disposable ticks;

    ReportTask(String channel, int intervalMinutes, ReportCycle cycle) {
        this.channel         = channel;
        this.intervalMinutes = intervalMinutes;
        this.cycle           = cycle;
    }

    public String channel()        { return channel; }
    public int intervalMinutes()   { return intervalMinutes; }
    public boolean isActive()      { return active; }

    synchronized void start(Scheduler scheduler) {
        if (!active || ticks != null) {
            return;
        }
        Duration period = Duration.ofMinutes(intervalMinutes);
        ticks = Flux.interval(period, period, scheduler)
            .subscribe(
                tick -> runCycle(tick),
                err  -> log.error("Auto-report ticker terminated. channel={}", channel, err)
            );
    }

    /** @return {@code true} if this call stopped a live task */
    synchronized boolean shutdown() {
        if (!active) {
            return false;
        }
        active = false;
        if (ticks != null) {
            ticks.dispose();
        }
        return true;
    }

    private void runCycle(long tick) {
        if (!active) {
            return;
        }
        try {
            cycle.run(this);
        } catch (RuntimeException e) {
            log.error("Auto-report cycle failed, continuing with next interval. channel={} cycle={}",
                      channel, tick + 1, e);
        }
    }
}
