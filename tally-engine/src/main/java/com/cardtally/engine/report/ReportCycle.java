package com.cardtally.engine.report;

/**
 * Work done on each tick of a channel's auto-report. Implementations must not throw
 * for ordinary delivery failures; anything that escapes is logged and the next tick
 * still runs.
 */
@FunctionalInterface
interface ReportCycle {

    void run(ReportTask task);
}
