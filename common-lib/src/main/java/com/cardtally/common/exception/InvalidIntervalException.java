package com.cardtally.common.exception;

/**
 * Rejected auto-report interval. Carries the offending value and the accepted bounds so
 * adapters can build a user-facing message.
 */
public class InvalidIntervalException extends TallyException {
    private final int requested;
    private final int min;
    private final int max;

    public InvalidIntervalException(String channel, int requested, int min, int max) {
        super(channel, "auto-report interval must be between " + min + " and " + max
            + " minutes, got " + requested);
        this.requested = requested;
        this.min = min;
        this.max = max;
    }

    public int getRequested() { return requested; }
    public int getMin()       { return min; }
    public int getMax()       { return max; }
}
