package com.cardtally.common.trace;

import org.slf4j.MDC;

import java.util.function.Supplier;

/**
 * Bridges the channel id into the SLF4J {@link MDC} for the duration of one block.
 *
 * <p>Timer threads are shared between channels, so the entry is always removed on exit
 * rather than left behind as a thread-local.
 *
 * <pre>
 *     ChannelMdc.withMdc(channel, () -> log.info("Counted. counts={}", counts));
 * </pre>
 */
public final class ChannelMdc {

    public static final String CHANNEL_KEY = "channel";

    private ChannelMdc() {}

    public static void withMdc(String channel, Runnable action) {
        MDC.put(CHANNEL_KEY, channel);
        try {
            action.run();
        } finally {
            MDC.remove(CHANNEL_KEY);
        }
    }

    public static <T> T callWithMdc(String channel, Supplier<T> action) {
        MDC.put(CHANNEL_KEY, channel);
        try {
            return action.get();
        } finally {
            MDC.remove(CHANNEL_KEY);
        }
    }
}
