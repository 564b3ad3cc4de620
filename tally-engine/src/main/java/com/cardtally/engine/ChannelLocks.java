package com.cardtally.engine;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One reentrant lock per channel.
 *
 * <p>Event processing, debounced edits firing, auto-report cycles and channel reset all
 * run their state mutations while holding the channel's lock, so a reset is totally
 * ordered against every other writer on that channel.
 */
public final class ChannelLocks {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public void runLocked(String channel, Runnable action) {
        ReentrantLock lock = locks.computeIfAbsent(channel, c -> new ReentrantLock());
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    public <T> T callLocked(String channel, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(channel, c -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
