package com.cardtally.engine;

import com.cardtally.common.reply.ReplySink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/** Captures replies in order; optionally fails every delivery. */
public class RecordingReplySink implements ReplySink {

    public record Reply(String channel, String text) {}

    private final List<Reply> replies = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    @Override
    public void reply(String channel, String text) {
        replies.add(new Reply(channel, text));
        if (failing) {
            throw new IllegalStateException("transport down");
        }
    }

    public void failDeliveries(boolean failing) {
        this.failing = failing;
    }

    public List<Reply> replies() {
        return List.copyOf(replies);
    }

    public List<String> textsFor(String channel) {
        return replies.stream()
            .filter(r -> r.channel().equals(channel))
            .map(Reply::text)
            .collect(Collectors.toList());
    }
}
