package com.cardtally.common.reply;

/**
 * Outbound text delivery to a channel.
 *
 * <p>Used identically for immediate replies, debounced edits and periodic reports.
 * Delivery is best-effort: implementations MUST NOT block the caller and MUST NOT
 * retry. Failures are logged by the implementation; a runtime exception escaping
 * {@link #reply} is logged by the caller and never undoes the state change that
 * produced the text.
 */
public interface ReplySink {

    /**
     * @param channel destination channel id
     * @param text    rendered message
     */
    void reply(String channel, String text);
}
