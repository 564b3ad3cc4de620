package com.cardtally.bot.sender;

import com.cardtally.common.reply.ReplySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

/**
 * Sends replies to the bot transport's {@code sendMessage} endpoint (fire-and-forget).
 *
 * <p>No reactor thread is blocked and nothing is retried: a failed send is logged and
 * the counters that produced the text stay as they are. When replies are disabled the
 * text is logged instead.
 */
@Component
public class WebhookReplySink implements ReplySink {

    private static final Logger log = LoggerFactory.getLogger(WebhookReplySink.class);

    private final WebClient replyClient;
    private final boolean enabled;

    public WebhookReplySink(WebClient replyClient,
                            @Value("${bot.reply.enabled:false}") boolean enabled) {
        this.replyClient = replyClient;
        this.enabled     = enabled;
    }

    @Override
    public void reply(String channel, String text) {
        if (!enabled) {
            log.info("Replies disabled. Logging reply instead. channel={} text={}", channel, text);
            return;
        }

        replyClient.post()
            .uri("/sendMessage")
            .bodyValue(Map.of("chat_id", channel, "text", text))
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Reply sent. channel={} status={}", channel, r.getStatusCode()),
                err -> log.warn("Reply delivery failed (not retried). channel={}", channel, err)
            );
    }
}
