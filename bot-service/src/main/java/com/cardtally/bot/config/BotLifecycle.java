package com.cardtally.bot.config;

import com.cardtally.bot.status.BotStatusWriter;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Marks the status file online once the app is ready and offline on shutdown.
 */
@Component
public class BotLifecycle {

    private static final Logger log = LoggerFactory.getLogger(BotLifecycle.class);

    private final BotStatusWriter statusWriter;

    public BotLifecycle(BotStatusWriter statusWriter) {
        this.statusWriter = statusWriter;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("Bot ready. statusFile={}", statusWriter.path());
        statusWriter.running("Bot online");
    }

    @PreDestroy
    public void onShutdown() {
        log.info("Bot stopping");
        statusWriter.stopped("Stopped", null);
    }
}
