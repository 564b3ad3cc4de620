package com.cardtally.bot.config;

import com.cardtally.bot.status.BotStatusWriter;
import com.cardtally.common.extraction.CardExtractor;
import com.cardtally.common.extraction.ParenthesizedCardExtractor;
import com.cardtally.common.render.DisplayStyle;
import com.cardtally.common.reply.ReplySink;
import com.cardtally.engine.CountedEventListener;
import com.cardtally.engine.TallyEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class BotConfig {

    @Value("${bot.reply.base-url:http://localhost:8081}")
    private String replyBaseUrl;

    @Value("${tally.edit.quiet-window:3s}")
    private Duration quietWindow;

    @Value("${tally.display-style:CLASSIC}")
    private DisplayStyle displayStyle;

    @Value("${tally.auto-report.purge-ledger:false}")
    private boolean purgeLedgerOnReport;

    @Bean
    public WebClient replyClient(WebClient.Builder builder) {
        return builder.baseUrl(replyBaseUrl).build();
    }

    @Bean
    public CardExtractor cardExtractor() {
        return new ParenthesizedCardExtractor();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Timers for debounced edits and auto-reports. */
    @Bean(destroyMethod = "dispose")
    public Scheduler tallyScheduler() {
        return Schedulers.newParallel("tally-timers");
    }

    @Bean(destroyMethod = "shutdown")
    public TallyEngine tallyEngine(CardExtractor cardExtractor,
                                   ReplySink replySink,
                                   BotStatusWriter statusWriter,
                                   Scheduler tallyScheduler,
                                   Clock clock) {
        return new TallyEngine(cardExtractor, replySink, countedStatus(statusWriter), tallyScheduler, clock,
                               quietWindow, displayStyle, purgeLedgerOnReport);
    }

    /** Records every counted event, immediate or settled edit, in the status file. */
    public static CountedEventListener countedStatus(BotStatusWriter statusWriter) {
        return (channel, eventId, reply) ->
            statusWriter.running("Channel " + channel + ": counted event " + eventId);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
