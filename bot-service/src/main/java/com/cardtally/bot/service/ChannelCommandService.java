package com.cardtally.bot.service;

import com.cardtally.bot.message.BotMessages;
import com.cardtally.bot.status.BotStatusWriter;
import com.cardtally.common.event.InboundEvent;
import com.cardtally.common.exception.InvalidIntervalException;
import com.cardtally.common.model.TallySnapshot;
import com.cardtally.common.reply.ReplySink;
import com.cardtally.engine.TallyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Thin adapters between transport commands and {@link TallyEngine}. Each command replies
 * its outcome text to the channel and records a status line.
 */
@Service
public class ChannelCommandService {

    private static final Logger log = LoggerFactory.getLogger(ChannelCommandService.class);

    /** Longer digit strings are out of range anyway and would overflow an int. */
    private static final int MAX_INTERVAL_DIGITS = 9;

    private final TallyEngine engine;
    private final ReplySink replySink;
    private final BotStatusWriter statusWriter;

    public ChannelCommandService(TallyEngine engine, ReplySink replySink, BotStatusWriter statusWriter) {
        this.engine       = engine;
        this.replySink    = replySink;
        this.statusWriter = statusWriter;
    }

    public Optional<String> ingest(InboundEvent event) {
        log.info("Delivery received. channel={} eventId={} edit={}", event.channel(), event.eventId(), event.edit());
        return engine.onEvent(event);
    }

    public CommandResult reset(String channel) {
        engine.reset(channel);
        replySink.reply(channel, BotMessages.RESET_CONFIRMATION);
        statusWriter.running("Reset completed for channel " + channel);
        return CommandResult.ok(BotMessages.RESET_CONFIRMATION);
    }

    /**
     * @param rawMinutes the command argument as typed; must be a plain decimal number
     */
    public CommandResult configureAutoReport(String channel, String rawMinutes) {
        if (rawMinutes == null || rawMinutes.isBlank() || !rawMinutes.chars().allMatch(Character::isDigit)) {
            log.info("Auto-report command without numeric interval. channel={} arg={}", channel, rawMinutes);
            return reject(channel, BotMessages.AUTO_REPORT_USAGE);
        }
        if (rawMinutes.length() > MAX_INTERVAL_DIGITS) {
            return reject(channel, BotMessages.intervalOutOfRange(rawMinutes));
        }

        int minutes = Integer.parseInt(rawMinutes);
        try {
            engine.configureAutoReport(channel, minutes);
        } catch (InvalidIntervalException e) {
            log.info("Auto-report interval rejected. channel={} minutes={}", e.getChannel(), e.getRequested());
            return reject(channel, BotMessages.intervalOutOfRange(rawMinutes));
        }

        String message = BotMessages.autoReportConfigured(minutes);
        replySink.reply(channel, message);
        statusWriter.running("Auto report set to " + minutes + "min for channel " + channel);
        return CommandResult.ok(message);
    }

    public CommandResult cancelAutoReport(String channel) {
        if (!engine.cancelAutoReport(channel)) {
            return CommandResult.rejected(BotMessages.AUTO_REPORT_NOT_ACTIVE);
        }
        replySink.reply(channel, BotMessages.AUTO_REPORT_CANCELLED);
        statusWriter.running("Auto report stopped for channel " + channel);
        return CommandResult.ok(BotMessages.AUTO_REPORT_CANCELLED);
    }

    public CommandResult start(String channel) {
        replySink.reply(channel, BotMessages.HELP);
        statusWriter.running("Bot started in channel " + channel);
        return CommandResult.ok(BotMessages.HELP);
    }

    public CommandResult joined(String channel) {
        replySink.reply(channel, BotMessages.WELCOME);
        statusWriter.running("Bot added to channel " + channel);
        log.info("Bot added to channel. channel={}", channel);
        return CommandResult.ok(BotMessages.WELCOME);
    }

    public TallySnapshot counters(String channel) {
        return engine.counters(channel);
    }

    private CommandResult reject(String channel, String message) {
        replySink.reply(channel, message);
        return CommandResult.rejected(message);
    }
}
