package com.cardtally.bot.service;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a channel command: whether it changed anything, and the text that was
 * replied to the channel.
 */
public record CommandResult(
    @JsonProperty("accepted") boolean accepted,
    @JsonProperty("message")  String message
) {
    public static CommandResult ok(String message)       { return new CommandResult(true, message); }
    public static CommandResult rejected(String message) { return new CommandResult(false, message); }
}
