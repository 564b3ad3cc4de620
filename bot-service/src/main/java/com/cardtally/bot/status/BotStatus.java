package com.cardtally.bot.status;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BotStatus(
    @JsonProperty("running")     boolean running,
    @JsonProperty("lastMessage") String lastMessage,
    @JsonProperty("error")       String error,
    @JsonProperty("updatedAt")   Instant updatedAt
) {}
