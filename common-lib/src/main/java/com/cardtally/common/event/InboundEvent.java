package com.cardtally.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One text delivery from the transport. {@code edit} marks a revised version of an
 * earlier event with the same {@code eventId}. {@code eventId} is required; it is boxed
 * so a body without it can be rejected rather than read as 0.
 */
public record InboundEvent(
    @JsonProperty("channel") String channel,
    @JsonProperty("eventId") Long eventId,
    @JsonProperty("text")    String text,
    @JsonProperty("edit")    boolean edit
) {}
