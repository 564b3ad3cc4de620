package com.cardtally.common.exception;

public class TallyException extends RuntimeException {
    private final String channel;

    public TallyException(String channel, String message) {
        super("[" + channel + "] " + message);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
