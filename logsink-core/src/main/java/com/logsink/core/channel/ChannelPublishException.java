package com.logsink.core.channel;

/** The channel was unavailable or did not confirm the record; nothing was queued. */
public class ChannelPublishException extends RuntimeException {

    public ChannelPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
