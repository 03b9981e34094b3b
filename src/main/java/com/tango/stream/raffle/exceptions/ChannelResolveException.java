package com.tango.stream.raffle.exceptions;

/**
 * Chatroom of a channel could not be resolved through the platform API.
 */
public class ChannelResolveException extends Exception {
    public ChannelResolveException(String message) {
        super(message);
    }

    public ChannelResolveException(String message, Throwable cause) {
        super(message, cause);
    }
}
