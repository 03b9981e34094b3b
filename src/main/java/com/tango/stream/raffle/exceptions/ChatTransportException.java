package com.tango.stream.raffle.exceptions;

public class ChatTransportException extends Exception {
    public ChatTransportException(String message) {
        super(message);
    }

    public ChatTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
