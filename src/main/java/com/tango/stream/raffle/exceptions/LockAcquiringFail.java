package com.tango.stream.raffle.exceptions;

public class LockAcquiringFail extends RuntimeException {
    public LockAcquiringFail(String message) {
        super(message);
    }
}
