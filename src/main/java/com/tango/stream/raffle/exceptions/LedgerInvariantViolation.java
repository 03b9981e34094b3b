package com.tango.stream.raffle.exceptions;

/**
 * A balance row whose total no longer equals the sum of its sources. Thrown inside the
 * mutating transaction so that it rolls back.
 */
public class LedgerInvariantViolation extends RuntimeException {
    public LedgerInvariantViolation(String message) {
        super(message);
    }
}
