package com.tango.stream.raffle.model;

import lombok.Value;

/**
 * Watchtime of a viewer that has a linked internal account.
 */
@Value
public class LinkedWatchtime {
    String kickName;
    long userId;
    long secondsWatched;

    public long getTotalMinutes() {
        return secondsWatched / 60;
    }
}
