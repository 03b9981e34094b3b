package com.tango.stream.raffle.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ConversionRecord {
    public static final String BASELINE_KEY = "baseline";

    long periodId;
    String kickName;
    String basisKey;
    long unitsConverted;
    long ticketsAwarded;

    public static String watchtimeKey(long cumulativeMinuteMark) {
        return "watchtime:" + cumulativeMinuteMark;
    }

    /**
     * @param cumulativeWagerCents settled wager of the player in cents
     */
    public static String wagerKey(long cumulativeWagerCents) {
        return "wager:" + cumulativeWagerCents;
    }
}
