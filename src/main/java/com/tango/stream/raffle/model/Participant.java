package com.tango.stream.raffle.model;

import lombok.Value;

@Value
public class Participant {
    long rowId;
    long userId;
    String kickName;
    long tickets;
}
