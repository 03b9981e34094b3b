package com.tango.stream.raffle.model;

import lombok.Value;

/**
 * Verified link of a gambling platform account to a chat account.
 */
@Value
public class WagerLink {
    String kickName;
    long userId;
}
