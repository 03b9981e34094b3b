package com.tango.stream.raffle.model;

import lombok.Builder;
import lombok.Value;

/**
 * Winning ticket together with everything needed to reproduce its selection.
 */
@Value
@Builder
public class WinningTicket {
    long ticket;
    String serverSeed;
    String clientSeed;
    long nonce;
    String proofHash;
}
