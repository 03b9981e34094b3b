package com.tango.stream.raffle.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DrawResult {
    private long id;
    private String tenantId;
    private long periodId;
    private long totalTickets;
    private int totalParticipants;
    private long winnerUserId;
    private String winnerKickName;
    private long winningTicket;
    private long winnerTickets;
    private double winProbability;
    private String prizeDescription;
    private String drawnBy;
    private String serverSeed;
    private String clientSeed;
    private long nonce;
    private String proofHash;
    private Instant drawnAt;
}
