package com.tango.stream.raffle.draw;

import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import com.google.common.primitives.Longs;
import com.tango.stream.raffle.model.WinningTicket;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Commit-reveal style selection: {@code SHA-256(serverSeed:clientSeed:nonce)} is read as an
 * unsigned 63 bit number and mapped onto the ticket line by rejection sampling, bumping the
 * nonce until the value falls below the largest multiple of the ticket count.
 */
@Component
public class ProvablyFairTicketSelector implements WinningTicketSelector {
    private static final int SERVER_SEED_BYTES = 32;
    private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    private final SecureRandom secureRandom;

    @Autowired
    public ProvablyFairTicketSelector(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    @Nonnull
    @Override
    public WinningTicket select(long periodId, long totalTickets, int participants) {
        if (totalTickets <= 0) {
            throw new IllegalArgumentException("No tickets to draw from: " + totalTickets);
        }
        byte[] seed = new byte[SERVER_SEED_BYTES];
        secureRandom.nextBytes(seed);
        String serverSeed = HEX.encode(seed);
        String clientSeed = clientSeed(periodId, totalTickets, participants);
        long limit = Long.MAX_VALUE - (Long.MAX_VALUE % totalTickets);
        for (long nonce = 0; ; nonce++) {
            HashCode hash = proof(serverSeed, clientSeed, nonce);
            long value = toUnsigned63(hash);
            if (value < limit) {
                return WinningTicket.builder()
                        .ticket(value % totalTickets + 1)
                        .serverSeed(serverSeed)
                        .clientSeed(clientSeed)
                        .nonce(nonce)
                        .proofHash(hash.toString())
                        .build();
            }
        }
    }

    @Override
    public boolean verify(@Nonnull WinningTicket ticket, long totalTickets) {
        if (totalTickets <= 0) {
            return false;
        }
        HashCode hash = proof(ticket.getServerSeed(), ticket.getClientSeed(), ticket.getNonce());
        long value = toUnsigned63(hash);
        long limit = Long.MAX_VALUE - (Long.MAX_VALUE % totalTickets);
        return hash.toString().equals(ticket.getProofHash())
                && value < limit
                && value % totalTickets + 1 == ticket.getTicket();
    }

    @Nonnull
    public static String clientSeed(long periodId, long totalTickets, int participants) {
        return periodId + ":" + totalTickets + ":" + participants;
    }

    private static HashCode proof(String serverSeed, String clientSeed, long nonce) {
        return Hashing.sha256().hashString(serverSeed + ":" + clientSeed + ":" + nonce, StandardCharsets.UTF_8);
    }

    private static long toUnsigned63(HashCode hash) {
        return Longs.fromByteArray(Arrays.copyOf(hash.asBytes(), Longs.BYTES)) & Long.MAX_VALUE;
    }
}
