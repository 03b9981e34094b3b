package com.tango.stream.raffle.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import com.tango.stream.raffle.model.DrawResult;
import com.tango.stream.raffle.service.DrawNotifier;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Publishes finished draws to a Redis topic for the announcement side.
 */
@Slf4j
@Service
public class RedisDrawNotifier implements DrawNotifier {
    private final RedissonClient redissonClient;
    private final ObjectMapper objectMapper;
    private final String topicName;

    @Autowired
    public RedisDrawNotifier(RedissonClient redissonClient,
                             ObjectMapper objectMapper,
                             @Value("${raffle.draw.topic:raffle:draws}") String topicName) {
        this.redissonClient = redissonClient;
        this.objectMapper = objectMapper;
        this.topicName = topicName;
    }

    @Override
    public void onDraw(@Nonnull DrawResult result) {
        Map<String, Object> payload = ImmutableMap.<String, Object>builder()
                .put("tenantId", result.getTenantId())
                .put("periodId", result.getPeriodId())
                .put("winnerUserId", result.getWinnerUserId())
                .put("winnerKickName", String.valueOf(result.getWinnerKickName()))
                .put("winningTicket", result.getWinningTicket())
                .put("totalTickets", result.getTotalTickets())
                .put("totalParticipants", result.getTotalParticipants())
                .put("winProbability", result.getWinProbability())
                .put("prize", String.valueOf(result.getPrizeDescription()))
                .put("proofHash", result.getProofHash())
                .put("drawnAt", result.getDrawnAt().toEpochMilli())
                .build();
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Draw of period " + result.getPeriodId() + " is not serializable", e);
        }
        long receivers = redissonClient.getTopic(topicName, StringCodec.INSTANCE).publish(json);
        log.info("onDraw(): draw of period {} published to {} receivers", result.getPeriodId(), receivers);
    }
}
