package com.tango.stream.raffle.conf;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.codec.JsonJacksonCodec;
import org.redisson.config.Config;
import org.redisson.config.ReadMode;
import org.redisson.config.SubscriptionMode;
import org.redisson.config.TransportMode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

@Slf4j
@Configuration
public class RedisConfig {

    @Bean(destroyMethod = "shutdown")
    @Profile("production")
    public RedissonClient redissonClient(@Value("${redis.clusterAddress}") String address,
                                         @Value("${redis.ping.connection.interval:3000}") int pingConnectionInterval,
                                         @Value("${redis.scan.interval.ms:5000}") int scanInterval,
                                         @Value("${redis.executorThreads:16}") int executorThreads,
                                         @Value("${redis.nettyThreads:32}") int nettyThreads,
                                         @Value("${redis.retryAttempts:5}") int retryAttempts,
                                         @Value("${redis.retryInterval:1500}") int retryInterval) {
        if (StringUtils.isBlank(address)) {
            throw new IllegalStateException("Redis clusterAddress is empty!");
        }
        log.info("Create Redisson cluster client for address {}, pingConnectionInterval {}, nettyThreads {}, executorThreads {}",
                address, pingConnectionInterval, nettyThreads, executorThreads);
        Config config = baseConfig(executorThreads, nettyThreads);
        config.useClusterServers().addNodeAddress(address)
                .setRetryAttempts(retryAttempts)
                .setRetryInterval(retryInterval)
                .setPingConnectionInterval(pingConnectionInterval)
                .setReadMode(ReadMode.MASTER)
                .setScanInterval(scanInterval)
                .setSubscriptionMode(SubscriptionMode.MASTER);
        return Redisson.create(config);
    }

    @Bean(destroyMethod = "shutdown")
    @Profile("!production")
    public RedissonClient singleServerRedissonClient(@Value("${redis.address:redis://127.0.0.1:6379}") String address,
                                                     @Value("${redis.executorThreads:4}") int executorThreads,
                                                     @Value("${redis.nettyThreads:8}") int nettyThreads) {
        log.info("Create Redisson single server client for address {}", address);
        Config config = baseConfig(executorThreads, nettyThreads);
        config.useSingleServer().setAddress(address);
        return Redisson.create(config);
    }

    private static Config baseConfig(int executorThreads, int nettyThreads) {
        return new Config()
                .setThreads(executorThreads)
                .setCodec(new JsonJacksonCodec())
                .setTransportMode(TransportMode.NIO)
                .setNettyThreads(nettyThreads);
    }
}
