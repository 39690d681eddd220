package com.xksgroup.hlstranscoder.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.hlstranscoder.service.queue.InMemoryWorkQueue;
import com.xksgroup.hlstranscoder.service.queue.RedisWorkQueue;
import com.xksgroup.hlstranscoder.service.queue.WorkQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Slf4j
@Configuration
public class QueueConfig {

    @Bean
    @ConditionalOnProperty(name = "transcode.queue.type", havingValue = "redis", matchIfMissing = true)
    public WorkQueue redisWorkQueue(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                    TranscodeProperties properties) {
        TranscodeProperties.Queue queue = properties.getQueue();
        validateLease(properties);
        log.info("Using Redis work queue '{}' (lease mode: {})", queue.getKey(), queue.getLease().isEnabled());
        return new RedisWorkQueue(redisTemplate, objectMapper, queue.getKey(),
                queue.getLease().isEnabled(), queue.getLease().getDuration(), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnProperty(name = "transcode.queue.type", havingValue = "memory")
    public WorkQueue inMemoryWorkQueue(TranscodeProperties properties) {
        TranscodeProperties.Lease lease = properties.getQueue().getLease();
        validateLease(properties);
        log.info("Using in-memory work queue (lease mode: {})", lease.isEnabled());
        return new InMemoryWorkQueue(lease.isEnabled(), lease.getDuration(), Clock.systemUTC());
    }

    // A lease must outlive one encoder run, the longest gap between keep-alives
    static void validateLease(TranscodeProperties properties) {
        TranscodeProperties.Lease lease = properties.getQueue().getLease();
        if (!lease.isEnabled()) {
            return;
        }
        if (lease.getDuration().compareTo(properties.getEncoder().getTimeout()) <= 0) {
            throw new IllegalStateException("transcode.queue.lease.duration (" + lease.getDuration()
                    + ") must be longer than transcode.encoder.timeout (" + properties.getEncoder().getTimeout() + ")");
        }
    }
}
