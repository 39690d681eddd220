package com.xksgroup.hlstranscoder.service.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.hlstranscoder.exception.QueueUnavailableException;
import com.xksgroup.hlstranscoder.model.dto.JobDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis list queue. Producers LPUSH, consumers BRPOP, so the right end is the
 * head.
 * <p>
 * In lease mode each step of the lease bookkeeping is one Lua script, so a
 * crash never leaves a payload in {@code <key>:processing} without a deadline
 * in {@code <key>:leases}, nor drops it between the two. Scripts cannot block,
 * so a leased poll retries every {@value #LEASE_POLL_INTERVAL_MS}ms until the
 * timeout.
 */
@Slf4j
public class RedisWorkQueue implements WorkQueue {

    static final long LEASE_POLL_INTERVAL_MS = 250;

    // KEYS: queue, processing, leases, requeued. ARGV: deadline
    @SuppressWarnings("rawtypes")
    static final RedisScript<List> POLL_SCRIPT = RedisScript.of("""
            local payload = redis.call('RPOPLPUSH', KEYS[1], KEYS[2])
            if not payload then
                return nil
            end
            redis.call('ZADD', KEYS[3], ARGV[1], payload)
            local again = redis.call('SREM', KEYS[4], payload)
            return {payload, tostring(again)}
            """, List.class);

    // KEYS: processing, leases. ARGV: payload
    static final RedisScript<Long> ACK_SCRIPT = RedisScript.of("""
            redis.call('LREM', KEYS[1], 1, ARGV[1])
            return redis.call('ZREM', KEYS[2], ARGV[1])
            """, Long.class);

    // KEYS: leases. ARGV: payload, deadline
    static final RedisScript<Long> EXTEND_SCRIPT = RedisScript.of("""
            if redis.call('ZSCORE', KEYS[1], ARGV[1]) then
                redis.call('ZADD', KEYS[1], ARGV[2], ARGV[1])
                return 1
            end
            return 0
            """, Long.class);

    // KEYS: leases, processing, requeued, queue. ARGV: now
    @SuppressWarnings("rawtypes")
    static final RedisScript<List> REQUEUE_SCRIPT = RedisScript.of("""
            local expired = redis.call('ZRANGEBYSCORE', KEYS[1], '-inf', ARGV[1])
            for _, payload in ipairs(expired) do
                redis.call('ZREM', KEYS[1], payload)
                redis.call('LREM', KEYS[2], 1, payload)
                redis.call('SADD', KEYS[3], payload)
                redis.call('RPUSH', KEYS[4], payload)
            end
            return expired
            """, List.class);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final String key;
    private final String processingKey;
    private final String leasesKey;
    private final String requeuedKey;
    private final boolean leaseEnabled;
    private final Duration leaseDuration;
    private final Clock clock;

    public RedisWorkQueue(StringRedisTemplate redis, ObjectMapper objectMapper, String key,
                          boolean leaseEnabled, Duration leaseDuration, Clock clock) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.key = key;
        this.processingKey = key + ":processing";
        this.leasesKey = key + ":leases";
        this.requeuedKey = key + ":leases:requeued";
        this.leaseEnabled = leaseEnabled;
        this.leaseDuration = leaseDuration;
        this.clock = clock;
    }

    @Override
    public void push(JobDescriptor descriptor) {
        String payload = serialize(descriptor);
        try {
            redis.opsForList().leftPush(key, payload);
            log.debug("LPUSH {} job {}", key, descriptor.getJobId());
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("failed to enqueue job " + descriptor.getJobId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Delivery> poll(Duration timeout) throws InterruptedException {
        if (!leaseEnabled) {
            String payload;
            try {
                payload = redis.opsForList().rightPop(key, timeout);
            } catch (DataAccessException e) {
                throw new QueueUnavailableException("failed to poll " + key + ": " + e.getMessage(), e);
            }
            return payload == null ? Optional.empty() : decode(payload, false);
        }

        long waitUntil = System.nanoTime() + timeout.toNanos();
        while (true) {
            List<?> popped = pollLeased();
            if (popped != null && !popped.isEmpty()) {
                String payload = String.valueOf(popped.get(0));
                boolean redelivered = popped.size() > 1 && "1".equals(String.valueOf(popped.get(1)));
                return decode(payload, redelivered);
            }
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(waitUntil - System.nanoTime());
            if (remainingMs <= 0) {
                return Optional.empty();
            }
            Thread.sleep(Math.min(LEASE_POLL_INTERVAL_MS, remainingMs));
        }
    }

    private List<?> pollLeased() {
        String deadline = String.valueOf(clock.millis() + leaseDuration.toMillis());
        try {
            return redis.execute(POLL_SCRIPT, List.of(key, processingKey, leasesKey, requeuedKey), deadline);
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("failed to poll " + key + ": " + e.getMessage(), e);
        }
    }

    private Optional<Delivery> decode(String payload, boolean redelivered) {
        try {
            JobDescriptor descriptor = objectMapper.readValue(payload, JobDescriptor.class);
            return Optional.of(new Delivery(descriptor, payload, redelivered));
        } catch (JsonProcessingException e) {
            log.error("Dropping malformed descriptor from {}: {}", key, payload);
            acknowledgePayload(payload);
            return Optional.empty();
        }
    }

    @Override
    public void acknowledge(Delivery delivery) {
        acknowledgePayload(delivery.receipt());
    }

    private void acknowledgePayload(String payload) {
        if (!leaseEnabled) {
            return;
        }
        try {
            redis.execute(ACK_SCRIPT, List.of(processingKey, leasesKey), payload);
        } catch (DataAccessException e) {
            log.warn("Failed to acknowledge delivery on {}: {}", key, e.getMessage());
        }
    }

    @Override
    public boolean extend(Delivery delivery) {
        if (!leaseEnabled) {
            return false;
        }
        String deadline = String.valueOf(clock.millis() + leaseDuration.toMillis());
        try {
            Long extended = redis.execute(EXTEND_SCRIPT, List.of(leasesKey), delivery.receipt(), deadline);
            return extended != null && extended > 0;
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("failed to extend lease on " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public int requeueExpired() {
        if (!leaseEnabled) {
            return 0;
        }
        List<?> expired;
        try {
            expired = redis.execute(REQUEUE_SCRIPT, List.of(leasesKey, processingKey, requeuedKey, key),
                    String.valueOf(clock.millis()));
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("failed to requeue expired leases on " + key + ": " + e.getMessage(), e);
        }
        if (expired == null) {
            return 0;
        }
        for (Object payload : expired) {
            log.warn("Lease expired on {}, descriptor requeued: {}", key, payload);
        }
        return expired.size();
    }

    @Override
    public long size() {
        try {
            Long size = redis.opsForList().size(key);
            return size != null ? size : 0L;
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("failed to read size of " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isLeaseEnabled() {
        return leaseEnabled;
    }

    private String serialize(JobDescriptor descriptor) {
        try {
            return objectMapper.writeValueAsString(descriptor);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("descriptor is not serializable: " + descriptor, e);
        }
    }
}
