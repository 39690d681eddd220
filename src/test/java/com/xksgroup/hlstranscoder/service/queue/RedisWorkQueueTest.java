package com.xksgroup.hlstranscoder.service.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.hlstranscoder.exception.QueueUnavailableException;
import com.xksgroup.hlstranscoder.model.dto.JobDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisWorkQueueTest {

    private static final String PAYLOAD = "{\"job_id\":\"j1\",\"video_id\":\"v1\",\"profiles\":[240,480]}";

    @Mock
    private StringRedisTemplate redis;
    @Mock
    private ListOperations<String, String> listOps;
    @Mock
    private ZSetOperations<String, String> zsetOps;
    @Mock
    private SetOperations<String, String> setOps;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        lenient().when(redis.opsForList()).thenReturn(listOps);
        lenient().when(redis.opsForZSet()).thenReturn(zsetOps);
        lenient().when(redis.opsForSet()).thenReturn(setOps);
    }

    @Test
    void pushWritesSnakeCaseJsonToTheQueueKey() throws Exception {
        RedisWorkQueue queue = new RedisWorkQueue(redis, objectMapper, "jobs:transcode", false, Duration.ofMinutes(30), clock);

        queue.push(JobDescriptor.builder().jobId("j1").videoId("v1").profiles(List.of(240, 480)).build());

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(listOps).leftPush(eq("jobs:transcode"), payload.capture());
        assertThat(objectMapper.readTree(payload.getValue())).isEqualTo(objectMapper.readTree(PAYLOAD));
    }

    @Test
    void pollDecodesDescriptor() throws Exception {
        RedisWorkQueue queue = new RedisWorkQueue(redis, objectMapper, "jobs:transcode", false, Duration.ofMinutes(30), clock);
        when(listOps.rightPop("jobs:transcode", Duration.ofSeconds(5))).thenReturn(PAYLOAD);

        Optional<Delivery> delivery = queue.poll(Duration.ofSeconds(5));

        assertThat(delivery).isPresent();
        assertThat(delivery.get().descriptor().getJobId()).isEqualTo("j1");
        assertThat(delivery.get().descriptor().getProfiles()).containsExactly(240, 480);
        assertThat(delivery.get().redelivered()).isFalse();
    }

    @Test
    void pollTimeoutIsEmpty() throws Exception {
        RedisWorkQueue queue = new RedisWorkQueue(redis, objectMapper, "jobs:transcode", false, Duration.ofMinutes(30), clock);
        when(listOps.rightPop("jobs:transcode", Duration.ofSeconds(1))).thenReturn(null);

        assertThat(queue.poll(Duration.ofSeconds(1))).isEmpty();
    }

    @Test
    void leasedPollRunsPopAndDeadlineAsOneScript() throws Exception {
        RedisWorkQueue queue = new RedisWorkQueue(redis, objectMapper, "jobs:transcode", true, Duration.ofMinutes(30), clock);
        String deadline = String.valueOf(clock.millis() + Duration.ofMinutes(30).toMillis());
        when(redis.execute(RedisWorkQueue.POLL_SCRIPT,
                List.of("jobs:transcode", "jobs:transcode:processing", "jobs:transcode:leases", "jobs:transcode:leases:requeued"),
                deadline)).thenReturn(List.of(PAYLOAD, "0"));

        Delivery delivery = queue.poll(Duration.ofSeconds(5)).orElseThrow();

        assertThat(delivery.descriptor().getJobId()).isEqualTo("j1");
        assertThat(delivery.redelivered()).isFalse();
        verifyNoInteractions(listOps, zsetOps, setOps);

        queue.acknowledge(delivery);
        verify(redis).execute(RedisWorkQueue.ACK_SCRIPT,
                List.of("jobs:transcode:processing", "jobs:transcode:leases"), PAYLOAD);
    }

    @Test
    void leasedPollFlagsPayloadThatWasRequeued() throws Exception {
        RedisWorkQueue queue = new RedisWorkQueue(redis, objectMapper, "jobs:transcode", true, Duration.ofMinutes(30), clock);
        String deadline = String.valueOf(clock.millis() + Duration.ofMinutes(30).toMillis());
        when(redis.execute(RedisWorkQueue.POLL_SCRIPT,
                List.of("jobs:transcode", "jobs:transcode:processing", "jobs:transcode:leases", "jobs:transcode:leases:requeued"),
                deadline)).thenReturn(List.of(PAYLOAD, "1"));

        assertThat(queue.poll(Duration.ofSeconds(5)).orElseThrow().redelivered()).isTrue();
    }

    @Test
    void leasedPollOnEmptyQueueTimesOut() throws Exception {
        RedisWorkQueue queue = new RedisWorkQueue(redis, objectMapper, "jobs:transcode", true, Duration.ofMinutes(30), clock);

        assertThat(queue.poll(Duration.ZERO)).isEmpty();
    }

    @Test
    void extendMovesDeadlineWithoutTouchingTheLists() {
        RedisWorkQueue queue = new RedisWorkQueue(redis, objectMapper, "jobs:transcode", true, Duration.ofMinutes(30), clock);
        String deadline = String.valueOf(clock.millis() + Duration.ofMinutes(30).toMillis());
        Delivery delivery = new Delivery(JobDescriptor.builder().jobId("j1").videoId("v1").build(), PAYLOAD, false);
        when(redis.execute(RedisWorkQueue.EXTEND_SCRIPT, List.of("jobs:transcode:leases"), PAYLOAD, deadline))
                .thenReturn(1L, 0L);

        assertThat(queue.extend(delivery)).isTrue();
        assertThat(queue.extend(delivery)).isFalse();
        verifyNoInteractions(listOps, zsetOps);
    }

    @Test
    void reaperRequeuesExpiredPayloadsInOneScript() {
        RedisWorkQueue queue = new RedisWorkQueue(redis, objectMapper, "jobs:transcode", true, Duration.ofMinutes(30), clock);
        when(redis.execute(RedisWorkQueue.REQUEUE_SCRIPT,
                List.of("jobs:transcode:leases", "jobs:transcode:processing", "jobs:transcode:leases:requeued", "jobs:transcode"),
                String.valueOf(clock.millis()))).thenReturn(List.of(PAYLOAD));

        assertThat(queue.requeueExpired()).isEqualTo(1);
        verifyNoInteractions(listOps, zsetOps, setOps);
    }

    @Test
    void scriptsKeepEachLeaseStepTogether() {
        assertThat(RedisWorkQueue.POLL_SCRIPT.getScriptAsString())
                .containsSubsequence("RPOPLPUSH", "ZADD", "SREM");
        assertThat(RedisWorkQueue.REQUEUE_SCRIPT.getScriptAsString())
                .containsSubsequence("ZRANGEBYSCORE", "ZREM", "LREM", "SADD", "RPUSH");
        assertThat(RedisWorkQueue.ACK_SCRIPT.getScriptAsString()).containsSubsequence("LREM", "ZREM");
    }

    @Test
    void withoutLeasesExtendAndRequeueDoNothing() {
        RedisWorkQueue queue = new RedisWorkQueue(redis, objectMapper, "jobs:transcode", false, Duration.ofMinutes(30), clock);
        Delivery delivery = new Delivery(JobDescriptor.builder().jobId("j1").videoId("v1").build(), PAYLOAD, false);

        assertThat(queue.extend(delivery)).isFalse();
        assertThat(queue.requeueExpired()).isZero();
        verifyNoInteractions(redis);
    }

    @Test
    void connectionFailureIsQueueUnavailable() {
        RedisWorkQueue queue = new RedisWorkQueue(redis, objectMapper, "jobs:transcode", false, Duration.ofMinutes(30), clock);
        when(listOps.leftPush(eq("jobs:transcode"), anyString()))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThatThrownBy(() -> queue.push(JobDescriptor.builder().jobId("j1").videoId("v1").profiles(List.of(240)).build()))
                .isInstanceOf(QueueUnavailableException.class)
                .hasMessageContaining("j1");
    }
}
