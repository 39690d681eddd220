package com.xksgroup.hlstranscoder.service.queue;

import com.xksgroup.hlstranscoder.model.dto.JobDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

/**
 * Single-process queue for local runs and tests.
 */
@Slf4j
public class InMemoryWorkQueue implements WorkQueue {

    private final BlockingDeque<Entry> queue = new LinkedBlockingDeque<>();
    private final Map<String, Lease> leases = new ConcurrentHashMap<>();
    private final Set<String> redelivered = ConcurrentHashMap.newKeySet();

    private final boolean leaseEnabled;
    private final Duration leaseDuration;
    private final Clock clock;

    public InMemoryWorkQueue() {
        this(false, Duration.ofMinutes(30), Clock.systemUTC());
    }

    public InMemoryWorkQueue(boolean leaseEnabled, Duration leaseDuration, Clock clock) {
        this.leaseEnabled = leaseEnabled;
        this.leaseDuration = leaseDuration;
        this.clock = clock;
    }

    @Override
    public void push(JobDescriptor descriptor) {
        queue.offerLast(new Entry(UUID.randomUUID().toString(), descriptor));
        log.debug("Queued job {}", descriptor.getJobId());
    }

    @Override
    public Optional<Delivery> poll(Duration timeout) throws InterruptedException {
        Entry entry = queue.pollFirst(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (entry == null) {
            return Optional.empty();
        }
        boolean again = redelivered.remove(entry.receipt());
        if (leaseEnabled) {
            leases.put(entry.receipt(), new Lease(entry, clock.instant().plus(leaseDuration)));
        }
        return Optional.of(new Delivery(entry.descriptor(), entry.receipt(), again));
    }

    @Override
    public void acknowledge(Delivery delivery) {
        if (leaseEnabled) {
            leases.remove(delivery.receipt());
        }
    }

    @Override
    public boolean extend(Delivery delivery) {
        if (!leaseEnabled) {
            return false;
        }
        Instant deadline = clock.instant().plus(leaseDuration);
        return leases.computeIfPresent(delivery.receipt(), (receipt, lease) -> new Lease(lease.entry(), deadline)) != null;
    }

    @Override
    public int requeueExpired() {
        if (!leaseEnabled) {
            return 0;
        }
        Instant now = clock.instant();
        List<Entry> expired = new ArrayList<>();
        leases.forEach((receipt, lease) -> {
            if (!lease.deadline().isAfter(now) && leases.remove(receipt, lease)) {
                expired.add(lease.entry());
            }
        });
        for (Entry entry : expired) {
            redelivered.add(entry.receipt());
            queue.offerFirst(entry);
            log.warn("Lease expired for job {}, descriptor requeued", entry.descriptor().getJobId());
        }
        return expired.size();
    }

    @Override
    public long size() {
        return queue.size();
    }

    @Override
    public boolean isLeaseEnabled() {
        return leaseEnabled;
    }

    int inFlight() {
        return leases.size();
    }

    private record Entry(String receipt, JobDescriptor descriptor) {
    }

    private record Lease(Entry entry, Instant deadline) {
    }
}
