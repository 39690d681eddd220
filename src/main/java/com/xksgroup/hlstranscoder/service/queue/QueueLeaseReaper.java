package com.xksgroup.hlstranscoder.service.queue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "transcode.queue.lease.enabled", havingValue = "true")
public class QueueLeaseReaper {

    private final WorkQueue workQueue;

    @Scheduled(fixedDelayString = "${transcode.queue.lease.reap-interval:60s}")
    public void reap() {
        try {
            int requeued = workQueue.requeueExpired();
            if (requeued > 0) {
                log.info("Requeued {} descriptor(s) with expired leases", requeued);
            }
        } catch (RuntimeException e) {
            log.warn("Lease reaping failed: {}", e.getMessage());
        }
    }
}
