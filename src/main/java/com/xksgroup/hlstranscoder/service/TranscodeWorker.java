package com.xksgroup.hlstranscoder.service;

import com.xksgroup.hlstranscoder.config.TranscodeProperties;
import com.xksgroup.hlstranscoder.service.queue.Delivery;
import com.xksgroup.hlstranscoder.service.queue.WorkQueue;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Queue consumer loops. Each thread polls, processes and acknowledges one
 * descriptor at a time.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "transcode.worker.enabled", havingValue = "true", matchIfMissing = true)
public class TranscodeWorker implements CommandLineRunner {

    private static final Duration ERROR_BACKOFF = Duration.ofSeconds(2);

    private final WorkQueue workQueue;
    private final TranscodeJobProcessor processor;
    private final int threadCount;
    private final Duration pollTimeout;
    private final Duration shutdownTimeout;

    private ExecutorService executorService;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger processed = new AtomicInteger();

    public TranscodeWorker(WorkQueue workQueue, TranscodeJobProcessor processor, TranscodeProperties properties) {
        this.workQueue = workQueue;
        this.processor = processor;
        this.threadCount = Math.max(1, properties.getWorker().getThreads());
        this.pollTimeout = properties.getQueue().getPollTimeout();
        this.shutdownTimeout = properties.getWorker().getShutdownTimeout();
    }

    @Override
    public void run(String... args) {
        start();
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        log.info("Starting TranscodeWorker with {} thread(s)", threadCount);

        AtomicInteger counter = new AtomicInteger();
        executorService = Executors.newFixedThreadPool(threadCount,
                r -> new Thread(r, "transcode-worker-" + counter.getAndIncrement()));

        for (int i = 0; i < threadCount; i++) {
            final int workerId = i;
            executorService.submit(() -> workerLoop(workerId));
        }
    }

    private void workerLoop(int workerId) {
        log.info("Worker-{} started", workerId);

        while (running.get()) {
            Delivery delivery = null;
            try {
                Optional<Delivery> next = workQueue.poll(pollTimeout);
                if (next.isEmpty()) {
                    continue;
                }
                delivery = next.get();
                String jobId = delivery.descriptor().getJobId();
                log.info("Worker-{} picked up job {}{}", workerId, jobId, delivery.redelivered() ? " (redelivery)" : "");

                long startTime = System.currentTimeMillis();
                Delivery leased = delivery;
                processor.process(delivery.descriptor(), delivery.redelivered(), () -> extendLease(leased));
                processed.incrementAndGet();
                log.info("Worker-{} finished job {} in {}ms", workerId, jobId, System.currentTimeMillis() - startTime);

            } catch (InterruptedException e) {
                log.info("Worker-{} interrupted, shutting down", workerId);
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Worker-{} encountered unexpected error", workerId, e);
                if (!backoff()) {
                    break;
                }
            } finally {
                if (delivery != null) {
                    acknowledge(delivery);
                }
            }
        }

        log.info("Worker-{} stopped", workerId);
    }

    private void extendLease(Delivery delivery) {
        if (!workQueue.isLeaseEnabled()) {
            return;
        }
        try {
            if (!workQueue.extend(delivery)) {
                log.warn("Lease of job {} is gone, it may be processed twice", delivery.descriptor().getJobId());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to extend lease of job {}: {}", delivery.descriptor().getJobId(), e.getMessage());
        }
    }

    private void acknowledge(Delivery delivery) {
        try {
            workQueue.acknowledge(delivery);
        } catch (RuntimeException e) {
            log.warn("Failed to acknowledge job {}: {}", delivery.descriptor().getJobId(), e.getMessage());
        }
    }

    private boolean backoff() {
        try {
            Thread.sleep(ERROR_BACKOFF.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public int processedCount() {
        return processed.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (!running.getAndSet(false)) {
            return;
        }
        log.info("Shutting down TranscodeWorker...");

        if (executorService != null) {
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Workers did not finish in-flight jobs in time, forcing shutdown");
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                log.error("Interrupted while waiting for workers to terminate", e);
                executorService.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        log.info("TranscodeWorker shut down complete");
    }
}
