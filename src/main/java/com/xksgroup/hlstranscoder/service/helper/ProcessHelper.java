package com.xksgroup.hlstranscoder.service.helper;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs external tools with a bounded wait and keeps the tail of their output.
 * Processes are tracked per job so that a cancel can kill them.
 */
@Slf4j
@Component
public class ProcessHelper {

    public static final int OUTPUT_TAIL_CHARS = 4000;

    private final ExecutorService outputReaders = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "process-output");
        t.setDaemon(true);
        return t;
    });

    // Running processes by job id
    private final ConcurrentHashMap<String, Set<Process>> runningProcesses = new ConcurrentHashMap<>();

    /**
     * Run {@code command} in {@code workingDirectory} (null for the current
     * one). Output is merged, logged at debug and the last
     * {@value #OUTPUT_TAIL_CHARS} characters are returned.
     */
    public ProcessResult run(List<String> command, Path workingDirectory, Duration timeout, String jobId)
            throws IOException, InterruptedException {

        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(workingDirectory != null ? workingDirectory.toFile() : null)
                .redirectErrorStream(true);
        pb.environment().put("MALLOC_ARENA_MAX", "2");

        log.debug("Running: {}", String.join(" ", command));
        Process process = pb.start();
        if (jobId != null) {
            runningProcesses.computeIfAbsent(jobId, id -> ConcurrentHashMap.newKeySet()).add(process);
        }

        OutputTail tail = new OutputTail(OUTPUT_TAIL_CHARS);
        Future<?> reader = outputReaders.submit(() -> {
            try (BufferedReader in = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = in.readLine()) != null) {
                    log.debug("{}: {}", command.get(0), line);
                    tail.append(line);
                }
            } catch (IOException e) {
                log.debug("Output stream of {} closed: {}", command.get(0), e.getMessage());
            }
        });

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.warn("{} exceeded {} and is being killed", command.get(0), timeout);
                process.destroyForcibly().waitFor(10, TimeUnit.SECONDS);
            }
            drain(reader);
            return new ProcessResult(finished ? process.exitValue() : -1, !finished, tail.toString());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            reader.cancel(true);
            throw e;
        } finally {
            if (jobId != null) {
                runningProcesses.computeIfPresent(jobId, (id, set) -> {
                    set.remove(process);
                    return set.isEmpty() ? null : set;
                });
            }
        }
    }

    /**
     * Kill every process started for {@code jobId} on this instance.
     *
     * @return whether anything was running
     */
    public boolean stopProcesses(String jobId) {
        Set<Process> processes = runningProcesses.remove(jobId);
        if (processes == null || processes.isEmpty()) {
            return false;
        }
        boolean stopped = false;
        for (Process process : processes) {
            if (process.isAlive()) {
                log.info("Stopping process {} for job {}", process.pid(), jobId);
                process.destroyForcibly();
                stopped = true;
            }
        }
        return stopped;
    }

    private void drain(Future<?> reader) {
        try {
            reader.get(10, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Timed out waiting for process output to drain");
            reader.cancel(true);
        } catch (InterruptedException e) {
            reader.cancel(true);
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.debug("Output reader ended with {}", e.getCause().toString());
        }
    }

    public record ProcessResult(int exitCode, boolean timedOut, String output) {
        public boolean succeeded() {
            return !timedOut && exitCode == 0;
        }
    }

    /**
     * Bounded character buffer keeping the most recent output.
     */
    static final class OutputTail {
        private final int limit;
        private final StringBuilder buffer = new StringBuilder();

        OutputTail(int limit) {
            this.limit = limit;
        }

        synchronized void append(String line) {
            buffer.append(line).append('\n');
            int overflow = buffer.length() - limit;
            if (overflow > 0) {
                buffer.delete(0, overflow);
            }
        }

        @Override
        public synchronized String toString() {
            return buffer.toString();
        }
    }
}
