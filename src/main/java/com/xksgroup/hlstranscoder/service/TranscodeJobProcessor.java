package com.xksgroup.hlstranscoder.service;

import com.xksgroup.hlstranscoder.config.TranscodeProperties;
import com.xksgroup.hlstranscoder.exception.NotFoundException;
import com.xksgroup.hlstranscoder.exception.TranscodeException;
import com.xksgroup.hlstranscoder.model.EncodedVariant;
import com.xksgroup.hlstranscoder.model.Job.Job;
import com.xksgroup.hlstranscoder.model.Rendition;
import com.xksgroup.hlstranscoder.model.RenditionStatus;
import com.xksgroup.hlstranscoder.model.VariantInfo;
import com.xksgroup.hlstranscoder.model.Video;
import com.xksgroup.hlstranscoder.model.dto.JobDescriptor;
import com.xksgroup.hlstranscoder.repo.JobRepository;
import com.xksgroup.hlstranscoder.repo.RenditionRepository;
import com.xksgroup.hlstranscoder.repo.VideoRepository;
import com.xksgroup.hlstranscoder.service.helper.ProfileLadder;
import com.xksgroup.hlstranscoder.service.helper.StorageKeys;
import com.xksgroup.hlstranscoder.service.helper.WorkingArea;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Drives one job from {@code queued} to {@code done} or {@code failed}.
 * <p>
 * The job goes {@code running} before any rendition does. Each rendition is
 * encoded and uploaded on its own; one failing profile never stops the others.
 * The master playlist is written and the job closed only once every rendition
 * is terminal. A job ends {@code done} iff at least one rendition is
 * {@code ready}.
 */
@Slf4j
@Service
public class TranscodeJobProcessor {

    static final String CANCELLED = "cancelled";

    private static final Runnable NO_KEEP_ALIVE = () -> { };

    private final JobRepository jobRepository;
    private final RenditionRepository renditionRepository;
    private final VideoRepository videoRepository;
    private final ObjectStoreGateway objectStore;
    private final TranscoderAdapter transcoder;
    private final PlaylistAssembler playlistAssembler;
    private final JobCancellationRegistry cancellationRegistry;
    private final Path workDir;
    private final boolean leaseEnabled;
    private final ExecutorService encodePool;

    public TranscodeJobProcessor(JobRepository jobRepository,
                                 RenditionRepository renditionRepository,
                                 VideoRepository videoRepository,
                                 ObjectStoreGateway objectStore,
                                 TranscoderAdapter transcoder,
                                 PlaylistAssembler playlistAssembler,
                                 JobCancellationRegistry cancellationRegistry,
                                 TranscodeProperties properties) {
        this.jobRepository = jobRepository;
        this.renditionRepository = renditionRepository;
        this.videoRepository = videoRepository;
        this.objectStore = objectStore;
        this.transcoder = transcoder;
        this.playlistAssembler = playlistAssembler;
        this.cancellationRegistry = cancellationRegistry;
        this.workDir = properties.getWorker().getWorkDir();
        this.leaseEnabled = properties.getQueue().getLease().isEnabled();

        int parallelism = Math.max(1, properties.getWorker().getEncodeParallelism());
        if (parallelism > 1) {
            AtomicInteger counter = new AtomicInteger();
            this.encodePool = Executors.newFixedThreadPool(parallelism,
                    r -> new Thread(r, "encode-" + counter.incrementAndGet()));
        } else {
            this.encodePool = null;
        }
    }

    public void process(JobDescriptor descriptor) {
        process(descriptor, false);
    }

    /**
     * @param redelivery the descriptor was handed out before and its lease expired
     */
    public void process(JobDescriptor descriptor, boolean redelivery) {
        process(descriptor, redelivery, NO_KEEP_ALIVE);
    }

    /**
     * @param redelivery the descriptor was handed out before and its lease expired
     * @param keepAlive  invoked between steps of the job to extend the delivery lease
     */
    public void process(JobDescriptor descriptor, boolean redelivery, Runnable keepAlive) {
        String jobId = descriptor.getJobId();
        MDC.put("jobId", jobId);
        try {
            Optional<Job> loaded = jobRepository.findById(jobId);
            if (loaded.isEmpty()) {
                log.error("Job {} not found, descriptor abandoned", jobId);
                return;
            }
            Job job = loaded.get();
            if (job.getStatus().isTerminal()) {
                log.info("Job {} is already {}, skipping", jobId, job.getStatus().dbValue());
                return;
            }

            try {
                jobRepository.markRunning(jobId, redelivery);
            } catch (TranscodeException e) {
                log.error("Job {} could not be started, descriptor abandoned: {}", jobId, e.getMessage());
                return;
            }
            log.info("Job {} running", jobId);

            runJob(job, descriptor, keepAlive);

        } catch (RuntimeException e) {
            log.error("Job {} aborted by unexpected error", jobId, e);
            failJobQuietly(jobId, describe(e));
        } finally {
            MDC.remove("jobId");
        }
    }

    private void runJob(Job job, JobDescriptor descriptor, Runnable keepAlive) {
        String jobId = job.getId();
        String videoId = job.getVideoId();

        List<Integer> heights = descriptor.getProfiles() == null || descriptor.getProfiles().isEmpty()
                ? job.getProfiles()
                : descriptor.getProfiles();

        Map<Integer, Rendition> rows = renditionRepository.findByJobId(jobId).stream()
                .collect(Collectors.toMap(Rendition::getHeight, Function.identity(), (a, b) -> a));

        List<VariantInfo> ready = new ArrayList<>();
        Map<Integer, String> failures = new TreeMap<>();
        List<Integer> pending = new ArrayList<>();

        for (Integer height : new LinkedHashSet<>(heights)) {
            Rendition row = rows.get(height);
            if (row == null) {
                log.warn("Job {} has no rendition row for {}p, profile ignored", jobId, height);
                continue;
            }
            if (row.getStatus() == RenditionStatus.READY) {
                ready.add(toVariant(row));
                continue;
            }
            if (row.getStatus() == RenditionStatus.FAILED) {
                failures.put(height, row.getError());
                continue;
            }
            renditionRepository.markRunning(jobId, height);
            pending.add(height);
        }

        if (pending.isEmpty()) {
            finish(jobId, videoId, ready, failures, null);
            return;
        }

        CancellationToken token = cancellationRegistry.register(jobId);
        try (WorkingArea area = WorkingArea.create(workDir, jobId)) {
            Path source;
            try {
                keepAlive.run();
                source = fetchSource(videoId, area);
            } catch (RuntimeException e) {
                String cause = describe(e);
                log.error("Job {} setup failed: {}", jobId, cause);
                for (int height : pending) {
                    markRenditionFailed(jobId, height, cause);
                    failures.put(height, cause);
                }
                finish(jobId, videoId, ready, failures, cause);
                return;
            }

            for (ProfileOutcome outcome : encodeAll(jobId, videoId, pending, source, area, token, keepAlive)) {
                if (outcome.variant() != null) {
                    ready.add(outcome.variant());
                } else {
                    failures.put(outcome.height(), outcome.error());
                }
            }
            keepAlive.run();
            finish(jobId, videoId, ready, failures, null);

        } catch (IOException e) {
            String cause = "working area unavailable: " + e.getMessage();
            log.error("Job {} setup failed: {}", jobId, cause);
            for (int height : pending) {
                markRenditionFailed(jobId, height, cause);
                failures.put(height, cause);
            }
            finish(jobId, videoId, ready, failures, cause);
        } finally {
            cancellationRegistry.unregister(jobId);
        }
    }

    private Path fetchSource(String videoId, WorkingArea area) {
        Video video = videoRepository.findById(videoId)
                .orElseThrow(() -> NotFoundException.video(videoId));
        String sourceKey = video.getSourceKey();
        Path target = area.resolve("source." + extension(sourceKey));
        objectStore.download(sourceKey, target);
        log.debug("Source {} downloaded to {}", sourceKey, target);
        return target;
    }

    private List<ProfileOutcome> encodeAll(String jobId, String videoId, List<Integer> heights,
                                           Path source, WorkingArea area, CancellationToken token,
                                           Runnable keepAlive) {
        List<ProfileOutcome> outcomes = new ArrayList<>();
        if (encodePool == null) {
            for (int height : heights) {
                outcomes.add(encodeProfile(jobId, videoId, height, source, area, token, keepAlive));
            }
            return outcomes;
        }

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<Future<ProfileOutcome>> futures = new ArrayList<>();
        for (int height : heights) {
            futures.add(encodePool.submit(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    return encodeProfile(jobId, videoId, height, source, area, token, keepAlive);
                } finally {
                    MDC.clear();
                }
            }));
        }
        for (int i = 0; i < futures.size(); i++) {
            int height = heights.get(i);
            try {
                outcomes.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                markRenditionFailed(jobId, height, "interrupted");
                outcomes.add(ProfileOutcome.failed(height, "interrupted"));
            } catch (ExecutionException e) {
                String cause = describe(e.getCause());
                markRenditionFailed(jobId, height, cause);
                outcomes.add(ProfileOutcome.failed(height, cause));
            }
        }
        return outcomes;
    }

    private ProfileOutcome encodeProfile(String jobId, String videoId, int height, Path source,
                                         WorkingArea area, CancellationToken token, Runnable keepAlive) {
        if (token.isCancelled()) {
            markRenditionFailed(jobId, height, CANCELLED);
            return ProfileOutcome.failed(height, CANCELLED);
        }
        try {
            keepAlive.run();
            Path outputDir = area.directory(String.valueOf(height));
            EncodedVariant encoded = transcoder.transcode(source, height, outputDir, token);
            keepAlive.run();

            for (Path segment : encoded.segments()) {
                objectStore.putFile(StorageKeys.renditionObject(videoId, height, segment.getFileName().toString()), segment);
            }
            String playlistKey = StorageKeys.renditionPlaylist(videoId, height);
            objectStore.putFile(playlistKey, encoded.playlist());

            renditionRepository.markReady(jobId, height, playlistKey, encoded.width(), encoded.codecs());
            log.info("Rendition {}p ready ({} segments)", height, encoded.segments().size());

            return ProfileOutcome.ready(height, VariantInfo.builder()
                    .height(height)
                    .width(encoded.width())
                    .bandwidth(encoded.bandwidth())
                    .codecs(encoded.codecs())
                    .build());

        } catch (Exception e) {
            String cause = token.isCancelled() ? CANCELLED : describe(e);
            log.warn("Rendition {}p failed: {}", height, firstLine(cause));
            markRenditionFailed(jobId, height, cause);
            return ProfileOutcome.failed(height, cause);
        }
    }

    private void finish(String jobId, String videoId, List<VariantInfo> ready,
                        Map<Integer, String> failures, String setupCause) {
        if (ready.isEmpty()) {
            String error = setupCause != null ? setupCause : aggregate(failures);
            jobRepository.markFailed(jobId, error);
            log.error("Job {} failed: {}", jobId, firstLine(error));
            return;
        }

        String master = playlistAssembler.assemble(ready);
        byte[] bytes = master.getBytes(StandardCharsets.UTF_8);
        String masterKey = StorageKeys.masterPlaylist(videoId);
        try {
            objectStore.put(masterKey, new ByteArrayInputStream(bytes), bytes.length,
                    ObjectStoreGateway.contentTypeFor(masterKey));
        } catch (RuntimeException e) {
            String error = "master playlist upload failed: " + describe(e);
            jobRepository.markFailed(jobId, error);
            log.error("Job {} failed: {}", jobId, error);
            return;
        }

        markDone(jobId);
        log.info("Job {} done: {} of {} rendition(s) ready, master at {}",
                jobId, ready.size(), ready.size() + failures.size(), masterKey);
    }

    private void markDone(String jobId) {
        try {
            jobRepository.markDone(jobId);
        } catch (DataAccessException e) {
            log.warn("Job {} could not be marked done, retrying once: {}", jobId, e.getMessage());
            jobRepository.markDone(jobId);
        }
    }

    static String aggregate(Map<Integer, String> failures) {
        if (failures.isEmpty()) {
            return "all renditions failed";
        }
        return "all renditions failed: " + failures.entrySet().stream()
                .map(e -> e.getKey() + "p: " + e.getValue())
                .collect(Collectors.joining("; "));
    }

    private void markRenditionFailed(String jobId, int height, String error) {
        try {
            renditionRepository.markFailed(jobId, height, error);
        } catch (RuntimeException e) {
            log.error("Could not record failure of rendition {}p: {}", height, e.getMessage());
        }
    }

    private void failJobQuietly(String jobId, String error) {
        try {
            for (Rendition rendition : renditionRepository.findByJobId(jobId)) {
                if (!rendition.getStatus().isTerminal()) {
                    markRenditionFailed(jobId, rendition.getHeight(), error);
                }
            }
            boolean anyReady = renditionRepository.findByJobId(jobId).stream()
                    .anyMatch(r -> r.getStatus() == RenditionStatus.READY);
            if (anyReady && leaseEnabled) {
                // The lease expires and the redelivery rebuilds the master from the ready rows
                log.error("Job {} left running with ready renditions after: {}", jobId, error);
                return;
            }
            jobRepository.markFailed(jobId, error);
        } catch (RuntimeException e) {
            log.error("Could not record failure of job {}: {}", jobId, e.getMessage());
        }
    }

    private static VariantInfo toVariant(Rendition rendition) {
        ProfileLadder.Preset preset = ProfileLadder.lookup(rendition.getHeight());
        int width = rendition.getWidth() != null ? rendition.getWidth() : 0;
        return VariantInfo.builder()
                .height(rendition.getHeight())
                .width(width)
                .bandwidth(preset.bandwidth())
                .codecs(rendition.getCodecs() != null ? rendition.getCodecs() : preset.codecs(true))
                .build();
    }

    private static String describe(Throwable e) {
        if (e == null) {
            return "unknown error";
        }
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static String firstLine(String message) {
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }

    private static String extension(String key) {
        int dot = key.lastIndexOf('.');
        int slash = key.lastIndexOf('/');
        return dot > slash ? key.substring(dot + 1) : "mp4";
    }

    @PreDestroy
    public void shutdown() {
        if (encodePool != null) {
            encodePool.shutdownNow();
        }
    }

    private record ProfileOutcome(int height, VariantInfo variant, String error) {
        static ProfileOutcome ready(int height, VariantInfo variant) {
            return new ProfileOutcome(height, variant, null);
        }

        static ProfileOutcome failed(int height, String error) {
            return new ProfileOutcome(height, null, error);
        }
    }
}
