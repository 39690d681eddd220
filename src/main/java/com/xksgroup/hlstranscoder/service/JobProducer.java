package com.xksgroup.hlstranscoder.service;

import com.xksgroup.hlstranscoder.config.TranscodeProperties;
import com.xksgroup.hlstranscoder.exception.NotFoundException;
import com.xksgroup.hlstranscoder.exception.QueueUnavailableException;
import com.xksgroup.hlstranscoder.model.Job.Job;
import com.xksgroup.hlstranscoder.model.Job.JobStatus;
import com.xksgroup.hlstranscoder.model.Rendition;
import com.xksgroup.hlstranscoder.model.RenditionStatus;
import com.xksgroup.hlstranscoder.model.Video;
import com.xksgroup.hlstranscoder.model.dto.JobDescriptor;
import com.xksgroup.hlstranscoder.repo.JobRepository;
import com.xksgroup.hlstranscoder.repo.RenditionRepository;
import com.xksgroup.hlstranscoder.repo.VideoRepository;
import com.xksgroup.hlstranscoder.service.helper.ProfileLadder;
import com.xksgroup.hlstranscoder.service.helper.StorageKeys;
import com.xksgroup.hlstranscoder.service.queue.WorkQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;

/**
 * Accepts transcode requests: validates them, records the job and its
 * renditions, then enqueues one descriptor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobProducer {

    private final VideoRepository videoRepository;
    private final JobRepository jobRepository;
    private final RenditionRepository renditionRepository;
    private final WorkQueue workQueue;
    private final ProfileLadder profileLadder;
    private final TranscodeProperties properties;
    private final TransactionTemplate transactionTemplate;

    /**
     * @param profiles target heights; null or empty selects the default ladder
     * @throws NotFoundException when the video is unknown
     * @throws com.xksgroup.hlstranscoder.exception.InvalidProfileException for an unsupported height
     * @throws QueueUnavailableException when the descriptor could not be enqueued; the job is then failed
     */
    public Job submit(String videoId, List<Integer> profiles) {
        List<Integer> heights = resolveProfiles(profiles);

        if (!videoRepository.existsById(videoId)) {
            throw NotFoundException.video(videoId);
        }

        String jobId = UUID.randomUUID().toString();
        Job job = Job.builder()
                .id(jobId)
                .videoId(videoId)
                .status(JobStatus.QUEUED)
                .profiles(heights)
                .build();

        List<Rendition> renditions = new ArrayList<>();
        for (int height : heights) {
            renditions.add(Rendition.builder()
                    .videoId(videoId)
                    .jobId(jobId)
                    .height(height)
                    .bitrateKbps(profileLadder.presetFor(height).videoKbps())
                    .status(RenditionStatus.QUEUED)
                    .build());
        }

        transactionTemplate.executeWithoutResult(status -> {
            jobRepository.insert(job);
            renditionRepository.insertAll(renditions);
        });

        JobDescriptor descriptor = JobDescriptor.builder()
                .jobId(jobId)
                .videoId(videoId)
                .profiles(heights)
                .build();
        try {
            workQueue.push(descriptor);
        } catch (RuntimeException e) {
            log.error("Job {} recorded but could not be enqueued: {}", jobId, e.getMessage());
            String error = "enqueue failed: " + e.getMessage();
            transactionTemplate.executeWithoutResult(status -> {
                for (int height : heights) {
                    renditionRepository.markFailed(jobId, height, error);
                }
                jobRepository.markFailed(jobId, error);
            });
            if (e instanceof QueueUnavailableException queueUnavailable) {
                throw queueUnavailable;
            }
            throw new QueueUnavailableException(error, e);
        }

        log.info("Job {} queued for video {} with profiles {}", jobId, videoId, heights);
        return job;
    }

    /**
     * Record a source video whose bytes were already stored by the upload layer.
     */
    public Video registerVideo(String originalFilename) {
        String videoId = UUID.randomUUID().toString();
        Video video = Video.builder()
                .id(videoId)
                .sourceKey(StorageKeys.source(videoId, StorageKeys.extensionOf(originalFilename)))
                .createdAt(LocalDateTime.now())
                .build();
        videoRepository.insert(video);
        log.info("Registered video {} at {}", videoId, video.getSourceKey());
        return video;
    }

    List<Integer> resolveProfiles(List<Integer> requested) {
        List<Integer> source = requested == null || requested.isEmpty()
                ? properties.getDefaultLadder()
                : requested;

        LinkedHashSet<Integer> heights = new LinkedHashSet<>();
        for (Integer height : source) {
            if (height == null) {
                throw new IllegalArgumentException("profiles must not contain null");
            }
            profileLadder.presetFor(height);
            heights.add(height);
        }
        return List.copyOf(heights);
    }
}
