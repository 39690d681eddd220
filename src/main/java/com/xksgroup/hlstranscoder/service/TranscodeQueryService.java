package com.xksgroup.hlstranscoder.service;

import com.xksgroup.hlstranscoder.exception.NotFoundException;
import com.xksgroup.hlstranscoder.exception.NotReadyException;
import com.xksgroup.hlstranscoder.exception.StorageUnavailableException;
import com.xksgroup.hlstranscoder.model.Job.Job;
import com.xksgroup.hlstranscoder.model.Job.JobStatus;
import com.xksgroup.hlstranscoder.model.Video;
import com.xksgroup.hlstranscoder.model.dto.JobStatusView;
import com.xksgroup.hlstranscoder.model.dto.VideoSummaryDto;
import com.xksgroup.hlstranscoder.repo.JobRepository;
import com.xksgroup.hlstranscoder.repo.RenditionRepository;
import com.xksgroup.hlstranscoder.repo.VideoRepository;
import com.xksgroup.hlstranscoder.service.helper.StorageKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;

/**
 * Read side used by collaborators (player, API layer).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TranscodeQueryService {

    static final int MAX_LIST_LIMIT = 200;

    private final VideoRepository videoRepository;
    private final JobRepository jobRepository;
    private final RenditionRepository renditionRepository;
    private final ObjectStoreGateway objectStore;

    public JobStatusView getJobStatus(String jobId) {
        Job job = jobRepository.findById(jobId)
                .orElseThrow(() -> NotFoundException.job(jobId));
        return JobStatusView.from(job, renditionRepository.findByJobId(jobId));
    }

    /**
     * Stored master playlist of the video's latest job.
     *
     * @throws NotReadyException unless that job is {@code done}
     */
    public byte[] getMasterPlaylist(String videoId) {
        if (!videoRepository.existsById(videoId)) {
            throw NotFoundException.video(videoId);
        }
        Job latest = jobRepository.findLatestByVideoId(videoId)
                .orElseThrow(() -> new NotReadyException("video " + videoId + " has no transcode job"));
        if (latest.getStatus() != JobStatus.DONE) {
            throw new NotReadyException("latest job " + latest.getId() + " of video " + videoId
                    + " is " + latest.getStatus().dbValue());
        }

        String key = StorageKeys.masterPlaylist(videoId);
        try (InputStream in = objectStore.get(key)) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new StorageUnavailableException(
                    "failed to read " + key + ": " + e.getMessage(), e);
        }
    }

    public VideoSummaryDto getVideoSummary(String videoId) {
        Video video = videoRepository.findById(videoId)
                .orElseThrow(() -> NotFoundException.video(videoId));
        return summarize(video);
    }

    /**
     * Newest videos first.
     */
    public List<VideoSummaryDto> listRecentVideos(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        int bounded = Math.min(limit, MAX_LIST_LIMIT);
        return videoRepository.findRecent(bounded).stream()
                .map(this::summarize)
                .toList();
    }

    private VideoSummaryDto summarize(Video video) {
        Optional<Job> latest = jobRepository.findLatestByVideoId(video.getId());
        VideoSummaryDto.VideoSummaryDtoBuilder summary = VideoSummaryDto.builder()
                .id(video.getId())
                .sourceKey(video.getSourceKey())
                .createdAt(video.getCreatedAt());
        latest.ifPresentOrElse(job -> {
            JobStatusView view = JobStatusView.from(job, renditionRepository.findByJobId(job.getId()));
            summary.jobId(job.getId())
                    .jobStatus(view.getStatus())
                    .renditions(view.getRenditions());
        }, () -> summary.renditions(List.of()));
        return summary.build();
    }
}
