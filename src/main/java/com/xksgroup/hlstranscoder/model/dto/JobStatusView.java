package com.xksgroup.hlstranscoder.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.xksgroup.hlstranscoder.model.Job.Job;
import com.xksgroup.hlstranscoder.model.Rendition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;

/**
 * Snapshot of a job and its renditions, as returned to the API layer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusView {

    @JsonProperty("job_id")
    private String jobId;

    @JsonProperty("video_id")
    private String videoId;

    private String status;
    private String error;
    private List<Integer> profiles;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;

    private List<RenditionView> renditions;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RenditionView {
        private int height;
        private Integer width;
        private String status;
        private String key;
        private String error;

        public static RenditionView from(Rendition rendition) {
            return RenditionView.builder()
                    .height(rendition.getHeight())
                    .width(rendition.getWidth())
                    .status(rendition.getStatus().dbValue())
                    .key(rendition.getKey())
                    .error(rendition.getError())
                    .build();
        }
    }

    public static JobStatusView from(Job job, List<Rendition> renditions) {
        return JobStatusView.builder()
                .jobId(job.getId())
                .videoId(job.getVideoId())
                .status(job.getStatus().dbValue())
                .error(job.getError())
                .profiles(job.getProfiles())
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt())
                .renditions(renditions.stream()
                        .sorted(Comparator.comparingInt(Rendition::getHeight))
                        .map(RenditionView::from)
                        .toList())
                .build();
    }
}
