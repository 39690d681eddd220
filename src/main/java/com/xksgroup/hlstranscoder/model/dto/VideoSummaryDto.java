package com.xksgroup.hlstranscoder.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VideoSummaryDto {

    private String id;

    @JsonProperty("source_key")
    private String sourceKey;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    // Latest job, null when the video was never submitted
    @JsonProperty("job_id")
    private String jobId;

    @JsonProperty("job_status")
    private String jobStatus;

    private List<JobStatusView.RenditionView> renditions;
}
