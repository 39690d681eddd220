package com.xksgroup.hlstranscoder.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Work queue message. Wire format:
 * {@code {"job_id": "...", "video_id": "...", "profiles": [240, 480, 720]}}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobDescriptor {

    @JsonProperty("job_id")
    private String jobId;

    @JsonProperty("video_id")
    private String videoId;

    @JsonProperty("profiles")
    private List<Integer> profiles;
}
