package com.xksgroup.hlstranscoder.model.Job;

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
public class Job {

    private String id;
    private String videoId;
    private JobStatus status;

    // Requested ladder, in request order
    private List<Integer> profiles;

    private String error;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
