package com.xksgroup.hlstranscoder.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Video {
    private String id;
    private String sourceKey;
    private LocalDateTime createdAt;
}
