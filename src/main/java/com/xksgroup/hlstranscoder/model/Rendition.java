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
public class Rendition {

    private String id;
    private String videoId;
    private String jobId;

    private int height;         // target height, e.g. 240/480/720
    private Integer width;      // known once encoded
    private Integer bitrateKbps; // target video bitrate

    private RenditionStatus status;

    private String key;         // variant playlist key, set together with READY
    private String codecs;      // CODECS attribute of the encoded stream
    private String error;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
