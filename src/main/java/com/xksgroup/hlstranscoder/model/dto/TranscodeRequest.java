package com.xksgroup.hlstranscoder.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record TranscodeRequest(
        @NotBlank @JsonProperty("video_id") String videoId,
        @JsonProperty("profiles") List<Integer> profiles
) {}
