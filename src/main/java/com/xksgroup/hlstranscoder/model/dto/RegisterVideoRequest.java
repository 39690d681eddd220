package com.xksgroup.hlstranscoder.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record RegisterVideoRequest(
        @NotBlank @JsonProperty("filename") String filename
) {}
