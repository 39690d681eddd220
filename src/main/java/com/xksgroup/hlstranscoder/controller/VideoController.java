package com.xksgroup.hlstranscoder.controller;

import com.xksgroup.hlstranscoder.model.Video;
import com.xksgroup.hlstranscoder.model.dto.RegisterVideoRequest;
import com.xksgroup.hlstranscoder.model.dto.VideoSummaryDto;
import com.xksgroup.hlstranscoder.service.JobProducer;
import com.xksgroup.hlstranscoder.service.TranscodeQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/videos")
@RequiredArgsConstructor
@Tag(name = "Videos", description = "Video summaries and master playlists")
public class VideoController {

    private static final MediaType MPEGURL = MediaType.parseMediaType("application/vnd.apple.mpegurl");

    private final TranscodeQueryService queryService;
    private final JobProducer jobProducer;

    @PostMapping
    @Operation(
        summary = "Register a source video",
        description = "Records a video whose bytes the upload layer has already stored, and returns the "
                + "source key it must live under. Transcoding is requested separately."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "201", description = "Video registered"),
        @ApiResponse(responseCode = "400", description = "Missing filename")
    })
    public ResponseEntity<Object> registerVideo(@Valid @RequestBody RegisterVideoRequest request) {
        Video video = jobProducer.registerVideo(request.filename());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("video_id", video.getId());
        body.put("source_key", video.getSourceKey());
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @GetMapping
    @Operation(summary = "Recent videos", description = "Newest videos first, with the state of their latest job.")
    public ResponseEntity<List<VideoSummaryDto>> listVideos(
            @Parameter(description = "Maximum number of videos", example = "20")
            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(queryService.listRecentVideos(limit));
    }

    @GetMapping("/{videoId}/summary")
    @Operation(summary = "Video summary")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Video found"),
        @ApiResponse(responseCode = "404", description = "Unknown video")
    })
    public ResponseEntity<VideoSummaryDto> getSummary(@PathVariable String videoId) {
        return ResponseEntity.ok(queryService.getVideoSummary(videoId));
    }

    @GetMapping("/{videoId}/playlist")
    @Operation(
        summary = "Master playlist",
        description = "Master manifest of the video's latest job. Variant URIs such as 240/index.m3u8 are "
                + "relative to the manifest's storage location (HLS/{videoId}/). Clients fetch variant playlists "
                + "and segments from the object store or the proxy in front of it; this API does not serve them."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Manifest bytes"),
        @ApiResponse(responseCode = "404", description = "Unknown video"),
        @ApiResponse(responseCode = "409", description = "Latest job is not done")
    })
    public ResponseEntity<byte[]> getPlaylist(@PathVariable String videoId) {
        byte[] manifest = queryService.getMasterPlaylist(videoId);
        return ResponseEntity.ok()
                .contentType(MPEGURL)
                .cacheControl(CacheControl.noCache())
                .body(manifest);
    }
}
