package com.xksgroup.hlstranscoder.controller;

import com.xksgroup.hlstranscoder.model.Job.Job;
import com.xksgroup.hlstranscoder.model.dto.JobStatusView;
import com.xksgroup.hlstranscoder.model.dto.TranscodeRequest;
import com.xksgroup.hlstranscoder.service.JobCancellationRegistry;
import com.xksgroup.hlstranscoder.service.JobProducer;
import com.xksgroup.hlstranscoder.service.TranscodeQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
@Tag(name = "Transcode jobs", description = "Submit transcode jobs and follow their progress")
public class JobController {

    private final JobProducer jobProducer;
    private final TranscodeQueryService queryService;
    private final JobCancellationRegistry cancellationRegistry;

    @PostMapping("/transcode")
    @Operation(
        summary = "Submit a transcode job",
        description = "Validates the requested ladder, records the job and its renditions, then enqueues it. "
                + "Without profiles the default ladder is used."
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "202",
            description = "Job accepted",
            content = @Content(
                mediaType = "application/json",
                examples = @ExampleObject(
                    name = "Accepted",
                    value = """
                    {
                        "job_id": "0b6f8a52-5d7e-4e8b-9a4c-3f2b1d0e9c71",
                        "status": "queued"
                    }
                    """
                )
            )
        ),
        @ApiResponse(responseCode = "400", description = "Unsupported profile or malformed body"),
        @ApiResponse(responseCode = "404", description = "Unknown video"),
        @ApiResponse(responseCode = "503", description = "Queue unavailable, job recorded as failed")
    })
    public ResponseEntity<Object> submit(@Valid @RequestBody TranscodeRequest request) {
        Job job = jobProducer.submit(request.videoId(), request.profiles());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("job_id", job.getId());
        body.put("status", job.getStatus().dbValue());
        body.put("profiles", job.getProfiles());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Job status", description = "Job status with its renditions ordered by height.")
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Job found",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = JobStatusView.class))
        ),
        @ApiResponse(responseCode = "404", description = "Unknown job")
    })
    public ResponseEntity<JobStatusView> getJob(
            @Parameter(description = "Job id", example = "0b6f8a52-5d7e-4e8b-9a4c-3f2b1d0e9c71")
            @PathVariable String jobId) {
        return ResponseEntity.ok(queryService.getJobStatus(jobId));
    }

    @PostMapping("/{jobId}/cancel")
    @Operation(
        summary = "Cancel a running job",
        description = "Stops the encoder of a job processed on this instance. Profiles not yet encoded are "
                + "failed with 'cancelled'. Returns cancelled=false when the job is not running here."
    )
    public ResponseEntity<Object> cancel(@PathVariable String jobId) {
        // 404 for jobs that never existed
        queryService.getJobStatus(jobId);

        boolean cancelled = cancellationRegistry.cancel(jobId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("job_id", jobId);
        body.put("cancelled", cancelled);
        return ResponseEntity.ok(body);
    }
}
