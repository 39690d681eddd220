package com.xksgroup.hlstranscoder.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings under {@code transcode.*}.
 */
@Data
@ConfigurationProperties(prefix = "transcode")
public class TranscodeProperties {

    /** Ladder used when a request names no profiles. */
    private List<Integer> defaultLadder = new ArrayList<>(List.of(240, 480, 720));

    /** Accepted target heights. Empty means every height of the preset table. */
    private List<Integer> supportedHeights = new ArrayList<>();

    private Queue queue = new Queue();
    private Worker worker = new Worker();
    private Encoder encoder = new Encoder();

    @Data
    public static class Queue {
        /** {@code redis} or {@code memory}. */
        private String type = "redis";
        private String key = "jobs:transcode";
        private Duration pollTimeout = Duration.ofSeconds(5);
        private Lease lease = new Lease();
    }

    @Data
    public static class Lease {
        private boolean enabled = false;
        private Duration duration = Duration.ofMinutes(45);
        private Duration reapInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class Worker {
        private boolean enabled = true;
        private int threads = 1;
        private int encodeParallelism = 1;
        private Path workDir = Path.of(System.getProperty("java.io.tmpdir"), "hls-transcoder");
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Encoder {
        private String ffmpegPath = "ffmpeg";
        private String ffprobePath = "ffprobe";
        private Duration timeout = Duration.ofMinutes(30);
        private int segmentSeconds = 4;
        private String preset = "veryfast";
    }
}
