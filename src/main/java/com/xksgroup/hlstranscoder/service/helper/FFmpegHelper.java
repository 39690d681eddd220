package com.xksgroup.hlstranscoder.service.helper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.hlstranscoder.config.TranscodeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
public class FFmpegHelper {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final Duration PROBE_TIMEOUT = Duration.ofMinutes(2);

    private final ProcessHelper processHelper;
    private final TranscodeProperties.Encoder settings;

    public FFmpegHelper(ProcessHelper processHelper, TranscodeProperties properties) {
        this.processHelper = processHelper;
        this.settings = properties.getEncoder();
    }

    /**
     * Single ffprobe call (JSON) for dimensions and audio presence.
     *
     * @throws IOException when ffprobe fails or the file has no video stream
     */
    public ProbeInfo probeMedia(Path inputFile) throws IOException, InterruptedException {
        List<String> probeCommand = List.of(
                settings.getFfprobePath(), "-v", "quiet",
                "-print_format", "json",
                "-show_streams", "-show_format",
                inputFile.toAbsolutePath().toString()
        );

        ProcessHelper.ProcessResult result = processHelper.run(probeCommand, null, PROBE_TIMEOUT, null);
        if (!result.succeeded()) {
            throw new IOException("ffprobe failed on " + inputFile.getFileName()
                    + " (exit " + result.exitCode() + "): " + result.output());
        }
        return parseProbeOutput(result.output());
    }

    static ProbeInfo parseProbeOutput(String json) throws IOException {
        boolean hasVideo = false;
        boolean hasAudio = false;
        int width = 0;
        int height = 0;

        JsonNode root = OBJECT_MAPPER.readTree(json);
        JsonNode streams = root.path("streams");
        if (streams.isArray()) {
            for (JsonNode stream : streams) {
                String codecType = stream.path("codec_type").asText("");
                if ("video".equalsIgnoreCase(codecType) && !hasVideo) {
                    hasVideo = true;
                    width = stream.path("width").asInt(0);
                    height = stream.path("height").asInt(0);
                } else if ("audio".equalsIgnoreCase(codecType)) {
                    hasAudio = true;
                }
            }
        }

        if (!hasVideo || width <= 0 || height <= 0) {
            throw new IOException("source has no usable video stream");
        }
        return new ProbeInfo(hasAudio, new VideoDimensions(width, height));
    }

    /**
     * Output width for a target height, keeping the source aspect ratio.
     * Rounded down to an even number, never below 2.
     */
    public static int scaledWidth(VideoDimensions source, int targetHeight) {
        long width = Math.round((double) source.width() * targetHeight / source.height());
        int even = (int) (width - (width % 2));
        return Math.max(2, even);
    }

    /**
     * Build the single-variant HLS command. Runs inside the rendition's output
     * directory, so the segment pattern and playlist name are relative.
     */
    public List<String> buildVariantCommand(Path inputFile, ProfileLadder.Preset preset, int width, boolean hasAudio) {
        List<String> command = new ArrayList<>();
        command.add(settings.getFfmpegPath());
        command.add("-y");
        command.add("-hide_banner");
        command.add("-loglevel");
        command.add("error");
        command.add("-i");
        command.add(inputFile.toAbsolutePath().toString());

        command.add("-vf");
        command.add("scale=" + width + ":" + preset.height());
        command.add("-c:v");
        command.add("libx264");
        command.add("-preset");
        command.add(settings.getPreset());
        // Must match the CODECS attribute written to the master playlist
        command.add("-profile:v");
        command.add(ProfileLadder.Preset.PROFILE);
        command.add("-level");
        command.add(preset.level());
        command.add("-b:v");
        command.add(preset.videoKbps() + "k");
        command.add("-maxrate");
        command.add(preset.maxrateKbps() + "k");
        command.add("-bufsize");
        command.add(preset.bufsizeKbps() + "k");
        command.add("-pix_fmt");
        command.add("yuv420p"); // Ensure compatibility across all devices

        if (hasAudio) {
            command.add("-c:a");
            command.add("aac");
            command.add("-b:a");
            command.add(preset.audioKbps() + "k");
            command.add("-ac");
            command.add("2");
        } else {
            command.add("-an");
        }

        // HLS settings
        command.add("-f");
        command.add("hls");
        command.add("-hls_time");
        command.add(String.valueOf(settings.getSegmentSeconds()));
        command.add("-hls_playlist_type");
        command.add("vod");
        command.add("-hls_list_size");
        command.add("0");
        command.add("-hls_segment_filename");
        command.add("seg_%d.ts");
        command.add(StorageKeys.PLAYLIST_NAME);

        return command;
    }

    public record VideoDimensions(int width, int height) {
        @Override
        public String toString() {
            return width + "x" + height;
        }
    }

    public record ProbeInfo(boolean hasAudio, VideoDimensions dimensions) {
    }
}
