package com.xksgroup.hlstranscoder.service;

import com.xksgroup.hlstranscoder.config.TranscodeProperties;
import com.xksgroup.hlstranscoder.exception.EncodeException;
import com.xksgroup.hlstranscoder.model.EncodedVariant;
import com.xksgroup.hlstranscoder.service.helper.FFmpegHelper;
import com.xksgroup.hlstranscoder.service.helper.ProcessHelper;
import com.xksgroup.hlstranscoder.service.helper.ProfileLadder;
import com.xksgroup.hlstranscoder.service.helper.StorageKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

@Slf4j
@Service
public class FFmpegTranscoderAdapter implements TranscoderAdapter {

    private final FFmpegHelper ffmpegHelper;
    private final ProcessHelper processHelper;
    private final ProfileLadder profileLadder;
    private final Duration timeout;

    public FFmpegTranscoderAdapter(FFmpegHelper ffmpegHelper, ProcessHelper processHelper,
                                   ProfileLadder profileLadder, TranscodeProperties properties) {
        this.ffmpegHelper = ffmpegHelper;
        this.processHelper = processHelper;
        this.profileLadder = profileLadder;
        this.timeout = properties.getEncoder().getTimeout();
    }

    @Override
    public EncodedVariant transcode(Path source, int height, Path outputDir, CancellationToken token) {
        ProfileLadder.Preset preset = profileLadder.presetFor(height);
        try {
            FFmpegHelper.ProbeInfo probe = ffmpegHelper.probeMedia(source);
            int width = FFmpegHelper.scaledWidth(probe.dimensions(), height);
            Files.createDirectories(outputDir);

            List<String> command = ffmpegHelper.buildVariantCommand(source, preset, width, probe.hasAudio());
            log.info("Encoding {}p ({}x{}, {}k/{}k) from {} source", height, width, height,
                    preset.videoKbps(), preset.audioKbps(), probe.dimensions());

            ProcessHelper.ProcessResult result = processHelper.run(command, outputDir, timeout, token.getJobId());

            if (token.isCancelled()) {
                throw new EncodeException(height, "cancelled");
            }
            if (result.timedOut()) {
                throw new EncodeException(height, "timed out after " + timeout + "\n" + result.output());
            }
            if (result.exitCode() != 0) {
                throw new EncodeException(height, "ffmpeg exited with " + result.exitCode() + "\n" + result.output());
            }

            Path playlist = outputDir.resolve(StorageKeys.PLAYLIST_NAME);
            if (!Files.isRegularFile(playlist)) {
                throw new EncodeException(height, "ffmpeg produced no playlist\n" + result.output());
            }
            List<Path> segments = listSegments(outputDir);
            if (segments.isEmpty()) {
                throw new EncodeException(height, "ffmpeg produced no segments\n" + result.output());
            }

            log.info("Encoded {}p: {} segment(s)", height, segments.size());
            return new EncodedVariant(height, width, preset.videoKbps(), preset.audioKbps(),
                    preset.codecs(probe.hasAudio()), playlist, segments);

        } catch (IOException e) {
            throw new EncodeException(height, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EncodeException(height, "interrupted", e);
        }
    }

    private static List<Path> listSegments(Path outputDir) throws IOException {
        try (Stream<Path> files = Files.list(outputDir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".ts"))
                    .sorted()
                    .toList();
        }
    }
}
