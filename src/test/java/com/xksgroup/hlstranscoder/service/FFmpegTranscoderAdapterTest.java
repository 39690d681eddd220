package com.xksgroup.hlstranscoder.service;

import com.xksgroup.hlstranscoder.config.TranscodeProperties;
import com.xksgroup.hlstranscoder.exception.EncodeException;
import com.xksgroup.hlstranscoder.exception.InvalidProfileException;
import com.xksgroup.hlstranscoder.model.EncodedVariant;
import com.xksgroup.hlstranscoder.service.helper.FFmpegHelper;
import com.xksgroup.hlstranscoder.service.helper.ProcessHelper;
import com.xksgroup.hlstranscoder.service.helper.ProfileLadder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FFmpegTranscoderAdapterTest {

    @TempDir
    Path tmp;

    private FFmpegHelper ffmpegHelper;
    private ProcessHelper processHelper;
    private FFmpegTranscoderAdapter adapter;
    private Path source;
    private Path out;

    @BeforeEach
    void setUp() throws Exception {
        TranscodeProperties properties = new TranscodeProperties();
        ffmpegHelper = mock(FFmpegHelper.class);
        processHelper = mock(ProcessHelper.class);
        adapter = new FFmpegTranscoderAdapter(ffmpegHelper, processHelper, new ProfileLadder(properties), properties);

        source = Files.writeString(tmp.resolve("source.mp4"), "bytes");
        out = tmp.resolve("480");
        when(ffmpegHelper.probeMedia(source))
                .thenReturn(new FFmpegHelper.ProbeInfo(true, new FFmpegHelper.VideoDimensions(1920, 1080)));
        when(ffmpegHelper.buildVariantCommand(eq(source), any(ProfileLadder.Preset.class), anyInt(), anyBoolean()))
                .thenReturn(List.of("ffmpeg", "-i", source.toString()));
    }

    private void encoderWrites(String... files) throws Exception {
        doAnswer(invocation -> {
            Path dir = invocation.getArgument(1);
            for (String file : files) {
                Files.writeString(dir.resolve(file), "x");
            }
            return new ProcessHelper.ProcessResult(0, false, "");
        }).when(processHelper).run(anyList(), any(Path.class), any(), any());
    }

    @Test
    void successfulEncodeListsSegmentsInOrder() throws Exception {
        encoderWrites("index.m3u8", "seg_1.ts", "seg_0.ts");

        EncodedVariant variant = adapter.transcode(source, 480, out, new CancellationToken("j1"));

        assertThat(variant.height()).isEqualTo(480);
        assertThat(variant.width()).isEqualTo(852);
        assertThat(variant.bandwidth()).isEqualTo(896_000L);
        assertThat(variant.codecs()).isEqualTo("avc1.4d401e,mp4a.40.2");
        assertThat(variant.playlist()).isEqualTo(out.resolve("index.m3u8"));
        assertThat(variant.segments()).extracting(p -> p.getFileName().toString())
                .containsExactly("seg_0.ts", "seg_1.ts");
    }

    @Test
    void silentSourceReportsVideoOnlyCodecs() throws Exception {
        when(ffmpegHelper.probeMedia(source))
                .thenReturn(new FFmpegHelper.ProbeInfo(false, new FFmpegHelper.VideoDimensions(1920, 1080)));
        encoderWrites("index.m3u8", "seg_0.ts");

        EncodedVariant variant = adapter.transcode(source, 480, out, new CancellationToken("j1"));

        assertThat(variant.codecs()).isEqualTo("avc1.4d401e");
    }

    @Test
    void nonZeroExitCarriesEncoderOutput() throws Exception {
        when(processHelper.run(anyList(), any(Path.class), any(), any()))
                .thenReturn(new ProcessHelper.ProcessResult(1, false, "Invalid data found when processing input"));

        assertThatThrownBy(() -> adapter.transcode(source, 480, out, new CancellationToken("j1")))
                .isInstanceOf(EncodeException.class)
                .hasMessageContaining("exited with 1")
                .hasMessageContaining("Invalid data found");
    }

    @Test
    void timeoutIsAnEncodeFailure() throws Exception {
        when(processHelper.run(anyList(), any(Path.class), any(), any()))
                .thenReturn(new ProcessHelper.ProcessResult(-1, true, ""));

        assertThatThrownBy(() -> adapter.transcode(source, 480, out, new CancellationToken("j1")))
                .isInstanceOf(EncodeException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    void missingSegmentsIsAnEncodeFailure() throws Exception {
        encoderWrites("index.m3u8");

        assertThatThrownBy(() -> adapter.transcode(source, 480, out, new CancellationToken("j1")))
                .isInstanceOf(EncodeException.class)
                .hasMessageContaining("no segments");
    }

    @Test
    void missingPlaylistIsAnEncodeFailure() throws Exception {
        encoderWrites("seg_0.ts");

        assertThatThrownBy(() -> adapter.transcode(source, 480, out, new CancellationToken("j1")))
                .isInstanceOf(EncodeException.class)
                .hasMessageContaining("no playlist");
    }

    @Test
    void unsupportedHeightIsRejectedBeforeProbing() {
        assertThatThrownBy(() -> adapter.transcode(source, 1440, out, new CancellationToken("j1")))
                .isInstanceOf(InvalidProfileException.class);
    }
}
