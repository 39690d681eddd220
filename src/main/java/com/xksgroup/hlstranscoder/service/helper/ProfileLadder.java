package com.xksgroup.hlstranscoder.service.helper;

import com.xksgroup.hlstranscoder.config.TranscodeProperties;
import com.xksgroup.hlstranscoder.exception.InvalidProfileException;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Height to bitrate preset table for the rendition ladder.
 */
@Component
public class ProfileLadder {

    private static final Map<Integer, Preset> PRESETS;

    static {
        Map<Integer, Preset> presets = new TreeMap<>();
        presets.put(240, new Preset(240, 400, 96, "3.0"));
        presets.put(360, new Preset(360, 600, 96, "3.0"));
        presets.put(480, new Preset(480, 800, 96, "3.0"));
        presets.put(720, new Preset(720, 1500, 128, "3.1"));
        presets.put(1080, new Preset(1080, 3000, 128, "4.0"));
        PRESETS = Collections.unmodifiableMap(presets);
    }

    private final List<Integer> supportedHeights;

    public ProfileLadder(TranscodeProperties properties) {
        List<Integer> configured = properties.getSupportedHeights();
        if (configured == null || configured.isEmpty()) {
            this.supportedHeights = List.copyOf(PRESETS.keySet());
        } else {
            for (Integer height : configured) {
                if (!PRESETS.containsKey(height)) {
                    throw new IllegalStateException("transcode.supported-heights lists " + height
                            + " which has no preset; known heights: " + PRESETS.keySet());
                }
            }
            this.supportedHeights = configured.stream().sorted().distinct().toList();
        }
    }

    public List<Integer> supportedHeights() {
        return supportedHeights;
    }

    public boolean isSupported(int height) {
        return supportedHeights.contains(height);
    }

    /**
     * @throws InvalidProfileException for a height outside the supported set
     */
    public Preset presetFor(int height) {
        if (!isSupported(height)) {
            throw new InvalidProfileException(height, supportedHeights);
        }
        return PRESETS.get(height);
    }

    /**
     * Preset for any height of the table, supported or not. Used for renditions
     * created before a configuration change.
     */
    public static Preset lookup(int height) {
        Preset preset = PRESETS.get(height);
        if (preset == null) {
            throw new IllegalArgumentException("no preset for " + height + "p");
        }
        return preset;
    }

    /**
     * @param level H.264 level passed to the encoder; every rendition is encoded in Main profile
     */
    public record Preset(int height, int videoKbps, int audioKbps, String level) {

        public static final String PROFILE = "main";
        public static final String AUDIO_CODEC = "mp4a.40.2";

        public int maxrateKbps() {
            return (int) Math.round(videoKbps * 1.1);
        }

        public int bufsizeKbps() {
            return videoKbps * 2;
        }

        public long bandwidth() {
            return (long) (videoKbps + audioKbps) * 1000L;
        }

        /**
         * RFC 6381 name of the video stream, e.g. {@code avc1.4d401f} for Main 3.1.
         */
        public String videoCodec() {
            int levelIdc = (int) Math.round(Double.parseDouble(level) * 10);
            return String.format("avc1.4d40%02x", levelIdc);
        }

        public String codecs(boolean hasAudio) {
            return hasAudio ? videoCodec() + "," + AUDIO_CODEC : videoCodec();
        }
    }
}
