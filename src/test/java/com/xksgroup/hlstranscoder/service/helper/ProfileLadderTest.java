package com.xksgroup.hlstranscoder.service.helper;

import com.xksgroup.hlstranscoder.config.TranscodeProperties;
import com.xksgroup.hlstranscoder.exception.InvalidProfileException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProfileLadderTest {

    @Test
    void defaultsToEveryPresetHeight() {
        ProfileLadder ladder = new ProfileLadder(new TranscodeProperties());

        assertThat(ladder.supportedHeights()).containsExactly(240, 360, 480, 720, 1080);
        assertThat(ladder.presetFor(720).videoKbps()).isEqualTo(1500);
        assertThat(ladder.presetFor(720).audioKbps()).isEqualTo(128);
        assertThat(ladder.presetFor(240).bandwidth()).isEqualTo(496_000L);
    }

    @Test
    void codecsMatchProfileAndLevelOfEachPreset() {
        assertThat(ProfileLadder.lookup(240).codecs(true)).isEqualTo("avc1.4d401e,mp4a.40.2");
        assertThat(ProfileLadder.lookup(480).codecs(true)).isEqualTo("avc1.4d401e,mp4a.40.2");
        assertThat(ProfileLadder.lookup(720).codecs(true)).isEqualTo("avc1.4d401f,mp4a.40.2");
        assertThat(ProfileLadder.lookup(1080).codecs(true)).isEqualTo("avc1.4d4028,mp4a.40.2");
        assertThat(ProfileLadder.lookup(720).codecs(false)).isEqualTo("avc1.4d401f");
    }

    @Test
    void configuredSubsetRestrictsHeights() {
        TranscodeProperties properties = new TranscodeProperties();
        properties.setSupportedHeights(List.of(480, 240));
        ProfileLadder ladder = new ProfileLadder(properties);

        assertThat(ladder.supportedHeights()).containsExactly(240, 480);
        assertThatThrownBy(() -> ladder.presetFor(720))
                .isInstanceOf(InvalidProfileException.class)
                .hasMessageContaining("720");
    }

    @Test
    void unknownConfiguredHeightFailsAtStartup() {
        TranscodeProperties properties = new TranscodeProperties();
        properties.setSupportedHeights(List.of(240, 144));

        assertThatThrownBy(() -> new ProfileLadder(properties)).isInstanceOf(IllegalStateException.class);
    }
}
