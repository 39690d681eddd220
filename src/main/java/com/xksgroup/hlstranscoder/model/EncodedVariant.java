package com.xksgroup.hlstranscoder.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Local output of one successful encode: a variant playlist and its segments.
 */
public record EncodedVariant(
        int height,
        int width,
        int videoKbps,
        int audioKbps,
        String codecs,
        Path playlist,
        List<Path> segments
) {
    public long bandwidth() {
        return (long) (videoKbps + audioKbps) * 1000L;
    }
}
