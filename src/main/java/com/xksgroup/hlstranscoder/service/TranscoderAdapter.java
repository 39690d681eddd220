package com.xksgroup.hlstranscoder.service;

import com.xksgroup.hlstranscoder.model.EncodedVariant;

import java.nio.file.Path;

public interface TranscoderAdapter {

    /**
     * Encode {@code source} into one HLS rendition of the given height, written
     * to {@code outputDir} as {@code index.m3u8} plus its segments.
     *
     * @throws com.xksgroup.hlstranscoder.exception.EncodeException on any encoder failure,
     *         with the tool's diagnostic as message
     */
    EncodedVariant transcode(Path source, int height, Path outputDir, CancellationToken token);
}
