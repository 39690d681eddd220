package com.xksgroup.hlstranscoder.service;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Key-addressed blob storage.
 * <p>
 * Missing keys raise {@link com.xksgroup.hlstranscoder.exception.NotFoundException};
 * transport failures raise
 * {@link com.xksgroup.hlstranscoder.exception.StorageUnavailableException}.
 */
public interface ObjectStoreGateway {

    /**
     * Open the object for reading. The caller closes the stream.
     */
    InputStream get(String key);

    void download(String key, Path target);

    void put(String key, InputStream body, long length, String contentType);

    void putFile(String key, Path file);

    static String contentTypeFor(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".m3u8")) {
            return "application/vnd.apple.mpegurl";
        }
        if (lower.endsWith(".ts")) {
            return "video/MP2T";
        }
        if (lower.endsWith(".mp4")) {
            return "video/mp4";
        }
        return "application/octet-stream";
    }
}
