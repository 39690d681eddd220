package com.xksgroup.hlstranscoder.service;

import com.xksgroup.hlstranscoder.exception.NotFoundException;
import com.xksgroup.hlstranscoder.exception.StorageUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.function.Supplier;

@Slf4j
@Service
public class S3ObjectStoreGateway implements ObjectStoreGateway {

    private final S3Client s3;

    @Value("${storage.s3.bucket}")
    private String bucket;

    @Value("${storage.upload.retry.max-attempts:3}")
    private int maxRetryAttempts;

    @Value("${storage.upload.retry.delay-ms:1000}")
    private long retryDelayMs;

    public S3ObjectStoreGateway(S3Client s3) {
        this.s3 = s3;
    }

    S3ObjectStoreGateway(S3Client s3, String bucket, int maxRetryAttempts, long retryDelayMs) {
        this.s3 = s3;
        this.bucket = bucket;
        this.maxRetryAttempts = maxRetryAttempts;
        this.retryDelayMs = retryDelayMs;
    }

    @Override
    public InputStream get(String key) {
        try {
            return s3.getObject(GetObjectRequest.builder().bucket(bucket).key(key).build());
        } catch (NoSuchKeyException e) {
            throw NotFoundException.key(key);
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                throw NotFoundException.key(key);
            }
            throw new StorageUnavailableException("failed to read " + key + ": " + e.getMessage(), e);
        } catch (SdkException e) {
            throw new StorageUnavailableException("failed to read " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void download(String key, Path target) {
        try (InputStream in = get(key)) {
            Files.createDirectories(target.toAbsolutePath().getParent());
            long bytes = Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Downloaded {} ({} bytes) to {}", key, bytes, target);
        } catch (IOException e) {
            throw new StorageUnavailableException("failed to download " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void put(String key, InputStream body, long length, String contentType) {
        byte[] bytes;
        try {
            bytes = body.readAllBytes();
            if (length >= 0 && bytes.length != length) {
                log.warn("Upload body for {} is {} bytes, {} announced", key, bytes.length, length);
            }
        } catch (IOException e) {
            throw new StorageUnavailableException("failed to read upload body for " + key, e);
        }
        uploadWithRetry(key, () -> RequestBody.fromBytes(bytes), contentType);
    }

    @Override
    public void putFile(String key, Path file) {
        uploadWithRetry(key, () -> RequestBody.fromFile(file), ObjectStoreGateway.contentTypeFor(key));
    }

    private void uploadWithRetry(String key, Supplier<RequestBody> body, String contentType) {
        SdkException lastException = null;

        for (int attempt = 1; attempt <= maxRetryAttempts; attempt++) {
            try {
                s3.putObject(PutObjectRequest.builder()
                                .bucket(bucket)
                                .key(key)
                                .contentType(contentType)
                                .cacheControl(cache(key))
                                .build(),
                        body.get());
                log.debug("Uploaded {} ({})", key, contentType);
                return;
            } catch (SdkException e) {
                lastException = e;
                if (attempt < maxRetryAttempts) {
                    log.warn("Upload attempt {} failed for key: {} - retrying in {}ms", attempt, key, retryDelayMs * attempt);
                    sleep(retryDelayMs * attempt);
                }
            }
        }

        throw new StorageUnavailableException("failed to upload after " + maxRetryAttempts + " attempts: " + key,
                lastException);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException("upload retry interrupted", e);
        }
    }

    // Playlists may be rewritten by a later job, segments never change
    private static String cache(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".m3u8")) {
            return "public, max-age=60";
        }
        if (lower.endsWith(".ts")) {
            return "public, max-age=31536000, immutable";
        }
        return "no-cache";
    }
}
