package com.xksgroup.hlstranscoder.service;

import com.xksgroup.hlstranscoder.exception.NotFoundException;
import com.xksgroup.hlstranscoder.exception.StorageUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class S3ObjectStoreGatewayTest {

    private S3Client s3;
    private S3ObjectStoreGateway gateway;

    @BeforeEach
    void setUp() {
        s3 = mock(S3Client.class);
        gateway = new S3ObjectStoreGateway(s3, "media", 3, 1);
    }

    @Test
    void putRetriesTransientFailures() {
        when(s3.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(SdkClientException.create("connection reset"))
                .thenReturn(PutObjectResponse.builder().build());

        gateway.put("HLS/v1/index.m3u8", new ByteArrayInputStream("#EXTM3U\n".getBytes(StandardCharsets.UTF_8)),
                8, "application/vnd.apple.mpegurl");

        ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3, times(2)).putObject(request.capture(), any(RequestBody.class));
        assertThat(request.getValue().bucket()).isEqualTo("media");
        assertThat(request.getValue().key()).isEqualTo("HLS/v1/index.m3u8");
        assertThat(request.getValue().contentType()).isEqualTo("application/vnd.apple.mpegurl");
        assertThat(request.getValue().cacheControl()).isEqualTo("public, max-age=60");
    }

    @Test
    void putGivesUpAfterMaxAttempts() {
        when(s3.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(SdkClientException.create("connection refused"));

        assertThatThrownBy(() -> gateway.put("HLS/v1/240/seg_0.ts",
                new ByteArrayInputStream(new byte[4]), 4, "video/MP2T"))
                .isInstanceOf(StorageUnavailableException.class)
                .hasMessageContaining("3 attempts");

        verify(s3, times(3)).putObject(any(PutObjectRequest.class), any(RequestBody.class));
    }

    @Test
    void missingKeyIsNotFound() {
        when(s3.getObject(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("no such key").build());

        assertThatThrownBy(() -> gateway.get("source/v1.mp4")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void serverErrorIsUnavailable() {
        when(s3.getObject(any(GetObjectRequest.class)))
                .thenThrow(S3Exception.builder().statusCode(500).message("internal error").build());

        assertThatThrownBy(() -> gateway.get("source/v1.mp4")).isInstanceOf(StorageUnavailableException.class);
    }

    @Test
    void upperCaseSegmentExtensionIsStillCachedAsImmutable() {
        when(s3.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenReturn(PutObjectResponse.builder().build());

        gateway.put("HLS/v1/240/SEG_0.TS", new ByteArrayInputStream(new byte[4]), 4, "video/MP2T");
        gateway.put("HLS/v1/240/INDEX.M3U8", new ByteArrayInputStream(new byte[4]), 4, "application/vnd.apple.mpegurl");

        ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3, times(2)).putObject(request.capture(), any(RequestBody.class));
        assertThat(request.getAllValues()).extracting(PutObjectRequest::cacheControl)
                .containsExactly("public, max-age=31536000, immutable", "public, max-age=60");
    }

    @Test
    void contentTypesFollowTheExtension() {
        assertThat(ObjectStoreGateway.contentTypeFor("HLS/v1/240/index.m3u8")).isEqualTo("application/vnd.apple.mpegurl");
        assertThat(ObjectStoreGateway.contentTypeFor("HLS/v1/240/seg_3.TS")).isEqualTo("video/MP2T");
        assertThat(ObjectStoreGateway.contentTypeFor("source/v1.mp4")).isEqualTo("video/mp4");
        assertThat(ObjectStoreGateway.contentTypeFor("notes.txt")).isEqualTo("application/octet-stream");
    }
}
