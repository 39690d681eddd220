package com.xksgroup.hlstranscoder.support;

import com.xksgroup.hlstranscoder.exception.NotFoundException;
import com.xksgroup.hlstranscoder.exception.StorageUnavailableException;
import com.xksgroup.hlstranscoder.service.ObjectStoreGateway;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

public class InMemoryObjectStore implements ObjectStoreGateway {

    private final Map<String, byte[]> objects = new ConcurrentHashMap<>();
    private final Map<String, String> contentTypes = new ConcurrentHashMap<>();
    private volatile Predicate<String> failingPuts = key -> false;
    private volatile boolean unavailable;

    public void seed(String key, String content) {
        objects.put(key, content.getBytes(StandardCharsets.UTF_8));
    }

    /** Puts whose key matches fail with StorageUnavailableException. */
    public void failPutsMatching(Predicate<String> predicate) {
        this.failingPuts = predicate;
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public String text(String key) {
        byte[] bytes = objects.get(key);
        return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
    }

    public String contentType(String key) {
        return contentTypes.get(key);
    }

    public Set<String> keys() {
        return new TreeSet<>(objects.keySet());
    }

    @Override
    public InputStream get(String key) {
        checkAvailable(key);
        byte[] bytes = objects.get(key);
        if (bytes == null) {
            throw NotFoundException.key(key);
        }
        return new ByteArrayInputStream(bytes);
    }

    @Override
    public void download(String key, Path target) {
        try (InputStream in = get(key)) {
            Files.createDirectories(target.toAbsolutePath().getParent());
            Files.copy(in, target);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void put(String key, InputStream body, long length, String contentType) {
        checkAvailable(key);
        if (failingPuts.test(key)) {
            throw new StorageUnavailableException("put rejected: " + key, null);
        }
        try {
            objects.put(key, body.readAllBytes());
            contentTypes.put(key, contentType);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void putFile(String key, Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            put(key, in, Files.size(file), ObjectStoreGateway.contentTypeFor(key));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void checkAvailable(String key) {
        if (unavailable) {
            throw new StorageUnavailableException("store unreachable: " + key, null);
        }
    }
}
