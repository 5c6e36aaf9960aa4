package com.example.clubadmin.service.storage;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Blob store for uploads. Keys are relative, slash separated paths ("public/cabin.jpg").
 */
public interface ObjectStorage {

    /** Stores the bytes under {@code key}, replacing any previous object. */
    void put(String key, byte[] content, String contentType) throws IOException;

    Optional<InputStream> open(String key) throws IOException;

    boolean exists(String key);

    void delete(String key) throws IOException;
}
