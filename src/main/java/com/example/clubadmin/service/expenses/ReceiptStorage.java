package com.example.clubadmin.service.expenses;

import com.example.clubadmin.service.storage.ObjectStorage;
import com.example.clubadmin.util.FileTypeDetector;
import com.example.clubadmin.util.FileTypeDetector.DetectedType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.Arrays;
import java.util.Optional;

/**
 * Stores expense receipts and income proofs as {@code receipts/{epochSeconds}_{name}}.
 * A key already in use gets a numbered name, so an upload never replaces another.
 */
@Slf4j
@Component
public class ReceiptStorage {

    public static final String PREFIX = "receipts/";
    public static final String REJECTED = "You have selected an unacceptable file type";

    private final ObjectStorage storage;
    private final Clock clock;

    @Autowired
    public ReceiptStorage(ObjectStorage storage) {
        this(storage, Clock.systemUTC());
    }

    public ReceiptStorage(ObjectStorage storage, Clock clock) {
        this.storage = storage;
        this.clock = clock;
    }

    /** Returns the storage key, or empty when no file was sent. */
    public Optional<String> store(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(store(file.getOriginalFilename(), file.getBytes()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read receipt upload", e);
        }
    }

    public String store(String originalName, byte[] content) {
        byte[] header = Arrays.copyOf(content, Math.min(content.length, FileTypeDetector.HEADER_LENGTH));
        DetectedType type = FileTypeDetector.detect(header)
                .orElseThrow(() -> new IllegalArgumentException(REJECTED));
        String base = PREFIX + clock.instant().getEpochSecond() + "_";
        String name = safeName(originalName, type);
        String key;
        synchronized (this) {
            key = freeKey(base, name);
            try {
                storage.put(key, content, type.mimeType());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to store receipt " + key, e);
            }
        }
        log.debug("Stored receipt {}", key);
        return key;
    }

    public Optional<InputStream> open(String key) throws IOException {
        if (key == null || !key.startsWith(PREFIX)) {
            return Optional.empty();
        }
        return storage.open(key);
    }

    /** {@code base + name}, or {@code name} with "-2", "-3"... before its extension when taken. */
    private String freeKey(String base, String name) {
        String key = base + name;
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : "";
        for (int n = 2; storage.exists(key); n++) {
            key = base + stem + "-" + n + ext;
        }
        return key;
    }

    static String safeName(String originalName, DetectedType type) {
        String base = originalName == null ? "" : originalName.replaceAll(".*[/\\\\]", "");
        base = base.replaceAll("[^A-Za-z0-9._-]", "_");
        if (base.isBlank() || base.chars().allMatch(c -> c == '.' || c == '_')) {
            base = "upload." + type.extension();
        }
        return base;
    }
}
