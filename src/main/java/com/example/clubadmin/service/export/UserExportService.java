package com.example.clubadmin.service.export;

import com.example.clubadmin.config.ClubProperties;
import com.example.clubadmin.domain.Subscription;
import com.example.clubadmin.domain.User;
import com.example.clubadmin.repository.UserRepository;
import com.example.clubadmin.service.NotFoundException;
import com.example.clubadmin.sse.SseEventPublisher;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Writes the user list to CSV in the background and reports progress over SSE.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserExportService {

    public static final int BATCH_SIZE = 100;
    public static final String EVENT_PROGRESS = "user_export:progress";
    public static final String EVENT_COMPLETE = "user_export:complete";
    public static final String EVENT_FAILED = "user_export:failed";
    public static final String FAILED_MESSAGE = "Failed to export Users to CSV";
    public static final String DOWNLOAD_PREFIX = "/admin/exports/";

    private final UserRepository userRepository;
    private final SseEventPublisher events;
    private final ClubProperties properties;
    private final CsvMapper csvMapper = new CsvMapper();

    public static String channelFor(Long adminId) {
        return "exporter:" + adminId;
    }

    @Async("taskExecutor")
    public void startExport(Long adminId, List<ExportField> fields, boolean onlySubscribed) {
        String channel = channelFor(adminId);
        try {
            Path file = writeExport(channel, fields, onlySubscribed);
            events.send(channel, EVENT_COMPLETE, DOWNLOAD_PREFIX + file.getFileName());
        } catch (IOException | RuntimeException ex) {
            log.error("User export for admin {} failed", adminId, ex);
            events.send(channel, EVENT_FAILED, FAILED_MESSAGE);
        }
    }

    /**
     * Streams users {@value #BATCH_SIZE} at a time into a new CSV file.
     * Progress (0..100) is sent at the start of every batch.
     */
    public Path writeExport(String channel, List<ExportField> fields, boolean onlySubscribed) throws IOException {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Select at least one field to export");
        }
        Path dir = exportDir();
        Files.createDirectories(dir);
        Path target = dir.resolve("club-user-export-" + LocalDate.now() + "-" + UUID.randomUUID() + ".csv");

        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        fields.forEach(f -> schema.addColumn(f.key()));

        Specification<User> spec = onlySubscribed ? subscribed() : null;
        long total = userRepository.count(spec);
        log.info("Exporting {} users ({} fields, onlySubscribed={}) to {}", total, fields.size(), onlySubscribed, target);

        boolean done = false;
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             SequenceWriter rows = csvMapper.writerFor(Map.class).with(schema.build()).writeValues(out)) {
            int pageIndex = 0;
            long written = 0;
            Page<User> page;
            do {
                page = userRepository.findAll(spec, PageRequest.of(pageIndex++, BATCH_SIZE, Sort.by("id")));
                events.send(channel, EVENT_PROGRESS, total == 0 ? 0 : (int) (written * 100 / total));
                for (User user : page.getContent()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (ExportField f : fields) {
                        row.put(f.key(), f.valueOf(user));
                    }
                    rows.write(row);
                    written++;
                }
            } while (page.hasNext());
            done = true;
        } finally {
            if (!done) {
                Files.deleteIfExists(target);
            }
        }
        return target;
    }

    /** Resolves a download name inside the export directory; rejects anything that escapes it. */
    public Path resolveDownload(String fileName) {
        Path dir = exportDir();
        Path file = dir.resolve(fileName).normalize();
        if (!file.startsWith(dir) || !fileName.endsWith(".csv") || !Files.isRegularFile(file)) {
            throw new NotFoundException("Export not found: " + fileName);
        }
        return file;
    }

    private Path exportDir() {
        return Paths.get(properties.getExportDir()).toAbsolutePath().normalize();
    }

    static Specification<User> subscribed() {
        return (root, query, cb) -> {
            Subquery<Long> sub = query.subquery(Long.class);
            Root<Subscription> s = sub.from(Subscription.class);
            sub.select(s.get("id")).where(
                    cb.equal(s.get("user"), root),
                    s.get("status").in(Subscription.SUBSCRIBED_STATUSES));
            return cb.exists(sub);
        };
    }
}
