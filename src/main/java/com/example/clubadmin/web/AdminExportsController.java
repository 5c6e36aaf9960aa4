package com.example.clubadmin.web;

import com.example.clubadmin.security.CurrentUserService;
import com.example.clubadmin.service.export.ExportField;
import com.example.clubadmin.service.export.UserExportService;
import com.example.clubadmin.sse.SseEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CSV export of the member list: start, progress stream, download.
 */
@Slf4j
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class AdminExportsController {

    private final UserExportService exportService;
    private final SseEventPublisher events;
    private final CurrentUserService currentUserService;

    @PostMapping("/users/export")
    public ResponseEntity<Map<String, Object>> start(@RequestParam(name = "fields", required = false) List<String> fields,
                                                     @RequestParam(defaultValue = "false") boolean onlySubscribed) {
        List<ExportField> selected = new ArrayList<>();
        try {
            if (fields != null) {
                for (String f : fields) {
                    selected.add(ExportField.parse(f));
                }
            }
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        if (selected.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Select at least one field to export"));
        }
        Long adminId = currentUserService.currentUser().getId();
        exportService.startExport(adminId, selected, onlySubscribed);
        log.info("Admin {} started a user export ({} fields, subscribers only: {})", adminId, selected.size(), onlySubscribed);
        return ResponseEntity.accepted().body(Map.of(
                "started", true,
                "channel", UserExportService.channelFor(adminId)));
    }

    @GetMapping(path = "/users/export/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter progress() {
        return events.register(UserExportService.channelFor(currentUserService.currentUser().getId()));
    }

    @GetMapping("/exports/{fileName:.+}")
    public ResponseEntity<Resource> download(@PathVariable String fileName) {
        Path file = exportService.resolveDownload(fileName);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType("text/csv"))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(file.getFileName().toString()).build().toString())
                .body(new FileSystemResource(file));
    }
}
