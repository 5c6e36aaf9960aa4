package com.example.clubadmin.service.export;

import com.example.clubadmin.config.ClubProperties;
import com.example.clubadmin.domain.User;
import com.example.clubadmin.repository.UserRepository;
import com.example.clubadmin.service.NotFoundException;
import com.example.clubadmin.sse.SseEventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentMatchers;
import org.mockito.InOrder;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

class UserExportServiceTest {

    @TempDir
    Path tmp;

    private Path exportDir;

    private UserRepository users;
    private SseEventPublisher events;
    private UserExportService service;

    @BeforeEach
    void setUp() throws Exception {
        exportDir = Files.createDirectories(tmp.resolve("exports"));
        users = mock(UserRepository.class);
        events = mock(SseEventPublisher.class);
        ClubProperties properties = new ClubProperties();
        properties.setExportDir(exportDir.toString());
        service = new UserExportService(users, events, properties);
    }

    @Test
    void writesSelectedColumnsInBatchesWithProgress() throws Exception {
        List<User> all = IntStream.rangeClosed(1, 150).mapToObj(i -> {
            User u = new User("user" + i + "@example.org", "first" + i, "last" + i);
            u.setId((long) i);
            return u;
        }).toList();
        stubUsers(all);

        Path file = service.writeExport("exporter:1", List.of(ExportField.EMAIL, ExportField.FIRST_NAME), false);

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(151);
        assertThat(lines.get(0)).isEqualTo("email,first_name");
        assertThat(lines.get(1)).isEqualTo("user1@example.org,first1");
        assertThat(lines.get(150)).isEqualTo("user150@example.org,first150");
        assertThat(file.getParent()).isEqualTo(exportDir.toAbsolutePath().normalize());

        InOrder order = inOrder(events);
        order.verify(events).send("exporter:1", UserExportService.EVENT_PROGRESS, 0);
        order.verify(events).send("exporter:1", UserExportService.EVENT_PROGRESS, 66);
    }

    @Test
    void startExportAnnouncesTheDownloadLink() {
        stubUsers(List.of());

        service.startExport(3L, List.of(ExportField.ID), true);

        verify(events).send(eq("exporter:3"), eq(UserExportService.EVENT_COMPLETE), startsWith("/admin/exports/club-user-export-"));
    }

    @Test
    void failedExportIsReportedOnTheChannel() {
        service.startExport(4L, List.of(), false);

        verify(events).send("exporter:4", UserExportService.EVENT_FAILED, UserExportService.FAILED_MESSAGE);
        verify(events, never()).send(eq("exporter:4"), eq(UserExportService.EVENT_COMPLETE), any());
    }

    @Test
    void downloadsStayInsideTheExportDirectory() throws Exception {
        Files.writeString(exportDir.resolve("a.csv"), "id\n");
        Files.writeString(tmp.resolve("outside.csv"), "secret\n");

        assertThat(service.resolveDownload("a.csv")).exists();
        assertThatThrownBy(() -> service.resolveDownload("../outside.csv")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.resolveDownload("missing.csv")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void fieldsParseByNameOrKey() {
        assertThat(ExportField.parse("board_position")).isEqualTo(ExportField.BOARD_POSITION);
        assertThat(ExportField.parse("PHONE_NUMBER")).isEqualTo(ExportField.PHONE_NUMBER);
        assertThatThrownBy(() -> ExportField.parse("password_hash"))
                .hasMessage("Unknown export field: password_hash");
    }

    private void stubUsers(List<User> all) {
        when(users.count(ArgumentMatchers.<Specification<User>>any())).thenReturn((long) all.size());
        when(users.findAll(ArgumentMatchers.<Specification<User>>any(), any(Pageable.class))).thenAnswer(inv -> {
            Pageable p = inv.getArgument(1);
            int from = (int) Math.min(p.getOffset(), all.size());
            int to = Math.min(from + p.getPageSize(), all.size());
            return new PageImpl<>(new ArrayList<>(all.subList(from, to)), p, all.size());
        });
    }
}
