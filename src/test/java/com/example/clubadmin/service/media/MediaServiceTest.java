package com.example.clubadmin.service.media;

import com.example.clubadmin.config.ClubProperties;
import com.example.clubadmin.domain.Image;
import com.example.clubadmin.domain.ImageProcessingState;
import com.example.clubadmin.domain.User;
import com.example.clubadmin.repository.ImageRepository;
import com.example.clubadmin.service.storage.LocalObjectStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Pageable;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class MediaServiceTest {

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A, 0, 0, 0, 0x0D};

    @TempDir
    Path root;

    private ImageRepository images;
    private ApplicationEventPublisher events;
    private ClubProperties properties;
    private LocalObjectStorage storage;
    private MediaService service;

    @BeforeEach
    void setUp() {
        images = mock(ImageRepository.class);
        events = mock(ApplicationEventPublisher.class);
        properties = new ClubProperties();
        storage = new LocalObjectStorage(root);
        service = new MediaService(images, storage, properties, events);

        AtomicLong ids = new AtomicLong();
        when(images.save(any(Image.class))).thenAnswer(inv -> {
            Image img = inv.getArgument(0);
            img.setId(ids.incrementAndGet());
            return img;
        });
    }

    @Test
    void uploadStoresRawFilesAndQueuesProcessing() {
        User admin = new User("a@example.org", "ad", "min");
        List<MultipartFile> files = List.of(
                png("Lake Tahoe.png"),
                new MockMultipartFile("files", "", "application/octet-stream", new byte[0]),
                png("cabin.PNG"));

        List<Image> saved = service.upload(files, admin);

        assertThat(saved).hasSize(2);
        assertThat(saved).extracting(Image::getTitle).containsExactly("Lake Tahoe", "cabin");
        assertThat(saved).allSatisfy(img -> {
            assertThat(img.getProcessingState()).isEqualTo(ImageProcessingState.UNPROCESSED);
            assertThat(img.getRawImagePath()).matches("images/[0-9a-f-]{36}/raw\\.png");
            assertThat(storage.exists(img.getRawImagePath())).isTrue();
            assertThat(img.getUploader()).isSameAs(admin);
        });
        verify(events).publishEvent(new ImageUploadedEvent(1L));
        verify(events).publishEvent(new ImageUploadedEvent(2L));
    }

    @Test
    void tooManyFilesRejectsTheBatch() {
        List<MultipartFile> files = new ArrayList<>(Collections.nCopies(properties.getMedia().getMaxEntries() + 1, png("a.png")));

        assertThatThrownBy(() -> service.upload(files, null))
                .isInstanceOf(UploadRejectedException.class)
                .hasMessage(UploadRejectedException.TOO_MANY_FILES);
        verifyNoInteractions(events);
    }

    @Test
    void oversizedFileIsNamedInTheRejection() {
        properties.getMedia().setMaxFileSize(8);

        assertThatThrownBy(() -> service.upload(List.of(png("huge.png")), null))
                .isInstanceOfSatisfying(UploadRejectedException.class, ex -> {
                    assertThat(ex.getMessage()).isEqualTo(UploadRejectedException.TOO_LARGE);
                    assertThat(ex.getFileName()).isEqualTo("huge.png");
                });
    }

    @Test
    void extensionAndContentMustBothBeImages() {
        MockMultipartFile text = new MockMultipartFile("files", "notes.txt", "text/plain",
                "hello".getBytes(StandardCharsets.UTF_8));
        MockMultipartFile disguised = new MockMultipartFile("files", "photo.png", "image/png",
                "%PDF-1.4 not a picture".getBytes(StandardCharsets.US_ASCII));

        assertThatThrownBy(() -> service.upload(List.of(text), null))
                .hasMessage(UploadRejectedException.NOT_ACCEPTED);
        assertThatThrownBy(() -> service.upload(List.of(disguised), null))
                .hasMessage(UploadRejectedException.NOT_ACCEPTED);
    }

    @Test
    void oneBadFileStoresNothing() throws Exception {
        MockMultipartFile bad = new MockMultipartFile("files", "bad.gif", "image/gif", new byte[]{1, 2, 3});

        assertThatThrownBy(() -> service.upload(List.of(png("good.png"), bad), null))
                .isInstanceOf(UploadRejectedException.class);

        verify(images, never()).save(any());
        try (var listing = Files.list(root)) {
            assertThat(listing).isEmpty();
        }
    }

    @Test
    void titleDropsPathAndExtension() {
        assertThat(MediaService.titleFrom("C:\\pics\\Lake.Tahoe.jpg")).isEqualTo("Lake.Tahoe");
        assertThat(MediaService.titleFrom("dir/.hidden")).isEqualTo(".hidden");
        assertThat(MediaService.titleFrom(" ")).isNull();
    }

    @Test
    void shortPageEndsTheTimelineAndOverrunRestarts() {
        when(images.findAllByOrderByCreatedAtDescIdDesc(any(Pageable.class))).thenReturn(List.of(new Image()));
        when(images.count()).thenReturn(21L);

        MediaPage second = service.page(2, false);
        assertThat(second.page()).isEqualTo(2);
        assertThat(second.endOfTimeline()).isTrue();
        assertThat(second.hasPrevious()).isTrue();
        assertThat(second.hasNext()).isFalse();

        assertThat(service.page(7, true).page()).isEqualTo(1);
        assertThat(service.page(-3, false).page()).isEqualTo(1);
    }

    @Test
    void updateBlanksToNullAndDeleteRemovesFiles() throws Exception {
        storage.put("images/x/raw.png", PNG, "image/png");
        storage.put("images/x/thumbnail.jpg", PNG, "image/jpeg");
        Image image = Image.builder().id(5L).rawImagePath("images/x/raw.png").thumbnailPath("images/x/thumbnail.jpg").build();
        when(images.findById(5L)).thenReturn(Optional.of(image));

        service.update(5L, " Sunset ", "", null);
        assertThat(image.getTitle()).isEqualTo("Sunset");
        assertThat(image.getAltText()).isNull();

        service.delete(5L);
        verify(images).delete(image);
        assertThat(storage.exists("images/x/raw.png")).isFalse();
        assertThat(storage.exists("images/x/thumbnail.jpg")).isFalse();
    }

    private static MockMultipartFile png(String name) {
        return new MockMultipartFile("files", name, "image/png", PNG);
    }
}
