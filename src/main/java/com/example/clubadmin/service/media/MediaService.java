package com.example.clubadmin.service.media;

import com.example.clubadmin.config.ClubProperties;
import com.example.clubadmin.domain.Image;
import com.example.clubadmin.domain.ImageProcessingState;
import com.example.clubadmin.domain.User;
import com.example.clubadmin.repository.ImageRepository;
import com.example.clubadmin.service.NotFoundException;
import com.example.clubadmin.service.storage.ObjectStorage;
import com.example.clubadmin.util.FileTypeDetector;
import com.example.clubadmin.util.FileTypeDetector.DetectedType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Image library: paged gallery, validated batch upload, metadata edits.
 * Renditions are produced by {@link ImageProcessor} after the upload commits.
 */
@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class MediaService {

    private final ImageRepository imageRepository;
    private final ObjectStorage storage;
    private final ClubProperties properties;
    private final ApplicationEventPublisher events;

    /* ───────── gallery ───────── */

    /**
     * Newest images first. Requesting the previous page from an overrun (an empty page past
     * the end) starts over at page 1.
     */
    @Transactional(readOnly = true)
    public MediaPage page(int requested, boolean previousFromOverrun) {
        int perPage = properties.getMedia().getPageSize();
        int page = previousFromOverrun ? 1 : Math.max(requested, 1);
        List<Image> images = imageRepository.findAllByOrderByCreatedAtDescIdDesc(PageRequest.of(page - 1, perPage));
        return new MediaPage(images, page, perPage, images.size() < perPage, imageRepository.count());
    }

    @Transactional(readOnly = true)
    public Image get(Long id) {
        return imageRepository.findById(id).orElseThrow(() -> new NotFoundException("Image", id));
    }

    /* ───────── upload ───────── */

    /**
     * Validates the whole batch before anything is stored, then saves each file as an
     * UNPROCESSED image.
     *
     * @throws UploadRejectedException with the message to show when any file is rejected
     */
    public List<Image> upload(List<MultipartFile> files, User uploader) {
        List<MultipartFile> present = files == null ? List.of()
                : files.stream().filter(f -> f != null && !f.isEmpty()).toList();
        ClubProperties.Media media = properties.getMedia();
        if (present.size() > media.getMaxEntries()) {
            throw new UploadRejectedException(UploadRejectedException.TOO_MANY_FILES, null);
        }

        List<Validated> accepted = new ArrayList<>();
        for (MultipartFile file : present) {
            accepted.add(validate(file, media));
        }

        List<Image> saved = new ArrayList<>();
        for (Validated v : accepted) {
            String key = "images/" + UUID.randomUUID() + "/raw." + v.type().extension();
            try {
                storage.put(key, v.content(), v.type().mimeType());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to store upload " + v.originalName(), e);
            }
            Image image = imageRepository.save(Image.builder()
                    .title(titleFrom(v.originalName()))
                    .rawImagePath(key)
                    .processingState(ImageProcessingState.UNPROCESSED)
                    .uploader(uploader)
                    .build());
            events.publishEvent(new ImageUploadedEvent(image.getId()));
            saved.add(image);
        }
        log.info("Uploaded {} image(s) by user {}", saved.size(), uploader == null ? null : uploader.getId());
        return saved;
    }

    private Validated validate(MultipartFile file, ClubProperties.Media media) {
        String name = file.getOriginalFilename();
        if (file.getSize() > media.getMaxFileSize()) {
            throw new UploadRejectedException(UploadRejectedException.TOO_LARGE, name);
        }
        if (!media.getAcceptedExtensions().contains(FileTypeDetector.extensionOf(name))) {
            throw new UploadRejectedException(UploadRejectedException.NOT_ACCEPTED, name);
        }
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read upload " + name, e);
        }
        byte[] header = Arrays.copyOf(content, Math.min(content.length, FileTypeDetector.HEADER_LENGTH));
        DetectedType type = FileTypeDetector.detect(header)
                .filter(DetectedType::isImage)
                .orElseThrow(() -> new UploadRejectedException(UploadRejectedException.NOT_ACCEPTED, name));
        return new Validated(name, content, type);
    }

    static String titleFrom(String originalName) {
        if (originalName == null || originalName.isBlank()) {
            return null;
        }
        String base = originalName.replaceAll(".*[/\\\\]", "");
        int dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(0, dot) : base;
    }

    private record Validated(String originalName, byte[] content, DetectedType type) {
    }

    /* ───────── edit / delete ───────── */

    public Image update(Long id, String title, String altText, String description) {
        Image image = get(id);
        image.setTitle(blankToNull(title));
        image.setAltText(blankToNull(altText));
        image.setDescription(blankToNull(description));
        return image;
    }

    public void delete(Long id) {
        Image image = get(id);
        imageRepository.delete(image);
        for (String key : new String[]{image.getRawImagePath(), image.getOptimizedImagePath(), image.getThumbnailPath()}) {
            if (key == null) continue;
            try {
                storage.delete(key);
            } catch (IOException e) {
                log.warn("Could not delete stored file {} of image {}", key, id, e);
            }
        }
        log.info("Deleted image {}", id);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
