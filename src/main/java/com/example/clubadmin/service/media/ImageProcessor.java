package com.example.clubadmin.service.media;

import com.example.clubadmin.config.ClubProperties;
import com.example.clubadmin.domain.Image;
import com.example.clubadmin.domain.ImageProcessingState;
import com.example.clubadmin.repository.ImageRepository;
import com.example.clubadmin.service.storage.ObjectStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.transaction.support.TransactionTemplate;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Produces the optimized and thumbnail renditions of an uploaded image.
 * Formats ImageIO cannot decode (webp on a stock JDK) end up FAILED.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImageProcessor {

    static final float JPEG_QUALITY = 0.85f;

    private final ImageRepository imageRepository;
    private final ObjectStorage storage;
    private final ClubProperties properties;
    private final TransactionTemplate transactionTemplate;

    @Async("taskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onUploaded(ImageUploadedEvent event) {
        process(event.imageId());
    }

    /** Runs synchronously; returns the final state. */
    public ImageProcessingState process(Long imageId) {
        Optional<Image> found = imageRepository.findById(imageId);
        if (found.isEmpty()) {
            log.warn("Image {} vanished before processing", imageId);
            return ImageProcessingState.FAILED;
        }
        String rawKey = found.get().getRawImagePath();
        setState(imageId, ImageProcessingState.PROCESSING);
        try {
            BufferedImage source = read(rawKey);
            String base = rawKey.substring(0, rawKey.lastIndexOf('/') + 1);
            String optimizedKey = base + "optimized.jpg";
            String thumbKey = base + "thumbnail.jpg";
            storage.put(optimizedKey, encodeJpeg(source), "image/jpeg");
            storage.put(thumbKey, encodeJpeg(scaleToFit(source, properties.getMedia().getThumbnailSize())), "image/jpeg");

            transactionTemplate.executeWithoutResult(tx -> imageRepository.findById(imageId).ifPresent(img -> {
                img.setWidth(source.getWidth());
                img.setHeight(source.getHeight());
                img.setOptimizedImagePath(optimizedKey);
                img.setThumbnailPath(thumbKey);
                img.setProcessingState(ImageProcessingState.COMPLETED);
            }));
            log.info("Processed image {} ({}x{})", imageId, source.getWidth(), source.getHeight());
            return ImageProcessingState.COMPLETED;
        } catch (IOException | RuntimeException e) {
            log.error("Processing image {} failed", imageId, e);
            setState(imageId, ImageProcessingState.FAILED);
            return ImageProcessingState.FAILED;
        }
    }

    private BufferedImage read(String key) throws IOException {
        try (InputStream in = storage.open(key).orElseThrow(() -> new IOException("Raw file missing: " + key))) {
            BufferedImage img = ImageIO.read(in);
            if (img == null) {
                throw new IOException("Unsupported image format: " + key);
            }
            return img;
        }
    }

    private void setState(Long imageId, ImageProcessingState state) {
        transactionTemplate.executeWithoutResult(tx ->
                imageRepository.findById(imageId).ifPresent(img -> img.setProcessingState(state)));
    }

    /** Scales down so the longer side is at most {@code box}; never upscales. */
    static BufferedImage scaleToFit(BufferedImage src, int box) {
        int w = src.getWidth();
        int h = src.getHeight();
        double ratio = Math.min(1.0, (double) box / Math.max(w, h));
        int tw = Math.max(1, (int) Math.round(w * ratio));
        int th = Math.max(1, (int) Math.round(h * ratio));
        BufferedImage out = new BufferedImage(tw, th, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, tw, th);
            g.drawImage(src, 0, 0, tw, th, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    static byte[] encodeJpeg(BufferedImage src) throws IOException {
        BufferedImage rgb = src.getType() == BufferedImage.TYPE_INT_RGB ? src : scaleToFit(src, Math.max(src.getWidth(), src.getHeight()));
        ImageWriter writer = ImageIO.getImageWritersByFormatName("jpeg").next();
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ImageOutputStream out = ImageIO.createImageOutputStream(bytes)) {
            writer.setOutput(out);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(JPEG_QUALITY);
            writer.write(null, new IIOImage(rgb, null, null), param);
        } finally {
            writer.dispose();
        }
        return bytes.toByteArray();
    }
}
