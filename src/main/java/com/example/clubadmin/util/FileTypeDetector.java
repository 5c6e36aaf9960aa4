package com.example.clubadmin.util;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Detects upload content type from leading magic bytes rather than the file name.
 */
public final class FileTypeDetector {

    public enum DetectedType {
        JPEG("image/jpeg", "jpg"),
        PNG("image/png", "png"),
        GIF("image/gif", "gif"),
        WEBP("image/webp", "webp"),
        PDF("application/pdf", "pdf");

        private final String mimeType;
        private final String extension;

        DetectedType(String mimeType, String extension) {
            this.mimeType = mimeType;
            this.extension = extension;
        }

        public String mimeType() { return mimeType; }

        public String extension() { return extension; }

        public boolean isImage() { return this != PDF; }
    }

    private static final byte[] JPEG_MAGIC = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
    private static final byte[] PNG_MAGIC = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A};
    private static final byte[] GIF87 = {'G', 'I', 'F', '8', '7', 'a'};
    private static final byte[] GIF89 = {'G', 'I', 'F', '8', '9', 'a'};
    private static final byte[] RIFF = {'R', 'I', 'F', 'F'};
    private static final byte[] WEBP = {'W', 'E', 'B', 'P'};
    private static final byte[] PDF_MAGIC = {'%', 'P', 'D', 'F', '-'};

    /** Bytes needed to recognise every supported type. */
    public static final int HEADER_LENGTH = 12;

    private FileTypeDetector() {
    }

    public static Optional<DetectedType> detect(byte[] header) {
        if (header == null) {
            return Optional.empty();
        }
        if (startsWith(header, 0, JPEG_MAGIC)) return Optional.of(DetectedType.JPEG);
        if (startsWith(header, 0, PNG_MAGIC)) return Optional.of(DetectedType.PNG);
        if (startsWith(header, 0, GIF87) || startsWith(header, 0, GIF89)) return Optional.of(DetectedType.GIF);
        if (startsWith(header, 0, RIFF) && startsWith(header, 8, WEBP)) return Optional.of(DetectedType.WEBP);
        if (startsWith(header, 0, PDF_MAGIC)) return Optional.of(DetectedType.PDF);
        return Optional.empty();
    }

    /** Lower-case extension including the dot, or "" when the name has none. */
    public static String extensionOf(String filename) {
        if (filename == null) return "";
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static boolean startsWith(byte[] data, int offset, byte[] magic) {
        if (data.length < offset + magic.length) {
            return false;
        }
        return Arrays.equals(data, offset, offset + magic.length, magic, 0, magic.length);
    }
}
