package com.example.clubadmin.service.media;

/**
 * An upload batch failed validation; the message is shown to the admin as-is.
 */
public class UploadRejectedException extends IllegalArgumentException {

    public static final String TOO_LARGE = "Too large";
    public static final String NOT_ACCEPTED = "You have selected an unacceptable file type";
    public static final String TOO_MANY_FILES = "You have selected too many files";

    private final String fileName;

    public UploadRejectedException(String message, String fileName) {
        super(message);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
