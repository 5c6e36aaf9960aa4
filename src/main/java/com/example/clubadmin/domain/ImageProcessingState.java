package com.example.clubadmin.domain;

public enum ImageProcessingState {
    UNPROCESSED,
    PROCESSING,
    COMPLETED,
    FAILED
}
