package com.example.clubadmin.service.media;

public record ImageUploadedEvent(Long imageId) {
}
