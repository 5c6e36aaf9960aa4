package com.example.clubadmin.service;

/**
 * Raised when a record addressed by id does not exist (mapped to 404).
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String entity, Object id) {
        super(entity + " not found: id=" + id);
    }
}
