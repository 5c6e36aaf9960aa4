package com.example.clubadmin.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Locale;

/**
 * BoardPosition ↔ lower-case column value ("treasurer", "vice_president", ...).
 *
 * <p>Rows imported from the old member database carry the lower-case form, and
 * some carry an empty string for "no position"; both are accepted on read.
 */
@Converter
public class BoardPositionConverter implements AttributeConverter<BoardPosition, String> {

    @Override
    public String convertToDatabaseColumn(BoardPosition position) {
        return position == null ? null : position.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public BoardPosition convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return BoardPosition.valueOf(dbData.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            // unknown legacy value: treat as no position
            return null;
        }
    }
}
