package com.example.clubadmin.service.export;

import com.example.clubadmin.domain.User;

import java.util.Locale;
import java.util.function.Function;

/**
 * Columns an admin can pick for the user CSV. The CSV header uses {@link #key()}.
 */
public enum ExportField {
    ID("id", "User ID", u -> u.getId()),
    EMAIL("email", "Email", User::getEmail),
    FIRST_NAME("first_name", "First Name", User::getFirstName),
    LAST_NAME("last_name", "Last Name", User::getLastName),
    PHONE_NUMBER("phone_number", "Phone Number", User::getPhoneNumber),
    STATE("state", "Account State", u -> u.getState() == null ? null : u.getState().name().toLowerCase(Locale.ROOT)),
    ROLE("role", "Role", u -> u.getRole() == null ? null : u.getRole().name().toLowerCase(Locale.ROOT)),
    BOARD_POSITION("board_position", "Board Position",
            u -> u.getBoardPosition() == null ? null : u.getBoardPosition().name().toLowerCase(Locale.ROOT));

    private final String key;
    private final String label;
    private final Function<User, Object> extractor;

    ExportField(String key, String label, Function<User, Object> extractor) {
        this.key = key;
        this.label = label;
        this.extractor = extractor;
    }

    public String key() { return key; }

    public String getLabel() { return label; }

    public Object valueOf(User user) {
        return extractor.apply(user);
    }

    /** Accepts either the enum name or the CSV key. */
    public static ExportField parse(String raw) {
        for (ExportField f : values()) {
            if (f.name().equalsIgnoreCase(raw) || f.key.equalsIgnoreCase(raw)) {
                return f;
            }
        }
        throw new IllegalArgumentException("Unknown export field: " + raw);
    }
}
