package com.example.clubadmin.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Form-level rejection carrying per-field messages. Controllers copy them into the
 * {@code BindingResult} and re-render the form.
 */
public class ValidationException extends RuntimeException {

    private final Map<String, List<String>> errors;

    public ValidationException(Map<String, List<String>> errors) {
        super(summarize(errors));
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public Map<String, List<String>> getErrors() {
        return errors;
    }

    public List<String> errorsFor(String field) {
        return errors.getOrDefault(field, List.of());
    }

    private static String summarize(Map<String, List<String>> errors) {
        StringBuilder sb = new StringBuilder();
        errors.forEach((field, messages) -> messages.forEach(m -> {
            if (sb.length() > 0) sb.append("; ");
            sb.append(field).append(' ').append(m);
        }));
        return sb.toString();
    }
}
