package com.example.clubadmin.util;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Human readable ids of the form {@code PMT-240115-K7QZC}: prefix, UTC date (yyMMdd),
 * four random characters and a one character checksum.
 */
@Component
public class ReferenceIdGenerator {

    public static final Set<String> PREFIXES = Set.of("PMT", "TKT", "BKG", "DON", "EVT", "ORD", "RFD");

    /** A-Z and 0-9 without the look-alikes O, I, 1 and 0. */
    static final String CHARSET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";

    private static final Pattern FORMAT = Pattern.compile("^([A-Z]{3})-(\\d{6})-([A-Z0-9]{4})([A-Z0-9])$");
    private static final DateTimeFormatter DATE_PART = DateTimeFormatter.ofPattern("yyMMdd");

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public ReferenceIdGenerator() {
        this(Clock.systemUTC());
    }

    public ReferenceIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String generate(String prefix) {
        if (!PREFIXES.contains(prefix)) {
            throw new IllegalArgumentException("Invalid prefix: " + prefix);
        }
        String datePart = LocalDate.now(clock).format(DATE_PART);
        StringBuilder randomPart = new StringBuilder(4);
        for (int i = 0; i < 4; i++) {
            randomPart.append(CHARSET.charAt(random.nextInt(CHARSET.length())));
        }
        String checksum = computeChecksum(prefix + datePart + randomPart);
        return prefix + "-" + datePart + "-" + randomPart + checksum;
    }

    /**
     * @return empty when the id is well formed, otherwise the reason it is not
     */
    public static Optional<String> validate(String referenceId) {
        if (referenceId == null) {
            return Optional.of("Invalid format");
        }
        Matcher m = FORMAT.matcher(referenceId);
        if (!m.matches()) {
            return Optional.of("Invalid format");
        }
        String prefix = m.group(1);
        String date = m.group(2);
        String randomPart = m.group(3);
        String checksum = m.group(4);

        if (!PREFIXES.contains(prefix)) {
            return Optional.of("Invalid prefix");
        }
        if (!date.matches("\\d{6}")) {
            return Optional.of("Invalid date format");
        }
        for (char c : randomPart.toCharArray()) {
            if (CHARSET.indexOf(c) < 0) {
                return Optional.of("Invalid random part");
            }
        }
        if (!checksum.equals(computeChecksum(prefix + date + randomPart))) {
            return Optional.of("Checksum validation failed");
        }
        return Optional.empty();
    }

    public static boolean isValid(String referenceId) {
        return validate(referenceId).isEmpty();
    }

    /** Sum of character codes mod 36, rendered as 0-9 then A-Z. */
    public static String computeChecksum(String base) {
        int sum = 0;
        for (int i = 0; i < base.length(); i++) {
            sum += base.charAt(i);
        }
        int value = sum % 36;
        return value < 10
                ? String.valueOf((char) ('0' + value))
                : String.valueOf((char) ('A' + value - 10));
    }
}
