package com.example.clubadmin.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Typed view of the {@code club.*} block in application.yml.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "club")
public class ClubProperties {

    /** Root directory of the local object store (media, receipts, exports). */
    @NotBlank
    private String storageRoot = "./data/storage";

    /** Directory generated CSV exports are written to. */
    @NotBlank
    private String exportDir = "./data/exports";

    /** How long a server-sent-event stream stays open; browsers reconnect after it closes. */
    private Duration sseTimeout = Duration.ofMinutes(30);

    @Valid
    private Admin admin = new Admin();

    @Valid
    private Posts posts = new Posts();

    @Valid
    private Media media = new Media();

    @Valid
    private Security security = new Security();

    /** Membership plans keyed by {@code MembershipType} name. */
    private Map<String, Plan> plans = new TreeMap<>(Map.of(
            "SINGLE", new Plan("Single", new BigDecimal("45.00"), "price_single"),
            "FAMILY", new Plan("Family", new BigDecimal("65.00"), "price_family"),
            "LIFETIME", new Plan("Lifetime", BigDecimal.ZERO, null)));

    @Getter @Setter
    public static class Admin {
        @NotBlank
        private String email = "admin@example.org";
        @NotBlank
        private String initialPassword = "change-me";
    }

    @Getter @Setter
    public static class Posts {
        private Duration autosaveDebounce = Duration.ofMillis(2000);
        @Min(1)
        private int pageSize = 20;
    }

    @Getter @Setter
    public static class Media {
        @Min(1)
        private int pageSize = 20;
        @Min(1)
        private int maxEntries = 10;
        /** Max upload size per file in bytes. */
        @Min(1)
        private long maxFileSize = 20L * 1024 * 1024;
        @NotEmpty
        private List<String> acceptedExtensions = new ArrayList<>(List.of(".jpg", ".jpeg", ".png", ".gif", ".webp"));
        @Min(16)
        private int thumbnailSize = 500;
    }

    @Getter @Setter
    public static class Security {
        /** Base64 AES key (16, 24 or 32 bytes) for bank account fields. */
        @NotBlank
        private String fieldEncryptionKey = "MDEyMzQ1Njc4OWFiY2RlZjAxMjM0NTY3ODlhYmNkZWY=";
        private String rememberMeKey = "club-admin-remember-me";
    }

    @Getter @Setter
    public static class Plan {
        private String name;
        private BigDecimal amount = BigDecimal.ZERO;
        private String priceId;

        public Plan() {
        }

        public Plan(String name, BigDecimal amount, String priceId) {
            this.name = name;
            this.amount = amount;
            this.priceId = priceId;
        }
    }
}
