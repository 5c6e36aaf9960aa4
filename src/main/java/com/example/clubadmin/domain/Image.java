package com.example.clubadmin.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "images")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Image {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 255)
    private String title;

    @Column(name = "alt_text", length = 255)
    private String altText;

    @Column(length = 1000)
    private String description;

    @Column(name = "raw_image_path", nullable = false, length = 500)
    private String rawImagePath;

    @Column(name = "optimized_image_path", length = 500)
    private String optimizedImagePath;

    @Column(name = "thumbnail_path", length = 500)
    private String thumbnailPath;

    private Integer width;

    private Integer height;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "processing_state", nullable = false, length = 20)
    private ImageProcessingState processingState = ImageProcessingState.UNPROCESSED;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id")
    private User uploader;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /** Path of the requested rendition, or null when it has not been produced. */
    public String pathFor(ImageVersion version) {
        return switch (version) {
            case OPTIMIZED -> optimizedImagePath;
            case THUMBNAIL -> thumbnailPath;
            case RAW -> rawImagePath;
        };
    }
}
