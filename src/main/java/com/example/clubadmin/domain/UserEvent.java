package com.example.clubadmin.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Audit row for administrative changes to a user (state transitions).
 */
@Entity
@Table(name = "user_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class UserEvent {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "updated_by_user_id")
    private User updatedBy;

    @Column(nullable = false, length = 30)
    private String type;

    @Column(name = "from_value", length = 50)
    private String from;

    @Column(name = "to_value", length = 50)
    private String to;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static UserEvent stateUpdate(User user, User actor, UserState from, UserState to) {
        return UserEvent.builder()
                .user(user)
                .updatedBy(actor)
                .type("state_update")
                .from(from == null ? null : from.name().toLowerCase())
                .to(to.name().toLowerCase())
                .build();
    }
}
