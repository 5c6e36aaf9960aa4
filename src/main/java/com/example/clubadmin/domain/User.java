// src/main/java/com/example/clubadmin/domain/User.java
package com.example.clubadmin.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Locale;

@Entity
@Table(name = "users", uniqueConstraints = @UniqueConstraint(columnNames = "email"))
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 160)
    private String email;

    @Column(name = "password_hash")
    private String passwordHash;

    @Column(name = "first_name", nullable = false, length = 150)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 150)
    private String lastName;

    @Column(name = "phone_number", length = 25)
    private String phoneNumber;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private UserState state = UserState.PENDING_APPROVAL;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserRole role = UserRole.MEMBER;

    @Convert(converter = BoardPositionConverter.class)
    @Column(name = "board_position", length = 40)
    private BoardPosition boardPosition;

    @Column(name = "date_of_birth")
    private LocalDate dateOfBirth;

    @Column(name = "lifetime_membership_awarded_at")
    private LocalDateTime lifetimeMembershipAwardedAt;

    @OneToOne(fetch = FetchType.LAZY, cascade = CascadeType.ALL, orphanRemoval = true)
    @JoinColumn(name = "billing_address_id")
    private Address billingAddress;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /** Convenience constructor used by seeds and tests. */
    public User(String email, String firstName, String lastName) {
        this.email = email;
        this.firstName = firstName;
        this.lastName = lastName;
        this.state = UserState.PENDING_APPROVAL;
        this.role = UserRole.MEMBER;
    }

    public String getFullName() {
        return capitalize(firstName) + " " + capitalize(lastName);
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    public boolean isActive() {
        return state == UserState.ACTIVE;
    }

    public boolean isTreasurer() {
        return boardPosition == BoardPosition.TREASURER && state == UserState.ACTIVE;
    }

    public boolean hasLifetimeMembership() {
        return lifetimeMembershipAwardedAt != null;
    }

    private static String capitalize(String s) {
        if (s == null || s.isEmpty()) return "";
        return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1);
    }
}
