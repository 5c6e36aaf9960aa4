package com.example.clubadmin.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Member bank account used for reimbursements.
 *
 * <p>Routing and account numbers are held as ciphertext (see {@code FieldCipher});
 * only {@link #accountNumberLast4} is stored in clear. Both ciphertext fields are
 * excluded from {@code toString} and JSON.
 */
@Entity
@Table(name = "bank_accounts")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"routingNumberCiphertext", "accountNumberCiphertext", "user"})
public class BankAccount {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @JsonIgnore
    @Column(name = "routing_number", nullable = false, length = 255)
    private String routingNumberCiphertext;

    @JsonIgnore
    @Column(name = "account_number", nullable = false, length = 255)
    private String accountNumberCiphertext;

    @Column(name = "account_number_last_4", nullable = false, length = 4)
    private String accountNumberLast4;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public String masked() {
        return "****" + accountNumberLast4;
    }
}
