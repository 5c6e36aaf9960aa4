package com.example.clubadmin.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "expense_reports")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExpenseReport {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(nullable = false, length = 1000)
    private String purpose;

    @Enumerated(EnumType.STRING)
    @Column(name = "reimbursement_method", nullable = false, length = 20)
    private ReimbursementMethod reimbursementMethod;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ExpenseReportStatus status = ExpenseReportStatus.DRAFT;

    @Builder.Default
    @Column(name = "certification_accepted", nullable = false)
    private boolean certificationAccepted = false;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "address_id")
    private Address address;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "bank_account_id")
    private BankAccount bankAccount;

    @Builder.Default
    @OneToMany(mappedBy = "expenseReport", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<ExpenseReportItem> expenseItems = new ArrayList<>();

    @Builder.Default
    @OneToMany(mappedBy = "expenseReport", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<ExpenseReportIncomeItem> incomeItems = new ArrayList<>();

    @Column(name = "quickbooks_sync_status", length = 20)
    private String quickbooksSyncStatus;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public void addExpenseItem(ExpenseReportItem item) {
        item.setExpenseReport(this);
        expenseItems.add(item);
    }

    public void addIncomeItem(ExpenseReportIncomeItem item) {
        item.setExpenseReport(this);
        incomeItems.add(item);
    }

    public BigDecimal expenseTotal() {
        return expenseItems.stream()
                .map(ExpenseReportItem::getAmount)
                .filter(a -> a != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal incomeTotal() {
        return incomeItems.stream()
                .map(ExpenseReportIncomeItem::getAmount)
                .filter(a -> a != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /** Amount owed to the member: expenses minus income collected on the club's behalf. */
    public BigDecimal netTotal() {
        return expenseTotal().subtract(incomeTotal());
    }
}
