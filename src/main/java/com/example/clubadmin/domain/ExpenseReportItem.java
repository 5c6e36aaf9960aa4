package com.example.clubadmin.domain;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDate;

@Entity
@Table(name = "expense_report_items")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExpenseReportItem {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "expense_report_id", nullable = false)
    private ExpenseReport expenseReport;

    @Column(nullable = false)
    private LocalDate date;

    @Column(nullable = false, length = 255)
    private String vendor;

    @Column(length = 1000)
    private String description;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "receipt_path", length = 500)
    private String receiptPath;

    public boolean hasReceipt() {
        return receiptPath != null && !receiptPath.isBlank();
    }
}
