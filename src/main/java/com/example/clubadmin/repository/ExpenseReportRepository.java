package com.example.clubadmin.repository;

import com.example.clubadmin.domain.ExpenseReport;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ExpenseReportRepository extends JpaRepository<ExpenseReport, Long> {

    List<ExpenseReport> findByUserIdOrderByCreatedAtDesc(Long userId);

    Optional<ExpenseReport> findByIdAndUserId(Long id, Long userId);

    boolean existsByBankAccountId(Long bankAccountId);
}
