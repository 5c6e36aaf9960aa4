package com.example.clubadmin.repository;

import com.example.clubadmin.domain.LedgerTransaction;
import com.example.clubadmin.domain.LedgerTransactionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;

public interface LedgerTransactionRepository extends JpaRepository<LedgerTransaction, Long> {

    List<LedgerTransaction> findByPaymentIdOrderByCreatedAtAsc(Long paymentId);

    @Query("select coalesce(sum(t.totalAmount), 0) from LedgerTransaction t " +
            "where t.payment.id = :paymentId and t.type = :type")
    BigDecimal sumByPaymentAndType(@Param("paymentId") Long paymentId,
                                   @Param("type") LedgerTransactionType type);
}
