package com.example.clubadmin.repository;

import com.example.clubadmin.domain.LedgerAccountType;
import com.example.clubadmin.domain.LedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, Long> {

    @Query("select e from LedgerEntry e join fetch e.account where e.payment.id = :paymentId order by e.id")
    List<LedgerEntry> findByPaymentWithAccount(@Param("paymentId") Long paymentId);

    /** Rows of [accountId, balance] over every entry. */
    @Query("select e.account.id, coalesce(sum(e.amount), 0) from LedgerEntry e group by e.account.id")
    List<Object[]> sumByAccount();

    /** Rows of [accountId, balance] over entries whose payment falls in the window. */
    @Query("select e.account.id, coalesce(sum(e.amount), 0) from LedgerEntry e join e.payment p " +
            "where p.paymentDate >= :start and p.paymentDate <= :end group by e.account.id")
    List<Object[]> sumByAccountBetween(@Param("start") LocalDateTime start,
                                       @Param("end") LocalDateTime end);

    @Query("select e from LedgerEntry e join fetch e.account a " +
            "where e.payment.id in :paymentIds and a.accountType = :type and e.amount > 0 order by e.id")
    List<LedgerEntry> findPositiveByPaymentsAndAccountType(@Param("paymentIds") List<Long> paymentIds,
                                                           @Param("type") LedgerAccountType type);
}
