package com.example.clubadmin.repository;

import com.example.clubadmin.domain.Payment;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, Long> {

    Page<Payment> findByUserIdOrderByPaymentDateDesc(Long userId, Pageable pageable);

    @EntityGraph(attributePaths = "user")
    @Query("select p from Payment p where p.paymentDate >= :start and p.paymentDate <= :end order by p.paymentDate desc")
    List<Payment> findRecent(@Param("start") LocalDateTime start,
                             @Param("end") LocalDateTime end,
                             Pageable pageable);

    @EntityGraph(attributePaths = "user")
    @Query("select p from Payment p order by p.paymentDate desc")
    List<Payment> findRecent(Pageable pageable);

    /** Row-locks the payment until the surrounding transaction ends. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from Payment p where p.id = :id")
    Optional<Payment> findByIdForUpdate(@Param("id") Long id);

    Optional<Payment> findByExternalPaymentId(String externalPaymentId);

    boolean existsByReferenceId(String referenceId);
}
