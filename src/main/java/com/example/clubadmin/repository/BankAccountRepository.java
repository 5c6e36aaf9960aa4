package com.example.clubadmin.repository;

import com.example.clubadmin.domain.BankAccount;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface BankAccountRepository extends JpaRepository<BankAccount, Long> {

    List<BankAccount> findByUserIdOrderByCreatedAtDesc(Long userId);

    Optional<BankAccount> findByIdAndUserId(Long id, Long userId);

    long countByUserId(Long userId);
}
