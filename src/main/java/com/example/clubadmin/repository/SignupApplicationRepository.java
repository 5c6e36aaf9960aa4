package com.example.clubadmin.repository;

import com.example.clubadmin.domain.SignupApplication;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface SignupApplicationRepository extends JpaRepository<SignupApplication, Long> {
    Optional<SignupApplication> findByUserId(Long userId);
}
