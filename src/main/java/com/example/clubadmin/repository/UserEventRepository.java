package com.example.clubadmin.repository;

import com.example.clubadmin.domain.UserEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface UserEventRepository extends JpaRepository<UserEvent, Long> {
    List<UserEvent> findByUserIdOrderByCreatedAtDesc(Long userId);
}
