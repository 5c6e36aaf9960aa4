package com.example.clubadmin.repository;

import com.example.clubadmin.domain.Subscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {

    Optional<Subscription> findFirstByUserIdAndStatusInOrderByCreatedAtDesc(Long userId, Collection<String> statuses);

    List<Subscription> findByUserIdInAndStatusIn(Collection<Long> userIds, Collection<String> statuses);

    List<Subscription> findByUserIdOrderByCreatedAtDesc(Long userId);
}
