package com.example.clubadmin.service.accounts;

import com.example.clubadmin.config.ClubProperties;
import com.example.clubadmin.domain.MembershipType;
import com.example.clubadmin.domain.Subscription;
import com.example.clubadmin.repository.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Applies subscription changes to the local mirror only. Stands in for the
 * processor client until one is wired up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LocalSubscriptionGateway implements SubscriptionGateway {

    private final SubscriptionRepository subscriptions;
    private final ClubProperties properties;

    @Override
    @Transactional
    public Subscription changePlan(Subscription subscription, String newPriceId, Direction direction) {
        MembershipType newType = typeForPrice(newPriceId);
        log.info("Subscription {} {} to {} (price {})",
                subscription.getId(), direction.name().toLowerCase(), newType, newPriceId);
        subscription.setPriceId(newPriceId);
        subscription.setMembershipType(newType);
        return subscriptions.save(subscription);
    }

    @Override
    @Transactional
    public Subscription updatePeriodEnd(Subscription subscription, LocalDateTime periodEnd) {
        log.info("Subscription {} period end {} -> {}",
                subscription.getId(), subscription.getCurrentPeriodEnd(), periodEnd);
        subscription.setCurrentPeriodEnd(periodEnd);
        return subscriptions.save(subscription);
    }

    @Override
    @Transactional
    public Subscription cancel(Subscription subscription) {
        log.info("Subscription {} set to cancel at period end", subscription.getId());
        subscription.setCancelAtPeriodEnd(true);
        return subscriptions.save(subscription);
    }

    private MembershipType typeForPrice(String priceId) {
        for (Map.Entry<String, ClubProperties.Plan> e : properties.getPlans().entrySet()) {
            if (priceId != null && priceId.equals(e.getValue().getPriceId())) {
                return MembershipType.parse(e.getKey());
            }
        }
        throw new IllegalArgumentException("Unknown price id: " + priceId);
    }
}
