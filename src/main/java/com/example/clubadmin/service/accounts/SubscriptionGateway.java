package com.example.clubadmin.service.accounts;

import com.example.clubadmin.domain.Subscription;

import java.time.LocalDateTime;

/**
 * Port to the payment processor that owns recurring subscriptions.
 */
public interface SubscriptionGateway {

    enum Direction { UPGRADE, DOWNGRADE }

    /** Moves the subscription to another price; upgrades prorate immediately, downgrades at renewal. */
    Subscription changePlan(Subscription subscription, String newPriceId, Direction direction);

    Subscription updatePeriodEnd(Subscription subscription, LocalDateTime periodEnd);

    /** Cancels at the end of the current period. */
    Subscription cancel(Subscription subscription);
}
