package app.taxguide.ask.entitlement.service;

import app.taxguide.ask.entitlement.domain.type.InteractionMode;
import app.taxguide.ask.subscription.domain.dto.SubscriptionView;

import java.util.UUID;

/**
 * Result of the subscription check for one request. {@code subscription} is always set;
 * the rest only when access is granted.
 */
public record AccessGrant(
        UUID accountId,
        InteractionMode mode,
        boolean granted,
        SubscriptionView subscription,
        Integer dailyCacheLimit,
        int creditCost
) {
}
