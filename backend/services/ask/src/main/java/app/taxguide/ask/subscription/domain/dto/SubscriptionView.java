package app.taxguide.ask.subscription.domain.dto;

import app.taxguide.ask.subscription.domain.type.AccessState;

import java.time.Instant;
import java.util.UUID;

public record SubscriptionView(
        UUID accountId,
        boolean active,
        AccessState state,
        String planCode,
        Instant expiresAt,
        Instant graceUntil,
        String pendingPlanCode,
        Instant pendingEffectiveAt,
        boolean nonRenewing
) {

    public static SubscriptionView none(UUID accountId) {
        return new SubscriptionView(accountId, false, AccessState.none, null, null, null, null, null, false);
    }
}
