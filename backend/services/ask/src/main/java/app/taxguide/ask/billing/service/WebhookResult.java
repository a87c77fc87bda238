package app.taxguide.ask.billing.service;

import app.taxguide.ask.subscription.domain.dto.SubscriptionView;
import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Outcome of one webhook delivery. {@code acknowledged} decides the HTTP status: the
 * provider retries anything that is not acknowledged.
 */
public record WebhookResult(
        boolean ok,
        String reason,
        String reference,
        Boolean idempotent,
        Boolean activated,
        Boolean scheduled,
        SubscriptionView subscription,
        @JsonIgnore boolean acknowledged
) {

    public static WebhookResult invalidSignature() {
        return new WebhookResult(false, "invalid_signature", null, null, null, null, null, true);
    }

    public static WebhookResult ignored(String reference, String reason) {
        return new WebhookResult(true, reason, reference, null, false, null, null, true);
    }

    public static WebhookResult rejected(String reference, String reason) {
        return new WebhookResult(false, reason, reference, null, false, null, null, true);
    }

    public static WebhookResult replay(String reference, SubscriptionView subscription) {
        return new WebhookResult(true, null, reference, true, false, null, subscription, true);
    }

    public static WebhookResult applied(String reference, boolean scheduled, SubscriptionView subscription) {
        return new WebhookResult(true, null, reference, false, !scheduled, scheduled, subscription, true);
    }

    public static WebhookResult retryLater(String reference, String reason) {
        return new WebhookResult(false, reason, reference, null, false, null, null, false);
    }
}
