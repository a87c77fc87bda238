package app.taxguide.ask.entitlement.domain.type;

public enum DenialReason {
    subscription_required,
    cache_limit_reached,
    no_credits
}
