package app.taxguide.ask.subscription.domain.type;

public enum SubscriptionStatus {
    trial,
    active,
    past_due,
    cancelled,
    expired
}
