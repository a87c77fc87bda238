package app.taxguide.ask.billing.domain.type;

public enum PaymentStatus {
    pending,
    success,
    failed
}
