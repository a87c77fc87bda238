package app.taxguide.ask.subscription.domain.type;

public enum AccessState {
    none,
    trial,
    active,
    grace,
    expired;

    public boolean grantsAccess() {
        return this == trial || this == active || this == grace;
    }
}
