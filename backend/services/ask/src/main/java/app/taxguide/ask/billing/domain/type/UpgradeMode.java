package app.taxguide.ask.billing.domain.type;

import java.util.Locale;

public enum UpgradeMode {
    immediate,
    at_expiry;

    /**
     * Anything other than an explicit {@code at_expiry} activates immediately.
     */
    public static UpgradeMode parse(String raw) {
        if (raw == null) {
            return immediate;
        }
        return "at_expiry".equals(raw.trim().toLowerCase(Locale.ROOT)) ? at_expiry : immediate;
    }
}
