package app.taxguide.ask.entitlement.service;

import app.taxguide.ask.entitlement.domain.type.AccessVia;
import app.taxguide.ask.entitlement.domain.type.DenialReason;

import java.time.Instant;

/**
 * Allowed via library, cache or credit, or denied with a machine-readable reason.
 * Quota fields are set for cache decisions only; {@code creditCost} for credit decisions only.
 */
public record EntitlementDecision(
        boolean allowed,
        AccessVia via,
        DenialReason reason,
        int creditCost,
        Integer cacheUsed,
        Integer cacheLimit,
        Instant resetsAt
) {

    public static EntitlementDecision allowedLibrary() {
        return new EntitlementDecision(true, AccessVia.library, null, 0, null, null, null);
    }

    public static EntitlementDecision allowedCache(int used, Integer limit, Instant resetsAt) {
        return new EntitlementDecision(true, AccessVia.cache, null, 0, used, limit, resetsAt);
    }

    public static EntitlementDecision allowedCredit(int cost) {
        return new EntitlementDecision(true, AccessVia.credit, null, cost, null, null, null);
    }

    public static EntitlementDecision denied(DenialReason reason) {
        return new EntitlementDecision(false, null, reason, 0, null, null, null);
    }

    public static EntitlementDecision cacheLimitReached(int used, Integer limit, Instant resetsAt) {
        return new EntitlementDecision(false, AccessVia.cache, DenialReason.cache_limit_reached, 0, used, limit,
                resetsAt);
    }
}
