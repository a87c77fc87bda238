package app.taxguide.ask.entitlement.service;

import app.taxguide.ask.config.AskProps;
import app.taxguide.ask.config.PlanCatalog;
import app.taxguide.ask.config.PlanCatalog.PlanSpec;
import app.taxguide.ask.entitlement.domain.type.AccessVia;
import app.taxguide.ask.entitlement.domain.type.DenialReason;
import app.taxguide.ask.entitlement.domain.type.InteractionMode;
import app.taxguide.ask.entitlement.service.DailyQuotaService.QuotaResult;
import app.taxguide.ask.subscription.domain.dto.SubscriptionView;
import app.taxguide.ask.subscription.service.SubscriptionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Decides whether an account may be served. The subscription is checked once per request;
 * quota is consumed only right before a cache answer is served and credit only right
 * before generation. Library answers are free.
 */
@Service
public class EntitlementGate {

    private static final Logger log = LoggerFactory.getLogger(EntitlementGate.class);

    private final SubscriptionService subscriptionService;
    private final DailyQuotaService dailyQuotaService;
    private final CreditLedgerService creditLedgerService;
    private final PlanCatalog planCatalog;
    private final AskProps.Credits credits;

    public EntitlementGate(SubscriptionService subscriptionService,
                           DailyQuotaService dailyQuotaService,
                           CreditLedgerService creditLedgerService,
                           PlanCatalog planCatalog,
                           AskProps props) {
        this.subscriptionService = subscriptionService;
        this.dailyQuotaService = dailyQuotaService;
        this.creditLedgerService = creditLedgerService;
        this.planCatalog = planCatalog;
        this.credits = props.credits();
    }

    public AccessGrant checkAccess(UUID accountId, InteractionMode mode) {
        SubscriptionView subscription = subscriptionService.status(accountId);
        if (!subscription.active()) {
            log.info("Access denied accountId={} state={}", accountId, subscription.state());
            return new AccessGrant(accountId, mode, false, subscription, null, 0);
        }
        // null limit is unlimited; an unknown plan gets no cache allowance
        PlanSpec plan = planCatalog.find(subscription.planCode()).orElse(null);
        Integer dailyCacheLimit = plan == null ? Integer.valueOf(0) : plan.dailyCacheLimit();
        return new AccessGrant(accountId, mode, true, subscription, dailyCacheLimit, costOf(mode));
    }

    /**
     * Consumes what {@code via} costs for an already-checked request.
     */
    public EntitlementDecision admit(AccessGrant grant, AccessVia via) {
        if (!grant.granted()) {
            return EntitlementDecision.denied(DenialReason.subscription_required);
        }
        return switch (via) {
            case library -> EntitlementDecision.allowedLibrary();
            case cache -> admitCache(grant);
            case credit -> admitCredit(grant);
        };
    }

    /**
     * Full check for a single source: subscription, then quota or credit.
     */
    public EntitlementDecision authorize(UUID accountId, InteractionMode mode, AccessVia via) {
        return admit(checkAccess(accountId, mode), via);
    }

    /**
     * Returns a credit reservation taken by {@link #admit} when generation did not produce an answer.
     */
    public void release(UUID accountId, EntitlementDecision decision) {
        if (decision == null || !decision.allowed() || decision.via() != AccessVia.credit) {
            return;
        }
        creditLedgerService.refund(accountId, decision.creditCost());
    }

    public int costOf(InteractionMode mode) {
        return switch (mode) {
            case text -> Math.max(1, credits.textCost());
            case voice -> Math.max(1, credits.voiceCost());
        };
    }

    private EntitlementDecision admitCache(AccessGrant grant) {
        QuotaResult quota = dailyQuotaService.tryConsume(grant.accountId(), grant.dailyCacheLimit());
        if (!quota.allowed()) {
            return EntitlementDecision.cacheLimitReached(quota.used(), quota.limit(), quota.resetsAt());
        }
        return EntitlementDecision.allowedCache(quota.used(), quota.limit(), quota.resetsAt());
    }

    private EntitlementDecision admitCredit(AccessGrant grant) {
        if (!creditLedgerService.tryDebit(grant.accountId(), grant.creditCost())) {
            return EntitlementDecision.denied(DenialReason.no_credits);
        }
        return EntitlementDecision.allowedCredit(grant.creditCost());
    }
}
