package app.taxguide.ask.billing.service;

import app.taxguide.ask.config.PlanCatalog;
import app.taxguide.ask.config.PlanCatalog.PlanSpec;
import app.taxguide.ask.entitlement.service.CreditLedgerService;
import app.taxguide.ask.entitlement.service.DailyQuotaService;
import app.taxguide.ask.subscription.domain.dto.SubscriptionView;
import app.taxguide.ask.subscription.service.SubscriptionService;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;

@Service
public class BillingSnapshotService {

    private final SubscriptionService subscriptionService;
    private final CreditLedgerService creditLedgerService;
    private final DailyQuotaService dailyQuotaService;
    private final PlanCatalog planCatalog;

    public BillingSnapshotService(SubscriptionService subscriptionService,
                                  CreditLedgerService creditLedgerService,
                                  DailyQuotaService dailyQuotaService,
                                  PlanCatalog planCatalog) {
        this.subscriptionService = subscriptionService;
        this.creditLedgerService = creditLedgerService;
        this.dailyQuotaService = dailyQuotaService;
        this.planCatalog = planCatalog;
    }

    public BillingSnapshot snapshot(UUID accountId) {
        SubscriptionView subscription = subscriptionService.status(accountId);
        PlanSpec plan = planCatalog.find(subscription.planCode()).orElse(null);
        return new BillingSnapshot(
                subscription,
                creditLedgerService.balance(accountId),
                plan == null ? null : plan.credits(),
                dailyQuotaService.usedToday(accountId),
                plan == null ? null : plan.dailyCacheLimit(),
                dailyQuotaService.nextReset()
        );
    }

    public record BillingSnapshot(
            SubscriptionView subscription,
            int creditBalance,
            Integer planCredits,
            int cacheUsedToday,
            Integer dailyCacheLimit,
            Instant cacheResetsAt
    ) {
    }
}
