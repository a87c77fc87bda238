package app.taxguide.ask.subscription.service;

import app.taxguide.ask.config.PlanCatalog;
import app.taxguide.ask.config.PlanCatalog.PlanSpec;
import app.taxguide.ask.entitlement.service.CreditLedgerService;
import app.taxguide.ask.subscription.domain.dto.SubscriptionView;
import app.taxguide.ask.subscription.domain.entity.SubscriptionEntity;
import app.taxguide.ask.subscription.domain.type.AccessState;
import app.taxguide.ask.subscription.domain.type.SubscriptionStatus;
import app.taxguide.ask.subscription.repository.SubscriptionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Subscription records are append-only history; the current record is the one with the
 * latest period end.
 */
@Service
public class SubscriptionService {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

    private final SubscriptionRepository subscriptionRepository;
    private final SubscriptionStateResolver stateResolver;
    private final CreditLedgerService creditLedgerService;
    private final PlanCatalog planCatalog;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public SubscriptionService(SubscriptionRepository subscriptionRepository,
                               SubscriptionStateResolver stateResolver,
                               CreditLedgerService creditLedgerService,
                               PlanCatalog planCatalog,
                               JdbcTemplate jdbcTemplate,
                               Clock clock) {
        this.subscriptionRepository = subscriptionRepository;
        this.stateResolver = stateResolver;
        this.creditLedgerService = creditLedgerService;
        this.planCatalog = planCatalog;
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    /**
     * Current access for the account. Applies a due scheduled change first.
     */
    @Transactional
    public SubscriptionView status(UUID accountId) {
        applyIfDue(accountId);
        Instant now = clock.instant();
        SubscriptionEntity current = subscriptionRepository.findFirstByAccountIdOrderByPeriodEndDescIdDesc(accountId)
                .orElse(null);
        return stateResolver.view(accountId, current, now);
    }

    /**
     * Appends a new current record starting now and seeds the plan's credits. Records still
     * running are closed at {@code now} first, and a pending change on the superseded record
     * moves to the new one, effective at its period end. {@code explicitExpiry} overrides the
     * plan duration.
     */
    @Transactional
    public SubscriptionView activate(UUID accountId, String planCode, Instant explicitExpiry) {
        PlanSpec plan = requirePlan(planCode);
        Instant now = clock.instant();
        Instant end = explicitExpiry != null ? explicitExpiry : now.plus(plan.duration());
        if (!end.isAfter(now)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Expiry must be in the future");
        }
        String carriedPlanCode = subscriptionRepository.findFirstByAccountIdOrderByPeriodEndDescIdDesc(accountId)
                .filter(SubscriptionEntity::hasPendingChange)
                .map(SubscriptionEntity::getPendingPlanCode)
                .orElse(null);
        int closed = subscriptionRepository.closeRunning(accountId, SubscriptionStatus.expired, now);
        SubscriptionEntity record = appendRecord(accountId, plan, now, end, now);
        if (carriedPlanCode != null) {
            subscriptionRepository.attachPendingChange(record.getId(), carriedPlanCode, now);
            record = subscriptionRepository.findById(record.getId()).orElseThrow();
        }
        log.info("Subscription activated accountId={} plan={} periodEnd={} superseded={} carriedPlan={}",
                accountId, plan.code(), end, closed, carriedPlanCode);
        return stateResolver.view(accountId, record, now);
    }

    /**
     * One trial per lifetime. Eligibility is the absence of any prior record; the
     * trial_grants row makes the claim atomic across concurrent callers.
     */
    @Transactional
    public TrialResult startTrial(UUID accountId) {
        if (subscriptionRepository.existsByAccountId(accountId)) {
            return TrialResult.notEligible(status(accountId));
        }
        int claimed = jdbcTemplate.update(
                """
                insert into app_ask.trial_grants (account_id, granted_at)
                values (?, now())
                on conflict (account_id) do nothing
                """,
                accountId
        );
        if (claimed == 0) {
            return TrialResult.notEligible(status(accountId));
        }
        PlanSpec trial = planCatalog.trialPlan();
        Instant now = clock.instant();
        SubscriptionEntity record = appendRecord(accountId, trial, now, now.plus(trial.duration()), now);
        log.info("Trial started accountId={} periodEnd={}", accountId, record.getPeriodEnd());
        return TrialResult.started(stateResolver.view(accountId, record, now));
    }

    /**
     * Attaches a plan change effective at the current period's end. Access is unchanged
     * until then. A change that is already pending is never replaced.
     */
    @Transactional
    public SubscriptionView schedule(UUID accountId, String nextPlanCode) {
        return trySchedule(accountId, nextPlanCode)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.CONFLICT, "A plan change is already scheduled"));
    }

    /**
     * Same as {@link #schedule} but reports an existing pending change as an empty result
     * instead of an exception, so callers inside a wider transaction can decide what to do.
     */
    @Transactional
    public Optional<SubscriptionView> trySchedule(UUID accountId, String nextPlanCode) {
        PlanSpec plan = requirePlan(nextPlanCode);
        if (planCatalog.isTrial(plan.code())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Trial plan cannot be scheduled");
        }
        Instant now = clock.instant();
        SubscriptionEntity current = subscriptionRepository.findFirstByAccountIdOrderByPeriodEndDescIdDesc(accountId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.CONFLICT, "No subscription to change"));
        AccessState state = stateResolver.resolve(current, now);
        if (!state.grantsAccess()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Subscription is not active");
        }
        if (current.hasPendingChange()
                || subscriptionRepository.attachPendingChange(current.getId(), plan.code(), now) == 0) {
            log.info("Plan change not scheduled accountId={} plan={} reason=pending_change_exists",
                    accountId, plan.code());
            return Optional.empty();
        }
        SubscriptionEntity updated = subscriptionRepository.findById(current.getId()).orElseThrow();
        log.info("Plan change scheduled accountId={} plan={} effectiveAt={}",
                accountId, plan.code(), updated.getPendingEffectiveAt());
        return Optional.of(stateResolver.view(accountId, updated, now));
    }

    /**
     * Activates a due scheduled change. The new period starts exactly at the previous
     * period's end. Safe to call concurrently: only one caller claims the change.
     */
    @Transactional
    public boolean applyIfDue(UUID accountId) {
        Instant now = clock.instant();
        SubscriptionEntity current = subscriptionRepository.findFirstByAccountIdOrderByPeriodEndDescIdDesc(accountId)
                .orElse(null);
        if (current == null || !current.hasPendingChange() || now.isBefore(current.getPendingEffectiveAt())) {
            return false;
        }
        String pendingCode = current.getPendingPlanCode();
        PlanSpec plan = planCatalog.find(pendingCode).orElse(null);
        Long currentId = current.getId();
        Instant start = current.getPeriodEnd();
        int claimed = subscriptionRepository.claimPendingChange(currentId, pendingCode, now);
        if (claimed == 0) {
            return false;
        }
        if (plan == null) {
            log.warn("Dropped scheduled change to unknown plan accountId={} plan={}", accountId, pendingCode);
            return false;
        }
        appendRecord(accountId, plan, start, start.plus(plan.duration()), now);
        log.info("Scheduled plan applied accountId={} plan={} periodStart={}", accountId, plan.code(), start);
        return true;
    }

    private SubscriptionEntity appendRecord(UUID accountId, PlanSpec plan, Instant start, Instant end, Instant now) {
        SubscriptionStatus status = planCatalog.isTrial(plan.code())
                ? SubscriptionStatus.trial
                : SubscriptionStatus.active;
        SubscriptionEntity record = subscriptionRepository.save(
                new SubscriptionEntity(accountId, plan.code(), status, start, end, now));
        creditLedgerService.grant(accountId, plan.credits());
        return record;
    }

    private PlanSpec requirePlan(String planCode) {
        return planCatalog.find(planCode)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown plan: " + planCode));
    }

    public record TrialResult(boolean started, String reason, SubscriptionView subscription) {

        static TrialResult started(SubscriptionView view) {
            return new TrialResult(true, null, view);
        }

        static TrialResult notEligible(SubscriptionView view) {
            return new TrialResult(false, "trial_not_eligible", view);
        }
    }
}
