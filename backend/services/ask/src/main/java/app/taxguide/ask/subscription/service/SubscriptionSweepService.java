package app.taxguide.ask.subscription.service;

import app.taxguide.ask.subscription.repository.SubscriptionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

/**
 * Batch pass over subscription records, triggered externally. Each scheduled change is
 * applied in its own transaction so one bad account does not block the rest.
 */
@Service
public class SubscriptionSweepService {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionSweepService.class);

    private static final String IS_CURRENT = """
            not exists (
                select 1 from app_ask.subscriptions n
                where n.account_id = s.account_id
                  and (n.period_end > s.period_end or (n.period_end = s.period_end and n.id > s.id))
            )
            """;

    private final SubscriptionRepository subscriptionRepository;
    private final SubscriptionService subscriptionService;
    private final SubscriptionStateResolver stateResolver;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public SubscriptionSweepService(SubscriptionRepository subscriptionRepository,
                                    SubscriptionService subscriptionService,
                                    SubscriptionStateResolver stateResolver,
                                    JdbcTemplate jdbcTemplate,
                                    Clock clock) {
        this.subscriptionRepository = subscriptionRepository;
        this.subscriptionService = subscriptionService;
        this.stateResolver = stateResolver;
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    public SweepResult sweep() {
        Instant now = clock.instant();
        int applied = 0;
        int failed = 0;
        List<UUID> due = subscriptionRepository.findAccountsWithDueChanges(now);
        for (UUID accountId : due) {
            try {
                if (subscriptionService.applyIfDue(accountId)) {
                    applied++;
                }
            } catch (RuntimeException ex) {
                failed++;
                log.warn("Scheduled change failed accountId={} error={}", accountId, ex.getMessage());
            }
        }

        OffsetDateTime nowTs = now.atOffset(ZoneOffset.UTC);
        OffsetDateTime graceCutoff = now.minus(stateResolver.graceWindow()).atOffset(ZoneOffset.UTC);
        int pastDue = jdbcTemplate.update(
                """
                update app_ask.subscriptions s
                set status = 'past_due', updated_at = now()
                where s.status = 'active'
                  and s.period_end <= ?
                  and s.period_end >= ?
                  and s.pending_plan_code is null
                  and
                """ + IS_CURRENT,
                nowTs,
                graceCutoff
        );
        int expired = jdbcTemplate.update(
                """
                update app_ask.subscriptions s
                set status = 'expired', updated_at = now()
                where s.pending_plan_code is null
                  and (
                      (s.status = 'trial' and s.period_end <= ?)
                      or (s.status in ('active', 'past_due', 'cancelled') and s.period_end < ?)
                  )
                  and
                """ + IS_CURRENT,
                nowTs,
                graceCutoff
        );
        log.info("Subscription sweep finished applied={} failed={} pastDue={} expired={}",
                applied, failed, pastDue, expired);
        return new SweepResult(applied, failed, pastDue, expired);
    }

    public record SweepResult(int applied, int failed, int markedPastDue, int markedExpired) {
    }
}
