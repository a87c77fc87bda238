package app.taxguide.ask.billing.service;

import app.taxguide.ask.billing.domain.type.UpgradeMode;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Writes to the processed-payment markers. A reference marked {@code success} is never
 * rewritten.
 */
@Service
public class PaymentMarkerService {

    private final JdbcTemplate jdbcTemplate;

    public PaymentMarkerService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public void recordPending(String reference, UUID accountId, String planCode, UpgradeMode upgradeMode,
                              long amountKobo, String currency) {
        jdbcTemplate.update(
                """
                insert into app_ask.payments (reference, status, account_id, plan_code, upgrade_mode,
                                              amount_kobo, currency, created_at, updated_at)
                values (?, 'pending', ?, ?, ?, ?, ?, now(), now())
                on conflict (reference) do nothing
                """,
                reference,
                accountId,
                planCode,
                upgradeMode.name(),
                amountKobo,
                currency
        );
    }

    /**
     * Marks the reference successful unless it already is. Returns true for the single caller
     * that made the transition; a concurrent duplicate blocks on the row and then gets false.
     * Must run inside the transaction that applies the payment.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean claimSuccess(String reference, UUID accountId, String planCode, UpgradeMode upgradeMode,
                                long amountKobo, String currency) {
        int updated = jdbcTemplate.update(
                """
                insert into app_ask.payments as p (reference, status, account_id, plan_code, upgrade_mode,
                                                   amount_kobo, currency, reason, created_at, updated_at)
                values (?, 'success', ?, ?, ?, ?, ?, null, now(), now())
                on conflict (reference) do update
                set status = 'success',
                    account_id = excluded.account_id,
                    plan_code = excluded.plan_code,
                    upgrade_mode = excluded.upgrade_mode,
                    amount_kobo = excluded.amount_kobo,
                    currency = excluded.currency,
                    reason = null,
                    updated_at = now()
                where p.status <> 'success'
                """,
                reference,
                accountId,
                planCode,
                upgradeMode.name(),
                amountKobo,
                currency
        );
        return updated == 1;
    }

    @Transactional
    public void recordFailure(String reference, UUID accountId, String planCode, String reason) {
        jdbcTemplate.update(
                """
                insert into app_ask.payments as p (reference, status, account_id, plan_code, reason,
                                                   created_at, updated_at)
                values (?, 'failed', ?, ?, ?, now(), now())
                on conflict (reference) do update
                set status = 'failed',
                    account_id = coalesce(excluded.account_id, p.account_id),
                    plan_code = coalesce(excluded.plan_code, p.plan_code),
                    reason = excluded.reason,
                    updated_at = now()
                where p.status <> 'success'
                """,
                reference,
                accountId,
                planCode,
                reason
        );
    }
}
