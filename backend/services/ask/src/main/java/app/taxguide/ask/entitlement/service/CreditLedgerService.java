package app.taxguide.ask.entitlement.service;

import app.taxguide.ask.entitlement.domain.entity.CreditBalanceEntity;
import app.taxguide.ask.entitlement.repository.CreditBalanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Per-account credit balance. Every mutation is one SQL statement; the balance
 * never goes below zero.
 */
@Service
public class CreditLedgerService {

    private static final Logger log = LoggerFactory.getLogger(CreditLedgerService.class);

    private final JdbcTemplate jdbcTemplate;
    private final CreditBalanceRepository creditBalanceRepository;

    public CreditLedgerService(JdbcTemplate jdbcTemplate, CreditBalanceRepository creditBalanceRepository) {
        this.jdbcTemplate = jdbcTemplate;
        this.creditBalanceRepository = creditBalanceRepository;
    }

    /**
     * Debits {@code cost} only when the balance covers it. Returns false, leaving the
     * balance unchanged, when it does not.
     */
    @Transactional
    public boolean tryDebit(UUID accountId, int cost) {
        if (cost <= 0) {
            return true;
        }
        int updated = jdbcTemplate.update(
                """
                update app_ask.credit_balances
                set balance = balance - ?,
                    updated_at = now()
                where account_id = ?
                  and balance >= ?
                """,
                cost,
                accountId,
                cost
        );
        if (updated == 0) {
            log.info("Credit debit denied accountId={} cost={}", accountId, cost);
            return false;
        }
        return true;
    }

    @Transactional
    public void refund(UUID accountId, int amount) {
        if (amount <= 0) {
            return;
        }
        int updated = jdbcTemplate.update(
                """
                update app_ask.credit_balances
                set balance = balance + ?,
                    updated_at = now()
                where account_id = ?
                """,
                amount,
                accountId
        );
        if (updated == 0) {
            throw new IllegalStateException("Credit balance missing for refund accountId=" + accountId);
        }
        log.info("Credit reservation released accountId={} amount={}", accountId, amount);
    }

    /**
     * Seeds the balance for a fresh plan period. Overwrites, never accumulates.
     */
    @Transactional
    public void grant(UUID accountId, int credits) {
        jdbcTemplate.update(
                """
                insert into app_ask.credit_balances (account_id, balance, updated_at)
                values (?, ?, now())
                on conflict (account_id) do update
                set balance = excluded.balance,
                    updated_at = now()
                """,
                accountId,
                Math.max(0, credits)
        );
    }

    @Transactional(readOnly = true)
    public int balance(UUID accountId) {
        return creditBalanceRepository.findById(accountId)
                .map(CreditBalanceEntity::getBalance)
                .orElse(0);
    }
}
