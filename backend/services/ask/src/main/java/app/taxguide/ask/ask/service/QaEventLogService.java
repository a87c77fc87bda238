package app.taxguide.ask.ask.service;

import app.taxguide.ask.support.BestEffortExecutor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Append-only log of ask outcomes. Writes are best-effort.
 */
@Service
public class QaEventLogService {

    private final JdbcTemplate jdbcTemplate;
    private final BestEffortExecutor bestEffortExecutor;

    public QaEventLogService(JdbcTemplate jdbcTemplate, BestEffortExecutor bestEffortExecutor) {
        this.jdbcTemplate = jdbcTemplate;
        this.bestEffortExecutor = bestEffortExecutor;
    }

    public void record(QaEvent event) {
        bestEffortExecutor.submit("qa-event", () -> insert(event));
    }

    void insert(QaEvent event) {
        jdbcTemplate.update(
                """
                insert into app_ask.qa_events (account_id, mode, lang, normalized_question, canonical_key,
                                               outcome, reason, source, credit_cost, latency_ms, created_at)
                values (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, now())
                """,
                event.accountId(),
                event.mode(),
                event.language(),
                event.normalizedQuestion(),
                event.canonicalKey(),
                event.outcome(),
                event.reason(),
                event.source(),
                event.creditCost(),
                (int) Math.min(Integer.MAX_VALUE, Math.max(0, event.latencyMs()))
        );
    }

    public record QaEvent(
            UUID accountId,
            String mode,
            String language,
            String normalizedQuestion,
            String canonicalKey,
            String outcome,
            String reason,
            String source,
            int creditCost,
            long latencyMs
    ) {
    }
}
