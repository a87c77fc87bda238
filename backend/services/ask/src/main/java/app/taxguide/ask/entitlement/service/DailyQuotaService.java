package app.taxguide.ask.entitlement.service;

import app.taxguide.ask.entitlement.domain.entity.DailyUsageEntity;
import app.taxguide.ask.entitlement.repository.DailyUsageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

/**
 * Daily counter of cache-served answers. Days are UTC calendar days.
 */
@Service
public class DailyQuotaService {

    private static final Logger log = LoggerFactory.getLogger(DailyQuotaService.class);

    private static final String UPSERT_SQL = """
            insert into app_ask.daily_usage as du (account_id, usage_day, cache_used, updated_at)
            values (?, ?, 1, now())
            on conflict (account_id, usage_day) do update
            set cache_used = du.cache_used + 1,
                updated_at = now()
            """;
    private static final String RETURNING_SQL = " returning cache_used";

    private final JdbcTemplate jdbcTemplate;
    private final DailyUsageRepository dailyUsageRepository;
    private final Clock clock;

    public DailyQuotaService(JdbcTemplate jdbcTemplate, DailyUsageRepository dailyUsageRepository, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.dailyUsageRepository = dailyUsageRepository;
        this.clock = clock;
    }

    /**
     * Check-and-increment in a single statement. A null limit means unlimited.
     */
    @Transactional
    public QuotaResult tryConsume(UUID accountId, Integer limit) {
        LocalDate today = today();
        Instant resetsAt = nextReset(today);
        if (limit != null && limit <= 0) {
            return QuotaResult.denied(usedOn(accountId, today), limit, resetsAt);
        }
        List<Integer> rows = limit == null
                ? jdbcTemplate.query(UPSERT_SQL + RETURNING_SQL,
                        (rs, rowNum) -> rs.getInt("cache_used"), accountId, today)
                : jdbcTemplate.query(UPSERT_SQL + " where du.cache_used < ?" + RETURNING_SQL,
                        (rs, rowNum) -> rs.getInt("cache_used"), accountId, today, limit);
        if (rows.isEmpty()) {
            log.info("Daily cache limit reached accountId={} limit={}", accountId, limit);
            return QuotaResult.denied(usedOn(accountId, today), limit, resetsAt);
        }
        return QuotaResult.allowed(rows.get(0), limit, resetsAt);
    }

    @Transactional(readOnly = true)
    public int usedToday(UUID accountId) {
        return usedOn(accountId, today());
    }

    public Instant nextReset() {
        return nextReset(today());
    }

    private int usedOn(UUID accountId, LocalDate day) {
        return dailyUsageRepository.findByAccountIdAndUsageDay(accountId, day)
                .map(DailyUsageEntity::getCacheUsed)
                .orElse(0);
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }

    private static Instant nextReset(LocalDate day) {
        return day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public record QuotaResult(boolean allowed, int used, Integer limit, Instant resetsAt) {

        static QuotaResult allowed(int used, Integer limit, Instant resetsAt) {
            return new QuotaResult(true, used, limit, resetsAt);
        }

        static QuotaResult denied(int used, Integer limit, Instant resetsAt) {
            return new QuotaResult(false, used, limit, resetsAt);
        }

        public Integer remaining() {
            return limit == null ? null : Math.max(0, limit - used);
        }
    }
}
