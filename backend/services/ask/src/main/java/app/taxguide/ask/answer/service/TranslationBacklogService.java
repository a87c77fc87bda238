package app.taxguide.ask.answer.service;

import app.taxguide.ask.canonical.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * One backlog row per (canonical key, target language). Repeated enqueues are no-ops.
 */
@Service
public class TranslationBacklogService {

    private static final Logger log = LoggerFactory.getLogger(TranslationBacklogService.class);

    private final JdbcTemplate jdbcTemplate;

    public TranslationBacklogService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public boolean enqueue(String canonicalKey, Language source, Language target, StoredAnswer.Tier sourceTier) {
        if (canonicalKey == null || source == target) {
            return false;
        }
        int inserted = jdbcTemplate.update(
                """
                insert into app_ask.translation_jobs (canonical_key, source_lang, target_lang, source_table,
                                                      status, attempts, created_at, updated_at)
                values (?, ?, ?, ?, 'pending', 0, now(), now())
                on conflict (canonical_key, target_lang) do nothing
                """,
                canonicalKey,
                source.name(),
                target.name(),
                sourceTier.table()
        );
        if (inserted > 0) {
            log.debug("Translation queued key={} from={} to={}", canonicalKey, source, target);
        }
        return inserted > 0;
    }

    @Transactional
    public int enqueueOthers(String canonicalKey, Language source, StoredAnswer.Tier sourceTier) {
        int queued = 0;
        for (Language target : Language.values()) {
            if (target != source && enqueue(canonicalKey, source, target, sourceTier)) {
                queued++;
            }
        }
        return queued;
    }
}
