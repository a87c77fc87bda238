package app.taxguide.ask.answer.service;

import app.taxguide.ask.answer.domain.type.CacheSource;
import app.taxguide.ask.answer.service.StoredAnswer.Tier;
import app.taxguide.ask.canonical.CanonicalQuestion;
import app.taxguide.ask.canonical.Language;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Library and cache tiers. Rows are matched on (canonical key, lang) when the question has a
 * resolved key, otherwise on (normalized question, lang). The library is read-only here.
 */
@Service
public class AnswerStore {

    private static final String ORDERING = """
             order by priority desc, enabled_at desc, last_used_at desc nulls last, id desc
             limit 1
            """;

    private final JdbcTemplate jdbcTemplate;

    public AnswerStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional(readOnly = true)
    public Optional<StoredAnswer> findLibrary(CanonicalQuestion question, Language language) {
        return find(Tier.library, question, language);
    }

    @Transactional(readOnly = true)
    public Optional<StoredAnswer> findCache(CanonicalQuestion question, Language language) {
        return find(Tier.cache, question, language);
    }

    /**
     * Library first, then cache. Library always wins when both match.
     */
    @Transactional(readOnly = true)
    public Optional<StoredAnswer> lookup(CanonicalQuestion question, Language language) {
        Optional<StoredAnswer> library = findLibrary(question, language);
        if (library.isPresent()) {
            return library;
        }
        return findCache(question, language);
    }

    @Transactional(readOnly = true)
    public Optional<StoredAnswer> findByKey(Tier tier, String canonicalKey, Language language) {
        List<StoredAnswer> rows = jdbcTemplate.query(
                "select id, answer, lang, canonical_key from app_ask." + tier.table()
                        + " where enabled and canonical_key = ? and lang = ?" + ORDERING,
                mapper(tier),
                canonicalKey,
                language.name()
        );
        return rows.stream().findFirst();
    }

    /**
     * Inserts or overwrites the cache row for the question's key and language. An overwritten
     * row is re-enabled.
     */
    @Transactional
    public void upsertCache(CanonicalQuestion question, Language language, String answer, CacheSource source) {
        if (question.hasResolvedKey()) {
            jdbcTemplate.update(
                    """
                    insert into app_ask.qa_cache as c (canonical_key, normalized_question, lang, answer, source,
                                                       enabled, enabled_at, created_at, updated_at)
                    values (?, ?, ?, ?, ?, true, now(), now(), now())
                    on conflict (canonical_key, lang) where canonical_key is not null do update
                    set answer = excluded.answer,
                        source = excluded.source,
                        normalized_question = coalesce(nullif(excluded.normalized_question, ''), c.normalized_question),
                        enabled = true,
                        updated_at = now()
                    """,
                    question.canonicalKey(),
                    question.normalizedText(),
                    language.name(),
                    answer,
                    source.name()
            );
            return;
        }
        jdbcTemplate.update(
                """
                insert into app_ask.qa_cache (canonical_key, normalized_question, lang, answer, source,
                                              enabled, enabled_at, created_at, updated_at)
                values (null, ?, ?, ?, ?, true, now(), now(), now())
                on conflict (normalized_question, lang) where canonical_key is null do update
                set answer = excluded.answer,
                    source = excluded.source,
                    enabled = true,
                    updated_at = now()
                """,
                question.normalizedText(),
                language.name(),
                answer,
                source.name()
        );
    }

    /**
     * Usage bookkeeping for a served row. Only the cache tracks use counts.
     */
    @Transactional
    public void touch(StoredAnswer answer) {
        if (answer.tier() == Tier.cache) {
            jdbcTemplate.update(
                    "update app_ask.qa_cache set use_count = use_count + 1, last_used_at = now() where id = ?",
                    answer.id()
            );
        } else {
            jdbcTemplate.update(
                    "update app_ask.qa_library set last_used_at = now() where id = ?",
                    answer.id()
            );
        }
    }

    private Optional<StoredAnswer> find(Tier tier, CanonicalQuestion question, Language language) {
        if (question.hasResolvedKey()) {
            return findByKey(tier, question.canonicalKey(), language);
        }
        if (question.normalizedText().isEmpty()) {
            return Optional.empty();
        }
        List<StoredAnswer> rows = jdbcTemplate.query(
                "select id, answer, lang, canonical_key from app_ask." + tier.table()
                        + " where enabled and normalized_question = ? and lang = ?" + ORDERING,
                mapper(tier),
                question.normalizedText(),
                language.name()
        );
        return rows.stream().findFirst();
    }

    private static RowMapper<StoredAnswer> mapper(Tier tier) {
        return (rs, rowNum) -> new StoredAnswer(
                rs.getLong("id"),
                tier,
                rs.getString("answer"),
                Language.fromCode(rs.getString("lang")),
                rs.getString("canonical_key")
        );
    }
}
