package app.taxguide.ask.answer.service;

import app.taxguide.ask.answer.domain.entity.TranslationJobEntity;
import app.taxguide.ask.answer.domain.type.CacheSource;
import app.taxguide.ask.answer.domain.type.TranslationJobStatus;
import app.taxguide.ask.answer.repository.TranslationJobRepository;
import app.taxguide.ask.answer.service.StoredAnswer.Tier;
import app.taxguide.ask.canonical.CanonicalQuestion;
import app.taxguide.ask.canonical.Language;
import app.taxguide.ask.config.AskProps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Works off the translation backlog. Triggered externally; several instances may drain
 * concurrently since claims skip locked rows.
 */
@Service
public class TranslationDrainService {

    private static final Logger log = LoggerFactory.getLogger(TranslationDrainService.class);

    private final JdbcTemplate jdbcTemplate;
    private final TranslationJobRepository jobRepository;
    private final AnswerStore answerStore;
    private final AnswerTranslator translator;
    private final Clock clock;
    private final int defaultBatchSize;
    private final int maxAttempts;
    private final Duration lockTtl;

    public TranslationDrainService(JdbcTemplate jdbcTemplate,
                                   TranslationJobRepository jobRepository,
                                   AnswerStore answerStore,
                                   AnswerTranslator translator,
                                   Clock clock,
                                   AskProps props) {
        this.jdbcTemplate = jdbcTemplate;
        this.jobRepository = jobRepository;
        this.answerStore = answerStore;
        this.translator = translator;
        this.clock = clock;
        AskProps.Translation config = props.translation();
        this.defaultBatchSize = Math.max(1, config.batchSize());
        this.maxAttempts = Math.max(1, config.maxAttempts());
        this.lockTtl = Duration.ofSeconds(Math.max(1, config.lockTtlSeconds()));
    }

    public DrainResult drain(Integer batchSize) {
        int limit = batchSize == null || batchSize <= 0 ? defaultBatchSize : batchSize;
        int done = 0;
        int retried = 0;
        int failed = 0;
        for (int i = 0; i < limit; i++) {
            Optional<TranslationJobEntity> claimed = claimNextJob();
            if (claimed.isEmpty()) {
                break;
            }
            TranslationJobEntity job = claimed.get();
            try {
                process(job);
                markDone(job);
                done++;
            } catch (RuntimeException ex) {
                log.warn("Translation job failed jobId={} key={} target={} errorType={} message={}",
                        job.getId(), job.getCanonicalKey(), job.getTargetLang(),
                        ex.getClass().getSimpleName(), safeMessage(ex));
                if (markFailed(job, ex) == TranslationJobStatus.failed) {
                    failed++;
                } else {
                    retried++;
                }
            }
        }
        log.info("Translation drain finished done={} retried={} failed={}", done, retried, failed);
        return new DrainResult(done, retried, failed);
    }

    @Transactional
    public Optional<TranslationJobEntity> claimNextJob() {
        Long jobId = jdbcTemplate.query(
                """
                with next_job as (
                    select id
                    from app_ask.translation_jobs
                    where (status = 'pending'
                           or (status = 'processing' and locked_at < now() - (? * interval '1 second')))
                    order by created_at asc, id asc
                    limit 1
                    for update skip locked
                )
                update app_ask.translation_jobs
                set status = 'processing',
                    locked_at = now(),
                    updated_at = now()
                where id in (select id from next_job)
                returning id
                """,
                rs -> rs.next() ? rs.getLong("id") : null,
                lockTtl.getSeconds()
        );
        if (jobId == null) {
            return Optional.empty();
        }
        return jobRepository.findById(jobId);
    }

    private void process(TranslationJobEntity job) {
        Language source = Language.fromCode(job.getSourceLang());
        Language target = Language.fromCode(job.getTargetLang());
        StoredAnswer original = loadSource(job, source)
                .orElseThrow(() -> new IllegalStateException("Source answer not found"));
        String translated = translator.translate(original.answer(), source, target);
        if (translated == null || translated.isBlank()) {
            throw new GenerationException("Translator returned empty text");
        }
        CacheSource provenance = original.tier() == Tier.library ? CacheSource.library_derived : CacheSource.ai;
        CanonicalQuestion key = new CanonicalQuestion("", job.getCanonicalKey(), target, false);
        answerStore.upsertCache(key, target, translated, provenance);
    }

    private Optional<StoredAnswer> loadSource(TranslationJobEntity job, Language source) {
        Tier preferred = Tier.fromTable(job.getSourceTable());
        Optional<StoredAnswer> answer = answerStore.findByKey(preferred, job.getCanonicalKey(), source);
        if (answer.isPresent()) {
            return answer;
        }
        Tier other = preferred == Tier.library ? Tier.cache : Tier.library;
        return answerStore.findByKey(other, job.getCanonicalKey(), source);
    }

    @Transactional
    public void markDone(TranslationJobEntity job) {
        jdbcTemplate.update(
                """
                update app_ask.translation_jobs
                set status = 'done',
                    attempts = attempts + 1,
                    locked_at = null,
                    last_error = null,
                    updated_at = now()
                where id = ?
                """,
                job.getId()
        );
    }

    @Transactional
    public TranslationJobStatus markFailed(TranslationJobEntity job, Exception ex) {
        int attempts = job.getAttempts() + 1;
        TranslationJobStatus next = attempts < maxAttempts ? TranslationJobStatus.pending : TranslationJobStatus.failed;
        job.setStatus(next);
        job.setLockedAt(null);
        job.setLastError(ex == null ? "Translation failed" : ex.getClass().getSimpleName() + ": " + safeMessage(ex));
        job.setUpdatedAt(clock.instant());
        jdbcTemplate.update(
                """
                update app_ask.translation_jobs
                set status = ?,
                    attempts = ?,
                    locked_at = null,
                    last_error = ?,
                    updated_at = now()
                where id = ?
                """,
                next.name(),
                attempts,
                job.getLastError(),
                job.getId()
        );
        return next;
    }

    private static String safeMessage(Exception ex) {
        String message = ex.getMessage();
        if (message == null) {
            return "";
        }
        String trimmed = message.replaceAll("[\\r\\n]+", " ").trim();
        int max = 200;
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max) + "...";
    }

    public record DrainResult(int done, int retried, int failed) {
    }
}
