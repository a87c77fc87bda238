package app.taxguide.ask.answer.service;

import app.taxguide.ask.answer.domain.type.AnswerSource;
import app.taxguide.ask.answer.domain.type.CacheSource;
import app.taxguide.ask.answer.service.StoredAnswer.Tier;
import app.taxguide.ask.canonical.CanonicalQuestion;
import app.taxguide.ask.canonical.Language;
import app.taxguide.ask.canonical.QuestionCanonicalizer;
import app.taxguide.ask.entitlement.domain.type.AccessVia;
import app.taxguide.ask.entitlement.service.EntitlementDecision;
import app.taxguide.ask.support.BestEffortExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Tiered lookup: library, then cache, in the requested language and then in the base
 * language; external generation last. Entitlement is consulted only once the source is known.
 */
@Service
public class AnswerResolver {

    private static final Logger log = LoggerFactory.getLogger(AnswerResolver.class);

    private final QuestionCanonicalizer canonicalizer;
    private final AnswerStore answerStore;
    private final TranslationBacklogService backlogService;
    private final AnswerGenerator generator;
    private final BestEffortExecutor bestEffortExecutor;

    public AnswerResolver(QuestionCanonicalizer canonicalizer,
                          AnswerStore answerStore,
                          TranslationBacklogService backlogService,
                          AnswerGenerator generator,
                          BestEffortExecutor bestEffortExecutor) {
        this.canonicalizer = canonicalizer;
        this.answerStore = answerStore;
        this.backlogService = backlogService;
        this.generator = generator;
        this.bestEffortExecutor = bestEffortExecutor;
    }

    /**
     * Stored answers only. A miss is {@code not_found}: no generator runs without a gate.
     */
    public Resolution resolve(String question, String language, String channel) {
        return resolve(canonicalizer.canonicalize(question, language), question, channel, null);
    }

    public Resolution resolve(CanonicalQuestion canonical, String question, String channel, ResolutionGate gate) {
        Language requested = canonical.language();
        Optional<StoredAnswer> hit = answerStore.lookup(canonical, requested);
        boolean fallbackUsed = false;
        if (hit.isEmpty() && !requested.isBase()) {
            hit = answerStore.lookup(canonical, Language.BASE);
            fallbackUsed = hit.isPresent();
        }

        if (hit.isPresent()) {
            return serveStored(canonical, hit.get(), fallbackUsed, gate);
        }
        if (gate == null) {
            return Resolution.notFound(canonical);
        }
        return generate(canonical, question, channel, gate);
    }

    private Resolution serveStored(CanonicalQuestion canonical, StoredAnswer stored, boolean fallbackUsed,
                                   ResolutionGate gate) {
        AccessVia via = stored.tier() == Tier.library ? AccessVia.library : AccessVia.cache;
        EntitlementDecision decision = gate == null ? null : gate.admit(via);
        if (decision != null && !decision.allowed()) {
            return Resolution.denied(canonical, decision);
        }
        if (fallbackUsed && canonical.hasResolvedKey()) {
            queueQuietly(() -> backlogService.enqueue(canonical.canonicalKey(), Language.BASE,
                    canonical.language(), stored.tier()));
        }
        bestEffortExecutor.submit("answer-touch", () -> answerStore.touch(stored));
        AnswerSource source = stored.tier() == Tier.library ? AnswerSource.library : AnswerSource.cache;
        return Resolution.answered(canonical, stored.answer(), source, stored.language(), fallbackUsed, decision);
    }

    private Resolution generate(CanonicalQuestion canonical, String question, String channel, ResolutionGate gate) {
        EntitlementDecision decision = gate.admit(AccessVia.credit);
        if (!decision.allowed()) {
            return Resolution.denied(canonical, decision);
        }
        Language language = canonical.language();
        String answer;
        try {
            answer = generator.generate(question, language, channel);
            if (answer == null || answer.isBlank()) {
                throw new GenerationException("Generator returned empty answer");
            }
        } catch (RuntimeException ex) {
            log.warn("Generation failed key={} lang={} error={}", canonical.canonicalKey(), language, ex.toString());
            gate.release(decision);
            return Resolution.generationFailed(canonical, decision);
        }

        try {
            answerStore.upsertCache(canonical, language, answer, CacheSource.ai);
        } catch (RuntimeException ex) {
            gate.release(decision);
            throw ex;
        }
        if (canonical.hasResolvedKey()) {
            queueQuietly(() -> backlogService.enqueueOthers(canonical.canonicalKey(), language, Tier.cache));
        }
        return Resolution.answered(canonical, answer, AnswerSource.ai, language, false, decision);
    }

    private void queueQuietly(Runnable enqueue) {
        try {
            enqueue.run();
        } catch (DataAccessException ex) {
            log.warn("Translation backlog write failed error={}", ex.getMessage());
        }
    }
}
