package app.taxguide.ask.answer.service;

import app.taxguide.ask.answer.domain.type.AnswerSource;
import app.taxguide.ask.answer.domain.type.CacheSource;
import app.taxguide.ask.answer.service.StoredAnswer.Tier;
import app.taxguide.ask.canonical.CanonicalQuestion;
import app.taxguide.ask.canonical.Language;
import app.taxguide.ask.canonical.LanguageDetector;
import app.taxguide.ask.canonical.QuestionCanonicalizer;
import app.taxguide.ask.entitlement.domain.type.AccessVia;
import app.taxguide.ask.entitlement.domain.type.DenialReason;
import app.taxguide.ask.entitlement.service.EntitlementDecision;
import app.taxguide.ask.support.BestEffortExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnswerResolverTest {

    private static final String VAT_KEY = "vat|any|any|any";

    @Mock
    AnswerStore answerStore;

    @Mock
    TranslationBacklogService backlogService;

    @Mock
    AnswerGenerator generator;

    @Mock
    BestEffortExecutor bestEffortExecutor;

    @Mock
    ResolutionGate gate;

    private final QuestionCanonicalizer canonicalizer = new QuestionCanonicalizer(new LanguageDetector());

    AnswerResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new AnswerResolver(canonicalizer, answerStore, backlogService, generator, bestEffortExecutor);
    }

    @Test
    void libraryHitIsServedFreeAndTouchedInBackground() {
        CanonicalQuestion question = canonicalizer.canonicalize("What is VAT?");
        StoredAnswer library = new StoredAnswer(1L, Tier.library, "VAT is 7.5%.", Language.en, VAT_KEY);
        when(answerStore.lookup(question, Language.en)).thenReturn(Optional.of(library));
        when(gate.admit(AccessVia.library)).thenReturn(EntitlementDecision.allowedLibrary());

        Resolution resolution = resolver.resolve(question, "What is VAT?", "web", gate);

        assertThat(resolution.answered()).isTrue();
        assertThat(resolution.source()).isEqualTo(AnswerSource.library);
        assertThat(resolution.answer()).isEqualTo("VAT is 7.5%.");
        assertThat(resolution.fallbackUsed()).isFalse();
        verify(bestEffortExecutor).submit(eq("answer-touch"), any(Runnable.class));
        verifyNoInteractions(generator, backlogService);
    }

    @Test
    void cacheHitDeniedByQuotaDoesNotFallThroughToGeneration() {
        CanonicalQuestion question = canonicalizer.canonicalize("What is VAT?");
        StoredAnswer cached = new StoredAnswer(7L, Tier.cache, "Cached VAT answer", Language.en, VAT_KEY);
        when(answerStore.lookup(question, Language.en)).thenReturn(Optional.of(cached));
        EntitlementDecision limit = EntitlementDecision.cacheLimitReached(20, 20, Instant.now());
        when(gate.admit(AccessVia.cache)).thenReturn(limit);

        Resolution resolution = resolver.resolve(question, "What is VAT?", "web", gate);

        assertThat(resolution.outcome()).isEqualTo(Resolution.Outcome.denied);
        assertThat(resolution.decision().reason()).isEqualTo(DenialReason.cache_limit_reached);
        verify(gate, never()).admit(AccessVia.credit);
        verifyNoInteractions(generator, bestEffortExecutor);
    }

    @Test
    void missingRegionalAnswerFallsBackToBaseAndQueuesTranslation() {
        CanonicalQuestion question = canonicalizer.canonicalize("What is VAT?", "yo");
        StoredAnswer base = new StoredAnswer(3L, Tier.library, "VAT is 7.5%.", Language.en, VAT_KEY);
        when(answerStore.lookup(question, Language.yo)).thenReturn(Optional.empty());
        when(answerStore.lookup(question, Language.en)).thenReturn(Optional.of(base));
        when(gate.admit(AccessVia.library)).thenReturn(EntitlementDecision.allowedLibrary());

        Resolution resolution = resolver.resolve(question, "What is VAT?", "web", gate);

        assertThat(resolution.answered()).isTrue();
        assertThat(resolution.fallbackUsed()).isTrue();
        assertThat(resolution.languageUsed()).isEqualTo(Language.en);
        verify(backlogService).enqueue(VAT_KEY, Language.en, Language.yo, Tier.library);
        verifyNoInteractions(generator);
    }

    @Test
    void missGeneratesAfterCreditAndWritesCache() {
        CanonicalQuestion question = canonicalizer.canonicalize("What is VAT?");
        when(answerStore.lookup(question, Language.en)).thenReturn(Optional.empty());
        when(gate.admit(AccessVia.credit)).thenReturn(EntitlementDecision.allowedCredit(1));
        when(generator.generate("What is VAT?", Language.en, "web")).thenReturn("Generated VAT answer");

        Resolution resolution = resolver.resolve(question, "What is VAT?", "web", gate);

        assertThat(resolution.answered()).isTrue();
        assertThat(resolution.source()).isEqualTo(AnswerSource.ai);
        assertThat(resolution.decision().creditCost()).isEqualTo(1);
        verify(answerStore).upsertCache(question, Language.en, "Generated VAT answer", CacheSource.ai);
        verify(backlogService).enqueueOthers(VAT_KEY, Language.en, Tier.cache);
        verify(gate, never()).release(any());
    }

    @Test
    void noCreditsMeansNoGeneratorCall() {
        CanonicalQuestion question = canonicalizer.canonicalize("What is VAT?");
        when(answerStore.lookup(question, Language.en)).thenReturn(Optional.empty());
        when(gate.admit(AccessVia.credit)).thenReturn(EntitlementDecision.denied(DenialReason.no_credits));

        Resolution resolution = resolver.resolve(question, "What is VAT?", "web", gate);

        assertThat(resolution.outcome()).isEqualTo(Resolution.Outcome.denied);
        verifyNoInteractions(generator);
    }

    @Test
    void generatorFailureReleasesCreditAndWritesNothing() {
        CanonicalQuestion question = canonicalizer.canonicalize("What is VAT?");
        EntitlementDecision credit = EntitlementDecision.allowedCredit(1);
        when(answerStore.lookup(question, Language.en)).thenReturn(Optional.empty());
        when(gate.admit(AccessVia.credit)).thenReturn(credit);
        when(generator.generate(anyString(), any(), any())).thenThrow(new GenerationException("timeout"));

        Resolution resolution = resolver.resolve(question, "What is VAT?", "web", gate);

        assertThat(resolution.outcome()).isEqualTo(Resolution.Outcome.generation_failed);
        verify(gate).release(credit);
        verify(answerStore, never()).upsertCache(any(), any(), any(), any());
    }

    @Test
    void unexpectedGeneratorExceptionStillReleasesCredit() {
        CanonicalQuestion question = canonicalizer.canonicalize("What is VAT?");
        EntitlementDecision credit = EntitlementDecision.allowedCredit(1);
        when(answerStore.lookup(question, Language.en)).thenReturn(Optional.empty());
        when(gate.admit(AccessVia.credit)).thenReturn(credit);
        when(generator.generate(anyString(), any(), any())).thenThrow(new IllegalStateException("client closed"));

        Resolution resolution = resolver.resolve(question, "What is VAT?", "web", gate);

        assertThat(resolution.outcome()).isEqualTo(Resolution.Outcome.generation_failed);
        verify(gate).release(credit);
        verify(answerStore, never()).upsertCache(any(), any(), any(), any());
    }

    @Test
    void blankGeneratedAnswerCountsAsFailure() {
        CanonicalQuestion question = canonicalizer.canonicalize("What is VAT?");
        EntitlementDecision credit = EntitlementDecision.allowedCredit(1);
        when(answerStore.lookup(question, Language.en)).thenReturn(Optional.empty());
        when(gate.admit(AccessVia.credit)).thenReturn(credit);
        when(generator.generate(anyString(), any(), any())).thenReturn("  ");

        Resolution resolution = resolver.resolve(question, "What is VAT?", "web", gate);

        assertThat(resolution.outcome()).isEqualTo(Resolution.Outcome.generation_failed);
        verify(gate).release(credit);
    }

    @Test
    void cacheWriteFailureReleasesCreditAndPropagates() {
        CanonicalQuestion question = canonicalizer.canonicalize("What is VAT?");
        EntitlementDecision credit = EntitlementDecision.allowedCredit(1);
        when(answerStore.lookup(question, Language.en)).thenReturn(Optional.empty());
        when(gate.admit(AccessVia.credit)).thenReturn(credit);
        when(generator.generate(anyString(), any(), any())).thenReturn("Generated");
        doThrow(new DataAccessResourceFailureException("db down"))
                .when(answerStore).upsertCache(any(), any(), any(), any());

        assertThatThrownBy(() -> resolver.resolve(question, "What is VAT?", "web", gate))
                .isInstanceOf(DataAccessResourceFailureException.class);
        verify(gate).release(credit);
    }

    @Test
    void unresolvedKeyNeverQueuesTranslations() {
        CanonicalQuestion question = canonicalizer.canonicalize("hello there");
        when(answerStore.lookup(question, Language.en)).thenReturn(Optional.empty());
        when(gate.admit(AccessVia.credit)).thenReturn(EntitlementDecision.allowedCredit(1));
        when(generator.generate(anyString(), any(), any())).thenReturn("Hi! Ask me about Nigerian tax.");

        Resolution resolution = resolver.resolve(question, "hello there", "web", gate);

        assertThat(resolution.answered()).isTrue();
        verifyNoInteractions(backlogService);
    }

    @Test
    void backlogFailureDoesNotAffectAnswer() {
        CanonicalQuestion question = canonicalizer.canonicalize("What is VAT?");
        when(answerStore.lookup(question, Language.en)).thenReturn(Optional.empty());
        when(gate.admit(AccessVia.credit)).thenReturn(EntitlementDecision.allowedCredit(1));
        when(generator.generate(anyString(), any(), any())).thenReturn("Generated");
        when(backlogService.enqueueOthers(any(), any(), any()))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        Resolution resolution = resolver.resolve(question, "What is VAT?", "web", gate);

        assertThat(resolution.answered()).isTrue();
        verify(gate, never()).release(any());
    }

    @Test
    void ungatedMissIsNotFound() {
        when(answerStore.lookup(any(), any())).thenReturn(Optional.empty());

        Resolution resolution = resolver.resolve("What is VAT?", null, "web");

        assertThat(resolution.outcome()).isEqualTo(Resolution.Outcome.not_found);
        verifyNoInteractions(generator);
    }
}
