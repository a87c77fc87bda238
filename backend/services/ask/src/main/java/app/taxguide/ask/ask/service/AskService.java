package app.taxguide.ask.ask.service;

import app.taxguide.ask.answer.service.AnswerResolver;
import app.taxguide.ask.answer.service.Resolution;
import app.taxguide.ask.answer.service.ResolutionGate;
import app.taxguide.ask.ask.dto.AskRequest;
import app.taxguide.ask.ask.dto.AskResponse;
import app.taxguide.ask.ask.service.QaEventLogService.QaEvent;
import app.taxguide.ask.canonical.CanonicalQuestion;
import app.taxguide.ask.canonical.QuestionCanonicalizer;
import app.taxguide.ask.entitlement.domain.type.AccessVia;
import app.taxguide.ask.entitlement.domain.type.InteractionMode;
import app.taxguide.ask.entitlement.service.AccessGrant;
import app.taxguide.ask.entitlement.service.EntitlementDecision;
import app.taxguide.ask.entitlement.service.EntitlementGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Inbound question flow: canonicalize, check the subscription, resolve through the tiers with
 * the entitlement gate in the loop, log the outcome.
 */
@Service
public class AskService {

    private static final Logger log = LoggerFactory.getLogger(AskService.class);

    static final String MSG_RENEW = "Your subscription is not active. Please renew your plan to continue.";
    static final String MSG_QUOTA = "You have reached today's limit for saved answers. Your quota resets tomorrow.";
    static final String MSG_CREDITS = "You have no credits left for new answers. Please top up or renew your plan.";
    static final String MSG_FAILED = "Sorry, we could not answer that right now. You were not charged. Please try again.";
    static final String MSG_INVALID = "Please send a question.";

    private final QuestionCanonicalizer canonicalizer;
    private final EntitlementGate entitlementGate;
    private final AnswerResolver answerResolver;
    private final QaEventLogService eventLogService;
    private final Clock clock;

    public AskService(QuestionCanonicalizer canonicalizer,
                      EntitlementGate entitlementGate,
                      AnswerResolver answerResolver,
                      QaEventLogService eventLogService,
                      Clock clock) {
        this.canonicalizer = canonicalizer;
        this.entitlementGate = entitlementGate;
        this.answerResolver = answerResolver;
        this.eventLogService = eventLogService;
        this.clock = clock;
    }

    public AskResponse ask(AskRequest request) {
        long startedAt = clock.millis();
        Optional<InteractionMode> mode = InteractionMode.parse(request.mode());
        if (request.accountId() == null || request.question() == null || request.question().isBlank()
                || mode.isEmpty()) {
            return AskResponse.error("invalid_request", MSG_INVALID);
        }

        CanonicalQuestion canonical = canonicalizer.canonicalize(request.question(), request.language());
        AccessGrant grant = entitlementGate.checkAccess(request.accountId(), mode.get());
        if (!grant.granted()) {
            record(request, mode.get(), canonical, "denied", "subscription_required", null, 0, startedAt);
            return AskResponse.error("subscription_required", MSG_RENEW);
        }

        Resolution resolution = answerResolver.resolve(canonical, request.question(), request.channel(),
                new ResolutionGate() {
                    @Override
                    public EntitlementDecision admit(AccessVia via) {
                        return entitlementGate.admit(grant, via);
                    }

                    @Override
                    public void release(EntitlementDecision decision) {
                        entitlementGate.release(grant.accountId(), decision);
                    }
                });

        AskResponse response = toResponse(resolution);
        int charged = response.ok() && response.creditsCharged() != null ? response.creditsCharged() : 0;
        record(request, mode.get(), canonical, resolution.outcome().name(), response.error(),
                resolution.source() == null ? null : resolution.source().name(), charged, startedAt);
        return response;
    }

    private AskResponse toResponse(Resolution resolution) {
        EntitlementDecision decision = resolution.decision();
        return switch (resolution.outcome()) {
            case answered -> AskResponse.answered(
                    resolution.answer(),
                    resolution.source(),
                    resolution.languageUsed().name(),
                    resolution.fallbackUsed(),
                    decision == null ? 0 : decision.creditCost(),
                    quotaOf(decision)
            );
            case denied -> switch (decision.reason()) {
                case cache_limit_reached -> AskResponse.error("cache_limit_reached", MSG_QUOTA, quotaOf(decision));
                case no_credits -> AskResponse.error("no_credits", MSG_CREDITS);
                case subscription_required -> AskResponse.error("subscription_required", MSG_RENEW);
            };
            case generation_failed, not_found -> AskResponse.error("generation_failed", MSG_FAILED);
        };
    }

    private static AskResponse.Quota quotaOf(EntitlementDecision decision) {
        if (decision == null || decision.cacheUsed() == null) {
            return null;
        }
        Integer limit = decision.cacheLimit();
        Integer remaining = limit == null ? null : Math.max(0, limit - decision.cacheUsed());
        return new AskResponse.Quota(decision.cacheUsed(), limit, remaining, decision.resetsAt());
    }

    private void record(AskRequest request, InteractionMode mode, CanonicalQuestion canonical, String outcome,
                        String reason, String source, int creditCost, long startedAt) {
        long latencyMs = clock.millis() - startedAt;
        log.info("Ask handled accountId={} mode={} lang={} key={} outcome={} reason={} source={} latencyMs={}",
                request.accountId(), mode, canonical.language(), canonical.canonicalKey(), outcome, reason, source,
                latencyMs);
        eventLogService.record(new QaEvent(
                request.accountId(),
                mode.name(),
                canonical.language().name(),
                canonical.normalizedText(),
                canonical.storageKey(),
                outcome,
                reason,
                source,
                creditCost,
                latencyMs
        ));
    }
}
