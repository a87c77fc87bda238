package app.taxguide.ask.answer.service;

import app.taxguide.ask.answer.domain.type.AnswerSource;
import app.taxguide.ask.canonical.CanonicalQuestion;
import app.taxguide.ask.canonical.Language;
import app.taxguide.ask.entitlement.service.EntitlementDecision;

public record Resolution(
        Outcome outcome,
        CanonicalQuestion question,
        String answer,
        AnswerSource source,
        Language languageUsed,
        boolean fallbackUsed,
        EntitlementDecision decision
) {

    public enum Outcome {
        answered,
        denied,
        not_found,
        generation_failed
    }

    public boolean answered() {
        return outcome == Outcome.answered;
    }

    static Resolution answered(CanonicalQuestion question, String answer, AnswerSource source,
                               Language languageUsed, boolean fallbackUsed, EntitlementDecision decision) {
        return new Resolution(Outcome.answered, question, answer, source, languageUsed, fallbackUsed, decision);
    }

    static Resolution denied(CanonicalQuestion question, EntitlementDecision decision) {
        return new Resolution(Outcome.denied, question, null, null, null, false, decision);
    }

    static Resolution notFound(CanonicalQuestion question) {
        return new Resolution(Outcome.not_found, question, null, null, null, false, null);
    }

    static Resolution generationFailed(CanonicalQuestion question, EntitlementDecision decision) {
        return new Resolution(Outcome.generation_failed, question, null, null, null, false, decision);
    }
}
