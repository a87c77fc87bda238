package app.taxguide.ask.ask.dto;

import app.taxguide.ask.answer.domain.type.AnswerSource;

import java.time.Instant;

public record AskResponse(
        boolean ok,
        String answer,
        AnswerSource source,
        String language,
        Boolean fallbackUsed,
        Integer creditsCharged,
        String error,
        String message,
        Quota quota
) {

    public static AskResponse answered(String answer, AnswerSource source, String language, boolean fallbackUsed,
                                       int creditsCharged, Quota quota) {
        return new AskResponse(true, answer, source, language, fallbackUsed, creditsCharged, null, null, quota);
    }

    public static AskResponse error(String error, String message) {
        return new AskResponse(false, null, null, null, null, null, error, message, null);
    }

    public static AskResponse error(String error, String message, Quota quota) {
        return new AskResponse(false, null, null, null, null, null, error, message, quota);
    }

    public record Quota(Integer used, Integer limit, Integer remaining, Instant resetsAt) {
    }
}
