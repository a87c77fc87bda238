package app.taxguide.ask.answer.domain.type;

public enum TranslationJobStatus {
    pending,
    processing,
    done,
    failed
}
