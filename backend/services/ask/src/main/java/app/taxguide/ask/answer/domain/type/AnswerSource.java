package app.taxguide.ask.answer.domain.type;

/**
 * Where a served answer came from.
 */
public enum AnswerSource {
    library,
    cache,
    ai
}
