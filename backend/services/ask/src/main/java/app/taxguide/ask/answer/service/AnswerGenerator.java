package app.taxguide.ask.answer.service;

import app.taxguide.ask.canonical.Language;

public interface AnswerGenerator {

    /**
     * @throws GenerationException on any failure, including timeout or empty output
     */
    String generate(String question, Language language, String channel);
}
