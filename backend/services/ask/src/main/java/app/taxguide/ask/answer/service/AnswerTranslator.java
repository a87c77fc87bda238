package app.taxguide.ask.answer.service;

import app.taxguide.ask.canonical.Language;

public interface AnswerTranslator {

    /**
     * @throws GenerationException on any failure, including timeout or empty output
     */
    String translate(String text, Language from, Language to);
}
