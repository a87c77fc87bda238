package app.taxguide.ask.provider.openai;

import app.taxguide.ask.answer.service.AnswerTranslator;
import app.taxguide.ask.answer.service.GenerationException;
import app.taxguide.ask.canonical.Language;
import org.springframework.stereotype.Component;

@Component
public class OpenAiAnswerTranslator implements AnswerTranslator {

    static final String SYSTEM_PROMPT = """
            You translate answers from a Nigerian tax assistant.
            Translate the user-facing answer accurately into the requested language.
            Keep numbers, amounts, tax names and agency acronyms (FIRS, VAT, PAYE) unchanged.
            Return only the translation.
            """;

    private final OpenAiClient client;
    private final OpenAiProps props;

    public OpenAiAnswerTranslator(OpenAiClient client, OpenAiProps props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public String translate(String text, Language from, Language to) {
        String model = props.translateModel() == null || props.translateModel().isBlank()
                ? props.defaultModel()
                : props.translateModel();
        OpenAiResponseResult result;
        try {
            result = client.createResponse(new OpenAiResponseRequest(
                    model,
                    SYSTEM_PROMPT,
                    "Translate from " + from.displayName() + " to " + to.displayName() + ":\n\n" + text,
                    props.maxOutputTokens(),
                    0.2
            ));
        } catch (RuntimeException ex) {
            throw new GenerationException("Translation failed: " + ex.getClass().getSimpleName(), ex);
        }
        if (result.outputText() == null || result.outputText().isBlank()) {
            throw new GenerationException("OpenAI returned no translation");
        }
        return result.outputText();
    }
}
