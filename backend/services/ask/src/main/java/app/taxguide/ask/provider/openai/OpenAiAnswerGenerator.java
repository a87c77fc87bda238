package app.taxguide.ask.provider.openai;

import app.taxguide.ask.answer.service.AnswerGenerator;
import app.taxguide.ask.answer.service.GenerationException;
import app.taxguide.ask.canonical.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class OpenAiAnswerGenerator implements AnswerGenerator {

    private static final Logger log = LoggerFactory.getLogger(OpenAiAnswerGenerator.class);

    static final String SYSTEM_PROMPT = """
            You are a professional Nigerian tax assistant.

            You help with:
            - FIRS and state tax rules
            - Freelancer and self-employed tax
            - Business registration
            - VAT
            - PAYE
            - Withholding tax
            - Record keeping
            - Compliance and filing

            Be concise, accurate and practical. Answer in the language you are asked in.
            """;

    private final OpenAiClient client;
    private final OpenAiProps props;

    public OpenAiAnswerGenerator(OpenAiClient client, OpenAiProps props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public String generate(String question, Language language, String channel) {
        String input = "[Language: " + language.displayName() + "] " + question.trim();
        OpenAiResponseResult result;
        try {
            result = client.createResponse(new OpenAiResponseRequest(
                    props.defaultModel(),
                    SYSTEM_PROMPT,
                    input,
                    props.maxOutputTokens(),
                    0.3
            ));
        } catch (RuntimeException ex) {
            log.warn("OpenAI generation failed lang={} channel={} errorType={}",
                    language, channel, ex.getClass().getSimpleName());
            throw new GenerationException("Answer generation failed", ex);
        }
        if (result.outputText() == null || result.outputText().isBlank()) {
            throw new GenerationException("OpenAI returned no output text");
        }
        log.debug("OpenAI answer generated model={} inputTokens={} outputTokens={}",
                result.model(), result.inputTokens(), result.outputTokens());
        return result.outputText();
    }
}
