package app.taxguide.ask.provider.openai;

public record OpenAiResponseRequest(
        String model,
        String instructions,
        String input,
        Integer maxOutputTokens,
        Double temperature
) {
}
