package app.taxguide.ask.provider.openai;

import com.fasterxml.jackson.databind.JsonNode;

public final class OpenAiResponseParser {

    private OpenAiResponseParser() {
    }

    /**
     * Joins every {@code output_text} part of message items, falling back to the top-level
     * {@code output_text} shortcut. Returns an empty string when there is no text.
     */
    public static String extractText(JsonNode response) {
        if (response == null || response.isNull()) {
            return "";
        }
        JsonNode outputText = response.get("output_text");
        if (outputText != null && outputText.isTextual() && !outputText.asText().isBlank()) {
            return outputText.asText().trim();
        }
        JsonNode output = response.get("output");
        if (output == null || !output.isArray()) {
            return "";
        }
        StringBuilder builder = new StringBuilder();
        for (JsonNode item : output) {
            String itemType = item.path("type").asText("message");
            if (!"message".equals(itemType)) {
                continue;
            }
            JsonNode content = item.get("content");
            if (content == null || !content.isArray()) {
                continue;
            }
            for (JsonNode part : content) {
                if (!"output_text".equals(part.path("type").asText())) {
                    continue;
                }
                String text = part.path("text").asText();
                if (!text.isBlank()) {
                    if (!builder.isEmpty()) {
                        builder.append('\n');
                    }
                    builder.append(text.trim());
                }
            }
        }
        return builder.toString();
    }
}
