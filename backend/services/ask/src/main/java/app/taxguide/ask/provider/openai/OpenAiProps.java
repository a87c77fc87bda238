package app.taxguide.ask.provider.openai;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.ai.openai")
public record OpenAiProps(
        String baseUrl,
        String apiKey,
        String defaultModel,
        String translateModel,
        Integer maxOutputTokens,
        Integer connectTimeoutMs,
        Integer readTimeoutMs
) {
}
