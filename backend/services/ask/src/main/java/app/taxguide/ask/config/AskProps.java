package app.taxguide.ask.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "app.ask")
public record AskProps(
        String baseLanguage,
        Subscription subscription,
        Credits credits,
        BestEffort bestEffort,
        Translation translation,
        Map<String, Plan> plans
) {

    public AskProps {
        baseLanguage = baseLanguage == null || baseLanguage.isBlank() ? "en" : baseLanguage;
        subscription = subscription == null ? new Subscription(5, "trial") : subscription;
        credits = credits == null ? new Credits(1, 2) : credits;
        bestEffort = bestEffort == null ? new BestEffort(2, 500, 2000) : bestEffort;
        translation = translation == null ? new Translation(25, 3, 300) : translation;
        plans = plans == null ? Map.of() : new LinkedHashMap<>(plans);
    }

    public record Subscription(int graceDays, String trialPlanCode) {
    }

    public record Credits(int textCost, int voiceCost) {
    }

    public record BestEffort(int threads, int queueCapacity, long timeoutMs) {
    }

    public record Translation(int batchSize, int maxAttempts, long lockTtlSeconds) {
    }

    public record Plan(int durationDays, int credits, Integer dailyCacheLimit, long priceKobo) {
    }
}
