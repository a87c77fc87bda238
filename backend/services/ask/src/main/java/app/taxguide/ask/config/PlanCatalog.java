package app.taxguide.ask.config;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Plans live in configuration. Codes are case-insensitive.
 */
@Component
public class PlanCatalog {

    private final Map<String, AskProps.Plan> plans;
    private final String trialPlanCode;

    public PlanCatalog(AskProps props) {
        this.plans = Collections.unmodifiableMap(props.plans());
        this.trialPlanCode = props.subscription().trialPlanCode();
    }

    public Optional<PlanSpec> find(String code) {
        String normalized = normalize(code);
        if (normalized == null) {
            return Optional.empty();
        }
        AskProps.Plan plan = plans.get(normalized);
        if (plan == null) {
            return Optional.empty();
        }
        return Optional.of(new PlanSpec(normalized, Duration.ofDays(plan.durationDays()), plan.credits(),
                plan.dailyCacheLimit(), plan.priceKobo()));
    }

    public PlanSpec trialPlan() {
        return find(trialPlanCode)
                .orElseThrow(() -> new IllegalStateException("Trial plan is not configured: " + trialPlanCode));
    }

    public boolean isTrial(String code) {
        return trialPlanCode.equalsIgnoreCase(code);
    }

    public static String normalize(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        return code.trim().toLowerCase(Locale.ROOT);
    }

    public record PlanSpec(String code, Duration duration, int credits, Integer dailyCacheLimit, long priceKobo) {

        public boolean isPaid() {
            return priceKobo > 0;
        }
    }
}
