package app.taxguide.ask.canonical;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class QuestionCanonicalizer {

    private final LanguageDetector languageDetector;

    public QuestionCanonicalizer(LanguageDetector languageDetector) {
        this.languageDetector = languageDetector;
    }

    /**
     * Pure and total: any input, including null or gibberish, yields a normalized string
     * and a four-field key.
     */
    public CanonicalQuestion canonicalize(String question, String languageHint) {
        String normalized = TextNormalizer.normalize(question);
        boolean hinted = languageHint != null && !languageHint.isBlank();
        Language language = hinted
                ? Language.fromCode(languageHint)
                : languageDetector.detect(normalized);

        String key = String.join("|",
                matchGroup(normalized, CanonicalRules.INTENTS),
                matchGroup(normalized, CanonicalRules.CHANNELS),
                matchJurisdiction(normalized),
                matchPeriod(normalized));
        return new CanonicalQuestion(normalized, key, language, !hinted);
    }

    public CanonicalQuestion canonicalize(String question) {
        return canonicalize(question, null);
    }

    private static String matchGroup(String text, Map<String, List<String>> groups) {
        String best = CanonicalQuestion.ANY;
        int bestLength = 0;
        for (Map.Entry<String, List<String>> group : groups.entrySet()) {
            for (String keyword : group.getValue()) {
                if (keyword.length() > bestLength && TextNormalizer.containsPhrase(text, keyword)) {
                    best = group.getKey();
                    bestLength = keyword.length();
                }
            }
        }
        return best;
    }

    private static String matchJurisdiction(String text) {
        String best = null;
        for (String place : CanonicalRules.JURISDICTIONS) {
            if (!TextNormalizer.containsPhrase(text, place)) {
                continue;
            }
            if (best == null || place.length() > best.length()
                    || (place.length() == best.length() && place.compareTo(best) < 0)) {
                best = place;
            }
        }
        if (best == null) {
            return CanonicalQuestion.ANY;
        }
        return CanonicalRules.JURISDICTION_ALIASES.getOrDefault(best, best).replace(' ', '_');
    }

    private static String matchPeriod(String text) {
        if (text.isEmpty()) {
            return CanonicalQuestion.ANY;
        }
        // first month mentioned wins
        for (String token : text.split(" ")) {
            String month = CanonicalRules.MONTHS.get(token);
            if (month != null) {
                return month;
            }
        }
        return CanonicalQuestion.ANY;
    }
}
