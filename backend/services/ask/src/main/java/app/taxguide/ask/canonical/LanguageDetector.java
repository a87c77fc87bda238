package app.taxguide.ask.canonical;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class LanguageDetector {

    private final Map<Language, List<String>> hints;

    public LanguageDetector() {
        Map<Language, List<String>> normalized = new LinkedHashMap<>();
        CanonicalRules.LANGUAGE_HINTS.forEach((language, words) -> {
            List<String> list = new ArrayList<>();
            for (String word : words) {
                list.add(TextNormalizer.normalize(word));
            }
            normalized.put(language, List.copyOf(list));
        });
        this.hints = Collections.unmodifiableMap(normalized);
    }

    /**
     * Classifies normalized text by fixed token lists. Text with no regional marker is base language.
     */
    public Language detect(String normalizedText) {
        if (normalizedText == null || normalizedText.isBlank()) {
            return Language.BASE;
        }
        for (Map.Entry<Language, List<String>> entry : hints.entrySet()) {
            for (String hint : entry.getValue()) {
                if (TextNormalizer.containsPhrase(normalizedText, hint)) {
                    return entry.getKey();
                }
            }
        }
        return Language.BASE;
    }
}
