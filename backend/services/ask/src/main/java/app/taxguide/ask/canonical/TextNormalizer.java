package app.taxguide.ask.canonical;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

final class TextNormalizer {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{M}\\p{N}\\s]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String text = Normalizer.normalize(raw, Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
        text = NON_WORD.matcher(text).replaceAll(" ");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Whole-word containment on normalized text. Both sides must already be normalized.
     */
    static boolean containsPhrase(String normalizedText, String phrase) {
        if (phrase.isEmpty() || normalizedText.isEmpty()) {
            return false;
        }
        return (" " + normalizedText + " ").contains(" " + phrase + " ");
    }
}
