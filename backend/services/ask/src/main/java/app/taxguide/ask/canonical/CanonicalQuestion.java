package app.taxguide.ask.canonical;

/**
 * Pure canonicalization output. {@code canonicalKey} is always well-formed:
 * {@code intent|channel|jurisdiction|period} with {@value #ANY} for unresolved fields.
 */
public record CanonicalQuestion(
        String normalizedText,
        String canonicalKey,
        Language language,
        boolean languageDetected
) {

    public static final String ANY = "any";
    public static final String UNRESOLVED_KEY = String.join("|", ANY, ANY, ANY, ANY);

    /**
     * A key with every field unresolved says nothing about the question, so lookups
     * and cache writes fall back to the normalized text.
     */
    public boolean hasResolvedKey() {
        return !UNRESOLVED_KEY.equals(canonicalKey);
    }

    public String storageKey() {
        return hasResolvedKey() ? canonicalKey : null;
    }
}
