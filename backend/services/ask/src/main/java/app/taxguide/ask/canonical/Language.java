package app.taxguide.ask.canonical;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public enum Language {
    en("English"),
    yo("Yoruba"),
    ig("Igbo"),
    ha("Hausa"),
    pcm("Nigerian Pidgin");

    public static final Language BASE = en;

    private static final Map<String, Language> ALIASES = Map.ofEntries(
            Map.entry("en", en),
            Map.entry("english", en),
            Map.entry("yo", yo),
            Map.entry("yoruba", yo),
            Map.entry("ig", ig),
            Map.entry("igbo", ig),
            Map.entry("ha", ha),
            Map.entry("hausa", ha),
            Map.entry("pcm", pcm),
            Map.entry("pidgin", pcm),
            Map.entry("naija", pcm),
            Map.entry("nigerian pidgin", pcm)
    );

    private final String displayName;

    Language(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isBase() {
        return this == BASE;
    }

    /**
     * Resolves a caller-supplied language hint ("yo", "Yoruba", "pidgin", ...).
     * Blank or unknown hints resolve to empty.
     */
    public static Optional<Language> fromHint(String hint) {
        if (hint == null || hint.isBlank()) {
            return Optional.empty();
        }
        String key = hint.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        return Optional.ofNullable(ALIASES.get(key));
    }

    public static Language fromCode(String code) {
        return fromHint(code).orElse(BASE);
    }
}
