package app.taxguide.ask.entitlement.domain.type;

import java.util.Locale;
import java.util.Optional;

public enum InteractionMode {
    text,
    voice;

    public static Optional<InteractionMode> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.of(text);
        }
        try {
            return Optional.of(valueOf(raw.trim().toLowerCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
