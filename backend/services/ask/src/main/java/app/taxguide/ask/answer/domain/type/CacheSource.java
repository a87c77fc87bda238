package app.taxguide.ask.answer.domain.type;

/**
 * Provenance of a cache row: generated directly, or translated from a library entry.
 */
public enum CacheSource {
    ai,
    library_derived
}
