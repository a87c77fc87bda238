package app.taxguide.ask.answer.service;

import app.taxguide.ask.canonical.Language;

/**
 * One row from a lookup tier.
 */
public record StoredAnswer(long id, Tier tier, String answer, Language language, String canonicalKey) {

    public enum Tier {
        library("qa_library"),
        cache("qa_cache");

        private final String table;

        Tier(String table) {
            this.table = table;
        }

        public String table() {
            return table;
        }

        public static Tier fromTable(String table) {
            for (Tier tier : values()) {
                if (tier.table.equals(table)) {
                    return tier;
                }
            }
            throw new IllegalArgumentException("Unknown answer table: " + table);
        }
    }
}
