package app.taxguide.ask.canonical;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed keyword tables behind the canonical key. Keywords are matched on
 * normalized text, whole words only.
 */
final class CanonicalRules {

    static final Map<String, List<String>> INTENTS = intents();

    static final Map<String, List<String>> CHANNELS = channels();

    static final Set<String> JURISDICTIONS = Set.of(
            "abia", "adamawa", "akwa ibom", "anambra", "bauchi", "bayelsa", "benue", "borno", "cross river",
            "delta", "ebonyi", "edo", "ekiti", "enugu", "gombe", "imo", "jigawa", "kaduna", "kano", "katsina",
            "kebbi", "kogi", "kwara", "lagos", "nasarawa", "niger", "ogun", "ondo", "osun", "oyo", "plateau",
            "rivers", "sokoto", "taraba", "yobe", "zamfara", "fct", "abuja"
    );

    static final Map<String, String> JURISDICTION_ALIASES = Map.of("fct", "abuja");

    static final Map<String, String> MONTHS = Map.ofEntries(
            Map.entry("january", "jan"), Map.entry("jan", "jan"),
            Map.entry("february", "feb"), Map.entry("feb", "feb"),
            Map.entry("march", "mar"), Map.entry("mar", "mar"),
            Map.entry("april", "apr"), Map.entry("apr", "apr"),
            Map.entry("may", "may"),
            Map.entry("june", "jun"), Map.entry("jun", "jun"),
            Map.entry("july", "jul"), Map.entry("jul", "jul"),
            Map.entry("august", "aug"), Map.entry("aug", "aug"),
            Map.entry("september", "sep"), Map.entry("sept", "sep"), Map.entry("sep", "sep"),
            Map.entry("october", "oct"), Map.entry("oct", "oct"),
            Map.entry("november", "nov"), Map.entry("nov", "nov"),
            Map.entry("december", "dec"), Map.entry("dec", "dec")
    );

    // detection order matters: first language with a hit wins
    static final Map<Language, List<String>> LANGUAGE_HINTS = languageHints();

    private CanonicalRules() {
    }

    private static Map<String, List<String>> intents() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put("record_keeping", List.of(
                "keep records", "record keeping", "bookkeeping", "documentation", "proof", "evidence",
                "receipts", "invoices", "reconcile", "bank statement", "track income", "track expenses"));
        map.put("paye", List.of("paye", "salary tax", "employee tax"));
        map.put("vat", List.of("vat", "value added tax"));
        map.put("pit", List.of("pit", "personal income tax"));
        map.put("business_reg", List.of("business registration", "cac", "register business"));
        map.put("withholding_tax", List.of("withholding tax", "wht"));
        map.put("compliance", List.of("file", "filing", "compliance", "penalty", "late payment", "audit"));
        return Collections.unmodifiableMap(map);
    }

    private static Map<String, List<String>> channels() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put("web_chat", List.of("web chat", "website chat", "live chat", "site chat"));
        map.put("whatsapp", List.of("whatsapp", "wa"));
        map.put("telegram", List.of("telegram", "tg"));
        map.put("bank_transfer", List.of("bank transfer", "transfer"));
        map.put("paypal", List.of("paypal"));
        map.put("payoneer", List.of("payoneer"));
        map.put("card", List.of("card", "debit card", "credit card"));
        return Collections.unmodifiableMap(map);
    }

    private static Map<Language, List<String>> languageHints() {
        Map<Language, List<String>> map = new LinkedHashMap<>();
        map.put(Language.yo, List.of("ẹni", "ṣé", "kini", "kí ni", "owo ori", "ìjọba", "jẹ́", "ọba", "ọwọ"));
        map.put(Language.ha, List.of("haraji", "me yasa", "yaya", "gwamnati", "kudin", "shin", "ina"));
        map.put(Language.ig, List.of("ụtụ", "gọọmenti", "kedu", "ego", "òlee", "gịnị", "anyị", "ọrụ"));
        map.put(Language.pcm, List.of("wetin", "how far", "abi", "dey", "no be", "una", "oya", "na"));
        return Collections.unmodifiableMap(map);
    }
}
