package app.taxguide.ask.canonical;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuestionCanonicalizerTest {

    private final QuestionCanonicalizer canonicalizer = new QuestionCanonicalizer(new LanguageDetector());

    @Test
    void canonicalizeIsDeterministic() {
        String question = "How do I charge VAT on WhatsApp sales in Lagos for March?";

        CanonicalQuestion first = canonicalizer.canonicalize(question);
        CanonicalQuestion second = canonicalizer.canonicalize(question);

        assertThat(first).isEqualTo(second);
        assertThat(first.canonicalKey()).isEqualTo("vat|whatsapp|lagos|mar");
    }

    @Test
    void canonicalizeIsTotalForEmptyAndGibberishInput() {
        for (String input : new String[]{null, "", "   ", "?!?!", "zxqv blorp 123"}) {
            CanonicalQuestion result = canonicalizer.canonicalize(input);

            assertThat(result.canonicalKey()).isEqualTo(CanonicalQuestion.UNRESOLVED_KEY);
            assertThat(result.canonicalKey().split("\\|")).hasSize(4);
            assertThat(result.language()).isEqualTo(Language.BASE);
            assertThat(result.hasResolvedKey()).isFalse();
            assertThat(result.storageKey()).isNull();
        }
    }

    @Test
    void simpleVatQuestionResolvesIntentOnly() {
        CanonicalQuestion result = canonicalizer.canonicalize("What is VAT?");

        assertThat(result.normalizedText()).isEqualTo("what is vat");
        assertThat(result.canonicalKey()).isEqualTo("vat|any|any|any");
        assertThat(result.language()).isEqualTo(Language.en);
        assertThat(result.languageDetected()).isTrue();
    }

    @Test
    void differentPhrasingsShareOneKey() {
        CanonicalQuestion first = canonicalizer.canonicalize("Value added tax in Kano?");
        CanonicalQuestion second = canonicalizer.canonicalize("kano VAT");

        assertThat(first.canonicalKey()).isEqualTo(second.canonicalKey());
    }

    @Test
    void longestKeywordWinsAcrossGroups() {
        assertThat(canonicalizer.canonicalize("Value added tax filing").canonicalKey())
                .isEqualTo("vat|any|any|any");
        assertThat(canonicalizer.canonicalize("Penalty for VAT").canonicalKey())
                .isEqualTo("compliance|any|any|any");
        assertThat(canonicalizer.canonicalize("Do I deduct withholding tax when paying by debit card").canonicalKey())
                .isEqualTo("withholding_tax|card|any|any");
    }

    @Test
    void keywordsMatchWholeWordsOnly() {
        CanonicalQuestion result = canonicalizer.canonicalize("My vatican trip receipts");

        assertThat(result.canonicalKey()).startsWith("record_keeping|");
    }

    @Test
    void jurisdictionAliasesAndMultiWordStates() {
        assertThat(canonicalizer.canonicalize("PAYE rules in the FCT").canonicalKey())
                .isEqualTo("paye|any|abuja|any");
        assertThat(canonicalizer.canonicalize("PAYE rules in Akwa Ibom").canonicalKey())
                .isEqualTo("paye|any|akwa_ibom|any");
    }

    @Test
    void firstMonthMentionedIsThePeriod() {
        CanonicalQuestion result = canonicalizer.canonicalize("Filing deadline, is it January or February?");

        assertThat(result.canonicalKey()).endsWith("|jan");
    }

    @Test
    void detectsRegionalLanguageFromMarkers() {
        assertThat(canonicalizer.canonicalize("Wetin be VAT?").language()).isEqualTo(Language.pcm);
        assertThat(canonicalizer.canonicalize("Menene haraji na VAT?").language()).isEqualTo(Language.ha);
    }

    @Test
    void explicitHintOverridesDetection() {
        CanonicalQuestion hinted = canonicalizer.canonicalize("Wetin be VAT?", "Yoruba");

        assertThat(hinted.language()).isEqualTo(Language.yo);
        assertThat(hinted.languageDetected()).isFalse();
        assertThat(hinted.canonicalKey()).isEqualTo("vat|any|any|any");
    }

    @Test
    void unknownHintFallsBackToBaseLanguage() {
        CanonicalQuestion hinted = canonicalizer.canonicalize("Wetin be VAT?", "klingon");

        assertThat(hinted.language()).isEqualTo(Language.BASE);
    }

    @Test
    void normalizationKeepsDiacritics() {
        assertThat(TextNormalizer.normalize("  Ṣé   owó-orí?  ")).isEqualTo("ṣé owó orí");
    }

    @Test
    void keywordTablesKeepDeclarationOrderAndAreReadOnly() {
        assertThat(CanonicalRules.INTENTS.keySet()).containsExactly(
                "record_keeping", "paye", "vat", "pit", "business_reg", "withholding_tax", "compliance");
        assertThat(CanonicalRules.CHANNELS.keySet()).containsExactly(
                "web_chat", "whatsapp", "telegram", "bank_transfer", "paypal", "payoneer", "card");
        assertThat(CanonicalRules.LANGUAGE_HINTS.keySet())
                .containsExactly(Language.yo, Language.ha, Language.ig, Language.pcm);
        assertThatThrownBy(() -> CanonicalRules.INTENTS.put("other", List.of()))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
