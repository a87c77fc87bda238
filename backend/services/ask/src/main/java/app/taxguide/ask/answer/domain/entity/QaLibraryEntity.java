package app.taxguide.ask.answer.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Curated answer. Maintained by admins; the resolution pipeline only reads it.
 */
@Entity
@Table(name = "qa_library", schema = "app_ask")
public class QaLibraryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "canonical_key")
    private String canonicalKey;

    @Column(name = "normalized_question", nullable = false)
    private String normalizedQuestion;

    @Column(name = "lang", nullable = false)
    private String lang;

    @Column(name = "answer", nullable = false)
    private String answer;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    @Column(name = "priority", nullable = false)
    private int priority;

    @Column(name = "enabled_at", nullable = false)
    private Instant enabledAt;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public QaLibraryEntity() {
    }

    public QaLibraryEntity(String canonicalKey,
                           String normalizedQuestion,
                           String lang,
                           String answer,
                           int priority,
                           Instant enabledAt) {
        this.canonicalKey = canonicalKey;
        this.normalizedQuestion = normalizedQuestion;
        this.lang = lang;
        this.answer = answer;
        this.enabled = true;
        this.priority = priority;
        this.enabledAt = enabledAt;
        this.createdAt = enabledAt;
        this.updatedAt = enabledAt;
    }

    public Long getId() {
        return id;
    }

    public String getCanonicalKey() {
        return canonicalKey;
    }

    public String getNormalizedQuestion() {
        return normalizedQuestion;
    }

    public String getLang() {
        return lang;
    }

    public String getAnswer() {
        return answer;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getPriority() {
        return priority;
    }

    public Instant getEnabledAt() {
        return enabledAt;
    }

    public Instant getLastUsedAt() {
        return lastUsedAt;
    }
}
