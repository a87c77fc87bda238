package app.taxguide.ask.answer.domain.entity;

import app.taxguide.ask.answer.domain.type.CacheSource;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Read model of a cached answer. Writes go through {@code AnswerStore}.
 */
@Entity
@Table(name = "qa_cache", schema = "app_ask")
public class QaCacheEntity {

    @Id
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

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false)
    private CacheSource source;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    @Column(name = "priority", nullable = false)
    private int priority;

    @Column(name = "use_count", nullable = false)
    private int useCount;

    @Column(name = "enabled_at", nullable = false)
    private Instant enabledAt;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;

    public QaCacheEntity() {
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

    public CacheSource getSource() {
        return source;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getPriority() {
        return priority;
    }

    public int getUseCount() {
        return useCount;
    }

    public Instant getEnabledAt() {
        return enabledAt;
    }

    public Instant getLastUsedAt() {
        return lastUsedAt;
    }
}
