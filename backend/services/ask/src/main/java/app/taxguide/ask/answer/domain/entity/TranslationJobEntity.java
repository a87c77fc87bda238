package app.taxguide.ask.answer.domain.entity;

import app.taxguide.ask.answer.domain.type.TranslationJobStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

@Entity
@Table(name = "translation_jobs", schema = "app_ask")
public class TranslationJobEntity {

    @Id
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "canonical_key", nullable = false)
    private String canonicalKey;

    @Column(name = "source_lang", nullable = false)
    private String sourceLang;

    @Column(name = "target_lang", nullable = false)
    private String targetLang;

    @Column(name = "source_table", nullable = false)
    private String sourceTable;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private TranslationJobStatus status;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "locked_at")
    private Instant lockedAt;

    @Column(name = "last_error")
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public TranslationJobEntity() {
    }

    public Long getId() {
        return id;
    }

    public String getCanonicalKey() {
        return canonicalKey;
    }

    public String getSourceLang() {
        return sourceLang;
    }

    public String getTargetLang() {
        return targetLang;
    }

    public String getSourceTable() {
        return sourceTable;
    }

    public TranslationJobStatus getStatus() {
        return status;
    }

    public void setStatus(TranslationJobStatus status) {
        this.status = status;
    }

    public int getAttempts() {
        return attempts;
    }

    public Instant getLockedAt() {
        return lockedAt;
    }

    public void setLockedAt(Instant lockedAt) {
        this.lockedAt = lockedAt;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
