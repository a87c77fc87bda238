package app.taxguide.ask.billing.domain.entity;

import app.taxguide.ask.billing.domain.type.PaymentStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * Processed-payment marker, keyed by provider reference. Written through SQL upserts only.
 */
@Entity
@Table(name = "payments", schema = "app_ask")
public class PaymentEntity {

    @Id
    @Column(name = "reference", nullable = false)
    private String reference;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private PaymentStatus status;

    @Column(name = "account_id")
    private UUID accountId;

    @Column(name = "plan_code")
    private String planCode;

    @Column(name = "upgrade_mode")
    private String upgradeMode;

    @Column(name = "amount_kobo")
    private Long amountKobo;

    @Column(name = "currency")
    private String currency;

    @Column(name = "reason")
    private String reason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public PaymentEntity() {
    }

    public String getReference() {
        return reference;
    }

    public PaymentStatus getStatus() {
        return status;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public String getPlanCode() {
        return planCode;
    }

    public String getUpgradeMode() {
        return upgradeMode;
    }

    public Long getAmountKobo() {
        return amountKobo;
    }

    public String getCurrency() {
        return currency;
    }

    public String getReason() {
        return reason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
