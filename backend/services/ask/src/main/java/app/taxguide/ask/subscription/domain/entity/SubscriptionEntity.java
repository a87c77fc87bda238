package app.taxguide.ask.subscription.domain.entity;

import app.taxguide.ask.subscription.domain.type.SubscriptionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "subscriptions", schema = "app_ask")
public class SubscriptionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "plan_code", nullable = false)
    private String planCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private SubscriptionStatus status;

    @Column(name = "period_start", nullable = false)
    private Instant periodStart;

    @Column(name = "period_end", nullable = false)
    private Instant periodEnd;

    @Column(name = "pending_plan_code")
    private String pendingPlanCode;

    @Column(name = "pending_effective_at")
    private Instant pendingEffectiveAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public SubscriptionEntity() {
    }

    public SubscriptionEntity(UUID accountId,
                              String planCode,
                              SubscriptionStatus status,
                              Instant periodStart,
                              Instant periodEnd,
                              Instant createdAt) {
        this.accountId = accountId;
        this.planCode = planCode;
        this.status = status;
        this.periodStart = periodStart;
        this.periodEnd = periodEnd;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public boolean hasPendingChange() {
        return pendingPlanCode != null && pendingEffectiveAt != null;
    }

    public Long getId() {
        return id;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public String getPlanCode() {
        return planCode;
    }

    public SubscriptionStatus getStatus() {
        return status;
    }

    public void setStatus(SubscriptionStatus status) {
        this.status = status;
    }

    public Instant getPeriodStart() {
        return periodStart;
    }

    public Instant getPeriodEnd() {
        return periodEnd;
    }

    public String getPendingPlanCode() {
        return pendingPlanCode;
    }

    public void setPendingPlanCode(String pendingPlanCode) {
        this.pendingPlanCode = pendingPlanCode;
    }

    public Instant getPendingEffectiveAt() {
        return pendingEffectiveAt;
    }

    public void setPendingEffectiveAt(Instant pendingEffectiveAt) {
        this.pendingEffectiveAt = pendingEffectiveAt;
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
