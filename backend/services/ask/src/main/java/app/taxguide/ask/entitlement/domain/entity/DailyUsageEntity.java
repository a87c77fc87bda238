package app.taxguide.ask.entitlement.domain.entity;

import app.taxguide.ask.entitlement.domain.composite.DailyUsageId;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "daily_usage", schema = "app_ask")
@IdClass(DailyUsageId.class)
public class DailyUsageEntity {

    @Id
    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    @Id
    @Column(name = "usage_day", nullable = false)
    private LocalDate usageDay;

    @Column(name = "cache_used", nullable = false)
    private Integer cacheUsed;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public DailyUsageEntity() {
    }

    public UUID getAccountId() {
        return accountId;
    }

    public LocalDate getUsageDay() {
        return usageDay;
    }

    public Integer getCacheUsed() {
        return cacheUsed;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
