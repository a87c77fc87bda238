package app.taxguide.ask.entitlement.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "credit_balances", schema = "app_ask")
public class CreditBalanceEntity {

    @Id
    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    @Column(name = "balance", nullable = false)
    private Integer balance;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public CreditBalanceEntity() {
    }

    public CreditBalanceEntity(UUID accountId, Integer balance, Instant updatedAt) {
        this.accountId = accountId;
        this.balance = balance;
        this.updatedAt = updatedAt;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public Integer getBalance() {
        return balance;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
