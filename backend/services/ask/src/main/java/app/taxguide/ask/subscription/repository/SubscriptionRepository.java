package app.taxguide.ask.subscription.repository;

import app.taxguide.ask.subscription.domain.entity.SubscriptionEntity;
import app.taxguide.ask.subscription.domain.type.SubscriptionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SubscriptionRepository extends JpaRepository<SubscriptionEntity, Long> {

    Optional<SubscriptionEntity> findFirstByAccountIdOrderByPeriodEndDescIdDesc(UUID accountId);

    boolean existsByAccountId(UUID accountId);

    List<SubscriptionEntity> findByAccountIdOrderByPeriodEndDescIdDesc(UUID accountId);

    @Query("""
            select distinct s.accountId from SubscriptionEntity s
            where s.pendingPlanCode is not null
              and s.pendingEffectiveAt <= :now
            """)
    List<UUID> findAccountsWithDueChanges(@Param("now") Instant now);

    /**
     * Clears a due pending change. Exactly one concurrent caller gets 1 back.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update SubscriptionEntity s
            set s.pendingPlanCode = null,
                s.pendingEffectiveAt = null,
                s.updatedAt = :now
            where s.id = :id
              and s.pendingPlanCode = :planCode
              and s.pendingEffectiveAt <= :now
            """)
    int claimPendingChange(@Param("id") Long id, @Param("planCode") String planCode, @Param("now") Instant now);

    /**
     * Attaches a plan change effective at the record's period end. Returns 0 when a change
     * is already pending.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update SubscriptionEntity s
            set s.pendingPlanCode = :planCode,
                s.pendingEffectiveAt = s.periodEnd,
                s.updatedAt = :now
            where s.id = :id
              and s.pendingPlanCode is null
            """)
    int attachPendingChange(@Param("id") Long id, @Param("planCode") String planCode, @Param("now") Instant now);

    /**
     * Ends every record still running at {@code now}, so a record appended afterwards is current.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update SubscriptionEntity s
            set s.periodEnd = :now,
                s.status = :status,
                s.pendingPlanCode = null,
                s.pendingEffectiveAt = null,
                s.updatedAt = :now
            where s.accountId = :accountId
              and s.periodEnd > :now
            """)
    int closeRunning(@Param("accountId") UUID accountId,
                     @Param("status") SubscriptionStatus status,
                     @Param("now") Instant now);
}
