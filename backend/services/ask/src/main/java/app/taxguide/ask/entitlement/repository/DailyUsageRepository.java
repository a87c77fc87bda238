package app.taxguide.ask.entitlement.repository;

import app.taxguide.ask.entitlement.domain.composite.DailyUsageId;
import app.taxguide.ask.entitlement.domain.entity.DailyUsageEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DailyUsageRepository extends JpaRepository<DailyUsageEntity, DailyUsageId> {
    Optional<DailyUsageEntity> findByAccountIdAndUsageDay(UUID accountId, LocalDate usageDay);
}
