package app.taxguide.ask.entitlement.repository;

import app.taxguide.ask.entitlement.domain.entity.CreditBalanceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface CreditBalanceRepository extends JpaRepository<CreditBalanceEntity, UUID> {
}
