package app.taxguide.ask.billing.repository;

import app.taxguide.ask.billing.domain.entity.PaymentEntity;
import app.taxguide.ask.billing.domain.type.PaymentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, String> {
    List<PaymentEntity> findByAccountIdAndStatusOrderByUpdatedAtDesc(UUID accountId, PaymentStatus status);

    long countByAccountIdAndStatus(UUID accountId, PaymentStatus status);
}
