package app.taxguide.ask.answer.repository;

import app.taxguide.ask.answer.domain.entity.TranslationJobEntity;
import app.taxguide.ask.answer.domain.type.TranslationJobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TranslationJobRepository extends JpaRepository<TranslationJobEntity, Long> {
    List<TranslationJobEntity> findByCanonicalKeyOrderByTargetLangAsc(String canonicalKey);

    long countByStatus(TranslationJobStatus status);
}
