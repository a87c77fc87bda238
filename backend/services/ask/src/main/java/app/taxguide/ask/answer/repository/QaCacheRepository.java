package app.taxguide.ask.answer.repository;

import app.taxguide.ask.answer.domain.entity.QaCacheEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface QaCacheRepository extends JpaRepository<QaCacheEntity, Long> {
    Optional<QaCacheEntity> findByCanonicalKeyAndLang(String canonicalKey, String lang);

    Optional<QaCacheEntity> findByCanonicalKeyIsNullAndNormalizedQuestionAndLang(String normalizedQuestion, String lang);

    List<QaCacheEntity> findByCanonicalKey(String canonicalKey);
}
