package app.taxguide.ask.answer.repository;

import app.taxguide.ask.answer.domain.entity.QaLibraryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface QaLibraryRepository extends JpaRepository<QaLibraryEntity, Long> {
}
