package io.b2mash.tender.tender;

import jakarta.persistence.LockModeType;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TenderRepository extends JpaRepository<Tender, UUID> {

  /** Loads a tender with a row lock held until the surrounding transaction ends. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT t FROM Tender t WHERE t.id = :id")
  Optional<Tender> findByIdForUpdate(@Param("id") UUID id);

  @Query(
      """
      SELECT t FROM Tender t
      WHERE (:phase IS NULL OR t.phase = :phase)
      ORDER BY t.createdAt DESC
      """)
  Page<Tender> findFiltered(@Param("phase") TenderPhase phase, Pageable pageable);
}
