package io.b2mash.tender.audit;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

  Page<AuditEvent> findByEntityTypeAndEntityIdOrderByOccurredAtDesc(
      String entityType, UUID entityId, Pageable pageable);

  List<AuditEvent> findByEntityIdAndEventType(UUID entityId, String eventType);
}
