package io.b2mash.tender.audit;

import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

/** Service interface for recording and querying audit events. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back (no REQUIRES_NEW).
   *
   * @param record the audit event data to persist
   */
  void log(AuditEventRecord record);

  /**
   * Returns the audit trail of one entity, newest first.
   *
   * @param entityType the kind of entity (e.g., "tender")
   * @param entityId the entity's id
   * @param pageable pagination parameters
   */
  Page<AuditEvent> findEvents(String entityType, UUID entityId, Pageable pageable);
}
