package io.b2mash.tender.audit;

import io.b2mash.tender.security.CallerIdentity;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEventRecord}. Auto-populates actor, source, IP address,
 * and user agent from the current request context when available.
 *
 * <p>Required fields: {@code eventType}, {@code entityType}, {@code entityId}.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("tender.created")
 *     .entityType("tender")
 *     .entityId(tender.getId())
 *     .details(Map.of("required_yes_votes", 3))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private static final int MAX_USER_AGENT_LENGTH = 500;

  private String eventType;
  private String entityType;
  private UUID entityId;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  /** Creates a new builder instance. */
  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  /**
   * Builds the {@link AuditEventRecord}, populating the remaining fields from the current context:
   *
   * <ul>
   *   <li>{@code actorId} from the authenticated caller, if any
   *   <li>{@code actorType} = "USER" if an actor is known, "SYSTEM" otherwise
   *   <li>{@code source} = "API" if in HTTP request context, "INTERNAL" otherwise
   *   <li>{@code ipAddress} from {@code HttpServletRequest.getRemoteAddr()}
   *   <li>{@code userAgent} from {@code User-Agent} header (truncated to 500 chars)
   * </ul>
   */
  public AuditEventRecord build() {
    String resolvedActorId = CallerIdentity.currentCallerId().orElse(null);
    String resolvedActorType = resolvedActorId != null ? "USER" : "SYSTEM";

    HttpServletRequest request = resolveHttpRequest();
    String resolvedSource = request != null ? "API" : "INTERNAL";

    String resolvedIpAddress = null;
    String resolvedUserAgent = null;
    if (request != null) {
      resolvedIpAddress = request.getRemoteAddr();
      String ua = request.getHeader("User-Agent");
      if (ua != null && ua.length() > MAX_USER_AGENT_LENGTH) {
        ua = ua.substring(0, MAX_USER_AGENT_LENGTH);
      }
      resolvedUserAgent = ua;
    }

    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        resolvedActorId,
        resolvedActorType,
        resolvedSource,
        resolvedIpAddress,
        resolvedUserAgent,
        details);
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
