package io.b2mash.tender.audit;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

class AuditEventBuilderTest {

  private static final UUID TENDER_ID = UUID.randomUUID();

  @AfterEach
  void clearContext() {
    SecurityContextHolder.clearContext();
    RequestContextHolder.resetRequestAttributes();
  }

  @Test
  void build_outsideRequest_isSystemInternal() {
    var record =
        AuditEventBuilder.builder()
            .eventType("tender.phase_changed")
            .entityType("tender")
            .entityId(TENDER_ID)
            .build();

    assertThat(record.actorId()).isNull();
    assertThat(record.actorType()).isEqualTo("SYSTEM");
    assertThat(record.source()).isEqualTo("INTERNAL");
    assertThat(record.ipAddress()).isNull();
    assertThat(record.userAgent()).isNull();
  }

  @Test
  void build_inAuthenticatedRequest_capturesCallerAndClient() {
    SecurityContextHolder.getContext()
        .setAuthentication(new TestingAuthenticationToken("voter-9", null, "ROLE_USER"));
    var request = new MockHttpServletRequest();
    request.setRemoteAddr("10.0.0.7");
    request.addHeader("User-Agent", "x".repeat(600));
    RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(request));

    var record =
        AuditEventBuilder.builder()
            .eventType("tender.approval_vote_cast")
            .entityType("tender")
            .entityId(TENDER_ID)
            .details(Map.of("voter_id", "voter-9"))
            .build();

    assertThat(record.actorId()).isEqualTo("voter-9");
    assertThat(record.actorType()).isEqualTo("USER");
    assertThat(record.source()).isEqualTo("API");
    assertThat(record.ipAddress()).isEqualTo("10.0.0.7");
    assertThat(record.userAgent()).hasSize(500);
    assertThat(record.details()).containsEntry("voter_id", "voter-9");
  }

  @Test
  void build_authenticatedOutsideRequest_isUserInternal() {
    SecurityContextHolder.getContext()
        .setAuthentication(new TestingAuthenticationToken("admin-2", null, "ROLE_USER"));

    var record =
        AuditEventBuilder.builder()
            .eventType("tender.awarded")
            .entityType("tender")
            .entityId(TENDER_ID)
            .build();

    assertThat(record.actorId()).isEqualTo("admin-2");
    assertThat(record.actorType()).isEqualTo("USER");
    assertThat(record.source()).isEqualTo("INTERNAL");
    assertThat(record.ipAddress()).isNull();
  }
}
