package io.b2mash.tender.tender;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/** One voter's yes-vote on a tender. Unique per (tender, voter). */
@Entity
@Table(name = "approval_votes")
public class ApprovalVote {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tender_id", nullable = false, updatable = false)
  private UUID tenderId;

  @Column(name = "voter_id", nullable = false, updatable = false, length = 255)
  private String voterId;

  @Column(name = "cast_at", nullable = false, updatable = false)
  private Instant castAt;

  protected ApprovalVote() {}

  public ApprovalVote(UUID tenderId, String voterId, Instant castAt) {
    this.tenderId = Objects.requireNonNull(tenderId, "tenderId must not be null");
    this.voterId = Objects.requireNonNull(voterId, "voterId must not be null");
    this.castAt = Objects.requireNonNull(castAt, "castAt must not be null");
  }

  public UUID getId() {
    return id;
  }

  public UUID getTenderId() {
    return tenderId;
  }

  public String getVoterId() {
    return voterId;
  }

  public Instant getCastAt() {
    return castAt;
  }
}
