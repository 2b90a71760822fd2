package io.b2mash.tender.tender;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A company's bid on a tender. Created only while the tender is PROPOSING. Everything except the
 * vote count is immutable; the vote count only grows, and only through {@link
 * Tender#recordProposalVote(Proposal, Proposal)}.
 */
@Entity
@Table(name = "tender_proposals")
public class Proposal {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tender_id", nullable = false, updatable = false)
  private UUID tenderId;

  @Column(name = "proposal_index", nullable = false, updatable = false)
  private int proposalIndex;

  @Column(name = "company_id", nullable = false, updatable = false)
  private long companyId;

  @Column(name = "submitted_by", nullable = false, updatable = false, length = 255)
  private String submittedBy;

  @Column(name = "descriptor_uri", nullable = false, updatable = false, length = 2048)
  private String descriptorUri;

  @Column(name = "vote_count", nullable = false)
  private int voteCount;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Proposal() {}

  public Proposal(
      UUID tenderId, int proposalIndex, long companyId, String submittedBy, String descriptorUri) {
    this.tenderId = Objects.requireNonNull(tenderId, "tenderId must not be null");
    this.proposalIndex = proposalIndex;
    this.companyId = companyId;
    this.submittedBy = Objects.requireNonNull(submittedBy, "submittedBy must not be null");
    this.descriptorUri = Objects.requireNonNull(descriptorUri, "descriptorUri must not be null");
    this.voteCount = 0;
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
  }

  void incrementVoteCount() {
    this.voteCount++;
  }

  public UUID getId() {
    return id;
  }

  public UUID getTenderId() {
    return tenderId;
  }

  public int getProposalIndex() {
    return proposalIndex;
  }

  public long getCompanyId() {
    return companyId;
  }

  public String getSubmittedBy() {
    return submittedBy;
  }

  public String getDescriptorUri() {
    return descriptorUri;
  }

  public int getVoteCount() {
    return voteCount;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
