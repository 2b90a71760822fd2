package io.b2mash.tender.tender;

import io.b2mash.tender.exception.ForbiddenException;
import io.b2mash.tender.exception.InvalidStateException;
import io.b2mash.tender.exception.VotingDeadlinePassedException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Aggregate root of one public tender.
 *
 * <p>Lifecycle: VOTING → APPROVED | DECLINED → PROPOSING → PROPOSAL_VOTING → VOTING_CLOSED →
 * AWARDED. Every phase change goes through {@link #apply(TenderTransition)}, which consults the
 * {@link TenderTransition} table. Vote bookkeeping (who voted) lives in {@link ApprovalVote} and
 * {@link ProposalVote}; this entity holds the counters and the running winner.
 */
@Entity
@Table(name = "tenders")
public class Tender {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "title", length = 200)
  private String title;

  @Column(name = "descriptor_uri", nullable = false, length = 2048)
  private String descriptorUri;

  @Enumerated(EnumType.STRING)
  @Column(name = "phase", nullable = false, length = 20)
  private TenderPhase phase;

  @Column(name = "voting_deadline", nullable = false)
  private Instant votingDeadline;

  @Column(name = "yes_vote_count", nullable = false)
  private int yesVoteCount;

  @Column(name = "required_yes_votes", nullable = false)
  private int requiredYesVotes;

  @Column(name = "admin_id", nullable = false, length = 255)
  private String adminId;

  // --- Collaborator references, fixed at creation ---

  @Column(name = "company_directory_ref", nullable = false, length = 500)
  private String companyDirectoryRef;

  @Column(name = "funding_ledger_ref", nullable = false, length = 500)
  private String fundingLedgerRef;

  // --- Proposal bookkeeping ---

  @Column(name = "proposal_count", nullable = false)
  private int proposalCount;

  @Column(name = "current_winning_proposal_index", nullable = false)
  private int currentWinningProposalIndex;

  // --- Result state (set on award) ---

  @Column(name = "winning_proposal_index")
  private Integer winningProposalIndex;

  @Column(name = "awarded_project_id")
  private UUID awardedProjectId;

  @Column(name = "awarded_amount", precision = 19, scale = 2)
  private BigDecimal awardedAmount;

  @Column(name = "awarded_at")
  private Instant awardedAt;

  // --- Metadata ---

  @Column(name = "created_by", nullable = false, length = 255)
  private String createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version private Long version;

  /** JPA-required no-arg constructor. */
  protected Tender() {}

  public Tender(
      String title,
      String descriptorUri,
      Instant votingDeadline,
      int requiredYesVotes,
      String adminId,
      String companyDirectoryRef,
      String fundingLedgerRef) {
    if (requiredYesVotes < 1) {
      throw new IllegalArgumentException("requiredYesVotes must be at least 1");
    }
    this.title = title;
    this.descriptorUri = Objects.requireNonNull(descriptorUri, "descriptorUri must not be null");
    this.votingDeadline = Objects.requireNonNull(votingDeadline, "votingDeadline must not be null");
    this.requiredYesVotes = requiredYesVotes;
    this.adminId = Objects.requireNonNull(adminId, "adminId must not be null");
    this.createdBy = adminId;
    this.companyDirectoryRef =
        Objects.requireNonNull(companyDirectoryRef, "companyDirectoryRef must not be null");
    this.fundingLedgerRef =
        Objects.requireNonNull(fundingLedgerRef, "fundingLedgerRef must not be null");
    this.phase = TenderPhase.VOTING;
    this.yesVoteCount = 0;
    this.proposalCount = 0;
    this.currentWinningProposalIndex = 0;
  }

  @PrePersist
  void onPrePersist() {
    var now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  // --- Approval voting ---

  /**
   * Throws unless an approval vote may be cast at {@code now}: the tender must be in VOTING and the
   * voting deadline must not have passed.
   */
  public void requireApprovalVotingOpen(Instant now) {
    requirePhase(TenderPhase.VOTING, "cast an approval vote on");
    if (now.isAfter(votingDeadline)) {
      throw new VotingDeadlinePassedException(id, votingDeadline);
    }
  }

  /**
   * Counts one approval vote. When the count reaches the threshold the tender is approved in the
   * same call.
   *
   * @return true if this vote approved the tender
   */
  public boolean recordApprovalVote() {
    requirePhase(TenderPhase.VOTING, "cast an approval vote on");
    this.yesVoteCount++;
    this.updatedAt = Instant.now();
    if (yesVoteCount >= requiredYesVotes) {
      apply(TenderTransition.AUTO_APPROVE);
      return true;
    }
    return false;
  }

  // --- Proposals ---

  /** Throws unless the tender is accepting proposals. */
  public void requireAcceptingProposals() {
    requirePhase(TenderPhase.PROPOSING, "submit a proposal to");
  }

  /**
   * Reserves the next sequential proposal index. Only valid in PROPOSING.
   *
   * @return the index assigned to the new proposal
   */
  public int allocateProposalIndex() {
    requireAcceptingProposals();
    int index = proposalCount;
    this.proposalCount++;
    this.updatedAt = Instant.now();
    return index;
  }

  /** Throws unless proposal votes are being accepted. */
  public void requireProposalVotingOpen() {
    requirePhase(TenderPhase.PROPOSAL_VOTING, "vote on a proposal of");
  }

  /**
   * Counts one vote for {@code proposal} and updates the running winner. The incumbent keeps the
   * lead on a tie, so among equally voted proposals the earliest one wins.
   *
   * @param proposal the proposal voted for
   * @param incumbent the proposal at {@link #getCurrentWinningProposalIndex()}
   * @return true if {@code proposal} took over the lead
   */
  public boolean recordProposalVote(Proposal proposal, Proposal incumbent) {
    requireProposalVotingOpen();
    requireOwnProposal(proposal);
    requireOwnProposal(incumbent);
    if (incumbent.getProposalIndex() != currentWinningProposalIndex) {
      throw new IllegalArgumentException(
          "incumbent must be proposal " + currentWinningProposalIndex);
    }
    proposal.incrementVoteCount();
    this.updatedAt = Instant.now();
    if (proposal.getProposalIndex() != incumbent.getProposalIndex()
        && proposal.getVoteCount() > incumbent.getVoteCount()) {
      this.currentWinningProposalIndex = proposal.getProposalIndex();
      return true;
    }
    return false;
  }

  // --- Admin-driven transitions ---

  /** Throws ForbiddenException unless {@code callerId} is the tender admin. */
  public void requireAdmin(String callerId, String action) {
    if (!adminId.equals(callerId)) {
      throw new ForbiddenException(
          "Admin only", "Only the tender admin may " + action + " tender " + id);
    }
  }

  public void overrideApprove() {
    apply(TenderTransition.OVERRIDE_APPROVE);
  }

  public void overrideDecline() {
    apply(TenderTransition.OVERRIDE_DECLINE);
  }

  public void openProposing() {
    apply(TenderTransition.OPEN_PROPOSING);
  }

  /** Closes proposing and opens proposal voting. Requires at least one submitted proposal. */
  public void closeProposing() {
    requireTransition(TenderTransition.CLOSE_PROPOSING);
    if (proposalCount == 0) {
      throw new InvalidStateException(
          "No proposals submitted",
          "Cannot open proposal voting for tender " + id + " without any proposals");
    }
    apply(TenderTransition.CLOSE_PROPOSING);
  }

  public void closeProposalVoting() {
    apply(TenderTransition.CLOSE_PROPOSAL_VOTING);
  }

  /**
   * Records the award result and moves the tender to AWARDED. The winner is the running winner at
   * the time of the call.
   */
  public void markAwarded(UUID projectId, BigDecimal amount) {
    requireTransition(TenderTransition.AWARD);
    this.winningProposalIndex = currentWinningProposalIndex;
    this.awardedProjectId = Objects.requireNonNull(projectId, "projectId must not be null");
    this.awardedAmount = Objects.requireNonNull(amount, "amount must not be null");
    this.awardedAt = Instant.now();
    apply(TenderTransition.AWARD);
  }

  /** Hands override authority to {@code newAdminId}. Takes effect immediately, no handshake. */
  public void changeAdmin(String newAdminId) {
    this.adminId = Objects.requireNonNull(newAdminId, "newAdminId must not be null");
    this.updatedAt = Instant.now();
  }

  /** Throws InvalidStateException if {@code transition} cannot fire from the current phase. */
  public void requireTransition(TenderTransition transition) {
    if (!transition.permits(this.phase)) {
      throw new InvalidStateException(
          "Invalid tender phase",
          "Cannot " + transition.action() + " tender in phase " + this.phase);
    }
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public String getDescriptorUri() {
    return descriptorUri;
  }

  public TenderPhase getPhase() {
    return phase;
  }

  public Instant getVotingDeadline() {
    return votingDeadline;
  }

  public int getYesVoteCount() {
    return yesVoteCount;
  }

  public int getRequiredYesVotes() {
    return requiredYesVotes;
  }

  public String getAdminId() {
    return adminId;
  }

  public String getCompanyDirectoryRef() {
    return companyDirectoryRef;
  }

  public String getFundingLedgerRef() {
    return fundingLedgerRef;
  }

  public int getProposalCount() {
    return proposalCount;
  }

  public int getCurrentWinningProposalIndex() {
    return currentWinningProposalIndex;
  }

  public Integer getWinningProposalIndex() {
    return winningProposalIndex;
  }

  public UUID getAwardedProjectId() {
    return awardedProjectId;
  }

  public BigDecimal getAwardedAmount() {
    return awardedAmount;
  }

  public Instant getAwardedAt() {
    return awardedAt;
  }

  public String getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  // --- Private helpers ---

  private void apply(TenderTransition transition) {
    requireTransition(transition);
    this.phase = transition.target();
    this.updatedAt = Instant.now();
  }

  private void requirePhase(TenderPhase required, String action) {
    if (this.phase != required) {
      throw new InvalidStateException(
          "Invalid tender phase", "Cannot " + action + " tender in phase " + this.phase);
    }
  }

  private void requireOwnProposal(Proposal proposal) {
    if (id != null && !id.equals(proposal.getTenderId())) {
      throw new IllegalArgumentException(
          "Proposal " + proposal.getProposalIndex() + " belongs to another tender");
    }
  }
}
