package io.b2mash.tender.tender;

import io.b2mash.tender.audit.AuditEvent;
import io.b2mash.tender.audit.AuditEventBuilder;
import io.b2mash.tender.audit.AuditService;
import io.b2mash.tender.config.IntegrationProperties;
import io.b2mash.tender.config.TenderDefaultsProperties;
import io.b2mash.tender.exception.DuplicateVoteException;
import io.b2mash.tender.exception.ForbiddenException;
import io.b2mash.tender.exception.InvalidRequestException;
import io.b2mash.tender.exception.ResourceNotFoundException;
import io.b2mash.tender.integration.CompanyDirectory;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Voting, proposal and admin operations of a tender. Every mutating method runs in one transaction
 * and takes the tender row lock first, so writers of one tender are serialized.
 */
@Service
public class TenderService {

  private static final Logger log = LoggerFactory.getLogger(TenderService.class);

  static final String ENTITY_TYPE = "tender";

  private final TenderRepository tenderRepository;
  private final ProposalRepository proposalRepository;
  private final ApprovalVoteRepository approvalVoteRepository;
  private final ProposalVoteRepository proposalVoteRepository;
  private final CompanyDirectory companyDirectory;
  private final AuditService auditService;
  private final TenderDefaultsProperties defaults;
  private final IntegrationProperties integrationProperties;

  public TenderService(
      TenderRepository tenderRepository,
      ProposalRepository proposalRepository,
      ApprovalVoteRepository approvalVoteRepository,
      ProposalVoteRepository proposalVoteRepository,
      CompanyDirectory companyDirectory,
      AuditService auditService,
      TenderDefaultsProperties defaults,
      IntegrationProperties integrationProperties) {
    this.tenderRepository = tenderRepository;
    this.proposalRepository = proposalRepository;
    this.approvalVoteRepository = approvalVoteRepository;
    this.proposalVoteRepository = proposalVoteRepository;
    this.companyDirectory = companyDirectory;
    this.auditService = auditService;
    this.defaults = defaults;
    this.integrationProperties = integrationProperties;
  }

  // --- Creation and reads ---

  /**
   * Creates a tender in VOTING with {@code callerId} as admin. Null duration or threshold fall back
   * to the configured defaults.
   */
  @Transactional
  public Tender createTender(
      String title,
      String descriptorUri,
      Duration votingDuration,
      Integer requiredYesVotes,
      String callerId) {
    var duration = votingDuration != null ? votingDuration : defaults.votingDuration();
    int threshold = requiredYesVotes != null ? requiredYesVotes : defaults.requiredYesVotes();
    if (duration.isNegative() || duration.isZero()) {
      throw new InvalidRequestException(
          "Invalid voting duration", "Voting duration must be positive, got " + duration);
    }
    if (threshold < 1) {
      throw new InvalidRequestException(
          "Invalid threshold", "Required yes-votes must be at least 1, got " + threshold);
    }

    var tender =
        new Tender(
            title,
            descriptorUri,
            Instant.now().plus(duration),
            threshold,
            callerId,
            integrationProperties.companyDirectory().baseUrl(),
            integrationProperties.fundingLedger().baseUrl());
    var saved = tenderRepository.save(tender);

    var details = new LinkedHashMap<String, Object>();
    details.put("title", title);
    details.put("required_yes_votes", threshold);
    details.put("voting_deadline", saved.getVotingDeadline().toString());
    details.put("admin_id", callerId);
    audit("tender.created", saved.getId(), details);

    log.info(
        "Created tender {} (threshold={}, deadline={})",
        saved.getId(),
        threshold,
        saved.getVotingDeadline());
    return saved;
  }

  @Transactional(readOnly = true)
  public Tender getTender(UUID tenderId) {
    return tenderRepository
        .findById(tenderId)
        .orElseThrow(() -> new ResourceNotFoundException("Tender", tenderId));
  }

  @Transactional(readOnly = true)
  public Page<Tender> listTenders(TenderPhase phase, Pageable pageable) {
    return tenderRepository.findFiltered(phase, pageable);
  }

  @Transactional(readOnly = true)
  public List<Proposal> getProposals(UUID tenderId) {
    requireExists(tenderId);
    return proposalRepository.findByTenderIdOrderByProposalIndex(tenderId);
  }

  @Transactional(readOnly = true)
  public boolean hasApprovalVote(UUID tenderId, String voterId) {
    requireExists(tenderId);
    return approvalVoteRepository.existsByTenderIdAndVoterId(tenderId, voterId);
  }

  @Transactional(readOnly = true)
  public boolean hasProposalVote(UUID tenderId, int proposalIndex, String voterId) {
    requireExists(tenderId);
    findProposal(tenderId, proposalIndex);
    return proposalVoteRepository.existsByTenderIdAndProposalIndexAndVoterId(
        tenderId, proposalIndex, voterId);
  }

  @Transactional(readOnly = true)
  public Page<AuditEvent> getEvents(UUID tenderId, Pageable pageable) {
    requireExists(tenderId);
    return auditService.findEvents(ENTITY_TYPE, tenderId, pageable);
  }

  // --- Approval voting ---

  /**
   * Records a yes-vote. Checks phase, then deadline, then duplicate; the vote that reaches the
   * threshold approves the tender in the same transaction.
   */
  @Transactional
  public Tender castApprovalVote(UUID tenderId, String voterId) {
    var tender = lockTender(tenderId);
    tender.requireApprovalVotingOpen(Instant.now());
    if (approvalVoteRepository.existsByTenderIdAndVoterId(tenderId, voterId)) {
      throw new DuplicateVoteException(
          "Voter " + voterId + " has already cast an approval vote on tender " + tenderId);
    }

    approvalVoteRepository.save(new ApprovalVote(tenderId, voterId, Instant.now()));
    boolean approved = tender.recordApprovalVote();
    tenderRepository.save(tender);

    audit(
        "tender.approval_vote_cast",
        tenderId,
        Map.of(
            "voter_id", voterId,
            "yes_vote_count", tender.getYesVoteCount(),
            "required_yes_votes", tender.getRequiredYesVotes()));
    log.info(
        "Approval vote on tender {} by {} ({}/{})",
        tenderId,
        voterId,
        tender.getYesVoteCount(),
        tender.getRequiredYesVotes());

    if (approved) {
      auditPhaseChange(tender, TenderPhase.VOTING, TenderTransition.AUTO_APPROVE);
    }
    return tender;
  }

  // --- Proposals ---

  /**
   * Appends a proposal for {@code companyId}. The caller must be the representative the company
   * directory names for that company.
   */
  @Transactional
  public Proposal submitProposal(
      UUID tenderId, long companyId, String descriptorUri, String callerId) {
    var tender = lockTender(tenderId);
    tender.requireAcceptingProposals();

    String representative = companyDirectory.lookupRepresentative(companyId);
    if (!representative.equals(callerId)) {
      throw new ForbiddenException(
          "Not company representative",
          "Caller is not the registered representative of company " + companyId);
    }

    int index = tender.allocateProposalIndex();
    var proposal =
        proposalRepository.save(
            new Proposal(tenderId, index, companyId, callerId, descriptorUri));
    tenderRepository.save(tender);

    audit(
        "tender.proposal_submitted",
        tenderId,
        Map.of(
            "proposal_index", index,
            "company_id", companyId,
            "descriptor_uri", descriptorUri));
    log.info("Proposal {} submitted to tender {} by company {}", index, tenderId, companyId);
    return proposal;
  }

  /**
   * Records one vote for a proposal. Checks phase, then duplicate, then that the proposal exists.
   * The running winner changes only when the voted proposal strictly overtakes it.
   */
  @Transactional
  public Proposal voteForProposal(UUID tenderId, int proposalIndex, String voterId) {
    var tender = lockTender(tenderId);
    tender.requireProposalVotingOpen();
    if (proposalVoteRepository.existsByTenderIdAndProposalIndexAndVoterId(
        tenderId, proposalIndex, voterId)) {
      throw new DuplicateVoteException(
          "Voter "
              + voterId
              + " has already voted for proposal "
              + proposalIndex
              + " of tender "
              + tenderId);
    }
    var proposal = findProposal(tenderId, proposalIndex);
    int winnerIndex = tender.getCurrentWinningProposalIndex();
    var incumbent =
        winnerIndex == proposalIndex
            ? proposal
            : proposalRepository
                .findByTenderIdAndProposalIndex(tenderId, winnerIndex)
                .orElseThrow(
                    () ->
                        new IllegalStateException(
                            "Winning proposal " + winnerIndex + " missing on tender " + tenderId));

    proposalVoteRepository.save(new ProposalVote(tenderId, proposalIndex, voterId, Instant.now()));
    boolean tookLead = tender.recordProposalVote(proposal, incumbent);
    proposalRepository.save(proposal);
    tenderRepository.save(tender);

    var details = new LinkedHashMap<String, Object>();
    details.put("proposal_index", proposalIndex);
    details.put("voter_id", voterId);
    details.put("vote_count", proposal.getVoteCount());
    details.put("current_winning_proposal_index", tender.getCurrentWinningProposalIndex());
    audit("tender.proposal_vote_cast", tenderId, details);
    log.info(
        "Vote for proposal {} of tender {} by {} (votes={}, leader={}{})",
        proposalIndex,
        tenderId,
        voterId,
        proposal.getVoteCount(),
        tender.getCurrentWinningProposalIndex(),
        tookLead ? ", lead changed" : "");
    return proposal;
  }

  // --- Admin operations ---

  @Transactional
  public Tender overrideAndApprove(UUID tenderId, String callerId) {
    return adminTransition(
        tenderId, callerId, TenderTransition.OVERRIDE_APPROVE, Tender::overrideApprove);
  }

  @Transactional
  public Tender overrideAndDecline(UUID tenderId, String callerId) {
    return adminTransition(
        tenderId, callerId, TenderTransition.OVERRIDE_DECLINE, Tender::overrideDecline);
  }

  @Transactional
  public Tender openTenderForProposals(UUID tenderId, String callerId) {
    return adminTransition(
        tenderId, callerId, TenderTransition.OPEN_PROPOSING, Tender::openProposing);
  }

  @Transactional
  public Tender closeProposingAndOpenVoting(UUID tenderId, String callerId) {
    return adminTransition(
        tenderId, callerId, TenderTransition.CLOSE_PROPOSING, Tender::closeProposing);
  }

  @Transactional
  public Tender closeProposalVoting(UUID tenderId, String callerId) {
    return adminTransition(
        tenderId, callerId, TenderTransition.CLOSE_PROPOSAL_VOTING, Tender::closeProposalVoting);
  }

  /** Transfers admin authority to {@code newAdminId}. Only the current admin may do this. */
  @Transactional
  public Tender updateAdmin(UUID tenderId, String newAdminId, String callerId) {
    var tender = lockTender(tenderId);
    tender.requireAdmin(callerId, "update the admin of");
    if (newAdminId == null || newAdminId.isBlank()) {
      throw new InvalidRequestException("Invalid admin", "New admin must not be blank");
    }
    String previousAdmin = tender.getAdminId();
    tender.changeAdmin(newAdminId);
    tenderRepository.save(tender);

    audit(
        "tender.admin_updated",
        tenderId,
        Map.of("previous_admin_id", previousAdmin, "admin_id", newAdminId));
    log.info("Admin of tender {} changed from {} to {}", tenderId, previousAdmin, newAdminId);
    return tender;
  }

  // --- Shared helpers (package-private for TenderAwardService) ---

  Tender lockTender(UUID tenderId) {
    return tenderRepository
        .findByIdForUpdate(tenderId)
        .orElseThrow(() -> new ResourceNotFoundException("Tender", tenderId));
  }

  Proposal findProposal(UUID tenderId, int proposalIndex) {
    return proposalRepository
        .findByTenderIdAndProposalIndex(tenderId, proposalIndex)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Proposal not found",
                    "No proposal with index " + proposalIndex + " in tender " + tenderId));
  }

  void auditPhaseChange(Tender tender, TenderPhase from, TenderTransition transition) {
    audit(
        "tender.phase_changed",
        tender.getId(),
        Map.of(
            "from", from.name(),
            "to", tender.getPhase().name(),
            "transition", transition.name()));
    log.info(
        "Tender {} moved {} -> {} ({})", tender.getId(), from, tender.getPhase(), transition);
  }

  void audit(String eventType, UUID tenderId, Map<String, Object> details) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType(ENTITY_TYPE)
            .entityId(tenderId)
            .details(details)
            .build());
  }

  private Tender adminTransition(
      UUID tenderId, String callerId, TenderTransition transition, Consumer<Tender> action) {
    var tender = lockTender(tenderId);
    tender.requireAdmin(callerId, transition.action());
    var from = tender.getPhase();
    action.accept(tender);
    tenderRepository.save(tender);
    auditPhaseChange(tender, from, transition);
    return tender;
  }

  private void requireExists(UUID tenderId) {
    if (!tenderRepository.existsById(tenderId)) {
      throw new ResourceNotFoundException("Tender", tenderId);
    }
  }
}
