package io.b2mash.tender.tender;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.tender.audit.AuditEventRecord;
import io.b2mash.tender.audit.AuditService;
import io.b2mash.tender.config.IntegrationProperties;
import io.b2mash.tender.config.TenderDefaultsProperties;
import io.b2mash.tender.exception.DependencyFailureException;
import io.b2mash.tender.exception.DuplicateVoteException;
import io.b2mash.tender.exception.ForbiddenException;
import io.b2mash.tender.exception.InvalidRequestException;
import io.b2mash.tender.exception.InvalidStateException;
import io.b2mash.tender.exception.ResourceNotFoundException;
import io.b2mash.tender.exception.VotingDeadlinePassedException;
import io.b2mash.tender.integration.CompanyDirectory;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class TenderServiceTest {

  private static final UUID TENDER_ID = UUID.randomUUID();
  private static final String ADMIN = "admin-1";
  private static final long COMPANY_ID = 42L;
  private static final String REPRESENTATIVE = "rep-42";

  @Mock private TenderRepository tenderRepository;
  @Mock private ProposalRepository proposalRepository;
  @Mock private ApprovalVoteRepository approvalVoteRepository;
  @Mock private ProposalVoteRepository proposalVoteRepository;
  @Mock private CompanyDirectory companyDirectory;
  @Mock private AuditService auditService;

  private TenderService service;

  @BeforeEach
  void setUp() {
    var integration =
        new IntegrationProperties(
            new IntegrationProperties.Endpoint("http://directory"),
            new IntegrationProperties.Endpoint("http://ledger"),
            new IntegrationProperties.Endpoint("http://factory"));
    service =
        new TenderService(
            tenderRepository,
            proposalRepository,
            approvalVoteRepository,
            proposalVoteRepository,
            companyDirectory,
            auditService,
            new TenderDefaultsProperties(Duration.ofDays(7), 3),
            integration);
  }

  private Tender tender(int requiredYesVotes, Instant deadline) {
    var tender =
        new Tender(
            "Road",
            "ipfs://road",
            deadline,
            requiredYesVotes,
            ADMIN,
            "http://directory",
            "http://ledger");
    ReflectionTestUtils.setField(tender, "id", TENDER_ID);
    return tender;
  }

  private Tender votingTender(int requiredYesVotes) {
    return tender(requiredYesVotes, Instant.now().plus(Duration.ofHours(1)));
  }

  private Tender proposingTender() {
    var tender = votingTender(1);
    tender.recordApprovalVote();
    tender.openProposing();
    return tender;
  }

  private Tender proposalVotingTender(int proposals) {
    var tender = proposingTender();
    for (int i = 0; i < proposals; i++) {
      tender.allocateProposalIndex();
    }
    tender.closeProposing();
    return tender;
  }

  private Proposal proposal(int index) {
    return new Proposal(TENDER_ID, index, COMPANY_ID + index, "rep", "ipfs://p" + index);
  }

  private void givenLocked(Tender tender) {
    when(tenderRepository.findByIdForUpdate(TENDER_ID)).thenReturn(Optional.of(tender));
  }

  // --- createTender ---

  @Test
  void createTender_appliesDefaultsAndCollaboratorRefs() {
    when(tenderRepository.save(any(Tender.class))).thenAnswer(inv -> inv.getArgument(0));

    var before = Instant.now();
    var tender = service.createTender("Road", "ipfs://road", null, null, ADMIN);

    assertThat(tender.getRequiredYesVotes()).isEqualTo(3);
    assertThat(tender.getVotingDeadline()).isAfterOrEqualTo(before.plus(Duration.ofDays(7)));
    assertThat(tender.getAdminId()).isEqualTo(ADMIN);
    assertThat(tender.getCompanyDirectoryRef()).isEqualTo("http://directory");
    assertThat(tender.getFundingLedgerRef()).isEqualTo("http://ledger");
    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    assertThat(captor.getValue().eventType()).isEqualTo("tender.created");
  }

  @Test
  void createTender_rejectsNonPositiveDuration() {
    assertThatThrownBy(
            () -> service.createTender("Road", "ipfs://road", Duration.ZERO, 2, ADMIN))
        .isInstanceOf(InvalidRequestException.class);
    verify(tenderRepository, never()).save(any());
  }

  // --- castApprovalVote ---

  @Test
  void castApprovalVote_recordsVote() {
    var tender = votingTender(3);
    givenLocked(tender);

    service.castApprovalVote(TENDER_ID, "voter-1");

    assertThat(tender.getYesVoteCount()).isEqualTo(1);
    assertThat(tender.getPhase()).isEqualTo(TenderPhase.VOTING);
    verify(approvalVoteRepository).save(any(ApprovalVote.class));
    verify(auditService, times(1)).log(any());
  }

  @Test
  void castApprovalVote_thresholdVoteApprovesInSameCall() {
    var tender = votingTender(3);
    tender.recordApprovalVote();
    tender.recordApprovalVote();
    givenLocked(tender);

    service.castApprovalVote(TENDER_ID, "voter-3");

    assertThat(tender.getPhase()).isEqualTo(TenderPhase.APPROVED);
    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService, times(2)).log(captor.capture());
    assertThat(captor.getAllValues())
        .extracting(AuditEventRecord::eventType)
        .containsExactly("tender.approval_vote_cast", "tender.phase_changed");
  }

  @Test
  void castApprovalVote_secondVoteBySameVoter_isRejected() {
    var tender = votingTender(3);
    tender.recordApprovalVote();
    givenLocked(tender);
    when(approvalVoteRepository.existsByTenderIdAndVoterId(TENDER_ID, "voter-1")).thenReturn(true);

    assertThatThrownBy(() -> service.castApprovalVote(TENDER_ID, "voter-1"))
        .isInstanceOf(DuplicateVoteException.class);

    assertThat(tender.getYesVoteCount()).isEqualTo(1);
    verify(approvalVoteRepository, never()).save(any());
  }

  @Test
  void castApprovalVote_afterDeadline_isRejected() {
    var tender = tender(3, Instant.now().minus(Duration.ofMinutes(1)));
    givenLocked(tender);

    assertThatThrownBy(() -> service.castApprovalVote(TENDER_ID, "voter-1"))
        .isInstanceOf(VotingDeadlinePassedException.class);
    verify(approvalVoteRepository, never()).existsByTenderIdAndVoterId(any(), anyString());
  }

  @Test
  void castApprovalVote_wrongPhase_isCheckedBeforeDuplicate() {
    var tender = votingTender(1);
    tender.recordApprovalVote();
    givenLocked(tender);

    assertThatThrownBy(() -> service.castApprovalVote(TENDER_ID, "voter-1"))
        .isInstanceOf(InvalidStateException.class);
    verify(approvalVoteRepository, never()).existsByTenderIdAndVoterId(any(), anyString());
  }

  @Test
  void castApprovalVote_unknownTender_isNotFound() {
    when(tenderRepository.findByIdForUpdate(TENDER_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.castApprovalVote(TENDER_ID, "voter-1"))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  // --- submitProposal ---

  @Test
  void submitProposal_byRepresentative_appendsWithNextIndex() {
    var tender = proposingTender();
    tender.allocateProposalIndex();
    givenLocked(tender);
    when(companyDirectory.lookupRepresentative(COMPANY_ID)).thenReturn(REPRESENTATIVE);
    when(proposalRepository.save(any(Proposal.class))).thenAnswer(inv -> inv.getArgument(0));

    var proposal = service.submitProposal(TENDER_ID, COMPANY_ID, "ipfs://bid", REPRESENTATIVE);

    assertThat(proposal.getProposalIndex()).isEqualTo(1);
    assertThat(proposal.getVoteCount()).isZero();
    assertThat(proposal.getSubmittedBy()).isEqualTo(REPRESENTATIVE);
    assertThat(tender.getProposalCount()).isEqualTo(2);
  }

  @Test
  void submitProposal_byNonRepresentative_isForbidden() {
    var tender = proposingTender();
    givenLocked(tender);
    when(companyDirectory.lookupRepresentative(COMPANY_ID)).thenReturn(REPRESENTATIVE);

    assertThatThrownBy(
            () -> service.submitProposal(TENDER_ID, COMPANY_ID, "ipfs://bid", "impostor"))
        .isInstanceOf(ForbiddenException.class);

    assertThat(tender.getProposalCount()).isZero();
    verify(proposalRepository, never()).save(any());
  }

  @Test
  void submitProposal_unknownCompany_isNotFound() {
    givenLocked(proposingTender());
    when(companyDirectory.lookupRepresentative(COMPANY_ID))
        .thenThrow(new ResourceNotFoundException("Company", COMPANY_ID));

    assertThatThrownBy(
            () -> service.submitProposal(TENDER_ID, COMPANY_ID, "ipfs://bid", REPRESENTATIVE))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void submitProposal_directoryDown_isDependencyFailure() {
    givenLocked(proposingTender());
    when(companyDirectory.lookupRepresentative(COMPANY_ID))
        .thenThrow(new DependencyFailureException("CompanyDirectory", "down", null));

    assertThatThrownBy(
            () -> service.submitProposal(TENDER_ID, COMPANY_ID, "ipfs://bid", REPRESENTATIVE))
        .isInstanceOf(DependencyFailureException.class);
    verify(proposalRepository, never()).save(any());
  }

  @Test
  void submitProposal_outsideProposing_doesNotCallDirectory() {
    givenLocked(votingTender(3));

    assertThatThrownBy(
            () -> service.submitProposal(TENDER_ID, COMPANY_ID, "ipfs://bid", REPRESENTATIVE))
        .isInstanceOf(InvalidStateException.class);
    verify(companyDirectory, never()).lookupRepresentative(anyLong());
  }

  // --- voteForProposal ---

  @Test
  void voteForProposal_overtakingIncumbent_changesWinner() {
    var tender = proposalVotingTender(2);
    givenLocked(tender);
    var first = proposal(0);
    var second = proposal(1);
    when(proposalRepository.findByTenderIdAndProposalIndex(TENDER_ID, 1))
        .thenReturn(Optional.of(second));
    when(proposalRepository.findByTenderIdAndProposalIndex(TENDER_ID, 0))
        .thenReturn(Optional.of(first));

    var voted = service.voteForProposal(TENDER_ID, 1, "voter-1");

    assertThat(voted.getVoteCount()).isEqualTo(1);
    assertThat(tender.getCurrentWinningProposalIndex()).isEqualTo(1);
    verify(proposalVoteRepository).save(any(ProposalVote.class));
  }

  @Test
  void voteForProposal_tie_keepsEarliestProposal() {
    var tender = proposalVotingTender(2);
    givenLocked(tender);
    var first = proposal(0);
    var second = proposal(1);
    when(proposalRepository.findByTenderIdAndProposalIndex(TENDER_ID, 0))
        .thenReturn(Optional.of(first));
    when(proposalRepository.findByTenderIdAndProposalIndex(TENDER_ID, 1))
        .thenReturn(Optional.of(second));

    service.voteForProposal(TENDER_ID, 0, "voter-1");
    service.voteForProposal(TENDER_ID, 1, "voter-2");

    assertThat(first.getVoteCount()).isEqualTo(1);
    assertThat(second.getVoteCount()).isEqualTo(1);
    assertThat(tender.getCurrentWinningProposalIndex()).isZero();
  }

  @Test
  void voteForProposal_sameVoterOnDifferentProposals_isAllowed() {
    var tender = proposalVotingTender(2);
    givenLocked(tender);
    var first = proposal(0);
    var second = proposal(1);
    when(proposalRepository.findByTenderIdAndProposalIndex(TENDER_ID, 0))
        .thenReturn(Optional.of(first));
    when(proposalRepository.findByTenderIdAndProposalIndex(TENDER_ID, 1))
        .thenReturn(Optional.of(second));

    service.voteForProposal(TENDER_ID, 0, "voter-1");
    service.voteForProposal(TENDER_ID, 1, "voter-1");

    assertThat(first.getVoteCount()).isEqualTo(1);
    assertThat(second.getVoteCount()).isEqualTo(1);
  }

  @Test
  void voteForProposal_duplicate_isRejectedWithoutCounting() {
    var tender = proposalVotingTender(1);
    givenLocked(tender);
    when(proposalVoteRepository.existsByTenderIdAndProposalIndexAndVoterId(
            TENDER_ID, 0, "voter-1"))
        .thenReturn(true);

    assertThatThrownBy(() -> service.voteForProposal(TENDER_ID, 0, "voter-1"))
        .isInstanceOf(DuplicateVoteException.class);
    verify(proposalRepository, never()).findByTenderIdAndProposalIndex(any(), anyInt());
  }

  @Test
  void voteForProposal_indexOutOfRange_isNotFound() {
    givenLocked(proposalVotingTender(1));
    when(proposalRepository.findByTenderIdAndProposalIndex(TENDER_ID, 5))
        .thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.voteForProposal(TENDER_ID, 5, "voter-1"))
        .isInstanceOf(ResourceNotFoundException.class)
        .hasMessageContaining("index 5");
    verify(proposalVoteRepository, never()).save(any());
  }

  @Test
  void voteForProposal_duringProposing_isPhaseError() {
    givenLocked(proposingTender());

    assertThatThrownBy(() -> service.voteForProposal(TENDER_ID, 0, "voter-1"))
        .isInstanceOf(InvalidStateException.class);
  }

  // --- Admin operations ---

  @Test
  void overrideAndDecline_byAdmin_declines() {
    var tender = votingTender(3);
    givenLocked(tender);

    service.overrideAndDecline(TENDER_ID, ADMIN);

    assertThat(tender.getPhase()).isEqualTo(TenderPhase.DECLINED);
    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    assertThat(captor.getValue().details())
        .containsEntry("from", "VOTING")
        .containsEntry("to", "DECLINED");
  }

  @Test
  void overrideAndApprove_byNonAdmin_isForbiddenBeforePhaseCheck() {
    var tender = proposingTender();
    givenLocked(tender);

    assertThatThrownBy(() -> service.overrideAndApprove(TENDER_ID, "someone"))
        .isInstanceOf(ForbiddenException.class);
    assertThat(tender.getPhase()).isEqualTo(TenderPhase.PROPOSING);
  }

  @Test
  void openTenderForProposals_fromVoting_isPhaseError() {
    givenLocked(votingTender(3));

    assertThatThrownBy(() -> service.openTenderForProposals(TENDER_ID, ADMIN))
        .isInstanceOf(InvalidStateException.class);
    verify(auditService, never()).log(any());
  }

  @Test
  void closeProposingAndOpenVoting_withProposals_opensVoting() {
    var tender = proposingTender();
    tender.allocateProposalIndex();
    givenLocked(tender);

    service.closeProposingAndOpenVoting(TENDER_ID, ADMIN);

    assertThat(tender.getPhase()).isEqualTo(TenderPhase.PROPOSAL_VOTING);
  }

  @Test
  void closeProposalVoting_byAdmin_closesVoting() {
    var tender = proposalVotingTender(1);
    givenLocked(tender);

    service.closeProposalVoting(TENDER_ID, ADMIN);

    assertThat(tender.getPhase()).isEqualTo(TenderPhase.VOTING_CLOSED);
  }

  @Test
  void updateAdmin_transfersAuthority() {
    var tender = votingTender(3);
    givenLocked(tender);

    service.updateAdmin(TENDER_ID, "admin-2", ADMIN);

    assertThat(tender.getAdminId()).isEqualTo("admin-2");
    assertThatThrownBy(() -> service.overrideAndDecline(TENDER_ID, ADMIN))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void updateAdmin_byNonAdmin_isForbidden() {
    var tender = votingTender(3);
    givenLocked(tender);

    assertThatThrownBy(() -> service.updateAdmin(TENDER_ID, "intruder", "intruder"))
        .isInstanceOf(ForbiddenException.class);
    assertThat(tender.getAdminId()).isEqualTo(ADMIN);
  }

  // --- Reads ---

  @Test
  void hasApprovalVote_unknownTender_isNotFound() {
    when(tenderRepository.existsById(TENDER_ID)).thenReturn(false);

    assertThatThrownBy(() -> service.hasApprovalVote(TENDER_ID, "voter-1"))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void hasProposalVote_delegatesToRepository() {
    when(tenderRepository.existsById(TENDER_ID)).thenReturn(true);
    when(proposalRepository.findByTenderIdAndProposalIndex(TENDER_ID, 0))
        .thenReturn(Optional.of(proposal(0)));
    when(proposalVoteRepository.existsByTenderIdAndProposalIndexAndVoterId(
            eq(TENDER_ID), eq(0), eq("voter-1")))
        .thenReturn(true);

    assertThat(service.hasProposalVote(TENDER_ID, 0, "voter-1")).isTrue();
  }
}
