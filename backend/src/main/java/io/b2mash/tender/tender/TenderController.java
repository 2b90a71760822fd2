package io.b2mash.tender.tender;

import io.b2mash.tender.audit.AuditEvent;
import io.b2mash.tender.security.CallerIdentity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tenders")
public class TenderController {

  private final TenderService tenderService;
  private final TenderAwardService tenderAwardService;

  public TenderController(TenderService tenderService, TenderAwardService tenderAwardService) {
    this.tenderService = tenderService;
    this.tenderAwardService = tenderAwardService;
  }

  // --- Tender ---

  @PostMapping
  public ResponseEntity<TenderResponse> createTender(
      @Valid @RequestBody CreateTenderRequest request) {
    var tender =
        tenderService.createTender(
            request.title(),
            request.descriptorUri(),
            request.votingDuration(),
            request.requiredYesVotes(),
            CallerIdentity.requireCallerId());
    return ResponseEntity.created(URI.create("/api/tenders/" + tender.getId()))
        .body(TenderResponse.from(tender));
  }

  @GetMapping
  public ResponseEntity<Page<TenderResponse>> listTenders(
      @RequestParam(required = false) TenderPhase phase, Pageable pageable) {
    return ResponseEntity.ok(tenderService.listTenders(phase, pageable).map(TenderResponse::from));
  }

  @GetMapping("/{id}")
  public ResponseEntity<TenderResponse> getTender(@PathVariable UUID id) {
    return ResponseEntity.ok(TenderResponse.from(tenderService.getTender(id)));
  }

  // --- Approval voting ---

  @PostMapping("/{id}/approval-votes")
  public ResponseEntity<TenderResponse> castApprovalVote(@PathVariable UUID id) {
    var tender = tenderService.castApprovalVote(id, CallerIdentity.requireCallerId());
    return ResponseEntity.ok(TenderResponse.from(tender));
  }

  @GetMapping("/{id}/approval-votes/{voterId}")
  public ResponseEntity<VoteStatusResponse> getApprovalVote(
      @PathVariable UUID id, @PathVariable String voterId) {
    return ResponseEntity.ok(
        new VoteStatusResponse(voterId, tenderService.hasApprovalVote(id, voterId)));
  }

  // --- Proposals ---

  @PostMapping("/{id}/proposals")
  public ResponseEntity<ProposalResponse> submitProposal(
      @PathVariable UUID id, @Valid @RequestBody SubmitProposalRequest request) {
    var proposal =
        tenderService.submitProposal(
            id, request.companyId(), request.descriptorUri(), CallerIdentity.requireCallerId());
    return ResponseEntity.created(
            URI.create("/api/tenders/" + id + "/proposals/" + proposal.getProposalIndex()))
        .body(ProposalResponse.from(proposal));
  }

  @GetMapping("/{id}/proposals")
  public ResponseEntity<List<ProposalResponse>> listProposals(@PathVariable UUID id) {
    return ResponseEntity.ok(
        tenderService.getProposals(id).stream().map(ProposalResponse::from).toList());
  }

  @PostMapping("/{id}/proposals/{index}/votes")
  public ResponseEntity<ProposalResponse> voteForProposal(
      @PathVariable UUID id, @PathVariable int index) {
    var proposal = tenderService.voteForProposal(id, index, CallerIdentity.requireCallerId());
    return ResponseEntity.ok(ProposalResponse.from(proposal));
  }

  @GetMapping("/{id}/proposals/{index}/votes/{voterId}")
  public ResponseEntity<VoteStatusResponse> getProposalVote(
      @PathVariable UUID id, @PathVariable int index, @PathVariable String voterId) {
    return ResponseEntity.ok(
        new VoteStatusResponse(voterId, tenderService.hasProposalVote(id, index, voterId)));
  }

  // --- Admin ---

  @PostMapping("/{id}/override/approve")
  public ResponseEntity<TenderResponse> overrideAndApprove(@PathVariable UUID id) {
    var tender = tenderService.overrideAndApprove(id, CallerIdentity.requireCallerId());
    return ResponseEntity.ok(TenderResponse.from(tender));
  }

  @PostMapping("/{id}/override/decline")
  public ResponseEntity<TenderResponse> overrideAndDecline(@PathVariable UUID id) {
    var tender = tenderService.overrideAndDecline(id, CallerIdentity.requireCallerId());
    return ResponseEntity.ok(TenderResponse.from(tender));
  }

  @PostMapping("/{id}/proposing/open")
  public ResponseEntity<TenderResponse> openProposing(@PathVariable UUID id) {
    var tender = tenderService.openTenderForProposals(id, CallerIdentity.requireCallerId());
    return ResponseEntity.ok(TenderResponse.from(tender));
  }

  @PostMapping("/{id}/proposing/close")
  public ResponseEntity<TenderResponse> closeProposing(@PathVariable UUID id) {
    var tender = tenderService.closeProposingAndOpenVoting(id, CallerIdentity.requireCallerId());
    return ResponseEntity.ok(TenderResponse.from(tender));
  }

  @PostMapping("/{id}/proposal-voting/close")
  public ResponseEntity<TenderResponse> closeProposalVoting(@PathVariable UUID id) {
    var tender = tenderService.closeProposalVoting(id, CallerIdentity.requireCallerId());
    return ResponseEntity.ok(TenderResponse.from(tender));
  }

  @PostMapping("/{id}/award")
  public ResponseEntity<AwardResult> award(
      @PathVariable UUID id, @Valid @RequestBody AwardRequest request) {
    var result =
        tenderAwardService.awardProposal(
            id, request.fundingAmount(), CallerIdentity.requireCallerId());
    return ResponseEntity.ok(result);
  }

  @PutMapping("/{id}/admin")
  public ResponseEntity<TenderResponse> updateAdmin(
      @PathVariable UUID id, @Valid @RequestBody UpdateAdminRequest request) {
    var tender =
        tenderService.updateAdmin(id, request.newAdminId(), CallerIdentity.requireCallerId());
    return ResponseEntity.ok(TenderResponse.from(tender));
  }

  // --- Audit trail ---

  @GetMapping("/{id}/events")
  public ResponseEntity<Page<TenderEventResponse>> listEvents(
      @PathVariable UUID id,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {
    var pageable = PageRequest.of(page, Math.min(size, 200));
    return ResponseEntity.ok(tenderService.getEvents(id, pageable).map(TenderEventResponse::from));
  }

  // --- DTOs ---

  public record CreateTenderRequest(
      @Size(max = 200, message = "title must not exceed 200 characters") String title,
      @NotBlank(message = "descriptorUri is required")
          @Size(max = 2048, message = "descriptorUri must not exceed 2048 characters")
          String descriptorUri,
      Duration votingDuration,
      @Min(value = 1, message = "requiredYesVotes must be at least 1") Integer requiredYesVotes) {}

  public record SubmitProposalRequest(
      @NotNull(message = "companyId is required") Long companyId,
      @NotBlank(message = "descriptorUri is required")
          @Size(max = 2048, message = "descriptorUri must not exceed 2048 characters")
          String descriptorUri) {}

  public record AwardRequest(
      @NotNull(message = "fundingAmount is required")
          @Positive(message = "fundingAmount must be positive")
          BigDecimal fundingAmount) {}

  public record UpdateAdminRequest(
      @NotBlank(message = "newAdminId is required")
          @Size(max = 255, message = "newAdminId must not exceed 255 characters")
          String newAdminId) {}

  public record VoteStatusResponse(String voterId, boolean voted) {}

  public record TenderResponse(
      UUID id,
      String title,
      String descriptorUri,
      TenderPhase phase,
      Instant votingDeadline,
      int yesVoteCount,
      int requiredYesVotes,
      String adminId,
      String companyDirectoryRef,
      String fundingLedgerRef,
      int proposalCount,
      int currentWinningProposalIndex,
      Integer winningProposalIndex,
      UUID awardedProjectId,
      BigDecimal awardedAmount,
      Instant awardedAt,
      String createdBy,
      Instant createdAt,
      Instant updatedAt) {

    public static TenderResponse from(Tender tender) {
      return new TenderResponse(
          tender.getId(),
          tender.getTitle(),
          tender.getDescriptorUri(),
          tender.getPhase(),
          tender.getVotingDeadline(),
          tender.getYesVoteCount(),
          tender.getRequiredYesVotes(),
          tender.getAdminId(),
          tender.getCompanyDirectoryRef(),
          tender.getFundingLedgerRef(),
          tender.getProposalCount(),
          tender.getCurrentWinningProposalIndex(),
          tender.getWinningProposalIndex(),
          tender.getAwardedProjectId(),
          tender.getAwardedAmount(),
          tender.getAwardedAt(),
          tender.getCreatedBy(),
          tender.getCreatedAt(),
          tender.getUpdatedAt());
    }
  }

  public record ProposalResponse(
      UUID id,
      int proposalIndex,
      long companyId,
      String submittedBy,
      String descriptorUri,
      int voteCount,
      Instant createdAt) {

    public static ProposalResponse from(Proposal proposal) {
      return new ProposalResponse(
          proposal.getId(),
          proposal.getProposalIndex(),
          proposal.getCompanyId(),
          proposal.getSubmittedBy(),
          proposal.getDescriptorUri(),
          proposal.getVoteCount(),
          proposal.getCreatedAt());
    }
  }

  public record TenderEventResponse(
      UUID id,
      String eventType,
      String actorId,
      String actorType,
      String source,
      Map<String, Object> details,
      Instant occurredAt) {

    public static TenderEventResponse from(AuditEvent event) {
      return new TenderEventResponse(
          event.getId(),
          event.getEventType(),
          event.getActorId(),
          event.getActorType(),
          event.getSource(),
          event.getDetails(),
          event.getOccurredAt());
    }
  }
}
