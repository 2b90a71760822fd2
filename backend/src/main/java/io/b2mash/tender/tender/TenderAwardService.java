package io.b2mash.tender.tender;

import io.b2mash.tender.exception.InvalidRequestException;
import io.b2mash.tender.integration.FundingLedger;
import io.b2mash.tender.integration.ProjectFactory;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Awards a closed tender to its running winner: creates the project, records the result, then
 * disburses the funds.
 *
 * <p>All database writes share one transaction, so any failure rolls them back. They are flushed
 * before the disbursement, which is the last step that can fail. The project factory call is
 * outside that transaction; when any later step fails, the project is discarded before the error
 * propagates. A failed discard is logged and attached to the propagated error as suppressed.
 */
@Service
public class TenderAwardService {

  private static final Logger log = LoggerFactory.getLogger(TenderAwardService.class);

  private final TenderService tenderService;
  private final TenderRepository tenderRepository;
  private final ProjectFactory projectFactory;
  private final FundingLedger fundingLedger;

  public TenderAwardService(
      TenderService tenderService,
      TenderRepository tenderRepository,
      ProjectFactory projectFactory,
      FundingLedger fundingLedger) {
    this.tenderService = tenderService;
    this.tenderRepository = tenderRepository;
    this.projectFactory = projectFactory;
    this.fundingLedger = fundingLedger;
  }

  @Transactional
  public AwardResult awardProposal(UUID tenderId, BigDecimal fundingAmount, String callerId) {
    var tender = tenderService.lockTender(tenderId);
    tender.requireAdmin(callerId, TenderTransition.AWARD.action());
    tender.requireTransition(TenderTransition.AWARD);
    if (fundingAmount == null || fundingAmount.signum() <= 0) {
      throw new InvalidRequestException(
          "Invalid funding amount", "Funding amount must be positive, got " + fundingAmount);
    }

    var winner = tenderService.findProposal(tenderId, tender.getCurrentWinningProposalIndex());
    UUID projectId = projectFactory.createProject(tenderId, winner.getCompanyId());
    log.info(
        "Created project {} for tender {} (proposal {}, company {})",
        projectId,
        tenderId,
        winner.getProposalIndex(),
        winner.getCompanyId());

    try {
      var from = tender.getPhase();
      tender.markAwarded(projectId, fundingAmount);
      tenderRepository.save(tender);

      var details = new LinkedHashMap<String, Object>();
      details.put("winning_proposal_index", winner.getProposalIndex());
      details.put("company_id", winner.getCompanyId());
      details.put("project_id", projectId.toString());
      details.put("funding_amount", fundingAmount.toPlainString());
      tenderService.audit("tender.awarded", tenderId, details);
      tenderService.auditPhaseChange(tender, from, TenderTransition.AWARD);
      // Pending writes must hit the database before money moves.
      tenderRepository.flush();

      fundingLedger.disburse(fundingAmount, projectId);
    } catch (RuntimeException e) {
      discardAfterFailedAward(tenderId, projectId, e);
      throw e;
    }

    log.info(
        "Awarded tender {} to proposal {} (project {}, amount {})",
        tenderId,
        winner.getProposalIndex(),
        projectId,
        fundingAmount.toPlainString());
    return new AwardResult(
        tenderId, winner.getProposalIndex(), winner.getCompanyId(), projectId, fundingAmount);
  }

  private void discardAfterFailedAward(UUID tenderId, UUID projectId, RuntimeException failure) {
    log.warn(
        "Award of tender {} failed after project {} was created, discarding it: {}",
        tenderId,
        projectId,
        failure.getMessage());
    try {
      projectFactory.discardProject(projectId);
    } catch (RuntimeException discardFailure) {
      log.error(
          "Failed to discard project {} after failed award of tender {}",
          projectId,
          tenderId,
          discardFailure);
      failure.addSuppressed(discardFailure);
    }
  }
}
