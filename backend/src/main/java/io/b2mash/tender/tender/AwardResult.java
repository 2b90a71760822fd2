package io.b2mash.tender.tender;

import java.math.BigDecimal;
import java.util.UUID;

/** Outcome of a successful award: who won and what was created and paid. */
public record AwardResult(
    UUID tenderId,
    int winningProposalIndex,
    long companyId,
    UUID projectId,
    BigDecimal fundingAmount) {}
