package io.b2mash.tender.integration;

import java.math.BigDecimal;
import java.util.UUID;

/** Port to the ledger that holds tender funds. */
public interface FundingLedger {

  /**
   * Pays {@code amount} to the project. Throws {@link
   * io.b2mash.tender.exception.DependencyFailureException} if the ledger rejects or cannot be
   * reached.
   */
  void disburse(BigDecimal amount, UUID projectId);
}
