package io.b2mash.tender.tender;

/** Lifecycle phase of a tender. Legal moves between phases are listed in {@link TenderTransition}. */
public enum TenderPhase {
  /** Initial phase: the community votes on whether the tender proceeds. */
  VOTING,

  /** Approved by vote or admin override; waiting for the admin to open proposing. */
  APPROVED,

  /** Declined by the admin. Can still be approved by override. */
  DECLINED,

  /** Registered companies submit proposals. */
  PROPOSING,

  /** Voters choose among the submitted proposals. */
  PROPOSAL_VOTING,

  /** Proposal voting has ended; the running winner is final. */
  VOTING_CLOSED,

  /** Terminal: the winning proposal has been awarded and funded. */
  AWARDED;

  /** Returns true if no transition leaves this phase. */
  public boolean isTerminal() {
    return TenderTransition.fromPhase(this).isEmpty();
  }
}
