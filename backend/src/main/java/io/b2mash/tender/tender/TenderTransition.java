package io.b2mash.tender.tender;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * The complete table of legal tender phase transitions. Every phase change of a {@link Tender} goes
 * through one of these entries; anything not listed here cannot happen.
 */
public enum TenderTransition {
  AUTO_APPROVE("approve", Set.of(TenderPhase.VOTING), TenderPhase.APPROVED),
  OVERRIDE_APPROVE(
      "override and approve",
      Set.of(TenderPhase.VOTING, TenderPhase.DECLINED),
      TenderPhase.APPROVED),
  OVERRIDE_DECLINE(
      "override and decline",
      Set.of(TenderPhase.VOTING, TenderPhase.APPROVED),
      TenderPhase.DECLINED),
  OPEN_PROPOSING("open proposing for", Set.of(TenderPhase.APPROVED), TenderPhase.PROPOSING),
  CLOSE_PROPOSING(
      "close proposing for", Set.of(TenderPhase.PROPOSING), TenderPhase.PROPOSAL_VOTING),
  CLOSE_PROPOSAL_VOTING(
      "close proposal voting for",
      Set.of(TenderPhase.PROPOSAL_VOTING),
      TenderPhase.VOTING_CLOSED),
  AWARD("award", Set.of(TenderPhase.VOTING_CLOSED), TenderPhase.AWARDED);

  private final String action;
  private final Set<TenderPhase> sources;
  private final TenderPhase target;

  TenderTransition(String action, Set<TenderPhase> sources, TenderPhase target) {
    this.action = action;
    this.sources = sources;
    this.target = target;
  }

  /** Human-readable verb phrase used in error messages ("Cannot {action} tender in phase X"). */
  public String action() {
    return action;
  }

  public TenderPhase target() {
    return target;
  }

  /** Returns true if this transition may fire while the tender is in {@code phase}. */
  public boolean permits(TenderPhase phase) {
    return sources.contains(phase);
  }

  /** Returns the transitions that may fire from {@code phase}. */
  public static List<TenderTransition> fromPhase(TenderPhase phase) {
    return Arrays.stream(values()).filter(t -> t.permits(phase)).toList();
  }

  /** Returns true if some transition moves a tender directly from {@code from} to {@code to}. */
  public static boolean isLegalEdge(TenderPhase from, TenderPhase to) {
    return Arrays.stream(values()).anyMatch(t -> t.permits(from) && t.target() == to);
  }
}
