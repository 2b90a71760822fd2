package io.b2mash.tender.tender;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProposalVoteRepository extends JpaRepository<ProposalVote, UUID> {

  boolean existsByTenderIdAndProposalIndexAndVoterId(
      UUID tenderId, int proposalIndex, String voterId);
}
