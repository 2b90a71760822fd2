package io.b2mash.tender.tender;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProposalRepository extends JpaRepository<Proposal, UUID> {

  List<Proposal> findByTenderIdOrderByProposalIndex(UUID tenderId);

  Optional<Proposal> findByTenderIdAndProposalIndex(UUID tenderId, int proposalIndex);
}
