package io.b2mash.tender.tender;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ApprovalVoteRepository extends JpaRepository<ApprovalVote, UUID> {

  boolean existsByTenderIdAndVoterId(UUID tenderId, String voterId);
}
