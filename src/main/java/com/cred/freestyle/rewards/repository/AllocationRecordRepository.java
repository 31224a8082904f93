package com.cred.freestyle.rewards.repository;

import com.cred.freestyle.rewards.domain.model.AllocationRecord;
import com.cred.freestyle.rewards.domain.model.AllocationRecord.AllocationType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for allocation records. Append-only.
 *
 * @author Rewards Team
 */
@Repository
public interface AllocationRecordRepository extends JpaRepository<AllocationRecord, String> {

    long countByAccountIdAndAllocationTypeAndSourceRef(String accountId, AllocationType allocationType, String sourceRef);

    long countByCandidateId(String candidateId);

    List<AllocationRecord> findByAccountIdOrderByCreatedAtDesc(String accountId);
}
