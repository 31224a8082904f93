package com.cred.freestyle.rewards.repository;

import com.cred.freestyle.rewards.domain.model.TaskCompletion;
import com.cred.freestyle.rewards.domain.model.TaskCompletion.CompletionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for per-account task progress.
 *
 * @author Rewards Team
 */
@Repository
public interface TaskCompletionRepository extends JpaRepository<TaskCompletion, String> {

    Optional<TaskCompletion> findByAccountIdAndTaskId(String accountId, String taskId);

    long countByAccountIdAndStatus(String accountId, CompletionStatus status);
}
