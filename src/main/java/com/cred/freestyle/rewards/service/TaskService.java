package com.cred.freestyle.rewards.service;

import com.cred.freestyle.rewards.domain.model.LedgerEntry;
import com.cred.freestyle.rewards.domain.model.Task;
import com.cred.freestyle.rewards.domain.model.TaskCompletion;
import com.cred.freestyle.rewards.exception.ResourceNotFoundException;
import com.cred.freestyle.rewards.repository.TaskCompletionRepository;
import com.cred.freestyle.rewards.repository.TaskRepository;
import com.cred.freestyle.rewards.service.result.RequestState;
import com.cred.freestyle.rewards.service.result.RewardRequest;
import com.cred.freestyle.rewards.service.result.TaskReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Task completion rewards.
 *
 * @author Rewards Team
 */
@Service
public class TaskService {

    private static final Logger logger = LoggerFactory.getLogger(TaskService.class);

    private final TaskRepository taskRepository;
    private final TaskCompletionRepository completionRepository;
    private final LedgerService ledgerService;
    private final EarningRulesEngine rulesEngine;
    private final Clock clock;

    public TaskService(
            TaskRepository taskRepository,
            TaskCompletionRepository completionRepository,
            LedgerService ledgerService,
            EarningRulesEngine rulesEngine,
            Clock clock
    ) {
        this.taskRepository = taskRepository;
        this.completionRepository = completionRepository;
        this.ledgerService = ledgerService;
        this.rulesEngine = rulesEngine;
        this.clock = clock;
    }

    /**
     * Record one completion of a task and credit its reward.
     *
     * @param accountId Account ID
     * @param taskCode Task code
     * @param request Request being processed
     * @return reward, new balance and completion progress
     */
    @Transactional
    public TaskReceipt completeTask(String accountId, String taskCode, RewardRequest request) {
        Task task = taskRepository.findByTaskCode(taskCode)
                .orElseThrow(() -> new ResourceNotFoundException("Task", taskCode));
        Instant now = clock.instant();

        ledgerService.lockAccount(accountId);
        TaskCompletion progress = completionRepository.findByAccountIdAndTaskId(accountId, task.getTaskId())
                .orElse(null);
        TaskDecision decision = rulesEngine.decideTaskCompletion(accountId, task, progress, now);

        request.advance(RequestState.COMMITTING);
        EarningDecision reward = decision.getReward();
        LedgerEntry entry = ledgerService.append(accountId, reward.getDelta(), reward.getSourceKind(),
                reward.getSourceRef(), reward.getDescription());

        if (progress == null) {
            progress = TaskCompletion.builder()
                    .accountId(accountId)
                    .taskId(task.getTaskId())
                    .build();
        }
        progress.setCompletionCount(decision.getNextCompletionCount());
        progress.setLastCompletedAt(now);
        progress.setStatus(decision.getNextStatus());
        completionRepository.save(progress);

        logger.info("Task {} completed by account {}: completion {}, status {}, +{} points",
                   taskCode, accountId, decision.getNextCompletionCount(), decision.getNextStatus(), reward.getDelta());

        return TaskReceipt.builder()
                .taskCode(taskCode)
                .pointsEarned(reward.getDelta())
                .newBalance(entry.getBalanceAfter())
                .completionCount(decision.getNextCompletionCount())
                .status(decision.getNextStatus())
                .ledgerEntryId(entry.getEntryId())
                .build();
    }
}
