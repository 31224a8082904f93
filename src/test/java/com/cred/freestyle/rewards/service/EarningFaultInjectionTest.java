package com.cred.freestyle.rewards.service;

import com.cred.freestyle.rewards.domain.model.CheckInRecord;
import com.cred.freestyle.rewards.domain.model.Task;
import com.cred.freestyle.rewards.domain.model.TaskCompletion;
import com.cred.freestyle.rewards.repository.CheckInRecordRepository;
import com.cred.freestyle.rewards.repository.TaskCompletionRepository;
import com.cred.freestyle.rewards.repository.TaskRepository;
import com.cred.freestyle.rewards.service.result.CheckInReceipt;
import com.cred.freestyle.rewards.service.result.HistoryFilter;
import com.cred.freestyle.rewards.service.result.RequestState;
import com.cred.freestyle.rewards.service.result.RewardResult;
import com.cred.freestyle.rewards.service.result.TaskReceipt;
import com.cred.freestyle.rewards.testutil.IntegrationTestSupport;
import com.cred.freestyle.rewards.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.test.context.TestPropertySource;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.reset;

/**
 * The ledger credit and the earning state it pays for commit together:
 * if the state write fails after the append, the credit is rolled back.
 */
@DisplayName("Earning Fault Injection Tests")
@TestPropertySource(properties = "spring.datasource.url=jdbc:h2:mem:rewards-earning-fault;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000")
class EarningFaultInjectionTest extends IntegrationTestSupport {

    @SpyBean
    private CheckInRecordRepository checkInRecordRepository;

    @SpyBean
    private TaskCompletionRepository completionRepository;

    @Autowired
    private TaskRepository taskRepository;

    @BeforeEach
    void setUp() {
        clock.set(START);
    }

    @Test
    @DisplayName("Check-in: failed streak write rolls back the credit")
    void checkIn_StreakWriteFails_RollsBackCredit() {
        // Given
        String account = emptyAccount("streak-crash");
        doThrow(new IllegalStateException("Simulated crash writing the check-in record"))
                .when(checkInRecordRepository).save(any(CheckInRecord.class));

        // When
        RewardResult<CheckInReceipt> result = coordinator.checkIn(account);

        // Then
        assertThat(result.isFailed()).isTrue();
        assertThat(result.getTrace()).contains(RequestState.COMMITTING).endsWith(RequestState.FAILED);
        assertThat(coordinator.balanceOf(account)).isZero();
        assertThat(coordinator.getHistory(account, HistoryFilter.all(), null, 10).getEntries()).isEmpty();
        assertThat(coordinator.reconcile(account).isConsistent()).isTrue();

        // Nothing half-written blocks the same day's check-in once storage recovers
        reset(checkInRecordRepository);
        RewardResult<CheckInReceipt> retry = coordinator.checkIn(account);
        assertThat(retry.isCommitted()).as("%s", retry).isTrue();
        assertThat(coordinator.balanceOf(account)).isEqualTo(10L);
    }

    @Test
    @DisplayName("Task: failed progress write rolls back the credit")
    void completeTask_ProgressWriteFails_RollsBackCredit() {
        // Given
        Task task = taskRepository.save(TestDataBuilder.task(TestDataBuilder.uniqueId("share")).build());
        String account = emptyAccount("task-crash");
        doThrow(new IllegalStateException("Simulated crash writing task progress"))
                .when(completionRepository).save(any(TaskCompletion.class));

        // When
        RewardResult<TaskReceipt> result = coordinator.completeTask(account, task.getTaskCode());

        // Then
        assertThat(result.isFailed()).isTrue();
        assertThat(coordinator.balanceOf(account)).isZero();
        assertThat(coordinator.getHistory(account, HistoryFilter.all(), null, 10).getEntries()).isEmpty();
        assertThat(coordinator.reconcile(account).isConsistent()).isTrue();
        assertThat(completionRepository.findByAccountIdAndTaskId(account, task.getTaskId())).isEmpty();
    }
}
