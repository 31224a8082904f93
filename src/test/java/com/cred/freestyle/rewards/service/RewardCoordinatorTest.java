package com.cred.freestyle.rewards.service;

import com.cred.freestyle.rewards.domain.model.Invitation;
import com.cred.freestyle.rewards.domain.model.Invitation.Channel;
import com.cred.freestyle.rewards.exception.InsufficientBalanceException;
import com.cred.freestyle.rewards.exception.RejectionReason;
import com.cred.freestyle.rewards.exception.RewardRejectedException;
import com.cred.freestyle.rewards.infrastructure.metrics.RewardsMetricsService;
import com.cred.freestyle.rewards.service.result.CheckInReceipt;
import com.cred.freestyle.rewards.service.result.DrawReceipt;
import com.cred.freestyle.rewards.service.result.RequestState;
import com.cred.freestyle.rewards.service.result.RewardRequest;
import com.cred.freestyle.rewards.service.result.RewardResult;
import com.cred.freestyle.rewards.service.result.RewardStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RewardCoordinator outcome mapping and retries.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RewardCoordinator Unit Tests")
class RewardCoordinatorTest {

    private static final String ACCOUNT = "user-123";

    @Mock
    private LedgerService ledgerService;

    @Mock
    private CheckInService checkInService;

    @Mock
    private TaskService taskService;

    @Mock
    private LotteryService lotteryService;

    @Mock
    private BlindBoxService blindBoxService;

    @Mock
    private PointsMallService pointsMallService;

    @Mock
    private InvitationService invitationService;

    @Mock
    private PointsGrantService pointsGrantService;

    @Mock
    private RewardStatsService statsService;

    @Mock
    private RewardsMetricsService metricsService;

    private RewardCoordinator coordinator;

    @BeforeEach
    void setUp() {
        coordinator = new RewardCoordinator(ledgerService, checkInService, taskService, lotteryService,
                blindBoxService, pointsMallService, invitationService, pointsGrantService, statsService,
                metricsService, 3, 0L);
    }

    private CheckInReceipt receipt() {
        return CheckInReceipt.builder()
                .checkInDate(LocalDate.of(2024, 3, 10))
                .pointsEarned(10L)
                .consecutiveDays(1)
                .cycleDay(1)
                .newBalance(10L)
                .ledgerEntryId(1L)
                .build();
    }

    @Test
    @DisplayName("Committed - Account is provisioned and the value returned")
    void execute_Committed() {
        // Given
        CheckInReceipt receipt = receipt();
        when(checkInService.checkIn(eq(ACCOUNT), any(RewardRequest.class))).thenReturn(receipt);

        // When
        RewardResult<CheckInReceipt> result = coordinator.checkIn(ACCOUNT);

        // Then
        assertThat(result.getStatus()).isEqualTo(RewardStatus.COMMITTED);
        assertThat(result.getValue()).isSameAs(receipt);
        assertThat(result.getAttempts()).isEqualTo(1);
        assertThat(result.getTrace()).containsExactly(
                RequestState.RECEIVED, RequestState.VALIDATING, RequestState.COMMITTING, RequestState.COMMITTED);
        verify(ledgerService).openAccount(ACCOUNT);
        verify(metricsService).recordCommitted("check_in");
        verify(metricsService).recordLatency(eq("check_in"), anyLong());
    }

    @Test
    @DisplayName("Rejected - Business rejection becomes a result with reason and details")
    void execute_Rejected() {
        when(lotteryService.draw(eq(ACCOUNT), eq("act-1"), any(RewardRequest.class)))
                .thenThrow(new InsufficientBalanceException(ACCOUNT, 100L, 40L));

        RewardResult<DrawReceipt> result = coordinator.draw(ACCOUNT, "act-1");

        assertThat(result.isRejected()).isTrue();
        assertThat(result.getReason()).isEqualTo(RejectionReason.INSUFFICIENT_BALANCE);
        assertThat(result.getDetails()).containsEntry("required", 100L).containsEntry("available", 40L);
        assertThat(result.getValue()).isNull();
        assertThat(result.getTrace()).endsWith(RequestState.REJECTED);
        verify(metricsService).recordRejected("draw", "INSUFFICIENT_BALANCE");
        verify(lotteryService, times(1)).draw(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("Retry - Transient lock failure is retried and then commits")
    void execute_TransientThenCommitted() {
        when(checkInService.checkIn(eq(ACCOUNT), any(RewardRequest.class)))
                .thenThrow(new CannotAcquireLockException("lock timeout"))
                .thenReturn(receipt());

        RewardResult<CheckInReceipt> result = coordinator.checkIn(ACCOUNT);

        assertThat(result.isCommitted()).isTrue();
        assertThat(result.getAttempts()).isEqualTo(2);
        verify(metricsService).recordRetry("check_in");
    }

    @Test
    @DisplayName("Failed - Conflict persisting past the retry budget fails the request")
    void execute_RetryBudgetExhausted() {
        when(checkInService.checkIn(eq(ACCOUNT), any(RewardRequest.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));

        RewardResult<CheckInReceipt> result = coordinator.checkIn(ACCOUNT);

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getAttempts()).isEqualTo(3);
        assertThat(result.getTrace()).endsWith(RequestState.FAILED);
        verify(checkInService, times(3)).checkIn(eq(ACCOUNT), any());
        verify(metricsService, times(2)).recordRetry("check_in");
        verify(metricsService).recordFailed("check_in", "DataIntegrityViolationException");
    }

    @Test
    @DisplayName("Failed - Unexpected error is not retried")
    void execute_UnexpectedError() {
        when(checkInService.checkIn(eq(ACCOUNT), any(RewardRequest.class)))
                .thenThrow(new IllegalStateException("boom"));

        RewardResult<CheckInReceipt> result = coordinator.checkIn(ACCOUNT);

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getAttempts()).isEqualTo(1);
        assertThat(result.getMessage()).contains("boom");
        verify(metricsService, never()).recordRetry(anyString());
    }

    @Test
    @DisplayName("registerInvitation - Both sides of the edge are provisioned")
    void registerInvitation_OpensBothAccounts() {
        Invitation invitation = Invitation.builder().invitationId("inv-1").build();
        when(invitationService.register(eq("inviter"), eq("invitee"), eq(Channel.PHONE), any(RewardRequest.class)))
                .thenReturn(invitation);

        RewardResult<Invitation> result = coordinator.registerInvitation("inviter", "invitee", Channel.PHONE);

        assertThat(result.getValue()).isSameAs(invitation);
        verify(ledgerService).openAccount("inviter");
        verify(ledgerService).openAccount("invitee");
    }

    @Test
    @DisplayName("registerInvitation - Missing inviter is returned as a rejection, not thrown")
    void registerInvitation_MissingInviter_Rejected() {
        when(invitationService.register(isNull(), eq("invitee"), eq(Channel.STANDARD), any(RewardRequest.class)))
                .thenThrow(RewardRejectedException.of(RejectionReason.INVALID_INVITATION, "Invitation needs both an inviter and an invitee"));

        RewardResult<Invitation> result = coordinator.registerInvitation(null, "invitee", Channel.STANDARD);

        assertThat(result.isRejected()).isTrue();
        assertThat(result.getReason()).isEqualTo(RejectionReason.INVALID_INVITATION);
        verify(ledgerService).openAccount("invitee");
        verify(ledgerService, times(1)).openAccount(any());
    }

    @Test
    @DisplayName("refundExchange - No account is provisioned for operator operations on an exchange")
    void refundExchange_NoProvisioning() {
        coordinator.refundExchange("ex-1", "customer request");

        verify(ledgerService, never()).openAccount(anyString());
        verify(pointsMallService).refund(eq("ex-1"), eq("customer request"), any(RewardRequest.class));
    }
}
