package com.cred.freestyle.rewards.service;

import com.cred.freestyle.rewards.domain.model.BlindBox;
import com.cred.freestyle.rewards.domain.model.BlindBox.BoxStatus;
import com.cred.freestyle.rewards.exception.RejectionReason;
import com.cred.freestyle.rewards.exception.RewardRejectedException;
import com.cred.freestyle.rewards.repository.BlindBoxRepository;
import com.cred.freestyle.rewards.service.result.RechargeCompletion;
import com.cred.freestyle.rewards.service.result.RequestState;
import com.cred.freestyle.rewards.service.result.RewardRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("BlindBoxService Unit Tests")
class BlindBoxServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-04T12:00:00Z");

    @Mock
    private BlindBoxRepository blindBoxRepository;

    @Mock
    private InventoryAllocator allocator;

    @Mock
    private PrizeGrantService prizeGrantService;

    private RewardRequest request;

    @BeforeEach
    void setUp() {
        request = RewardRequest.received("record_recharge_completed", "acct-1");
        request.beginAttempt();
    }

    private BlindBoxService service(BlindBoxEligibilityPolicy policy) {
        return new BlindBoxService(blindBoxRepository, allocator, prizeGrantService, policy,
                Clock.fixed(NOW, ZoneOffset.UTC), "blind-box", 7);
    }

    private RechargeCompletion completion(BigDecimal amount) {
        return RechargeCompletion.builder()
                .accountId("acct-1")
                .orderId("order-1")
                .amount(amount)
                .latitude(12.97)
                .longitude(77.59)
                .build();
    }

    @Test
    @DisplayName("Ineligible recharge issues nothing")
    void ineligible_IssuesNothing() {
        when(blindBoxRepository.findByOrderId("order-1")).thenReturn(Optional.empty());

        Optional<BlindBox> box = service(c -> false).recordRechargeCompleted(completion(BigDecimal.TEN), request);

        assertThat(box).isEmpty();
        assertThat(request.getState()).isEqualTo(RequestState.VALIDATING);
        verify(blindBoxRepository, never()).save(any());
    }

    @Test
    @DisplayName("Eligible recharge issues an unopened box expiring after the validity window")
    void eligible_IssuesBox() {
        when(blindBoxRepository.findByOrderId("order-1")).thenReturn(Optional.empty());
        when(blindBoxRepository.save(any(BlindBox.class))).thenAnswer(invocation -> invocation.getArgument(0));

        BlindBox box = service(c -> c.getLatitude() != null).recordRechargeCompleted(completion(BigDecimal.TEN), request)
                .orElseThrow();

        assertThat(box.getStatus()).isEqualTo(BoxStatus.UNOPENED);
        assertThat(box.getPoolId()).isEqualTo("blind-box");
        assertThat(box.getExpiresAt()).isEqualTo(NOW.plusSeconds(7L * 24 * 3600));
        assertThat(request.getState()).isEqualTo(RequestState.COMMITTING);
    }

    @Test
    @DisplayName("Missing amount is rejected before the policy runs")
    void missingAmount_Rejected() {
        BlindBoxEligibilityPolicy policy = mock(BlindBoxEligibilityPolicy.class);

        assertThatThrownBy(() -> service(policy).recordRechargeCompleted(completion(null), request))
                .isInstanceOf(RewardRejectedException.class)
                .extracting(e -> ((RewardRejectedException) e).getReason())
                .isEqualTo(RejectionReason.INVALID_AMOUNT);
        verifyNoInteractions(policy, blindBoxRepository);
    }
}
