package com.cred.freestyle.rewards.service;

import com.cred.freestyle.rewards.domain.model.Invitation;
import com.cred.freestyle.rewards.domain.model.Invitation.Channel;
import com.cred.freestyle.rewards.domain.model.Invitation.InvitationStatus;
import com.cred.freestyle.rewards.domain.model.LedgerEntry;
import com.cred.freestyle.rewards.domain.model.SourceKind;
import com.cred.freestyle.rewards.exception.RejectionReason;
import com.cred.freestyle.rewards.repository.InvitationRepository;
import com.cred.freestyle.rewards.service.result.RewardResult;
import com.cred.freestyle.rewards.testutil.ConcurrentCalls;
import com.cred.freestyle.rewards.testutil.IntegrationTestSupport;
import com.cred.freestyle.rewards.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Invitation edges: registration, completion and the exactly-once reward.
 */
@DisplayName("Invitation Integration Tests")
class InvitationIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private InvitationRepository invitationRepository;

    @Autowired
    private LedgerService ledgerService;

    private String inviter;
    private String invitee;

    @BeforeEach
    void setUp() {
        clock.set(START);
        inviter = TestDataBuilder.uniqueId("inviter");
        invitee = TestDataBuilder.uniqueId("invitee");
    }

    private Invitation completedEdge(Channel channel) {
        Invitation edge = coordinator.registerInvitation(inviter, invitee, channel).getValue();
        assertThat(coordinator.completeInvitation(edge.getInvitationId()).isCommitted()).isTrue();
        return edge;
    }

    @Test
    @DisplayName("Claim pays the inviter and the invitee's new-user bonus")
    void claim_PaysBothSides() {
        // Given
        Invitation edge = completedEdge(Channel.STANDARD);

        // When
        RewardResult<LedgerEntry> result = coordinator.claimInvitationReward(inviter, edge.getInvitationId());

        // Then
        assertThat(result.isCommitted()).isTrue();
        assertThat(result.getValue().getSourceKind()).isEqualTo(SourceKind.INVITATION);
        assertThat(result.getValue().getSourceRef()).isEqualTo(edge.getInvitationId());
        assertThat(coordinator.balanceOf(inviter)).isEqualTo(50L);
        assertThat(coordinator.balanceOf(invitee)).isEqualTo(20L);
        assertThat(invitationRepository.findById(edge.getInvitationId()).orElseThrow().getClaimedAt()).isEqualTo(START);
    }

    @Test
    @DisplayName("Phone sign-ups pay the higher inviter reward")
    void claim_PhoneChannel() {
        Invitation edge = completedEdge(Channel.PHONE);

        coordinator.claimInvitationReward(inviter, edge.getInvitationId());

        assertThat(coordinator.balanceOf(inviter)).isEqualTo(150L);
    }

    @Test
    @DisplayName("Second claim is rejected and pays nothing")
    void claim_Twice() {
        Invitation edge = completedEdge(Channel.STANDARD);
        coordinator.claimInvitationReward(inviter, edge.getInvitationId());

        RewardResult<LedgerEntry> again = coordinator.claimInvitationReward(inviter, edge.getInvitationId());

        assertThat(again.getReason()).isEqualTo(RejectionReason.DUPLICATE_SOURCE);
        assertThat(again.getDetails()).containsKey("claimedAt");
        assertThat(coordinator.balanceOf(inviter)).isEqualTo(50L);
        assertThat(coordinator.balanceOf(invitee)).isEqualTo(20L);
    }

    @Test
    @DisplayName("Concurrent claims on one edge pay each side exactly once")
    void claim_Concurrent() throws Exception {
        Invitation edge = completedEdge(Channel.STANDARD);

        List<RewardResult<LedgerEntry>> results = ConcurrentCalls.run(6,
                i -> coordinator.claimInvitationReward(inviter, edge.getInvitationId()));

        assertThat(results).filteredOn(RewardResult::isCommitted).isNotEmpty();
        assertThat(results).filteredOn(RewardResult::isRejected)
                .allSatisfy(r -> assertThat(r.getReason()).isEqualTo(RejectionReason.DUPLICATE_SOURCE));
        assertThat(coordinator.balanceOf(inviter)).isEqualTo(50L);
        assertThat(coordinator.balanceOf(invitee)).isEqualTo(20L);
        assertThat(coordinator.reconcile(inviter).isConsistent()).isTrue();
        assertThat(coordinator.reconcile(invitee).isConsistent()).isTrue();
    }

    @Test
    @DisplayName("Re-driving a half-applied claim pays only the missing side")
    void claim_ResumesPartialPayout() {
        // Given: the invitee bonus landed but the claim never finished
        Invitation edge = completedEdge(Channel.STANDARD);
        ledgerService.append(invitee, 20L, SourceKind.NEW_USER_BONUS, edge.getInvitationId(), "New user bonus");

        // When
        RewardResult<LedgerEntry> result = coordinator.claimInvitationReward(inviter, edge.getInvitationId());

        // Then
        assertThat(result.isCommitted()).isTrue();
        assertThat(coordinator.balanceOf(inviter)).isEqualTo(50L);
        assertThat(coordinator.balanceOf(invitee)).isEqualTo(20L);
    }

    @Test
    @DisplayName("Claim before completion, or by someone else, is rejected")
    void claim_Rejections() {
        Invitation edge = coordinator.registerInvitation(inviter, invitee, Channel.STANDARD).getValue();

        assertThat(coordinator.claimInvitationReward(inviter, edge.getInvitationId()).getReason())
                .isEqualTo(RejectionReason.INVITATION_NOT_COMPLETED);

        coordinator.completeInvitation(edge.getInvitationId());
        assertThat(coordinator.claimInvitationReward(invitee, edge.getInvitationId()).getReason())
                .isEqualTo(RejectionReason.NOT_INVITER);
        assertThat(coordinator.balanceOf(inviter)).isZero();
    }

    @Test
    @DisplayName("Self-invites, a missing inviter and a second inviter for the same invitee are refused")
    void register_Rejections() {
        assertThat(coordinator.registerInvitation(null, invitee, Channel.STANDARD).getReason())
                .isEqualTo(RejectionReason.INVALID_INVITATION);
        assertThat(coordinator.registerInvitation(inviter, inviter, Channel.STANDARD).getReason())
                .isEqualTo(RejectionReason.INVALID_INVITATION);

        coordinator.registerInvitation(inviter, invitee, Channel.STANDARD);
        RewardResult<Invitation> second = coordinator.registerInvitation(TestDataBuilder.uniqueId("other"), invitee, Channel.STANDARD);
        assertThat(second.getReason()).isEqualTo(RejectionReason.INVALID_INVITATION);
    }

    @Test
    @DisplayName("Completing twice is a no-op")
    void complete_Idempotent() {
        Invitation edge = completedEdge(Channel.STANDARD);

        RewardResult<Invitation> again = coordinator.completeInvitation(edge.getInvitationId());

        assertThat(again.isCommitted()).isTrue();
        assertThat(again.getValue().getStatus()).isEqualTo(InvitationStatus.COMPLETED);
    }
}
