package com.cred.freestyle.rewards.service;

import com.cred.freestyle.rewards.domain.model.Invitation;
import com.cred.freestyle.rewards.domain.model.Invitation.Channel;
import com.cred.freestyle.rewards.domain.model.Invitation.InvitationStatus;
import com.cred.freestyle.rewards.domain.model.LedgerEntry;
import com.cred.freestyle.rewards.exception.RejectionReason;
import com.cred.freestyle.rewards.exception.ResourceNotFoundException;
import com.cred.freestyle.rewards.exception.RewardRejectedException;
import com.cred.freestyle.rewards.repository.InvitationRepository;
import com.cred.freestyle.rewards.service.result.RequestState;
import com.cred.freestyle.rewards.service.result.RewardRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Arrays;
import java.util.Optional;

/**
 * Invitation edges and their one-time reward.
 *
 * @author Rewards Team
 */
@Service
public class InvitationService {

    private static final Logger logger = LoggerFactory.getLogger(InvitationService.class);

    private final InvitationRepository invitationRepository;
    private final LedgerService ledgerService;
    private final EarningRulesEngine rulesEngine;
    private final Clock clock;
    private final long inviterPoints;
    private final long inviterPointsPhone;
    private final long inviteeBonusPoints;

    public InvitationService(
            InvitationRepository invitationRepository,
            LedgerService ledgerService,
            EarningRulesEngine rulesEngine,
            Clock clock,
            @Value("${rewards.invitation.inviter-points:50}") long inviterPoints,
            @Value("${rewards.invitation.inviter-points-phone:150}") long inviterPointsPhone,
            @Value("${rewards.invitation.invitee-bonus-points:20}") long inviteeBonusPoints
    ) {
        this.invitationRepository = invitationRepository;
        this.ledgerService = ledgerService;
        this.rulesEngine = rulesEngine;
        this.clock = clock;
        this.inviterPoints = inviterPoints;
        this.inviterPointsPhone = inviterPointsPhone;
        this.inviteeBonusPoints = inviteeBonusPoints;
    }

    /**
     * Record that an invitee registered through an inviter's code.
     * An invitee can only ever have one inviter.
     */
    @Transactional
    public Invitation register(String inviterId, String inviteeId, Channel channel, RewardRequest request) {
        if (inviterId == null || inviteeId == null) {
            throw RewardRejectedException.of(RejectionReason.INVALID_INVITATION,
                    "Invitation needs both an inviter and an invitee",
                    "inviterId", inviterId, "inviteeId", inviteeId);
        }
        if (inviterId.equals(inviteeId)) {
            throw RewardRejectedException.of(RejectionReason.INVALID_INVITATION,
                    "Account " + inviterId + " cannot invite itself", "inviterId", inviterId);
        }
        Optional<Invitation> existing = invitationRepository.findByInviteeId(inviteeId);
        if (existing.isPresent()) {
            throw RewardRejectedException.of(RejectionReason.INVALID_INVITATION,
                    "Account " + inviteeId + " was already invited",
                    "inviteeId", inviteeId, "invitationId", existing.get().getInvitationId());
        }

        request.advance(RequestState.COMMITTING);
        Invitation invitation = invitationRepository.save(Invitation.builder()
                .inviterId(inviterId)
                .inviteeId(inviteeId)
                .status(InvitationStatus.PENDING)
                .rewardPoints(channel == Channel.PHONE ? inviterPointsPhone : inviterPoints)
                .inviteeBonusPoints(inviteeBonusPoints)
                .build());
        logger.info("Registered invitation {}: {} invited {} via {}",
                   invitation.getInvitationId(), inviterId, inviteeId, channel);
        return invitation;
    }

    /**
     * Mark an invitation completed once the invitee qualifies. Idempotent.
     */
    @Transactional
    public Invitation complete(String invitationId, RewardRequest request) {
        Invitation invitation = invitationRepository.findByIdForUpdate(invitationId)
                .orElseThrow(() -> new ResourceNotFoundException("Invitation", invitationId));
        if (invitation.getStatus() == InvitationStatus.EXPIRED) {
            throw RewardRejectedException.of(RejectionReason.INVALID_INVITATION,
                    "Invitation " + invitationId + " has expired", "invitationId", invitationId);
        }
        request.advance(RequestState.COMMITTING);
        invitation.complete(clock.instant());
        return invitationRepository.save(invitation);
    }

    /**
     * Pay the invitation reward to the inviter and the new-user bonus to the invitee.
     *
     * Each side is checked against the ledger before it is applied, so re-driving a
     * partially applied claim pays only the missing side. claimed_at is set last.
     *
     * @param accountId Caller; must be the inviter
     * @param invitationId Invitation ID
     * @param request Request being processed
     * @return the inviter's ledger entry
     */
    @Transactional
    public LedgerEntry claimReward(String accountId, String invitationId, RewardRequest request) {
        Invitation invitation = invitationRepository.findByIdForUpdate(invitationId)
                .orElseThrow(() -> new ResourceNotFoundException("Invitation", invitationId));
        InvitationPayout payout = rulesEngine.decideInvitationPayout(accountId, invitation);

        ledgerService.lockAccounts(Arrays.asList(invitation.getInviterId(), invitation.getInviteeId()));

        request.advance(RequestState.COMMITTING);
        LedgerEntry inviterEntry = applyOnce(payout.getInviterReward());
        payout.getInviteeBonus().ifPresent(this::applyOnce);

        invitation.setClaimedAt(clock.instant());
        invitationRepository.save(invitation);

        logger.info("Invitation {} claimed: inviter {} +{}, invitee {} +{}",
                   invitationId, invitation.getInviterId(), invitation.getRewardPoints(),
                   invitation.getInviteeId(), invitation.getInviteeBonusPoints());
        return inviterEntry;
    }

    private LedgerEntry applyOnce(EarningDecision side) {
        Optional<LedgerEntry> applied = ledgerService.findApplied(side.getAccountId(), side.getSourceKind(), side.getSourceRef());
        if (applied.isPresent()) {
            logger.warn("{} for invitation {} already applied to account {}, skipping",
                       side.getSourceKind(), side.getSourceRef(), side.getAccountId());
            return applied.get();
        }
        return ledgerService.append(side.getAccountId(), side.getDelta(), side.getSourceKind(),
                side.getSourceRef(), side.getDescription());
    }
}
