package com.cred.freestyle.rewards.service;

import java.util.Optional;

/**
 * Both sides of an invitation reward. Each side is its own ledger entry keyed by the edge id.
 */
public class InvitationPayout {

    private final EarningDecision inviterReward;
    private final EarningDecision inviteeBonus;

    public InvitationPayout(EarningDecision inviterReward, EarningDecision inviteeBonus) {
        this.inviterReward = inviterReward;
        this.inviteeBonus = inviteeBonus;
    }

    public EarningDecision getInviterReward() {
        return inviterReward;
    }

    /**
     * Empty when the edge carries no new-user bonus.
     */
    public Optional<EarningDecision> getInviteeBonus() {
        return Optional.ofNullable(inviteeBonus);
    }
}
