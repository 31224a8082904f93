package com.cred.freestyle.rewards.service;

import com.cred.freestyle.rewards.service.result.RechargeCompletion;

/**
 * Decides whether a completed recharge earns a blind box (for example a business-district geofence).
 * Implemented by a collaborator; the default bean accepts every recharge.
 *
 * @author Rewards Team
 */
@FunctionalInterface
public interface BlindBoxEligibilityPolicy {

    boolean isEligible(RechargeCompletion completion);
}
