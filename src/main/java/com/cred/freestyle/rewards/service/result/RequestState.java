package com.cred.freestyle.rewards.service.result;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a reward request inside the coordinator.
 *
 * @author Rewards Team
 */
public enum RequestState {
    RECEIVED,
    VALIDATING,
    ALLOCATING,
    COMMITTING,
    COMMITTED,
    REJECTED,
    FAILED;

    public boolean isTerminal() {
        return this == COMMITTED || this == REJECTED || this == FAILED;
    }

    boolean canMoveTo(RequestState next) {
        return allowedNext().contains(next);
    }

    private Set<RequestState> allowedNext() {
        switch (this) {
            case RECEIVED:
                return EnumSet.of(VALIDATING, FAILED);
            case VALIDATING:
                return EnumSet.of(ALLOCATING, COMMITTING, REJECTED, FAILED);
            case ALLOCATING:
                return EnumSet.of(COMMITTING, REJECTED, FAILED);
            case COMMITTING:
                return EnumSet.of(COMMITTED, REJECTED, FAILED);
            default:
                return EnumSet.noneOf(RequestState.class);
        }
    }
}
