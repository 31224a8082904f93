package com.cred.freestyle.rewards.service.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Tracks one coordinator request through {@link RequestState}.
 * Services advance it as they validate, allocate and write; the coordinator sets the terminal state.
 * Not thread-safe: one request belongs to one calling thread.
 *
 * @author Rewards Team
 */
public class RewardRequest {

    private final String requestId;
    private final String operation;
    private final String accountId;
    private final List<RequestState> trace = new ArrayList<>();
    private RequestState state;
    private int attempts;

    private RewardRequest(String operation, String accountId) {
        this.requestId = UUID.randomUUID().toString();
        this.operation = operation;
        this.accountId = accountId;
        this.state = RequestState.RECEIVED;
        this.trace.add(RequestState.RECEIVED);
    }

    public static RewardRequest received(String operation, String accountId) {
        return new RewardRequest(operation, accountId);
    }

    /**
     * Move to the next state.
     *
     * @throws IllegalStateException on a transition the lifecycle does not allow
     */
    public void advance(RequestState next) {
        if (state == next) {
            return;
        }
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException(
                    String.format("Request %s (%s) cannot move from %s to %s", requestId, operation, state, next));
        }
        state = next;
        trace.add(next);
    }

    /**
     * Start a new attempt. A retried request goes back to VALIDATING.
     */
    public void beginAttempt() {
        if (state.isTerminal()) {
            throw new IllegalStateException("Request " + requestId + " already finished as " + state);
        }
        attempts++;
        if (state != RequestState.RECEIVED && state != RequestState.VALIDATING) {
            state = RequestState.VALIDATING;
            trace.add(RequestState.VALIDATING);
            return;
        }
        advance(RequestState.VALIDATING);
    }

    public String getRequestId() {
        return requestId;
    }

    public String getOperation() {
        return operation;
    }

    public String getAccountId() {
        return accountId;
    }

    public RequestState getState() {
        return state;
    }

    public int getAttempts() {
        return attempts;
    }

    public List<RequestState> getTrace() {
        return Collections.unmodifiableList(trace);
    }
}
