package com.cred.freestyle.rewards.service.result;

import com.cred.freestyle.rewards.exception.RejectionReason;
import com.cred.freestyle.rewards.exception.RewardRejectedException;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a coordinator operation.
 * COMMITTED carries a value; REJECTED carries a business reason with render details;
 * FAILED means nothing was committed and the call may be retried as-is.
 *
 * @param <T> committed value type
 * @author Rewards Team
 */
public final class RewardResult<T> {

    private final RewardStatus status;
    private final T value;
    private final RejectionReason reason;
    private final Map<String, Object> details;
    private final String message;
    private final int attempts;
    private final List<RequestState> trace;

    private RewardResult(RewardStatus status, T value, RejectionReason reason, Map<String, Object> details,
                         String message, RewardRequest request) {
        this.status = status;
        this.value = value;
        this.reason = reason;
        this.details = details;
        this.message = message;
        this.attempts = request.getAttempts();
        this.trace = request.getTrace();
    }

    public static <T> RewardResult<T> committed(T value, RewardRequest request) {
        return new RewardResult<>(RewardStatus.COMMITTED, value, null, Collections.emptyMap(), null, request);
    }

    public static <T> RewardResult<T> rejected(RewardRejectedException rejection, RewardRequest request) {
        return new RewardResult<>(RewardStatus.REJECTED, null, rejection.getReason(), rejection.getDetails(),
                rejection.getMessage(), request);
    }

    public static <T> RewardResult<T> failed(String message, RewardRequest request) {
        return new RewardResult<>(RewardStatus.FAILED, null, null, Collections.emptyMap(), message, request);
    }

    public RewardStatus getStatus() {
        return status;
    }

    public boolean isCommitted() {
        return status == RewardStatus.COMMITTED;
    }

    public boolean isRejected() {
        return status == RewardStatus.REJECTED;
    }

    public boolean isFailed() {
        return status == RewardStatus.FAILED;
    }

    /**
     * @return the committed value, or null unless committed
     */
    public T getValue() {
        return value;
    }

    public RejectionReason getReason() {
        return reason;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public String getMessage() {
        return message;
    }

    public int getAttempts() {
        return attempts;
    }

    public List<RequestState> getTrace() {
        return trace;
    }

    @Override
    public String toString() {
        return "RewardResult{status=" + status + ", reason=" + reason + ", message=" + message
                + ", attempts=" + attempts + "}";
    }
}
