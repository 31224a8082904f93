package com.cred.freestyle.rewards.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown inside a reward transaction when the operation is refused for a business reason.
 * Throwing rolls back everything the transaction already wrote; the coordinator turns it
 * into a rejected result carrying {@link #getReason()} and {@link #getDetails()}.
 *
 * @author Rewards Team
 */
public class RewardRejectedException extends RuntimeException {

    private final RejectionReason reason;
    private final Map<String, Object> details;

    public RewardRejectedException(RejectionReason reason, String message) {
        this(reason, message, Collections.emptyMap());
    }

    public RewardRejectedException(RejectionReason reason, String message, Map<String, Object> details) {
        super(message);
        this.reason = reason;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public RejectionReason getReason() {
        return reason;
    }

    /**
     * Structured values a caller needs to render the rejection (remaining cooldown, streak, limits).
     */
    public Map<String, Object> getDetails() {
        return details;
    }

    protected static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return map;
    }

    public static RewardRejectedException of(RejectionReason reason, String message, Object... keyValues) {
        return new RewardRejectedException(reason, message, details(keyValues));
    }
}
