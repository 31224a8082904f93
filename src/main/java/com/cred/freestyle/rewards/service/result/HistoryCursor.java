package com.cred.freestyle.rewards.service.result;

import java.time.Instant;
import java.util.Objects;

/**
 * Position after the last entry of a history page: (created_at, entry_id) of that entry.
 * Encoded as an opaque token for callers.
 *
 * @author Rewards Team
 */
public final class HistoryCursor {

    private final Instant createdAt;
    private final long entryId;

    public HistoryCursor(Instant createdAt, long entryId) {
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.entryId = entryId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public long getEntryId() {
        return entryId;
    }

    public String toToken() {
        return createdAt.getEpochSecond() + "." + createdAt.getNano() + ":" + entryId;
    }

    /**
     * Parse a token produced by {@link #toToken()}.
     *
     * @throws IllegalArgumentException if the token is malformed
     */
    public static HistoryCursor fromToken(String token) {
        try {
            int colon = token.indexOf(':');
            int dot = token.indexOf('.');
            if (colon < 0 || dot < 0 || dot > colon) {
                throw new IllegalArgumentException("Malformed history cursor: " + token);
            }
            long seconds = Long.parseLong(token.substring(0, dot));
            int nanos = Integer.parseInt(token.substring(dot + 1, colon));
            long entryId = Long.parseLong(token.substring(colon + 1));
            return new HistoryCursor(Instant.ofEpochSecond(seconds, nanos), entryId);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed history cursor: " + token, e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HistoryCursor)) return false;
        HistoryCursor that = (HistoryCursor) o;
        return entryId == that.entryId && createdAt.equals(that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(createdAt, entryId);
    }
}
