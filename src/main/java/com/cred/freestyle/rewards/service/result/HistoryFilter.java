package com.cred.freestyle.rewards.service.result;

import com.cred.freestyle.rewards.domain.model.SourceKind;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Optional filters for ledger history. Every unset field matches all entries.
 *
 * @author Rewards Team
 */
public final class HistoryFilter {

    private final Set<SourceKind> kinds;
    private final Instant from;
    private final Instant to;
    private final Direction direction;

    private HistoryFilter(Set<SourceKind> kinds, Instant from, Instant to, Direction direction) {
        this.kinds = kinds;
        this.from = from;
        this.to = to;
        this.direction = direction;
    }

    public static HistoryFilter all() {
        return new HistoryFilter(Collections.emptySet(), null, null, Direction.ANY);
    }

    public HistoryFilter withKinds(SourceKind first, SourceKind... rest) {
        return new HistoryFilter(Collections.unmodifiableSet(EnumSet.of(first, rest)), from, to, direction);
    }

    /**
     * Restrict to entries created in [from, to). Either bound may be null.
     */
    public HistoryFilter between(Instant from, Instant to) {
        return new HistoryFilter(kinds, from, to, direction);
    }

    public HistoryFilter onlyCredits() {
        return new HistoryFilter(kinds, from, to, Direction.CREDIT);
    }

    public HistoryFilter onlyDebits() {
        return new HistoryFilter(kinds, from, to, Direction.DEBIT);
    }

    public Set<SourceKind> getKinds() {
        return kinds;
    }

    public Instant getFrom() {
        return from;
    }

    public Instant getTo() {
        return to;
    }

    public Direction getDirection() {
        return direction;
    }

    public enum Direction {
        ANY,
        CREDIT,
        DEBIT
    }
}
