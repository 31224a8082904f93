package com.cred.freestyle.rewards.service.result;

import com.cred.freestyle.rewards.domain.model.LedgerEntry;

import java.util.List;

/**
 * One page of ledger history, newest first.
 */
public class HistoryPage {

    private final List<LedgerEntry> entries;
    private final String nextCursor;

    public HistoryPage(List<LedgerEntry> entries, String nextCursor) {
        this.entries = List.copyOf(entries);
        this.nextCursor = nextCursor;
    }

    public List<LedgerEntry> getEntries() {
        return entries;
    }

    /**
     * Token for the following page, or null on the last page.
     */
    public String getNextCursor() {
        return nextCursor;
    }

    public boolean hasNext() {
        return nextCursor != null;
    }
}
