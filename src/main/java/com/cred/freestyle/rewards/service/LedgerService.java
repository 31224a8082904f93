package com.cred.freestyle.rewards.service;

import com.cred.freestyle.rewards.domain.model.Account;
import com.cred.freestyle.rewards.domain.model.LedgerEntry;
import com.cred.freestyle.rewards.domain.model.SourceKind;
import com.cred.freestyle.rewards.exception.DuplicateSourceException;
import com.cred.freestyle.rewards.exception.InsufficientBalanceException;
import com.cred.freestyle.rewards.exception.LedgerCorruptionException;
import com.cred.freestyle.rewards.exception.ResourceNotFoundException;
import com.cred.freestyle.rewards.infrastructure.metrics.RewardsMetricsService;
import com.cred.freestyle.rewards.repository.AccountRepository;
import com.cred.freestyle.rewards.repository.LedgerEntryRepository;
import com.cred.freestyle.rewards.service.result.HistoryCursor;
import com.cred.freestyle.rewards.service.result.HistoryFilter;
import com.cred.freestyle.rewards.service.result.HistoryPage;
import com.cred.freestyle.rewards.service.result.ReconciliationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

import static com.cred.freestyle.rewards.repository.LedgerEntrySpecifications.*;

/**
 * Ledger store: the append-only log of balance changes and the balance projection per account.
 *
 * Every append locks the account row, checks the idempotency guard, computes
 * balance_after and writes the entry and the new balance in the caller's transaction.
 * The ledger is authoritative; {@link #reconcile(String)} checks the projection against it.
 *
 * @author Rewards Team
 */
@Service
public class LedgerService {

    private static final Logger logger = LoggerFactory.getLogger(LedgerService.class);

    static final int MAX_PAGE_SIZE = 200;

    private final AccountRepository accountRepository;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final RewardsMetricsService metricsService;
    private final TransactionTemplate newTransaction;
    private final Clock clock;

    public LedgerService(
            AccountRepository accountRepository,
            LedgerEntryRepository ledgerEntryRepository,
            RewardsMetricsService metricsService,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.accountRepository = accountRepository;
        this.ledgerEntryRepository = ledgerEntryRepository;
        this.metricsService = metricsService;
        this.newTransaction = new TransactionTemplate(transactionManager);
        this.newTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    /**
     * Provision an account with a zero balance if it does not exist yet.
     * Runs in its own transaction so a concurrent first request for the same
     * account cannot poison the caller's unit of work.
     *
     * @param accountId Account ID
     * @return the existing or newly created account
     */
    public Account openAccount(String accountId) {
        Optional<Account> existing = accountRepository.findById(accountId);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            Account created = newTransaction.execute(status -> accountRepository.saveAndFlush(
                    Account.builder().accountId(accountId).balance(0L).redeemedTotal(0L).build()));
            logger.info("Opened points account: {}", accountId);
            return created;
        } catch (DataIntegrityViolationException e) {
            logger.debug("Account {} was opened by a concurrent request", accountId);
            return accountRepository.findById(accountId)
                    .orElseThrow(() -> new IllegalStateException("Account " + accountId + " missing after insert conflict", e));
        }
    }

    /**
     * Lock an account row for the rest of the current transaction.
     *
     * @param accountId Account ID
     * @return the locked, managed account
     * @throws ResourceNotFoundException if the account does not exist
     */
    @Transactional
    public Account lockAccount(String accountId) {
        return accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account", accountId));
    }

    /**
     * Lock several accounts in ascending id order so two multi-account operations cannot deadlock.
     */
    @Transactional
    public List<Account> lockAccounts(Collection<String> accountIds) {
        List<Account> locked = new ArrayList<>();
        for (String accountId : new TreeSet<>(accountIds)) {
            locked.add(lockAccount(accountId));
        }
        return locked;
    }

    /**
     * Append one entry and move the balance projection with it.
     *
     * @param accountId Account ID
     * @param delta Signed, non-zero points change
     * @param kind What caused the change
     * @param sourceRef Id of the originating event
     * @param description Human readable description
     * @return the persisted entry
     * @throws InsufficientBalanceException if a debit would make the balance negative
     * @throws DuplicateSourceException if an at-most-once event was already applied
     */
    @Transactional
    public LedgerEntry append(String accountId, long delta, SourceKind kind, String sourceRef, String description) {
        if (delta == 0) {
            throw new IllegalArgumentException("Ledger delta must be non-zero");
        }
        if (sourceRef == null || sourceRef.isBlank()) {
            throw new IllegalArgumentException("Ledger source reference is required");
        }

        Account account = lockAccount(accountId);

        String dedupeKey = kind.dedupeKey(accountId, sourceRef);
        if (dedupeKey != null) {
            Optional<LedgerEntry> existing = ledgerEntryRepository.findByDedupeKey(dedupeKey);
            if (existing.isPresent()) {
                logger.warn("Duplicate {} {} for account {}, existing entry {}",
                           kind, sourceRef, accountId, existing.get().getEntryId());
                throw new DuplicateSourceException(accountId, kind, sourceRef,
                        existing.get().getEntryId(), existing.get().getCreatedAt());
            }
        }

        long balanceBefore = account.getBalance();
        long balanceAfter = Math.addExact(balanceBefore, delta);
        if (balanceAfter < 0) {
            throw new InsufficientBalanceException(accountId, -delta, balanceBefore);
        }

        LedgerEntry entry = ledgerEntryRepository.save(LedgerEntry.builder()
                .accountId(accountId)
                .delta(delta)
                .balanceAfter(balanceAfter)
                .sourceKind(kind)
                .sourceRef(sourceRef)
                .dedupeKey(dedupeKey)
                .description(description)
                .createdAt(clock.instant())
                .build());

        account.setBalance(balanceAfter);
        if (kind == SourceKind.EXCHANGE_COST) {
            account.setRedeemedTotal(account.getRedeemedTotal() - delta);
        } else if (kind == SourceKind.EXCHANGE_REFUND) {
            account.setRedeemedTotal(Math.max(0L, account.getRedeemedTotal() - delta));
        }
        accountRepository.save(account);

        metricsService.recordPoints(kind, delta);
        logger.info("Ledger append: account={}, kind={}, ref={}, delta={}, balance {} -> {}",
                   accountId, kind, sourceRef, delta, balanceBefore, balanceAfter);
        return entry;
    }

    /**
     * Entry already recorded for an event, if any. Used to resume partially applied payouts.
     */
    @Transactional(readOnly = true)
    public Optional<LedgerEntry> findApplied(String accountId, SourceKind kind, String sourceRef) {
        String dedupeKey = kind.dedupeKey(accountId, sourceRef);
        if (dedupeKey != null) {
            return ledgerEntryRepository.findByDedupeKey(dedupeKey);
        }
        return ledgerEntryRepository.findByAccountIdAndSourceKindAndSourceRef(accountId, kind, sourceRef)
                .stream().findFirst();
    }

    /**
     * Current committed balance; 0 for an account that was never opened.
     */
    @Transactional(readOnly = true)
    public long balanceOf(String accountId) {
        return accountRepository.findById(accountId).map(Account::getBalance).orElse(0L);
    }

    /**
     * One page of ledger history, newest first, ordered by (created_at, entry_id) descending.
     * Pages are keyset-based: entries committed after the first page was read only ever
     * appear before the cursor, so later pages never skip or repeat rows.
     *
     * @param accountId Account ID
     * @param filter Optional filters
     * @param cursorToken Token from the previous page, or null for the first page
     * @param pageSize Entries per page, 1..200
     * @return the page and the token for the next one
     */
    @Transactional(readOnly = true)
    public HistoryPage history(String accountId, HistoryFilter filter, String cursorToken, int pageSize) {
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("pageSize must be between 1 and " + MAX_PAGE_SIZE);
        }
        HistoryFilter effective = filter == null ? HistoryFilter.all() : filter;

        Specification<LedgerEntry> spec = Specification.where(forAccount(accountId));
        if (!effective.getKinds().isEmpty()) {
            spec = spec.and(kindIn(effective.getKinds()));
        }
        if (effective.getFrom() != null) {
            spec = spec.and(createdAtOrAfter(effective.getFrom()));
        }
        if (effective.getTo() != null) {
            spec = spec.and(createdBefore(effective.getTo()));
        }
        if (effective.getDirection() == HistoryFilter.Direction.CREDIT) {
            spec = spec.and(credits());
        } else if (effective.getDirection() == HistoryFilter.Direction.DEBIT) {
            spec = spec.and(debits());
        }
        if (cursorToken != null) {
            HistoryCursor cursor = HistoryCursor.fromToken(cursorToken);
            spec = spec.and(before(cursor.getCreatedAt(), cursor.getEntryId()));
        }

        Sort newestFirst = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("entryId"));
        List<LedgerEntry> rows = ledgerEntryRepository
                .findAll(spec, PageRequest.of(0, pageSize + 1, newestFirst))
                .getContent();

        if (rows.size() <= pageSize) {
            return new HistoryPage(rows, null);
        }
        List<LedgerEntry> page = rows.subList(0, pageSize);
        LedgerEntry last = page.get(page.size() - 1);
        return new HistoryPage(page, new HistoryCursor(last.getCreatedAt(), last.getEntryId()).toToken());
    }

    /**
     * Compare the cached balance with the sum of the account's ledger deltas.
     */
    @Transactional(readOnly = true)
    public ReconciliationReport reconcile(String accountId) {
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account", accountId));
        Long sum = ledgerEntryRepository.sumDeltaByAccountId(accountId);
        long lastBalanceAfter = ledgerEntryRepository.findFirstByAccountIdOrderByEntryIdDesc(accountId)
                .map(LedgerEntry::getBalanceAfter)
                .orElse(0L);

        ReconciliationReport report = ReconciliationReport.builder()
                .accountId(accountId)
                .cachedBalance(account.getBalance())
                .ledgerSum(sum == null ? 0L : sum)
                .lastBalanceAfter(lastBalanceAfter)
                .entryCount(ledgerEntryRepository.countByAccountId(accountId))
                .build();

        if (!report.isConsistent()) {
            logger.error("Ledger mismatch for account {}: cached={}, ledgerSum={}, lastBalanceAfter={}",
                        accountId, report.getCachedBalance(), report.getLedgerSum(), report.getLastBalanceAfter());
        }
        return report;
    }

    /**
     * Strict form of {@link #reconcile(String)}.
     *
     * @throws LedgerCorruptionException if the projection disagrees with the ledger
     */
    @Transactional(readOnly = true)
    public ReconciliationReport verifyBalance(String accountId) {
        ReconciliationReport report = reconcile(accountId);
        if (!report.isConsistent()) {
            throw new LedgerCorruptionException(accountId, report.getCachedBalance(), report.getLedgerSum());
        }
        return report;
    }
}
