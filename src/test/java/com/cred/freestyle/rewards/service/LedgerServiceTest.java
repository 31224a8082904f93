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
import com.cred.freestyle.rewards.service.result.ReconciliationReport;
import com.cred.freestyle.rewards.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for LedgerService.
 * Storage is mocked; the tests pin the append arithmetic and guards.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("LedgerService Unit Tests")
class LedgerServiceTest {

    private static final String ACCOUNT = "user-123";
    private static final Instant NOW = Instant.parse("2024-03-10T10:00:00Z");

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private LedgerEntryRepository ledgerEntryRepository;

    @Mock
    private RewardsMetricsService metricsService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private LedgerService ledgerService;

    @BeforeEach
    void setUp() {
        ledgerService = new LedgerService(accountRepository, ledgerEntryRepository, metricsService,
                transactionManager, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Account lockedAccount(long balance) {
        Account account = TestDataBuilder.account(ACCOUNT, balance).build();
        when(accountRepository.findByIdForUpdate(ACCOUNT)).thenReturn(Optional.of(account));
        return account;
    }

    private void saveReturnsEntry() {
        when(ledgerEntryRepository.save(any(LedgerEntry.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    // ========================================
    // append() Tests
    // ========================================

    @Test
    @DisplayName("append - Credit moves the balance and stamps balance_after")
    void append_Credit() {
        // Given
        Account account = lockedAccount(100L);
        saveReturnsEntry();

        // When
        LedgerEntry entry = ledgerService.append(ACCOUNT, 25L, SourceKind.TASK, "task-1#1", "Task");

        // Then
        assertThat(entry.getBalanceAfter()).isEqualTo(125L);
        assertThat(entry.getDelta()).isEqualTo(25L);
        assertThat(entry.getCreatedAt()).isEqualTo(NOW);
        assertThat(entry.getDedupeKey()).isNull();
        assertThat(account.getBalance()).isEqualTo(125L);
        verify(accountRepository).save(account);
        verify(metricsService).recordPoints(SourceKind.TASK, 25L);
        verify(ledgerEntryRepository, never()).findByDedupeKey(anyString());
    }

    @Test
    @DisplayName("append - Debit to exactly zero is allowed")
    void append_DebitToZero() {
        Account account = lockedAccount(40L);
        saveReturnsEntry();

        LedgerEntry entry = ledgerService.append(ACCOUNT, -40L, SourceKind.LOTTERY_COST, "alloc-1", "Draw");

        assertThat(entry.getBalanceAfter()).isZero();
        assertThat(account.getBalance()).isZero();
    }

    @Test
    @DisplayName("append - Debit below zero is rejected and nothing is written")
    void append_InsufficientBalance() {
        lockedAccount(30L);

        assertThatThrownBy(() -> ledgerService.append(ACCOUNT, -31L, SourceKind.LOTTERY_COST, "alloc-1", "Draw"))
                .isInstanceOf(InsufficientBalanceException.class);

        verify(ledgerEntryRepository, never()).save(any());
        verify(accountRepository, never()).save(any());
    }

    @Test
    @DisplayName("append - At-most-once event already applied is rejected as duplicate")
    void append_Duplicate() {
        // Given
        lockedAccount(10L);
        LedgerEntry existing = LedgerEntry.builder()
                .entryId(7L)
                .accountId(ACCOUNT)
                .delta(10L)
                .balanceAfter(10L)
                .sourceKind(SourceKind.CHECK_IN)
                .sourceRef("2024-03-10")
                .createdAt(NOW)
                .build();
        when(ledgerEntryRepository.findByDedupeKey(ACCOUNT + "|CHECK_IN|2024-03-10")).thenReturn(Optional.of(existing));

        // When / Then
        assertThatThrownBy(() -> ledgerService.append(ACCOUNT, 10L, SourceKind.CHECK_IN, "2024-03-10", "Check-in"))
                .isInstanceOf(DuplicateSourceException.class)
                .satisfies(e -> assertThat(((DuplicateSourceException) e).getDetails())
                        .containsEntry("existingEntryId", 7L));
        verify(ledgerEntryRepository, never()).save(any());
    }

    @Test
    @DisplayName("append - Exchange cost and refund move redeemed_total")
    void append_RedeemedTotal() {
        Account account = lockedAccount(500L);
        saveReturnsEntry();

        ledgerService.append(ACCOUNT, -300L, SourceKind.EXCHANGE_COST, "ex-1", "Exchange");
        assertThat(account.getRedeemedTotal()).isEqualTo(300L);

        ledgerService.append(ACCOUNT, 300L, SourceKind.EXCHANGE_REFUND, "ex-1", "Refund");
        assertThat(account.getRedeemedTotal()).isZero();
        assertThat(account.getBalance()).isEqualTo(500L);
    }

    @Test
    @DisplayName("append - Dedupe key is stored for at-most-once kinds")
    void append_StoresDedupeKey() {
        lockedAccount(0L);
        saveReturnsEntry();

        ledgerService.append(ACCOUNT, 500L, SourceKind.ORDER_REWARD, "order-9", "Order");

        ArgumentCaptor<LedgerEntry> captor = ArgumentCaptor.forClass(LedgerEntry.class);
        verify(ledgerEntryRepository).save(captor.capture());
        assertThat(captor.getValue().getDedupeKey()).isEqualTo(ACCOUNT + "|ORDER_REWARD|order-9");
    }

    @Test
    @DisplayName("append - Zero delta and blank reference are programming errors")
    void append_InvalidArguments() {
        assertThatThrownBy(() -> ledgerService.append(ACCOUNT, 0L, SourceKind.TASK, "t#1", "x"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledgerService.append(ACCOUNT, 5L, SourceKind.TASK, " ", "x"))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(accountRepository);
    }

    @Test
    @DisplayName("lockAccount - Unknown account is a not-found rejection")
    void lockAccount_NotFound() {
        when(accountRepository.findByIdForUpdate("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> ledgerService.lockAccount("ghost"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("openAccount - Existing account is returned without an insert")
    void openAccount_Existing() {
        Account existing = TestDataBuilder.account(ACCOUNT, 42L).build();
        when(accountRepository.findById(ACCOUNT)).thenReturn(Optional.of(existing));

        assertThat(ledgerService.openAccount(ACCOUNT)).isSameAs(existing);
        verify(accountRepository, never()).saveAndFlush(any());
    }

    // ========================================
    // reconcile() Tests
    // ========================================

    @Test
    @DisplayName("reconcile - Mismatch is reported and verifyBalance throws")
    void reconcile_Mismatch() {
        // Given
        when(accountRepository.findById(ACCOUNT)).thenReturn(Optional.of(TestDataBuilder.account(ACCOUNT, 90L).build()));
        when(ledgerEntryRepository.sumDeltaByAccountId(ACCOUNT)).thenReturn(100L);
        when(ledgerEntryRepository.findFirstByAccountIdOrderByEntryIdDesc(ACCOUNT)).thenReturn(Optional.empty());
        when(ledgerEntryRepository.countByAccountId(ACCOUNT)).thenReturn(3L);

        // When
        ReconciliationReport report = ledgerService.reconcile(ACCOUNT);

        // Then
        assertThat(report.isConsistent()).isFalse();
        assertThat(report.getLedgerSum()).isEqualTo(100L);
        assertThatThrownBy(() -> ledgerService.verifyBalance(ACCOUNT))
                .isInstanceOf(LedgerCorruptionException.class);
    }

    @Test
    @DisplayName("reconcile - Account without entries is consistent at zero")
    void reconcile_Empty() {
        when(accountRepository.findById(ACCOUNT)).thenReturn(Optional.of(TestDataBuilder.account(ACCOUNT, 0L).build()));
        when(ledgerEntryRepository.sumDeltaByAccountId(ACCOUNT)).thenReturn(null);
        when(ledgerEntryRepository.findFirstByAccountIdOrderByEntryIdDesc(ACCOUNT)).thenReturn(Optional.empty());

        assertThat(ledgerService.verifyBalance(ACCOUNT).isConsistent()).isTrue();
    }

    @Test
    @DisplayName("history - Page size outside 1..200 is rejected")
    void history_PageSizeBounds() {
        assertThatThrownBy(() -> ledgerService.history(ACCOUNT, null, null, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledgerService.history(ACCOUNT, null, null, 201))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
