package com.cred.freestyle.rewards.service;

import com.cred.freestyle.rewards.domain.model.Account;
import com.cred.freestyle.rewards.domain.model.CheckInRecord;
import com.cred.freestyle.rewards.domain.model.TaskCompletion.CompletionStatus;
import com.cred.freestyle.rewards.repository.AccountRepository;
import com.cred.freestyle.rewards.repository.CheckInRecordRepository;
import com.cred.freestyle.rewards.repository.LedgerEntryRepository;
import com.cred.freestyle.rewards.repository.TaskCompletionRepository;
import com.cred.freestyle.rewards.service.result.MonthlyCheckInStats;
import com.cred.freestyle.rewards.service.result.PointsStats;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only summaries over check-ins and the ledger.
 *
 * @author Rewards Team
 */
@Service
@Transactional(readOnly = true)
public class RewardStatsService {

    private final AccountRepository accountRepository;
    private final CheckInRecordRepository checkInRecordRepository;
    private final TaskCompletionRepository completionRepository;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final CheckInService checkInService;
    private final Clock clock;

    public RewardStatsService(
            AccountRepository accountRepository,
            CheckInRecordRepository checkInRecordRepository,
            TaskCompletionRepository completionRepository,
            LedgerEntryRepository ledgerEntryRepository,
            CheckInService checkInService,
            Clock clock
    ) {
        this.accountRepository = accountRepository;
        this.checkInRecordRepository = checkInRecordRepository;
        this.completionRepository = completionRepository;
        this.ledgerEntryRepository = ledgerEntryRepository;
        this.checkInService = checkInService;
        this.clock = clock;
    }

    public MonthlyCheckInStats monthlyCheckIns(String accountId, YearMonth month) {
        List<CheckInRecord> records = checkInRecordRepository
                .findByAccountIdAndCheckInDateBetweenOrderByCheckInDateAsc(accountId, month.atDay(1), month.atEndOfMonth());

        List<LocalDate> dates = new ArrayList<>();
        long points = 0;
        for (CheckInRecord record : records) {
            dates.add(record.getCheckInDate());
            points += record.getPointsEarned();
        }

        return MonthlyCheckInStats.builder()
                .year(month.getYear())
                .month(month.getMonthValue())
                .totalDays(month.lengthOfMonth())
                .checkInDays(records.size())
                .consecutiveDays(records.isEmpty() ? 0 : records.get(records.size() - 1).getConsecutiveDays())
                .pointsEarned(points)
                .checkInDates(dates)
                .build();
    }

    public PointsStats pointsStats(String accountId) {
        LocalDate today = LocalDate.now(clock);
        Account account = accountRepository.findById(accountId).orElse(null);

        return PointsStats.builder()
                .accountId(accountId)
                .balance(account == null ? 0L : account.getBalance())
                .redeemedTotal(account == null ? 0L : account.getRedeemedTotal())
                .consecutiveCheckInDays(checkInService.currentStreak(accountId).liveConsecutiveDays(today))
                .totalCheckIns(checkInRecordRepository.countByAccountId(accountId))
                .tasksCompleted(completionRepository.countByAccountIdAndStatus(accountId, CompletionStatus.COMPLETED))
                .pointsToday(creditsSince(accountId, today))
                .pointsThisWeek(creditsSince(accountId, today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))))
                .pointsThisMonth(creditsSince(accountId, today.withDayOfMonth(1)))
                .build();
    }

    private long creditsSince(String accountId, LocalDate day) {
        Instant since = day.atStartOfDay(clock.getZone()).toInstant();
        Long sum = ledgerEntryRepository.sumCreditsSince(accountId, since);
        return sum == null ? 0L : sum;
    }
}
