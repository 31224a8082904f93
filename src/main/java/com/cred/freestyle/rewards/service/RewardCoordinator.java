package com.cred.freestyle.rewards.service;

import com.cred.freestyle.rewards.domain.model.Account;
import com.cred.freestyle.rewards.domain.model.BlindBox;
import com.cred.freestyle.rewards.domain.model.Invitation;
import com.cred.freestyle.rewards.domain.model.Invitation.Channel;
import com.cred.freestyle.rewards.domain.model.LedgerEntry;
import com.cred.freestyle.rewards.domain.model.ProductExchange;
import com.cred.freestyle.rewards.exception.RewardRejectedException;
import com.cred.freestyle.rewards.infrastructure.metrics.RewardsMetricsService;
import com.cred.freestyle.rewards.service.result.BlindBoxReceipt;
import com.cred.freestyle.rewards.service.result.CheckInReceipt;
import com.cred.freestyle.rewards.service.result.DrawReceipt;
import com.cred.freestyle.rewards.service.result.HistoryFilter;
import com.cred.freestyle.rewards.service.result.HistoryPage;
import com.cred.freestyle.rewards.service.result.MonthlyCheckInStats;
import com.cred.freestyle.rewards.service.result.PointsStats;
import com.cred.freestyle.rewards.service.result.RechargeCompletion;
import com.cred.freestyle.rewards.service.result.ReconciliationReport;
import com.cred.freestyle.rewards.service.result.RequestState;
import com.cred.freestyle.rewards.service.result.RewardRequest;
import com.cred.freestyle.rewards.service.result.RewardResult;
import com.cred.freestyle.rewards.service.result.TaskReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;

import java.time.YearMonth;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Entry point for every reward operation.
 *
 * Each mutating operation runs as one transaction in the owning service. The coordinator
 * provisions accounts, retries transient storage conflicts, and turns the outcome into a
 * {@link RewardResult}: COMMITTED, REJECTED with a business reason, or FAILED with nothing written.
 * Business rejections never escape as exceptions.
 *
 * @author Rewards Team
 */
@Service
public class RewardCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(RewardCoordinator.class);

    private final LedgerService ledgerService;
    private final CheckInService checkInService;
    private final TaskService taskService;
    private final LotteryService lotteryService;
    private final BlindBoxService blindBoxService;
    private final PointsMallService pointsMallService;
    private final InvitationService invitationService;
    private final PointsGrantService pointsGrantService;
    private final RewardStatsService statsService;
    private final RewardsMetricsService metricsService;
    private final int maxAttempts;
    private final long retryBackoffMs;

    public RewardCoordinator(
            LedgerService ledgerService,
            CheckInService checkInService,
            TaskService taskService,
            LotteryService lotteryService,
            BlindBoxService blindBoxService,
            PointsMallService pointsMallService,
            InvitationService invitationService,
            PointsGrantService pointsGrantService,
            RewardStatsService statsService,
            RewardsMetricsService metricsService,
            @Value("${rewards.coordinator.max-attempts:3}") int maxAttempts,
            @Value("${rewards.coordinator.retry-backoff-ms:20}") long retryBackoffMs
    ) {
        this.ledgerService = ledgerService;
        this.checkInService = checkInService;
        this.taskService = taskService;
        this.lotteryService = lotteryService;
        this.blindBoxService = blindBoxService;
        this.pointsMallService = pointsMallService;
        this.invitationService = invitationService;
        this.pointsGrantService = pointsGrantService;
        this.statsService = statsService;
        this.metricsService = metricsService;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryBackoffMs = retryBackoffMs;
    }

    public RewardResult<Account> openAccount(String accountId) {
        return execute("open_account", accountId, Collections.singletonList(accountId),
                request -> ledgerService.openAccount(accountId));
    }

    public RewardResult<CheckInReceipt> checkIn(String accountId) {
        return execute("check_in", accountId, Collections.singletonList(accountId),
                request -> checkInService.checkIn(accountId, request));
    }

    public RewardResult<TaskReceipt> completeTask(String accountId, String taskCode) {
        return execute("complete_task", accountId, Collections.singletonList(accountId),
                request -> taskService.completeTask(accountId, taskCode, request));
    }

    public RewardResult<DrawReceipt> draw(String accountId, String activityId) {
        return execute("draw", accountId, Collections.singletonList(accountId),
                request -> lotteryService.draw(accountId, activityId, request));
    }

    public RewardResult<BlindBoxReceipt> openBlindBox(String accountId, String boxId) {
        return execute("open_blind_box", accountId, Collections.singletonList(accountId),
                request -> blindBoxService.openBlindBox(accountId, boxId, request));
    }

    public RewardResult<ProductExchange> exchangeProduct(String accountId, String productId, int quantity) {
        return execute("exchange_product", accountId, Collections.singletonList(accountId),
                request -> pointsMallService.exchange(accountId, productId, quantity, request));
    }

    public RewardResult<LedgerEntry> claimInvitationReward(String accountId, String invitationId) {
        return execute("claim_invitation", accountId, Collections.singletonList(accountId),
                request -> invitationService.claimReward(accountId, invitationId, request));
    }

    public RewardResult<LedgerEntry> grantOrderReward(String accountId, String orderId, long points, String description) {
        return execute("grant_order_reward", accountId, Collections.singletonList(accountId),
                request -> pointsGrantService.grantOrderReward(accountId, orderId, points, description, request));
    }

    /**
     * @return the issued box, or an empty Optional when the recharge does not qualify
     */
    public RewardResult<Optional<BlindBox>> recordRechargeCompleted(RechargeCompletion completion) {
        return execute("record_recharge", completion.getAccountId(), Collections.singletonList(completion.getAccountId()),
                request -> blindBoxService.recordRechargeCompleted(completion, request));
    }

    public RewardResult<ProductExchange> refundExchange(String exchangeId, String reason) {
        return execute("refund_exchange", null, Collections.emptyList(),
                request -> pointsMallService.refund(exchangeId, reason, request));
    }

    public RewardResult<LedgerEntry> adjustBalance(String accountId, long delta, String ticket, String reason) {
        return execute("adjust_balance", accountId, Collections.singletonList(accountId),
                request -> pointsGrantService.adjustBalance(accountId, delta, ticket, reason, request));
    }

    public RewardResult<Invitation> registerInvitation(String inviterId, String inviteeId, Channel channel) {
        Set<String> accounts = new LinkedHashSet<>();
        if (inviterId != null) {
            accounts.add(inviterId);
        }
        if (inviteeId != null) {
            accounts.add(inviteeId);
        }
        return execute("register_invitation", inviterId, accounts,
                request -> invitationService.register(inviterId, inviteeId, channel, request));
    }

    public RewardResult<Invitation> completeInvitation(String invitationId) {
        return execute("complete_invitation", null, Collections.emptyList(),
                request -> invitationService.complete(invitationId, request));
    }

    // Read-only queries; no request lifecycle.

    public HistoryPage getHistory(String accountId, HistoryFilter filter, String cursor, int pageSize) {
        return ledgerService.history(accountId, filter, cursor, pageSize);
    }

    public long balanceOf(String accountId) {
        return ledgerService.balanceOf(accountId);
    }

    public ReconciliationReport reconcile(String accountId) {
        return ledgerService.reconcile(accountId);
    }

    public ReconciliationReport verifyBalance(String accountId) {
        return ledgerService.verifyBalance(accountId);
    }

    public MonthlyCheckInStats monthlyCheckInStats(String accountId, YearMonth month) {
        return statsService.monthlyCheckIns(accountId, month);
    }

    public PointsStats pointsStats(String accountId) {
        return statsService.pointsStats(accountId);
    }

    /**
     * Run one operation with retries on transient storage conflicts.
     *
     * @param operation Metric and log name
     * @param accountId Primary account, for logging; may be null
     * @param accountsToOpen Accounts provisioned before the operation's transaction starts
     * @param work The transactional unit of work
     */
    <T> RewardResult<T> execute(String operation, String accountId, Collection<String> accountsToOpen,
                                Function<RewardRequest, T> work) {
        RewardRequest request = RewardRequest.received(operation, accountId);
        long startTime = System.currentTimeMillis();
        try {
            return attempt(request, accountsToOpen, work);
        } finally {
            metricsService.recordLatency(operation, System.currentTimeMillis() - startTime);
        }
    }

    private <T> RewardResult<T> attempt(RewardRequest request, Collection<String> accountsToOpen,
                                        Function<RewardRequest, T> work) {
        String operation = request.getOperation();
        long backoff = retryBackoffMs;

        while (true) {
            request.beginAttempt();
            try {
                for (String id : accountsToOpen) {
                    ledgerService.openAccount(id);
                }
                T value = work.apply(request);
                request.advance(RequestState.COMMITTING);
                request.advance(RequestState.COMMITTED);
                metricsService.recordCommitted(operation);
                logger.debug("{} committed for account {} (request {}, attempt {})",
                            operation, request.getAccountId(), request.getRequestId(), request.getAttempts());
                return RewardResult.committed(value, request);

            } catch (RewardRejectedException e) {
                request.advance(RequestState.REJECTED);
                metricsService.recordRejected(operation, e.getReason().name());
                logger.warn("{} rejected for account {}: {} - {}",
                           operation, request.getAccountId(), e.getReason(), e.getMessage());
                return RewardResult.rejected(e, request);

            } catch (TransientDataAccessException | DataIntegrityViolationException e) {
                if (request.getAttempts() >= maxAttempts) {
                    return fail(request, e, "Storage conflict persisted after " + request.getAttempts() + " attempts");
                }
                metricsService.recordRetry(operation);
                logger.warn("{} hit a storage conflict for account {} (attempt {}/{}), retrying: {}",
                           operation, request.getAccountId(), request.getAttempts(), maxAttempts, e.getMessage());
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return fail(request, ie, "Interrupted while waiting to retry");
                }
                backoff *= 2;

            } catch (RuntimeException e) {
                return fail(request, e, "Unexpected error: " + e.getMessage());
            }
        }
    }

    private <T> RewardResult<T> fail(RewardRequest request, Exception cause, String message) {
        request.advance(RequestState.FAILED);
        metricsService.recordFailed(request.getOperation(), cause.getClass().getSimpleName());
        logger.error("{} failed for account {} (request {}): {}",
                    request.getOperation(), request.getAccountId(), request.getRequestId(), message, cause);
        return RewardResult.failed(message, request);
    }
}
