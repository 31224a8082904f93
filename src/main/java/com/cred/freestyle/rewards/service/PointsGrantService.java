package com.cred.freestyle.rewards.service;

import com.cred.freestyle.rewards.domain.model.LedgerEntry;
import com.cred.freestyle.rewards.domain.model.SourceKind;
import com.cred.freestyle.rewards.exception.RejectionReason;
import com.cred.freestyle.rewards.exception.RewardRejectedException;
import com.cred.freestyle.rewards.service.result.RequestState;
import com.cred.freestyle.rewards.service.result.RewardRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Point grants that need no earning rule: completed orders and operator adjustments.
 * Both are keyed by their external reference, so retries cannot pay twice.
 *
 * @author Rewards Team
 */
@Service
public class PointsGrantService {

    private static final Logger logger = LoggerFactory.getLogger(PointsGrantService.class);

    private final LedgerService ledgerService;

    public PointsGrantService(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @Transactional
    public LedgerEntry grantOrderReward(String accountId, String orderId, long points, String description,
                                        RewardRequest request) {
        if (points <= 0) {
            throw RewardRejectedException.of(RejectionReason.INVALID_AMOUNT,
                    "Order reward must be positive", "orderId", orderId, "points", points);
        }
        request.advance(RequestState.COMMITTING);
        LedgerEntry entry = ledgerService.append(accountId, points, SourceKind.ORDER_REWARD, orderId,
                description == null ? "Order completed: " + orderId : description);
        logger.info("Order reward for account {} on order {}: +{}", accountId, orderId, points);
        return entry;
    }

    /**
     * Operator correction. A debit may not take the balance below zero.
     *
     * @param ticket Operator ticket; one adjustment per ticket and account
     */
    @Transactional
    public LedgerEntry adjustBalance(String accountId, long delta, String ticket, String reason,
                                     RewardRequest request) {
        if (delta == 0) {
            throw RewardRejectedException.of(RejectionReason.INVALID_AMOUNT,
                    "Adjustment must be non-zero", "ticket", ticket);
        }
        if (ticket == null || ticket.isBlank()) {
            throw new IllegalArgumentException("Adjustment ticket is required");
        }
        request.advance(RequestState.COMMITTING);
        LedgerEntry entry = ledgerService.append(accountId, delta, SourceKind.ADMIN, ticket,
                reason == null ? "Manual adjustment" : reason);
        logger.info("Manual adjustment for account {} (ticket {}): {}", accountId, ticket, delta);
        return entry;
    }
}
