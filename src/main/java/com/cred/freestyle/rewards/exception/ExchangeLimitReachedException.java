package com.cred.freestyle.rewards.exception;

/**
 * Exception thrown when an account would exceed a product's per-user exchange cap.
 *
 * @author Rewards Team
 */
public class ExchangeLimitReachedException extends RewardRejectedException {

    private final String accountId;
    private final String productId;

    public ExchangeLimitReachedException(String accountId, String productId, int limit, long alreadyExchanged) {
        super(RejectionReason.EXCHANGE_LIMIT_REACHED,
                String.format("Account %s reached the exchange limit for product %s. Limit: %d, Exchanged: %d",
                        accountId, productId, limit, alreadyExchanged),
                details("limit", limit, "exchanged", alreadyExchanged, "remaining", Math.max(0, limit - alreadyExchanged)));
        this.accountId = accountId;
        this.productId = productId;
    }

    public String getAccountId() {
        return accountId;
    }

    public String getProductId() {
        return productId;
    }
}
