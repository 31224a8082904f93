package com.cred.freestyle.rewards.service;

import com.cred.freestyle.rewards.domain.model.Account;
import com.cred.freestyle.rewards.domain.model.AllocationRecord;
import com.cred.freestyle.rewards.domain.model.PointsProduct;
import com.cred.freestyle.rewards.domain.model.ProductExchange;
import com.cred.freestyle.rewards.domain.model.ProductExchange.ExchangeStatus;
import com.cred.freestyle.rewards.domain.model.SourceKind;
import com.cred.freestyle.rewards.exception.ExchangeLimitReachedException;
import com.cred.freestyle.rewards.exception.InsufficientBalanceException;
import com.cred.freestyle.rewards.exception.RejectionReason;
import com.cred.freestyle.rewards.exception.ResourceNotFoundException;
import com.cred.freestyle.rewards.exception.RewardRejectedException;
import com.cred.freestyle.rewards.repository.PointsProductRepository;
import com.cred.freestyle.rewards.repository.ProductExchangeRepository;
import com.cred.freestyle.rewards.service.result.RequestState;
import com.cred.freestyle.rewards.service.result.RewardRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Points-mall exchanges and refunds.
 *
 * @author Rewards Team
 */
@Service
public class PointsMallService {

    private static final Logger logger = LoggerFactory.getLogger(PointsMallService.class);

    private final PointsProductRepository productRepository;
    private final ProductExchangeRepository exchangeRepository;
    private final LedgerService ledgerService;
    private final InventoryAllocator allocator;
    private final Clock clock;

    public PointsMallService(
            PointsProductRepository productRepository,
            ProductExchangeRepository exchangeRepository,
            LedgerService ledgerService,
            InventoryAllocator allocator,
            Clock clock
    ) {
        this.productRepository = productRepository;
        this.exchangeRepository = exchangeRepository;
        this.ledgerService = ledgerService;
        this.allocator = allocator;
        this.clock = clock;
    }

    /**
     * Exchange points for a product.
     *
     * Validation order: quantity, product availability, per-user cap, minimum balance, affordability.
     * Then stock is taken, the cost debited and the exchange recorded as PENDING.
     *
     * @param accountId Account ID
     * @param productId Product ID
     * @param quantity Units, >= 1
     * @param request Request being processed
     * @return the exchange record
     */
    @Transactional
    public ProductExchange exchange(String accountId, String productId, int quantity, RewardRequest request) {
        if (quantity < 1) {
            throw RewardRejectedException.of(RejectionReason.INVALID_QUANTITY,
                    "Quantity must be at least 1", "quantity", quantity);
        }
        PointsProduct product = productRepository.findById(productId)
                .orElseThrow(() -> new ResourceNotFoundException("PointsProduct", productId));
        Instant now = clock.instant();
        if (!product.isAvailable(now)) {
            throw RewardRejectedException.of(RejectionReason.PRODUCT_UNAVAILABLE,
                    "Product " + productId + " is not available for exchange",
                    "productId", productId, "startTime", product.getStartTime(), "endTime", product.getEndTime());
        }

        Account account = ledgerService.lockAccount(accountId);

        if (product.hasPerUserCap()) {
            Long held = exchangeRepository.sumQuantityExcludingStatuses(accountId, productId, ExchangeStatus.released());
            long alreadyExchanged = held == null ? 0L : held;
            if (alreadyExchanged + quantity > product.getMaxExchangePerUser()) {
                throw new ExchangeLimitReachedException(accountId, productId, product.getMaxExchangePerUser(), alreadyExchanged);
            }
        }

        long cost = totalCost(product, quantity);
        if (!account.canAfford(product.getMinPointsBalance())) {
            throw new InsufficientBalanceException(accountId, product.getMinPointsBalance(), account.getBalance());
        }
        if (!account.canAfford(cost)) {
            throw new InsufficientBalanceException(accountId, cost, account.getBalance());
        }

        request.advance(RequestState.ALLOCATING);
        AllocationRecord allocation = allocator.allocateProduct(product, accountId, quantity, cost);

        request.advance(RequestState.COMMITTING);
        String exchangeId = UUID.randomUUID().toString();
        if (cost > 0) {
            ledgerService.append(accountId, -cost, SourceKind.EXCHANGE_COST, exchangeId,
                    "Points mall exchange: " + product.getName() + " x" + quantity);
        }
        ProductExchange exchange = exchangeRepository.save(ProductExchange.builder()
                .exchangeId(exchangeId)
                .accountId(accountId)
                .productId(productId)
                .productName(product.getName())
                .quantity(quantity)
                .pointsUsed(cost)
                .status(ExchangeStatus.PENDING)
                .allocationId(allocation.getAllocationId())
                .build());

        logger.info("Account {} exchanged {} x {} for {} points (exchange {})",
                   accountId, quantity, productId, cost, exchangeId);
        return exchange;
    }

    /**
     * Refund a pending or issued exchange: credit the points back and return the stock.
     *
     * @param exchangeId Exchange ID
     * @param reason Operator note stored on the exchange
     * @param request Request being processed
     * @return the refunded exchange
     */
    @Transactional
    public ProductExchange refund(String exchangeId, String reason, RewardRequest request) {
        ProductExchange exchange = exchangeRepository.findByIdForUpdate(exchangeId)
                .orElseThrow(() -> new ResourceNotFoundException("ProductExchange", exchangeId));
        if (!exchange.isRefundable()) {
            throw RewardRejectedException.of(RejectionReason.EXCHANGE_NOT_REFUNDABLE,
                    "Exchange " + exchangeId + " cannot be refunded in status " + exchange.getStatus(),
                    "exchangeId", exchangeId, "status", exchange.getStatus().name());
        }

        ledgerService.lockAccount(exchange.getAccountId());

        request.advance(RequestState.COMMITTING);
        if (exchange.getPointsUsed() > 0) {
            ledgerService.append(exchange.getAccountId(), exchange.getPointsUsed(), SourceKind.EXCHANGE_REFUND,
                    exchangeId, "Refund for exchange of " + exchange.getProductName());
        }
        productRepository.restoreStock(exchange.getProductId(), exchange.getQuantity());
        exchange.refund(reason, clock.instant());
        exchangeRepository.save(exchange);

        logger.info("Refunded exchange {} of account {}: {} points, {} unit(s) restocked",
                   exchangeId, exchange.getAccountId(), exchange.getPointsUsed(), exchange.getQuantity());
        return exchange;
    }

    private static long totalCost(PointsProduct product, int quantity) {
        try {
            return Math.multiplyExact(product.getPointsRequired(), (long) quantity);
        } catch (ArithmeticException e) {
            throw RewardRejectedException.of(RejectionReason.INVALID_QUANTITY,
                    "Quantity " + quantity + " of product " + product.getProductId() + " exceeds the points range",
                    "quantity", quantity, "pointsRequired", product.getPointsRequired());
        }
    }
}
