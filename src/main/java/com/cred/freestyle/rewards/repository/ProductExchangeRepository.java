package com.cred.freestyle.rewards.repository;

import com.cred.freestyle.rewards.domain.model.ProductExchange;
import com.cred.freestyle.rewards.domain.model.ProductExchange.ExchangeStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for points-mall exchanges.
 *
 * @author Rewards Team
 */
@Repository
public interface ProductExchangeRepository extends JpaRepository<ProductExchange, String> {

    /**
     * Units of a product an account holds in exchanges whose status is not in {@code excluded}.
     * Null when there are none.
     */
    @Query("SELECT SUM(x.quantity) FROM ProductExchange x " +
           "WHERE x.accountId = :accountId AND x.productId = :productId AND x.status NOT IN :excluded")
    Long sumQuantityExcludingStatuses(@Param("accountId") String accountId,
                                      @Param("productId") String productId,
                                      @Param("excluded") Collection<ExchangeStatus> excluded);

    List<ProductExchange> findByAccountIdOrderByCreatedAtDesc(String accountId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT x FROM ProductExchange x WHERE x.exchangeId = :exchangeId")
    Optional<ProductExchange> findByIdForUpdate(@Param("exchangeId") String exchangeId);
}
