package com.cred.freestyle.rewards.repository;

import com.cred.freestyle.rewards.domain.model.PointsProduct;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * Repository for points-mall products.
 *
 * @author Rewards Team
 */
@Repository
public interface PointsProductRepository extends JpaRepository<PointsProduct, String> {

    /**
     * Atomically take {@code quantity} units of finite stock.
     *
     * @param productId Product ID
     * @param quantity Units to take
     * @return 1 if taken, 0 if not enough stock remained
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE PointsProduct p SET " +
           "p.stockQuantity = p.stockQuantity - :quantity, " +
           "p.exchangedQuantity = p.exchangedQuantity + :quantity " +
           "WHERE p.productId = :productId AND p.totalQuantity >= 0 AND p.stockQuantity >= :quantity")
    int decrementStock(@Param("productId") String productId, @Param("quantity") int quantity);

    /**
     * Count exchanged units of an unlimited product.
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE PointsProduct p SET p.exchangedQuantity = p.exchangedQuantity + :quantity " +
           "WHERE p.productId = :productId AND p.totalQuantity < 0")
    int incrementExchanged(@Param("productId") String productId, @Param("quantity") int quantity);

    /**
     * Give refunded units back. Finite stock grows again; exchanged quantity never drops below zero.
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE PointsProduct p SET " +
           "p.stockQuantity = CASE WHEN p.totalQuantity >= 0 THEN p.stockQuantity + :quantity ELSE p.stockQuantity END, " +
           "p.exchangedQuantity = CASE WHEN p.exchangedQuantity >= :quantity THEN p.exchangedQuantity - :quantity ELSE 0 END " +
           "WHERE p.productId = :productId")
    int restoreStock(@Param("productId") String productId, @Param("quantity") int quantity);

    @Query("SELECT p.stockQuantity FROM PointsProduct p WHERE p.productId = :productId")
    Integer findStockQuantity(@Param("productId") String productId);
}
