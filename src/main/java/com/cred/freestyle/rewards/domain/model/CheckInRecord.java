package com.cred.freestyle.rewards.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One row per account per calendar day checked in.
 * The latest row is the account's streak state.
 *
 * @author Rewards Team
 */
@Entity
@Table(name = "check_in_records", indexes = {
    @Index(name = "idx_check_in_account_date", columnList = "account_id, check_in_date", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckInRecord {

    @Id
    @Column(name = "check_in_id", nullable = false, length = 36)
    private String checkInId;

    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    @Column(name = "check_in_date", nullable = false)
    private LocalDate checkInDate;

    @Column(name = "consecutive_days", nullable = false)
    private Integer consecutiveDays;

    @Column(name = "points_earned", nullable = false)
    private Long pointsEarned;

    @Column(name = "ledger_entry_id")
    private Long ledgerEntryId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (checkInId == null) {
            checkInId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
    }

    public StreakState toStreakState() {
        return new StreakState(checkInDate, consecutiveDays);
    }
}
