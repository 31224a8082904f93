package com.cred.freestyle.rewards.service.result;

import com.cred.freestyle.rewards.domain.model.PrizeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Prize an account received from a draw or a blind box.
 * grantId and redemptionCode are null for THANK_YOU prizes; redemptionCode is null for POINTS prizes.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public class PrizeView {

    private final String allocationId;
    private final String candidateId;
    private final String name;
    private final PrizeType prizeType;
    private final long pointsAwarded;
    private final String grantId;
    private final String redemptionCode;
    private final Instant expiresAt;
}
