package com.cred.freestyle.rewards.service;

import com.cred.freestyle.rewards.domain.model.AllocationRecord;
import com.cred.freestyle.rewards.domain.model.PrizeCandidate;
import com.cred.freestyle.rewards.domain.model.PrizeGrant;
import com.cred.freestyle.rewards.domain.model.PrizeGrant.GrantStatus;
import com.cred.freestyle.rewards.domain.model.PrizeType;
import com.cred.freestyle.rewards.domain.model.SourceKind;
import com.cred.freestyle.rewards.exception.ResourceNotFoundException;
import com.cred.freestyle.rewards.repository.PrizeCandidateRepository;
import com.cred.freestyle.rewards.repository.PrizeGrantRepository;
import com.cred.freestyle.rewards.service.result.PrizeView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.UUID;

/**
 * Turns an allocated prize into what the account owns: a points credit,
 * a redeemable grant, or nothing for a consolation prize.
 *
 * @author Rewards Team
 */
@Service
public class PrizeGrantService {

    private static final Logger logger = LoggerFactory.getLogger(PrizeGrantService.class);

    private static final DateTimeFormatter CODE_DATE = DateTimeFormatter.ofPattern("MMdd");

    private final PrizeCandidateRepository candidateRepository;
    private final PrizeGrantRepository grantRepository;
    private final LedgerService ledgerService;
    private final Clock clock;

    public PrizeGrantService(
            PrizeCandidateRepository candidateRepository,
            PrizeGrantRepository grantRepository,
            LedgerService ledgerService,
            Clock clock
    ) {
        this.candidateRepository = candidateRepository;
        this.grantRepository = grantRepository;
        this.ledgerService = ledgerService;
        this.clock = clock;
    }

    /**
     * Pay out an allocated prize.
     *
     * @param allocation Allocation produced by the allocator
     * @param payoutKind Ledger kind for points prizes
     * @param description Ledger description for points prizes
     * @return view of the prize as granted
     */
    @Transactional
    public PrizeView grant(AllocationRecord allocation, SourceKind payoutKind, String description) {
        PrizeCandidate candidate = candidateRepository.findById(allocation.getCandidateId())
                .orElseThrow(() -> new ResourceNotFoundException("PrizeCandidate", allocation.getCandidateId()));

        PrizeView.PrizeViewBuilder view = PrizeView.builder()
                .allocationId(allocation.getAllocationId())
                .candidateId(candidate.getCandidateId())
                .name(candidate.getName())
                .prizeType(candidate.getPrizeType());

        if (candidate.getPrizeType() == PrizeType.THANK_YOU) {
            return view.pointsAwarded(0L).build();
        }

        Instant now = clock.instant();
        long pointsAwarded = 0L;
        GrantStatus status = GrantStatus.PENDING;
        Instant redeemedAt = null;
        if (candidate.getPrizeType() == PrizeType.POINTS && candidate.getPointsValue() > 0) {
            ledgerService.append(allocation.getAccountId(), candidate.getPointsValue(), payoutKind,
                    allocation.getAllocationId(), description);
            pointsAwarded = candidate.getPointsValue();
            status = GrantStatus.REDEEMED;
            redeemedAt = now;
        }

        Instant expiresAt = candidate.getValidityDays() == null
                ? null
                : now.plus(Duration.ofDays(candidate.getValidityDays()));
        String redemptionCode = candidate.getPrizeType().needsRedemptionCode()
                ? redemptionCode(candidate.getPrizeCode(), LocalDate.now(clock))
                : null;

        PrizeGrant grant = grantRepository.save(PrizeGrant.builder()
                .accountId(allocation.getAccountId())
                .allocationId(allocation.getAllocationId())
                .candidateId(candidate.getCandidateId())
                .prizeName(candidate.getName())
                .prizeType(candidate.getPrizeType())
                .pointsValue(candidate.getPointsValue())
                .redemptionCode(redemptionCode)
                .status(status)
                .expiresAt(expiresAt)
                .redeemedAt(redeemedAt)
                .build());

        logger.info("Granted prize {} ({}) to account {}, grant {}",
                   candidate.getName(), candidate.getPrizeType(), allocation.getAccountId(), grant.getGrantId());

        return view.pointsAwarded(pointsAwarded)
                .grantId(grant.getGrantId())
                .redemptionCode(redemptionCode)
                .expiresAt(expiresAt)
                .build();
    }

    /**
     * Code format: first four characters of the prize code, MMdd, six random characters.
     */
    static String redemptionCode(String prizeCode, LocalDate today) {
        String prefix = prizeCode.length() > 4 ? prizeCode.substring(0, 4) : prizeCode;
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 6);
        return (prefix + today.format(CODE_DATE) + suffix).toUpperCase(Locale.ROOT);
    }
}
