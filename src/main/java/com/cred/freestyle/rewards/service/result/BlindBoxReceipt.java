package com.cred.freestyle.rewards.service.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
@AllArgsConstructor
public class BlindBoxReceipt {

    private final String boxId;
    private final PrizeView prize;
}
