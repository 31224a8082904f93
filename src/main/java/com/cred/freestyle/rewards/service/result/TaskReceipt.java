package com.cred.freestyle.rewards.service.result;

import com.cred.freestyle.rewards.domain.model.TaskCompletion.CompletionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
@AllArgsConstructor
public class TaskReceipt {

    private final String taskCode;
    private final long pointsEarned;
    private final long newBalance;
    private final int completionCount;
    private final CompletionStatus status;
    private final Long ledgerEntryId;
}
