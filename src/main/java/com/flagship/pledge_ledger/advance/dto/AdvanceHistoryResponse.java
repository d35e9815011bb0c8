package com.flagship.pledge_ledger.advance.dto;

import com.flagship.pledge_ledger.advance.AdvanceDeposit;
import com.flagship.pledge_ledger.advance.AdvanceUsage;
import lombok.Value;

import java.util.List;

/**
 * A user's advance deposits and the draws made against them.
 */
@Value
public class AdvanceHistoryResponse {
    long userId;
    long remainingBalance;
    List<AdvanceDeposit> deposits;
    List<AdvanceUsage> usages;
}
