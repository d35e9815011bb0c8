package com.flagship.pledge_ledger.ledger;

import com.flagship.pledge_ledger.payment.LedgerKind;

/**
 * Which table a transaction log row's {@code entryId} points into.
 */
public enum RecordKind {
    PLEDGE,
    OUTSTANDING,
    ADVANCE_DEPOSIT;

    public static RecordKind of(LedgerKind kind) {
        return kind == LedgerKind.PLEDGE ? PLEDGE : OUTSTANDING;
    }
}
