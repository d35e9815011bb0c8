package com.flagship.pledge_ledger.receipt;

import lombok.Value;

/**
 * Inclusive range of receipt sequence numbers owned by one stream.
 */
@Value
public class ReceiptBlock {
    int start;
    int end;

    public ReceiptBlock(int start, int end) {
        if (start < 1 || end < start) {
            throw new IllegalArgumentException(
                String.format("Invalid receipt block [%d, %d]", start, end));
        }
        this.start = start;
        this.end = end;
    }

    public boolean contains(int number) {
        return number >= start && number <= end;
    }
}
