package com.flagship.pledge_ledger.payment;

import com.flagship.pledge_ledger.receipt.ReceiptStream;

/**
 * The kinds of record that carry an embedded payment list.
 * Each kind draws its receipt numbers from its own stream.
 */
public enum LedgerKind {
    PLEDGE(ReceiptStream.BOLI, "Pledge entry"),
    OUTSTANDING(ReceiptStream.OUTSTANDING, "Previous outstanding record");

    private final ReceiptStream receiptStream;
    private final String label;

    LedgerKind(ReceiptStream receiptStream, String label) {
        this.receiptStream = receiptStream;
        this.label = label;
    }

    public ReceiptStream getReceiptStream() {
        return receiptStream;
    }

    public String getLabel() {
        return label;
    }
}
