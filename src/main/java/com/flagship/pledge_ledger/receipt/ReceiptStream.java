package com.flagship.pledge_ledger.receipt;

/**
 * The two independent receipt streams sharing one yearly number space.
 *
 * Numbers are laid out in repeating windows of {@link #PERIOD}: the boli
 * stream owns the first 200 numbers of every window and the outstanding
 * stream owns the last 100. Block k of a stream is therefore
 * {@code [PERIOD * k + offset, PERIOD * k + offset + width - 1]}.
 */
public enum ReceiptStream {
    BOLI("boli", 1, 200),
    OUTSTANDING("outstanding", 201, 100);

    public static final int PERIOD = 300;

    private final String code;
    private final int offset;
    private final int width;

    ReceiptStream(String code, int offset, int width) {
        this.code = code;
        this.offset = offset;
        this.width = width;
    }

    public String getCode() {
        return code;
    }

    /**
     * Returns the k-th block (zero based) of this stream.
     */
    public ReceiptBlock blockAt(int k) {
        if (k < 0) {
            throw new IllegalArgumentException("Block index cannot be negative: " + k);
        }
        int start = PERIOD * k + offset;
        return new ReceiptBlock(start, start + width - 1);
    }

    public boolean owns(int number) {
        if (number < 1) {
            return false;
        }
        int position = (number - 1) % PERIOD + 1;
        return position >= offset && position < offset + width;
    }
}
