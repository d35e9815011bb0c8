package com.flagship.pledge_ledger.receipt;

import java.util.Iterator;
import java.util.Set;

/**
 * Open-ended sequence of the blocks belonging to one receipt stream.
 *
 * The sequence never runs out: after the last block anyone has seen, the
 * next one is computed from the stream's period, offset and width.
 */
public final class ReceiptBlockSequence implements Iterable<ReceiptBlock> {

    private final ReceiptStream stream;

    private ReceiptBlockSequence(ReceiptStream stream) {
        this.stream = stream;
    }

    public static ReceiptBlockSequence of(ReceiptStream stream) {
        return new ReceiptBlockSequence(stream);
    }

    @Override
    public Iterator<ReceiptBlock> iterator() {
        return new Iterator<>() {
            private int index = 0;

            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public ReceiptBlock next() {
                return stream.blockAt(index++);
            }
        };
    }

    /**
     * Returns the smallest number in the stream's blocks, walked in order,
     * that is not in {@code used}.
     *
     * Pure function: the same stream and used set always give the same answer.
     * Always terminates because {@code used} is finite.
     */
    public static int nextNumber(ReceiptStream stream, Set<Integer> used) {
        for (ReceiptBlock block : of(stream)) {
            for (int candidate = block.getStart(); candidate <= block.getEnd(); candidate++) {
                if (!used.contains(candidate)) {
                    return candidate;
                }
            }
        }
        throw new IllegalStateException("Receipt block sequence is unbounded");
    }
}
