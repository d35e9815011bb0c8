package com.flagship.pledge_ledger.payment;

import com.flagship.pledge_ledger.payment.exception.LedgerRecordNotFoundException;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the store for each kind of payment-bearing record.
 */
@Component
public class PaymentBearingStores {

    private final Map<LedgerKind, PaymentBearingStore> stores = new EnumMap<>(LedgerKind.class);

    public PaymentBearingStores(List<PaymentBearingStore> stores) {
        for (PaymentBearingStore store : stores) {
            if (this.stores.put(store.kind(), store) != null) {
                throw new IllegalStateException("Two stores registered for " + store.kind());
            }
        }
        for (LedgerKind kind : LedgerKind.values()) {
            if (!this.stores.containsKey(kind)) {
                throw new IllegalStateException("No store registered for " + kind);
            }
        }
    }

    public PaymentBearingStore forKind(LedgerKind kind) {
        return stores.get(kind);
    }

    /**
     * Fresh read from the database.
     *
     * @throws LedgerRecordNotFoundException if there is no such record
     */
    public PaymentBearingRecord load(LedgerKind kind, long id) {
        return forKind(kind).findRecord(id)
            .orElseThrow(() -> LedgerRecordNotFoundException.of(kind.getLabel(), id));
    }
}
