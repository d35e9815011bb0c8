package com.flagship.pledge_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed settings under the {@code ledger.*} prefix.
 */
@ConfigurationProperties(prefix = "ledger")
@Getter
@Setter
public class LedgerProperties {

    private Receipt receipt = new Receipt();
    private Payment payment = new Payment();

    @Getter
    @Setter
    public static class Receipt {
        /**
         * Leading part of every receipt number, e.g. SPDJMSJ-2024-00001.
         */
        private String prefix = "SPDJMSJ";

        /**
         * How many candidates the allocator tries to claim before falling back.
         */
        private int maxClaimAttempts = 20;

        /**
         * How many times the issued numbers are re-scanned after a full set of
         * claim attempts was lost to concurrent callers.
         */
        private int maxScanRounds = 3;
    }

    @Getter
    @Setter
    public static class Payment {
        /**
         * How many times a payment commit is retried after losing a version race.
         */
        private int maxCommitAttempts = 10;
    }
}
