package com.flagship.pledge_ledger.outbox;

import lombok.Value;

import java.time.Duration;

/**
 * Point-in-time view of undelivered notifications.
 */
@Value
public class OutboxBacklog {

    public static final OutboxBacklog EMPTY = new OutboxBacklog(0, 0, Duration.ZERO);

    /** All undelivered messages, abandoned ones included. */
    long pending;

    /** Undelivered messages the publisher has given up on. */
    long abandoned;

    Duration oldestPendingAge;
}
