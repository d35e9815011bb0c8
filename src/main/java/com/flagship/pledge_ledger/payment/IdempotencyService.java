package com.flagship.pledge_ledger.payment;

import com.flagship.pledge_ledger.payment.exception.DuplicatePaymentRequestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;

/**
 * Idempotency keys for payment requests.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the database (slower, always available, the source of truth)
 * 3. Cache database hits in Redis for the next lookup
 *
 * A key is registered in the same transaction as its payment, so a key is
 * never stored for a payment that rolled back.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:payment:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final PaymentIdempotencyKeyRepository repository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(PaymentIdempotencyKeyRepository repository,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.repository = repository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Looks up the payment an idempotency key was used for.
     *
     * @return the earlier payment's location, or empty if the key is new
     */
    @Transactional(readOnly = true)
    public Optional<IdempotentPayment> find(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(IdempotentPayment.fromCacheValue(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<IdempotentPayment> stored = repository.findByIdempotencyKey(idempotencyKey)
            .map(PaymentIdempotencyKeyEntity::toDomain);
        stored.ifPresent(payment -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, payment);
        });
        return stored;
    }

    /**
     * Stores a key for a payment that is being committed in the caller's transaction.
     *
     * @throws DuplicatePaymentRequestException if another request already holds the key
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void register(String idempotencyKey, IdempotentPayment payment) {
        requireKey(idempotencyKey);
        try {
            repository.saveAndFlush(PaymentIdempotencyKeyEntity.create(idempotencyKey, payment));
        } catch (DataIntegrityViolationException e) {
            throw new DuplicatePaymentRequestException(idempotencyKey, e);
        }
        // only cache once the payment itself is durable
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                cache(idempotencyKey, payment);
            }
        });
    }

    private void cache(String idempotencyKey, IdempotentPayment payment) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, payment.toCacheValue(), REDIS_TTL);
        } catch (Exception e) {
            log.debug("Failed to cache idempotency key in Redis: {}", e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
