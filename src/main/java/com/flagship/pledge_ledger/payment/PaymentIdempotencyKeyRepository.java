package com.flagship.pledge_ledger.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PaymentIdempotencyKeyRepository extends JpaRepository<PaymentIdempotencyKeyEntity, Long> {

    Optional<PaymentIdempotencyKeyEntity> findByIdempotencyKey(String idempotencyKey);
}
