package com.flagship.pledge_ledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TransactionLogRepository extends JpaRepository<TransactionLogEntity, Long> {

    List<TransactionLogEntity> findAllByOrderByIdDesc();

    List<TransactionLogEntity> findByRecordKindAndEntryIdOrderByIdDesc(RecordKind recordKind, long entryId);
}
