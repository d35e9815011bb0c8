package com.flagship.pledge_ledger.advance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface AdvanceDepositRepository extends JpaRepository<AdvanceDepositEntity, Long> {

    List<AdvanceDepositEntity> findByUserIdOrderByDateDescIdDesc(long userId);

    List<AdvanceDepositEntity> findByUserIdAndDateBetweenOrderByDateDescIdDesc(long userId, LocalDate from, LocalDate to);
}
