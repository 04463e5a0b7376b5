package com.paycycle.obligation.repository;

import com.paycycle.obligation.entity.BudgetSnapshot;
import com.paycycle.obligation.entity.TimingBucket;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface BudgetSnapshotRepository extends JpaRepository<BudgetSnapshot, UUID> {

    Optional<BudgetSnapshot> findBySnapshotYearAndSnapshotMonthAndTimingBucket(
            Integer snapshotYear, Integer snapshotMonth, TimingBucket timingBucket);
}
