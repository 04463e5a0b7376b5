package com.paycycle.obligation.service;

import com.paycycle.obligation.domain.BudgetPeriod;
import com.paycycle.obligation.entity.BudgetLineItem;
import com.paycycle.obligation.entity.BudgetSnapshot;
import com.paycycle.obligation.entity.Obligation;
import com.paycycle.obligation.entity.PaymentSchedule;
import com.paycycle.obligation.entity.SnapshotStatus;
import com.paycycle.obligation.repository.BudgetSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Service for per-period budget snapshots
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BudgetSnapshotService {

    static final String UNCATEGORIZED = "Uncategorized";

    private final BudgetSnapshotRepository snapshotRepository;
    private final ObligationService obligationService;

    @Transactional(readOnly = true)
    public Optional<BudgetSnapshot> getSnapshot(BudgetPeriod period) {
        return snapshotRepository.findBySnapshotYearAndSnapshotMonthAndTimingBucket(
                period.getMonth().getYear(), period.getMonth().getMonthValue(), period.getTiming());
    }

    /**
     * Replace a period's items and salary figures and mark the snapshot saved.
     * The cached total is recomputed from the included items.
     */
    @Transactional
    public BudgetSnapshot saveSnapshot(BudgetPeriod period, List<BudgetLineItem> items,
                                       BigDecimal projectedSalary, BigDecimal actualSalary) {
        BudgetSnapshot snapshot = getSnapshot(period).orElseGet(() -> newSnapshot(period));
        snapshot.getItems().clear();
        snapshot.getItems().addAll(items);
        snapshot.setProjectedSalary(projectedSalary);
        snapshot.setActualSalary(actualSalary);
        snapshot.setStatus(SnapshotStatus.SAVED);
        snapshot.recomputeTotal();

        BudgetSnapshot saved = snapshotRepository.save(snapshot);
        log.info("Budget snapshot saved: period={}, items={}, total={}", period, items.size(), saved.getTotalAmount());
        return saved;
    }

    /**
     * Record the actual salary of a period; overrides the projected salary from then on
     */
    @Transactional
    public BudgetSnapshot recordActualSalary(BudgetPeriod period, BigDecimal actualSalary) {
        BudgetSnapshot snapshot = getSnapshot(period).orElseGet(() -> newSnapshot(period));
        snapshot.setActualSalary(actualSalary);
        log.info("Actual salary recorded: period={}, amount={}", period, actualSalary);
        return snapshotRepository.save(snapshot);
    }

    /**
     * Fold the period's generated schedules into its snapshot as one line per schedule.
     * Manual lines are kept. A snapshot that is already saved is returned unchanged.
     */
    @Transactional
    public BudgetSnapshot draftFromSchedules(BudgetPeriod period) {
        BudgetSnapshot snapshot = getSnapshot(period).orElseGet(() -> newSnapshot(period));
        if (snapshot.getStatus() == SnapshotStatus.SAVED) {
            log.info("Snapshot for {} already saved; not redrafting", period);
            return snapshot;
        }

        List<BudgetLineItem> manual = snapshot.getItems().stream()
                .filter(item -> item.getObligationId() == null)
                .collect(Collectors.toList());

        List<BudgetLineItem> drafted = new ArrayList<>();
        for (PaymentSchedule schedule : obligationService.findSchedulesForPeriod(period.getMonth(), period.getTiming())) {
            Obligation obligation = obligationService.getObligation(schedule.getObligationType(), schedule.getObligationId());
            drafted.add(BudgetLineItem.builder()
                    .category(obligation.getCategory() != null ? obligation.getCategory() : UNCATEGORIZED)
                    .label(obligation.getName())
                    .amount(schedule.getExpectedAmount())
                    .included(true)
                    .obligationId(obligation.getId())
                    .build());
        }

        snapshot.getItems().clear();
        snapshot.getItems().addAll(drafted);
        snapshot.getItems().addAll(manual);
        snapshot.setStatus(SnapshotStatus.DRAFT);
        snapshot.recomputeTotal();

        BudgetSnapshot saved = snapshotRepository.save(snapshot);
        log.info("Budget snapshot drafted: period={}, scheduleItems={}, manualItems={}",
                period, drafted.size(), manual.size());
        return saved;
    }

    private BudgetSnapshot newSnapshot(BudgetPeriod period) {
        BudgetSnapshot snapshot = BudgetSnapshot.builder().build();
        snapshot.setPeriod(period);
        return snapshot;
    }
}
