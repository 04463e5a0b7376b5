package com.paycycle.obligation.entity;

import com.paycycle.obligation.domain.BudgetPeriod;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Manually curated budget for one month half: line items grouped by category plus salary figures.
 * {@code totalAmount} caches the sum of included items and is recomputed on every save.
 */
@Entity
@Table(name = "budget_snapshots",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_snapshot_period",
                        columnNames = {"snapshot_year", "snapshot_month", "timing_bucket"})
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BudgetSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "snapshot_year", nullable = false)
    private Integer snapshotYear;

    @Column(name = "snapshot_month", nullable = false)
    private Integer snapshotMonth;

    @Enumerated(EnumType.STRING)
    @Column(name = "timing_bucket", nullable = false, length = 20)
    private TimingBucket timingBucket;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private SnapshotStatus status = SnapshotStatus.DRAFT;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "budget_line_items", joinColumns = @JoinColumn(name = "snapshot_id"))
    @OrderColumn(name = "line_order")
    @Builder.Default
    private List<BudgetLineItem> items = new ArrayList<>();

    @Column(name = "projected_salary", precision = 19, scale = 4)
    private BigDecimal projectedSalary;

    /**
     * Overrides the projected salary once present
     */
    @Column(name = "actual_salary", precision = 19, scale = 4)
    private BigDecimal actualSalary;

    @Column(name = "total_amount", nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal totalAmount = BigDecimal.ZERO;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    @Builder.Default
    private Long version = 0L;

    public BudgetPeriod getPeriod() {
        return BudgetPeriod.of(snapshotYear, snapshotMonth, timingBucket);
    }

    public void setPeriod(BudgetPeriod period) {
        this.snapshotYear = period.getMonth().getYear();
        this.snapshotMonth = period.getMonth().getMonthValue();
        this.timingBucket = period.getTiming();
    }

    /**
     * Live sum of included line items
     */
    public BigDecimal sumIncludedItems() {
        return items.stream()
                .filter(BudgetLineItem::isIncluded)
                .map(BudgetLineItem::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public void recomputeTotal() {
        this.totalAmount = sumIncludedItems();
    }

    /**
     * Actual salary when recorded, otherwise the projected salary, otherwise zero
     */
    public BigDecimal getEffectiveIncome() {
        if (actualSalary != null) {
            return actualSalary;
        }
        return projectedSalary != null ? projectedSalary : BigDecimal.ZERO;
    }

    public Map<String, List<BudgetLineItem>> getItemsByCategory() {
        Map<String, List<BudgetLineItem>> grouped = new LinkedHashMap<>();
        for (BudgetLineItem item : items) {
            grouped.computeIfAbsent(item.getCategory(), k -> new ArrayList<>()).add(item);
        }
        return grouped;
    }

    @PrePersist
    @PreUpdate
    protected void onSave() {
        if (status == null) {
            status = SnapshotStatus.DRAFT;
        }
        recomputeTotal();
    }
}
