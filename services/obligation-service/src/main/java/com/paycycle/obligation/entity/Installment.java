package com.paycycle.obligation.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A fixed-term loan repaid in equal periodic amounts.
 * {@code cumulativePaid} caches the sum of paid amounts over all of its schedules
 * and is only ever recomputed from them.
 */
@Entity
@Table(name = "installments", indexes = {
        @Index(name = "idx_installment_account_id", columnList = "account_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Installment implements Obligation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "category", length = 100)
    private String category;

    @Column(name = "total_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalAmount;

    @Column(name = "period_amount", precision = 19, scale = 4)
    private BigDecimal periodAmount;

    @Column(name = "term_periods", nullable = false)
    private Integer termPeriods;

    @Column(name = "cumulative_paid", nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal cumulativePaid = BigDecimal.ZERO;

    @Column(name = "account_id", length = 100)
    private String accountId;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "timing", length = 20)
    private TimingBucket timing;

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

    @Override
    public ObligationType getObligationType() {
        return ObligationType.INSTALLMENT;
    }

    @Override
    public String getDefaultAccountId() {
        return accountId;
    }

    /**
     * Explicit period amount, or the total spread evenly over the term when unset
     */
    @Override
    public BigDecimal getExpectedAmount() {
        if (periodAmount != null) {
            return periodAmount;
        }
        if (totalAmount == null || termPeriods == null || termPeriods <= 0) {
            return null;
        }
        return totalAmount.divide(BigDecimal.valueOf(termPeriods), 2, RoundingMode.HALF_EVEN);
    }

    public BigDecimal getRemainingBalance() {
        BigDecimal paid = cumulativePaid == null ? BigDecimal.ZERO : cumulativePaid;
        return totalAmount.subtract(paid).max(BigDecimal.ZERO);
    }

    @PrePersist
    protected void onCreate() {
        if (cumulativePaid == null) {
            cumulativePaid = BigDecimal.ZERO;
        }
    }
}
