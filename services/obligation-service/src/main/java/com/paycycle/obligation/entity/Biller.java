package com.paycycle.obligation.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.Optional;
import java.util.UUID;

/**
 * A recurring monthly bill (utilities, subscriptions, rent).
 * Scheduled once per calendar month between its activation and deactivation windows.
 */
@Entity
@Table(name = "billers", indexes = {
        @Index(name = "idx_biller_category", columnList = "category"),
        @Index(name = "idx_biller_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Biller implements Obligation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "category", length = 100)
    private String category;

    @Column(name = "expected_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal expectedAmount;

    /**
     * Day of month the bill falls due (1-31)
     */
    @Column(name = "due_day")
    private Integer dueDay;

    @Column(name = "activation_year", nullable = false)
    private Integer activationYear;

    @Column(name = "activation_month", nullable = false)
    private Integer activationMonth;

    @Column(name = "activation_day")
    private Integer activationDay;

    @Column(name = "deactivation_year")
    private Integer deactivationYear;

    @Column(name = "deactivation_month")
    private Integer deactivationMonth;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private BillerStatus status = BillerStatus.ACTIVE;

    @Column(name = "linked_account_id", length = 100)
    private String linkedAccountId;

    /**
     * Statement day of the linked credit account (1-31)
     */
    @Column(name = "billing_day")
    private Integer billingDay;

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
        return ObligationType.BILLER;
    }

    @Override
    public String getDefaultAccountId() {
        return linkedAccountId;
    }

    public YearMonth getActivationWindow() {
        if (activationYear == null || activationMonth == null) {
            return null;
        }
        return YearMonth.of(activationYear, activationMonth);
    }

    public void setActivationWindow(YearMonth window) {
        this.activationYear = window == null ? null : window.getYear();
        this.activationMonth = window == null ? null : window.getMonthValue();
    }

    /**
     * First month for which no schedule is generated, or null when open-ended
     */
    public YearMonth getDeactivationWindow() {
        if (deactivationYear == null || deactivationMonth == null) {
            return null;
        }
        return YearMonth.of(deactivationYear, deactivationMonth);
    }

    public void setDeactivationWindow(YearMonth window) {
        this.deactivationYear = window == null ? null : window.getYear();
        this.deactivationMonth = window == null ? null : window.getMonthValue();
    }

    public boolean isActive() {
        return status == BillerStatus.ACTIVE;
    }

    /**
     * Day used for half-month bucketing: the due day when present, else the activation day.
     */
    public Optional<Integer> getBucketingDay() {
        if (dueDay != null) {
            return Optional.of(dueDay);
        }
        return Optional.ofNullable(activationDay);
    }

    public Optional<TimingBucket> getTimingBucket() {
        return getBucketingDay().map(TimingBucket::fromDayOfMonth);
    }

    @PrePersist
    protected void onCreate() {
        if (status == null) {
            status = BillerStatus.ACTIVE;
        }
    }
}
