package com.paycycle.obligation.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Month;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.UUID;

/**
 * One payable instance of an obligation for one monthly period.
 *
 * Payment fields are written through conditional updates in
 * {@link com.paycycle.obligation.repository.PaymentScheduleRepository}; the unique
 * {@code linked_transaction_id} column backs the one-ledger-entry-per-schedule rule.
 */
@Entity
@Table(name = "payment_schedules",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_schedule_obligation_period",
                        columnNames = {"obligation_type", "obligation_id", "schedule_year", "schedule_month"}),
                @UniqueConstraint(name = "uk_schedule_linked_transaction", columnNames = {"linked_transaction_id"})
        },
        indexes = {
                @Index(name = "idx_schedule_obligation", columnList = "obligation_type, obligation_id"),
                @Index(name = "idx_schedule_period", columnList = "schedule_year, schedule_month"),
                @Index(name = "idx_schedule_due_date", columnList = "due_date")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class PaymentSchedule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "obligation_type", nullable = false, length = 20, updatable = false)
    private ObligationType obligationType;

    @Column(name = "obligation_id", nullable = false, updatable = false)
    private UUID obligationId;

    @Column(name = "schedule_year", nullable = false)
    private Integer scheduleYear;

    @Column(name = "schedule_month", nullable = false)
    private Integer scheduleMonth;

    @Enumerated(EnumType.STRING)
    @Column(name = "timing_bucket", nullable = false, length = 20)
    private TimingBucket timingBucket;

    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;

    /**
     * Sequence within an installment term (1..N); null for billers
     */
    @Column(name = "payment_number")
    private Integer paymentNumber;

    @Column(name = "expected_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal expectedAmount;

    @Column(name = "paid_amount", precision = 19, scale = 4)
    private BigDecimal paidAmount;

    @Column(name = "date_paid")
    private LocalDate datePaid;

    @Column(name = "linked_account_id", length = 100)
    private String linkedAccountId;

    @Column(name = "linked_transaction_id")
    private UUID linkedTransactionId;

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

    public YearMonth getPeriod() {
        return YearMonth.of(scheduleYear, scheduleMonth);
    }

    public String getMonthName() {
        return Month.of(scheduleMonth).getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    public boolean isLinked() {
        return linkedTransactionId != null;
    }

    public boolean hasPaymentRecorded() {
        return paidAmount != null && paidAmount.signum() > 0;
    }

    /**
     * Derives the payment status as of the given date.
     * A schedule without a positive paid amount is overdue once its due date has passed.
     */
    public PaymentStatus statusAsOf(LocalDate asOf) {
        if (!hasPaymentRecorded()) {
            return asOf.isAfter(dueDate) ? PaymentStatus.OVERDUE : PaymentStatus.PENDING;
        }
        return paidAmount.compareTo(expectedAmount) >= 0 ? PaymentStatus.PAID : PaymentStatus.PARTIAL;
    }

    public BigDecimal getOutstandingAmount() {
        if (paidAmount == null) {
            return expectedAmount;
        }
        return expectedAmount.subtract(paidAmount).max(BigDecimal.ZERO);
    }

    public void recordPayment(BigDecimal amount, LocalDate date, String accountId, UUID transactionId) {
        this.paidAmount = amount;
        this.datePaid = date;
        this.linkedAccountId = accountId;
        this.linkedTransactionId = transactionId;
    }

    public void clearPayment() {
        this.paidAmount = null;
        this.datePaid = null;
        this.linkedAccountId = null;
        this.linkedTransactionId = null;
    }
}
