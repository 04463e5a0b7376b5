package com.paycycle.obligation.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A money-movement record in the ledger.
 * At most one entry may reference a given payment schedule.
 */
@Entity
@Table(name = "ledger_transactions",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_ledger_linked_schedule", columnNames = {"linked_schedule_id"})
        },
        indexes = {
                @Index(name = "idx_ledger_occurred_on", columnList = "occurred_on"),
                @Index(name = "idx_ledger_account_date", columnList = "account_id, occurred_on"),
                @Index(name = "idx_ledger_orphaned", columnList = "orphaned")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "occurred_on", nullable = false)
    private LocalDate occurredOn;

    /**
     * Signed amount; payments are recorded as positive values
     */
    @Column(name = "amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "account_id", length = 100)
    private String accountId;

    @Column(name = "linked_schedule_id")
    private UUID linkedScheduleId;

    @Column(name = "note", columnDefinition = "TEXT")
    private String note;

    /**
     * Set when the entry was written but its schedule update could not be completed or undone
     */
    @Column(name = "orphaned", nullable = false)
    @Builder.Default
    private Boolean orphaned = false;

    @Column(name = "orphan_reason", length = 500)
    private String orphanReason;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Version
    @Column(name = "version", nullable = false)
    @Builder.Default
    private Long version = 0L;

    public boolean isLinked() {
        return linkedScheduleId != null;
    }

    @PrePersist
    protected void onCreate() {
        if (orphaned == null) {
            orphaned = false;
        }
    }
}
