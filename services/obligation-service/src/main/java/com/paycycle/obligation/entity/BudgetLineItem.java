package com.paycycle.obligation.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One line of a budget snapshot. Lines folded in from generated schedules carry the
 * owning obligation id; manual lines leave it empty.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BudgetLineItem {

    @Column(name = "category", nullable = false, length = 100)
    private String category;

    @Column(name = "label", nullable = false, length = 200)
    private String label;

    @Column(name = "amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "included", nullable = false)
    @Builder.Default
    private Boolean included = true;

    @Column(name = "obligation_id")
    private UUID obligationId;

    public boolean isIncluded() {
        return Boolean.TRUE.equals(included);
    }
}
