package com.paycycle.obligation.dto;

import com.paycycle.obligation.entity.TimingBucket;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Partial installment edit; null fields are left unchanged
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateInstallmentRequest {

    @Size(max = 200)
    private String name;

    @Size(max = 100)
    private String category;

    private BigDecimal totalAmount;

    private BigDecimal periodAmount;

    private Integer termPeriods;

    @Size(max = 100)
    private String accountId;

    private LocalDate startDate;

    private TimingBucket timing;
}
