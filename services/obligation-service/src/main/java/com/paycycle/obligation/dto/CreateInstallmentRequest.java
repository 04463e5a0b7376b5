package com.paycycle.obligation.dto;

import com.paycycle.obligation.entity.TimingBucket;
import jakarta.validation.constraints.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateInstallmentRequest {

    @NotBlank(message = "Installment name is required")
    @Size(max = 200)
    private String name;

    @Size(max = 100)
    private String category;

    @NotNull(message = "Total amount is required")
    @DecimalMin(value = "0.01", message = "Total amount must be greater than zero")
    private BigDecimal totalAmount;

    private BigDecimal periodAmount;

    @NotNull(message = "Term is required")
    private Integer termPeriods;

    @Size(max = 100)
    private String accountId;

    private LocalDate startDate;

    private TimingBucket timing;
}
