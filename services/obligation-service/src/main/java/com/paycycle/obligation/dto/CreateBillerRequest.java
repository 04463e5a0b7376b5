package com.paycycle.obligation.dto;

import jakarta.validation.constraints.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateBillerRequest {

    @NotBlank(message = "Biller name is required")
    @Size(max = 200)
    private String name;

    @Size(max = 100)
    private String category;

    @NotNull(message = "Expected amount is required")
    @DecimalMin(value = "0.00", message = "Expected amount cannot be negative")
    private BigDecimal expectedAmount;

    @Min(1)
    @Max(31)
    private Integer dueDay;

    @NotNull(message = "Activation year is required")
    private Integer activationYear;

    @NotNull(message = "Activation month is required")
    @Min(1)
    @Max(12)
    private Integer activationMonth;

    @Min(1)
    @Max(31)
    private Integer activationDay;

    private Integer deactivationYear;

    @Min(1)
    @Max(12)
    private Integer deactivationMonth;

    @Size(max = 100)
    private String linkedAccountId;

    @Min(1)
    @Max(31)
    private Integer billingDay;

    /**
     * Months to schedule; the configured default applies when absent
     */
    @Min(1)
    @Max(120)
    private Integer horizonMonths;
}
