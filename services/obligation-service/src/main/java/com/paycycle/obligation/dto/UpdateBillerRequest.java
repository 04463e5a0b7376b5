package com.paycycle.obligation.dto;

import jakarta.validation.constraints.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Partial biller edit; null fields are left unchanged
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateBillerRequest {

    @Size(max = 200)
    private String name;

    @Size(max = 100)
    private String category;

    @DecimalMin(value = "0.00", message = "Expected amount cannot be negative")
    private BigDecimal expectedAmount;

    @Min(1)
    @Max(31)
    private Integer dueDay;

    private Integer activationYear;

    @Min(1)
    @Max(12)
    private Integer activationMonth;

    @Size(max = 100)
    private String linkedAccountId;

    @Min(1)
    @Max(31)
    private Integer billingDay;
}
