package com.paycycle.obligation.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetLineItemDto {

    @NotBlank
    private String category;

    @NotBlank
    private String label;

    @NotNull
    @DecimalMin(value = "0.00")
    private BigDecimal amount;

    @Builder.Default
    private Boolean included = true;

    private UUID obligationId;
}
