package com.paycycle.obligation.dto;

import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Correction of a stored paid amount; an absent amount means "take the ledger-derived value"
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorrectionRequest {

    @DecimalMin(value = "0.00", message = "Corrected amount cannot be negative")
    private BigDecimal newPaidAmount;
}
