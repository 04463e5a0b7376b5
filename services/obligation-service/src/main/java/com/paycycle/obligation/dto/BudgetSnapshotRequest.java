package com.paycycle.obligation.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetSnapshotRequest {

    @Valid
    @Builder.Default
    private List<BudgetLineItemDto> items = new ArrayList<>();

    @DecimalMin(value = "0.00")
    private BigDecimal projectedSalary;

    @DecimalMin(value = "0.00")
    private BigDecimal actualSalary;
}
