package com.paycycle.obligation.dto;

import com.paycycle.obligation.entity.SnapshotStatus;
import com.paycycle.obligation.entity.TimingBucket;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetSnapshotResponse {
    private UUID id;
    private Integer snapshotYear;
    private Integer snapshotMonth;
    private TimingBucket timingBucket;
    private SnapshotStatus status;
    private Map<String, List<BudgetLineItemDto>> itemsByCategory;
    private BigDecimal projectedSalary;
    private BigDecimal actualSalary;
    private BigDecimal totalAmount;
}
