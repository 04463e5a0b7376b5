package com.paycycle.obligation.dto;

import com.paycycle.obligation.entity.BillerStatus;
import com.paycycle.obligation.entity.TimingBucket;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BillerResponse {
    private UUID id;
    private String name;
    private String category;
    private BigDecimal expectedAmount;
    private Integer dueDay;
    private TimingBucket timingBucket;
    private Integer activationYear;
    private Integer activationMonth;
    private Integer deactivationYear;
    private Integer deactivationMonth;
    private BillerStatus status;
    private String linkedAccountId;
    private Integer billingDay;
    private LocalDateTime createdAt;
}
