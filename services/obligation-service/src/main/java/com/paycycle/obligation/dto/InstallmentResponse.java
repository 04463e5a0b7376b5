package com.paycycle.obligation.dto;

import com.paycycle.obligation.entity.TimingBucket;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstallmentResponse {
    private UUID id;
    private String name;
    private String category;
    private BigDecimal totalAmount;
    private BigDecimal periodAmount;
    private Integer termPeriods;
    private BigDecimal cumulativePaid;
    private BigDecimal remainingBalance;
    private String accountId;
    private LocalDate startDate;
    private TimingBucket timing;
    private LocalDateTime createdAt;
}
