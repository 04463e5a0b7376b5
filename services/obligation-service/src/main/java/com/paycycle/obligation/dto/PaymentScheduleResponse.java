package com.paycycle.obligation.dto;

import com.paycycle.obligation.entity.ObligationType;
import com.paycycle.obligation.entity.PaymentStatus;
import com.paycycle.obligation.entity.TimingBucket;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentScheduleResponse {
    private UUID id;
    private ObligationType obligationType;
    private UUID obligationId;
    private Integer scheduleYear;
    private Integer scheduleMonth;
    private String monthName;
    private TimingBucket timingBucket;
    private LocalDate dueDate;
    private Integer paymentNumber;
    private BigDecimal expectedAmount;
    private BigDecimal paidAmount;
    private LocalDate datePaid;
    private String linkedAccountId;
    private UUID linkedTransactionId;
    private PaymentStatus status;
}
