package com.paycycle.obligation.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Obligation Event - state changes of payment schedules
 *
 * Event types:
 * - PAYMENT_APPLIED
 * - PAYMENT_REVERTED
 * - PAYMENT_CORRECTED
 * - SCHEDULES_REGENERATED
 * - PARTIAL_APPLY_FAILURE
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObligationEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String PAYMENT_APPLIED = "PAYMENT_APPLIED";
    public static final String PAYMENT_REVERTED = "PAYMENT_REVERTED";
    public static final String PAYMENT_CORRECTED = "PAYMENT_CORRECTED";
    public static final String SCHEDULES_REGENERATED = "SCHEDULES_REGENERATED";
    public static final String PARTIAL_APPLY_FAILURE = "PARTIAL_APPLY_FAILURE";

    @JsonProperty("event_id")
    private String eventId;

    @JsonProperty("event_type")
    private String eventType;

    @JsonProperty("timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant timestamp;

    @JsonProperty("obligation_type")
    private String obligationType;

    @JsonProperty("obligation_id")
    private String obligationId;

    @JsonProperty("schedule_id")
    private String scheduleId;

    @JsonProperty("transaction_id")
    private String transactionId;

    @JsonProperty("amount")
    private BigDecimal amount;

    @JsonProperty("schedule_count")
    private Integer scheduleCount;

    @JsonProperty("detail")
    private String detail;
}
