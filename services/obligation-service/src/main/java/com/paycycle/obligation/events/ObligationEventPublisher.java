package com.paycycle.obligation.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.paycycle.obligation.entity.PaymentSchedule;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Publishes schedule state changes to the obligation events topic.
 *
 * Publication is best effort: failures are logged and counted but never fail the
 * operation that produced the event.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ObligationEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @Value("${obligation.events.topic:obligation-events}")
    private String topic;

    public void publishPaymentApplied(PaymentSchedule schedule, UUID transactionId, BigDecimal amount) {
        publish(scheduleEvent(ObligationEvent.PAYMENT_APPLIED, schedule)
                .transactionId(transactionId.toString())
                .amount(amount)
                .build());
    }

    public void publishPaymentReverted(PaymentSchedule schedule, UUID transactionId) {
        publish(scheduleEvent(ObligationEvent.PAYMENT_REVERTED, schedule)
                .transactionId(transactionId.toString())
                .build());
    }

    public void publishPaymentCorrected(PaymentSchedule schedule, BigDecimal previousAmount) {
        publish(scheduleEvent(ObligationEvent.PAYMENT_CORRECTED, schedule)
                .amount(schedule.getPaidAmount())
                .transactionId(schedule.getLinkedTransactionId() != null ? schedule.getLinkedTransactionId().toString() : null)
                .detail("previous=" + previousAmount)
                .build());
    }

    public void publishSchedulesRegenerated(String obligationType, UUID obligationId, int removed, int created) {
        publish(baseEvent(ObligationEvent.SCHEDULES_REGENERATED)
                .obligationType(obligationType)
                .obligationId(obligationId.toString())
                .scheduleCount(created)
                .detail("removed=" + removed)
                .build());
    }

    public void publishPartialApplyFailure(PaymentSchedule schedule, UUID transactionId, String reason) {
        publish(scheduleEvent(ObligationEvent.PARTIAL_APPLY_FAILURE, schedule)
                .transactionId(transactionId.toString())
                .detail(reason)
                .build());
    }

    private ObligationEvent.ObligationEventBuilder scheduleEvent(String type, PaymentSchedule schedule) {
        return baseEvent(type)
                .obligationType(schedule.getObligationType().name())
                .obligationId(schedule.getObligationId().toString())
                .scheduleId(schedule.getId().toString());
    }

    private ObligationEvent.ObligationEventBuilder baseEvent(String type) {
        return ObligationEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(type)
                .timestamp(Instant.now());
    }

    private void publish(ObligationEvent event) {
        String key = event.getObligationId();
        try {
            String payload = objectMapper.writeValueAsString(event);
            kafkaTemplate.send(topic, key, payload).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish {} for obligation {}: {}", event.getEventType(), key, ex.getMessage());
                    meterRegistry.counter("obligation.events.failed", "type", event.getEventType()).increment();
                } else {
                    meterRegistry.counter("obligation.events.published", "type", event.getEventType()).increment();
                }
            });
        } catch (JsonProcessingException e) {
            log.error("Could not serialize {} event for obligation {}", event.getEventType(), key, e);
            meterRegistry.counter("obligation.events.failed", "type", event.getEventType()).increment();
        } catch (RuntimeException e) {
            log.error("Kafka send rejected {} event for obligation {}: {}", event.getEventType(), key, e.getMessage());
            meterRegistry.counter("obligation.events.failed", "type", event.getEventType()).increment();
        }
    }
}
