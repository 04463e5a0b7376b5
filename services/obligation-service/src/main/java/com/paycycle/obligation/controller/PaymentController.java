package com.paycycle.obligation.controller;

import com.paycycle.obligation.dto.ApplyPaymentRequest;
import com.paycycle.obligation.dto.CorrectionRequest;
import com.paycycle.obligation.dto.PaymentScheduleResponse;
import com.paycycle.obligation.entity.PaymentSchedule;
import com.paycycle.obligation.mapper.PaymentScheduleMapper;
import com.paycycle.obligation.service.PaymentApplier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

/**
 * REST controller for payments, corrections and ledger deletions
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Validated
@Tag(name = "Payments", description = "Schedule payment APIs")
public class PaymentController {

    private final PaymentApplier paymentApplier;
    private final PaymentScheduleMapper scheduleMapper;
    private final Clock clock;

    @PostMapping("/schedules/{scheduleId}")
    @Operation(summary = "Pay a schedule and record the ledger transaction")
    public ResponseEntity<PaymentScheduleResponse> applyPayment(
            @PathVariable UUID scheduleId,
            @Valid @RequestBody ApplyPaymentRequest request) {

        log.info("Payment request for schedule {}: amount={}", scheduleId, request.getAmount());
        PaymentSchedule schedule = paymentApplier.applyPayment(scheduleId, request.getAmount(), request.getDate(),
                request.getAccountId(), request.getNote());
        return ResponseEntity.ok(scheduleMapper.toResponse(schedule, LocalDate.now(clock)));
    }

    @PostMapping("/installments/{installmentId}")
    @Operation(summary = "Pay the next unpaid schedule of an installment")
    public ResponseEntity<PaymentScheduleResponse> applyInstallmentPayment(
            @PathVariable UUID installmentId,
            @Valid @RequestBody ApplyPaymentRequest request) {

        log.info("Installment payment request for {}: amount={}", installmentId, request.getAmount());
        PaymentSchedule schedule = paymentApplier.applyInstallmentPayment(installmentId, request.getAmount(),
                request.getDate(), request.getAccountId(), request.getNote());
        return ResponseEntity.ok(scheduleMapper.toResponse(schedule, LocalDate.now(clock)));
    }

    @GetMapping("/installments/{installmentId}/next")
    @Operation(summary = "Get the next payable schedule of an installment")
    public ResponseEntity<PaymentScheduleResponse> getNextPayable(@PathVariable UUID installmentId) {
        return paymentApplier.nextPayable(installmentId)
                .map(schedule -> ResponseEntity.ok(scheduleMapper.toResponse(schedule, LocalDate.now(clock))))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/schedules/{scheduleId}/correction")
    @Operation(summary = "Correct a schedule's paid amount; an empty amount takes the ledger value")
    public ResponseEntity<PaymentScheduleResponse> applyCorrection(
            @PathVariable UUID scheduleId,
            @Valid @RequestBody CorrectionRequest request) {

        log.info("Correction request for schedule {}: newPaidAmount={}", scheduleId, request.getNewPaidAmount());
        PaymentSchedule schedule = paymentApplier.applyCorrection(scheduleId, request.getNewPaidAmount());
        return ResponseEntity.ok(scheduleMapper.toResponse(schedule, LocalDate.now(clock)));
    }

    @DeleteMapping("/transactions/{transactionId}")
    @Operation(summary = "Delete a ledger transaction and revert the schedule it paid")
    public ResponseEntity<Void> deleteTransaction(@PathVariable UUID transactionId) {
        log.info("Ledger transaction deletion requested: {}", transactionId);
        paymentApplier.deleteTransaction(transactionId);
        return ResponseEntity.noContent().build();
    }
}
