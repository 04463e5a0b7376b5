package com.paycycle.obligation.controller;

import com.paycycle.obligation.dto.*;
import com.paycycle.obligation.entity.Biller;
import com.paycycle.obligation.entity.Installment;
import com.paycycle.obligation.entity.ObligationType;
import com.paycycle.obligation.entity.TimingBucket;
import com.paycycle.obligation.mapper.ObligationMapper;
import com.paycycle.obligation.mapper.PaymentScheduleMapper;
import com.paycycle.obligation.service.LinkedAccountSyncService;
import com.paycycle.obligation.service.ObligationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST controller for obligations and their schedules
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/obligations")
@RequiredArgsConstructor
@Validated
@Tag(name = "Obligations", description = "Biller and installment management APIs")
public class ObligationController {

    private final ObligationService obligationService;
    private final LinkedAccountSyncService linkedAccountSyncService;
    private final ObligationMapper obligationMapper;
    private final PaymentScheduleMapper scheduleMapper;
    private final Clock clock;

    // ============== Billers ==============

    @PostMapping("/billers")
    @Operation(summary = "Create a biller and generate its schedules")
    public ResponseEntity<BillerResponse> createBiller(@Valid @RequestBody CreateBillerRequest request) {
        log.info("Creating biller: {}", request.getName());
        Biller biller = obligationService.createBiller(obligationMapper.toEntity(request), request.getHorizonMonths());
        return ResponseEntity.status(HttpStatus.CREATED).body(obligationMapper.toResponse(biller));
    }

    @GetMapping("/billers")
    @Operation(summary = "List billers")
    public ResponseEntity<List<BillerResponse>> listBillers(@RequestParam(required = false) String category) {
        List<Biller> billers = obligationService.listObligations(ObligationType.BILLER, category).stream()
                .map(Biller.class::cast)
                .collect(Collectors.toList());
        return ResponseEntity.ok(obligationMapper.toBillerResponseList(billers));
    }

    @GetMapping("/billers/{billerId}")
    @Operation(summary = "Get biller details")
    public ResponseEntity<BillerResponse> getBiller(@PathVariable UUID billerId) {
        return ResponseEntity.ok(obligationMapper.toResponse(obligationService.getBiller(billerId)));
    }

    @PutMapping("/billers/{billerId}")
    @Operation(summary = "Update a biller; amount or cadence changes regenerate unpaid future schedules")
    public ResponseEntity<BillerResponse> updateBiller(
            @PathVariable UUID billerId,
            @Valid @RequestBody UpdateBillerRequest request) {

        log.info("Updating biller {}", billerId);
        Biller biller = obligationService.updateBiller(billerId, request, LocalDate.now(clock));
        return ResponseEntity.ok(obligationMapper.toResponse(biller));
    }

    @PostMapping("/billers/{billerId}/deactivate")
    @Operation(summary = "Stop scheduling a biller from the given month on")
    public ResponseEntity<BillerResponse> deactivateBiller(
            @PathVariable UUID billerId,
            @Valid @RequestBody DeactivateBillerRequest request) {

        log.info("Deactivating biller {} from {}-{}", billerId, request.getYear(), request.getMonth());
        Biller biller = obligationService.deactivateBiller(billerId, YearMonth.of(request.getYear(), request.getMonth()));
        return ResponseEntity.ok(obligationMapper.toResponse(biller));
    }

    @PostMapping("/billers/{billerId}/sync-linked-account")
    @Operation(summary = "Take unpaid schedule amounts from the linked credit account's statement cycles")
    public ResponseEntity<List<PaymentScheduleResponse>> syncFromLinkedAccount(
            @PathVariable UUID billerId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {

        LocalDate date = resolve(asOf);
        log.info("Syncing biller {} from its linked account as of {}", billerId, date);
        return ResponseEntity.ok(scheduleMapper.toResponseList(
                linkedAccountSyncService.syncFromLinkedAccount(billerId, date), date));
    }

    // ============== Installments ==============

    @PostMapping("/installments")
    @Operation(summary = "Create an installment and generate its full term of schedules")
    public ResponseEntity<InstallmentResponse> createInstallment(@Valid @RequestBody CreateInstallmentRequest request) {
        log.info("Creating installment: {}", request.getName());
        Installment installment = obligationService.createInstallment(obligationMapper.toEntity(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(obligationMapper.toResponse(installment));
    }

    @GetMapping("/installments")
    @Operation(summary = "List installments")
    public ResponseEntity<List<InstallmentResponse>> listInstallments(@RequestParam(required = false) String category) {
        List<Installment> installments = obligationService.listObligations(ObligationType.INSTALLMENT, category).stream()
                .map(Installment.class::cast)
                .collect(Collectors.toList());
        return ResponseEntity.ok(obligationMapper.toInstallmentResponseList(installments));
    }

    @GetMapping("/installments/{installmentId}")
    @Operation(summary = "Get installment details")
    public ResponseEntity<InstallmentResponse> getInstallment(@PathVariable UUID installmentId) {
        return ResponseEntity.ok(obligationMapper.toResponse(obligationService.getInstallment(installmentId)));
    }

    @PutMapping("/installments/{installmentId}")
    @Operation(summary = "Update an installment; amount, term or start changes regenerate unpaid future schedules")
    public ResponseEntity<InstallmentResponse> updateInstallment(
            @PathVariable UUID installmentId,
            @Valid @RequestBody UpdateInstallmentRequest request) {

        log.info("Updating installment {}", installmentId);
        Installment installment = obligationService.updateInstallment(installmentId, request, LocalDate.now(clock));
        return ResponseEntity.ok(obligationMapper.toResponse(installment));
    }

    @DeleteMapping("/{obligationId}")
    @Operation(summary = "Delete an obligation and all of its schedules")
    public ResponseEntity<Void> deleteObligation(@PathVariable UUID obligationId) {
        log.info("Deleting obligation {}", obligationId);
        obligationService.deleteObligation(obligationId);
        return ResponseEntity.noContent().build();
    }

    // ============== Schedules ==============

    @GetMapping("/{obligationId}/schedules")
    @Operation(summary = "List an obligation's schedules with status derived at the given date")
    public ResponseEntity<List<PaymentScheduleResponse>> getSchedules(
            @PathVariable UUID obligationId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {

        return ResponseEntity.ok(scheduleMapper.toResponseList(
                obligationService.findSchedules(obligationId), resolve(asOf)));
    }

    @PostMapping("/{obligationId}/schedules/generate")
    @Operation(summary = "Persist any missing schedules within the horizon")
    public ResponseEntity<List<PaymentScheduleResponse>> generateSchedules(
            @PathVariable UUID obligationId,
            @RequestParam(required = false) @Min(1) @Max(120) Integer horizonMonths) {

        log.info("Generating schedules for obligation {} (horizon={})", obligationId, horizonMonths);
        return ResponseEntity.ok(scheduleMapper.toResponseList(
                obligationService.generateSchedules(obligationId, horizonMonths), LocalDate.now(clock)));
    }

    @PostMapping("/{obligationId}/schedules/regenerate")
    @Operation(summary = "Recreate unpaid schedules from the given date's month on")
    public ResponseEntity<List<PaymentScheduleResponse>> regenerateSchedules(
            @PathVariable UUID obligationId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {

        LocalDate date = resolve(asOf);
        log.info("Regenerating schedules for obligation {} from {}", obligationId, date);
        return ResponseEntity.ok(scheduleMapper.toResponseList(
                obligationService.regenerateFutureSchedules(obligationId, date), date));
    }

    @GetMapping("/schedules")
    @Operation(summary = "List all schedules of a month, optionally of one half")
    public ResponseEntity<List<PaymentScheduleResponse>> getSchedulesForPeriod(
            @RequestParam int year,
            @RequestParam @Min(1) @Max(12) int month,
            @RequestParam(required = false) TimingBucket timing,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {

        return ResponseEntity.ok(scheduleMapper.toResponseList(
                obligationService.findSchedulesForPeriod(YearMonth.of(year, month), timing), resolve(asOf)));
    }

    @GetMapping("/schedules/overdue")
    @Operation(summary = "List unpaid schedules past their due date")
    public ResponseEntity<List<PaymentScheduleResponse>> getOverdueSchedules(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {

        LocalDate date = resolve(asOf);
        return ResponseEntity.ok(scheduleMapper.toResponseList(obligationService.findOverdue(date), date));
    }

    private LocalDate resolve(LocalDate asOf) {
        return asOf != null ? asOf : LocalDate.now(clock);
    }
}
