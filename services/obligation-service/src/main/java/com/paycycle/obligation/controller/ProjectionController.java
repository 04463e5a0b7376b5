package com.paycycle.obligation.controller;

import com.paycycle.obligation.domain.BudgetPeriod;
import com.paycycle.obligation.domain.MonthlyAverage;
import com.paycycle.obligation.domain.PayoffPoint;
import com.paycycle.obligation.domain.PeriodProjection;
import com.paycycle.obligation.dto.BudgetSnapshotRequest;
import com.paycycle.obligation.dto.BudgetSnapshotResponse;
import com.paycycle.obligation.dto.MonthlyAverageResponse;
import com.paycycle.obligation.entity.TimingBucket;
import com.paycycle.obligation.mapper.BudgetSnapshotMapper;
import com.paycycle.obligation.service.BudgetSnapshotService;
import com.paycycle.obligation.service.ProjectionEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for budget snapshots and projections
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/projections")
@RequiredArgsConstructor
@Validated
@Tag(name = "Projections", description = "Budget snapshot and projection APIs")
public class ProjectionController {

    private final ProjectionEngine projectionEngine;
    private final BudgetSnapshotService budgetSnapshotService;
    private final BudgetSnapshotMapper snapshotMapper;
    private final Clock clock;

    // ============== Projections ==============

    @GetMapping
    @Operation(summary = "Project income, obligated spend and remaining per month half; empty for a reversed range")
    public ResponseEntity<List<PeriodProjection>> project(
            @RequestParam int startYear,
            @RequestParam @Min(1) @Max(12) int startMonth,
            @RequestParam(defaultValue = "FIRST_HALF") TimingBucket startTiming,
            @RequestParam int endYear,
            @RequestParam @Min(1) @Max(12) int endMonth,
            @RequestParam(defaultValue = "SECOND_HALF") TimingBucket endTiming) {

        return ResponseEntity.ok(projectionEngine.project(
                BudgetPeriod.of(startYear, startMonth, startTiming),
                BudgetPeriod.of(endYear, endMonth, endTiming)));
    }

    @GetMapping("/monthly-averages")
    @Operation(summary = "Average remaining per month with the best and worst month")
    public ResponseEntity<MonthlyAverageResponse> monthlyAverages(
            @RequestParam int startYear,
            @RequestParam @Min(1) @Max(12) int startMonth,
            @RequestParam int endYear,
            @RequestParam @Min(1) @Max(12) int endMonth) {

        List<PeriodProjection> projections = projectionEngine.project(
                BudgetPeriod.of(startYear, startMonth, TimingBucket.FIRST_HALF),
                BudgetPeriod.of(endYear, endMonth, TimingBucket.SECOND_HALF));
        List<MonthlyAverage> averages = projectionEngine.monthlyAverage(projections);

        return ResponseEntity.ok(MonthlyAverageResponse.builder()
                .averages(averages)
                .bestMonth(projectionEngine.bestMonth(averages).orElse(null))
                .worstMonth(projectionEngine.worstMonth(averages).orElse(null))
                .build());
    }

    @GetMapping("/installments/{installmentId}/payoff")
    @Operation(summary = "Project the remaining payments of an installment")
    public ResponseEntity<List<PayoffPoint>> projectPayoff(
            @PathVariable UUID installmentId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {

        return ResponseEntity.ok(projectionEngine.projectPayoff(installmentId,
                asOf != null ? asOf : LocalDate.now(clock)));
    }

    // ============== Budget snapshots ==============

    @GetMapping("/snapshots/{year}/{month}/{timing}")
    @Operation(summary = "Get the budget snapshot of a month half")
    public ResponseEntity<BudgetSnapshotResponse> getSnapshot(
            @PathVariable int year,
            @PathVariable @Min(1) @Max(12) int month,
            @PathVariable TimingBucket timing) {

        return budgetSnapshotService.getSnapshot(BudgetPeriod.of(year, month, timing))
                .map(snapshot -> ResponseEntity.ok(snapshotMapper.toResponse(snapshot)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PutMapping("/snapshots/{year}/{month}/{timing}")
    @Operation(summary = "Save the budget snapshot of a month half")
    public ResponseEntity<BudgetSnapshotResponse> saveSnapshot(
            @PathVariable int year,
            @PathVariable @Min(1) @Max(12) int month,
            @PathVariable TimingBucket timing,
            @Valid @RequestBody BudgetSnapshotRequest request) {

        BudgetPeriod period = BudgetPeriod.of(year, month, timing);
        log.info("Saving budget snapshot for {}", period);
        return ResponseEntity.ok(snapshotMapper.toResponse(budgetSnapshotService.saveSnapshot(period,
                snapshotMapper.toEntityList(request.getItems()),
                request.getProjectedSalary(), request.getActualSalary())));
    }

    @PutMapping("/snapshots/{year}/{month}/{timing}/actual-salary")
    @Operation(summary = "Record the actual salary of a month half")
    public ResponseEntity<BudgetSnapshotResponse> recordActualSalary(
            @PathVariable int year,
            @PathVariable @Min(1) @Max(12) int month,
            @PathVariable TimingBucket timing,
            @RequestParam @DecimalMin("0.00") BigDecimal amount) {

        return ResponseEntity.ok(snapshotMapper.toResponse(
                budgetSnapshotService.recordActualSalary(BudgetPeriod.of(year, month, timing), amount)));
    }

    @PostMapping("/snapshots/{year}/{month}/{timing}/draft")
    @Operation(summary = "Draft a snapshot from the generated schedules of a month half")
    public ResponseEntity<BudgetSnapshotResponse> draftSnapshot(
            @PathVariable int year,
            @PathVariable @Min(1) @Max(12) int month,
            @PathVariable TimingBucket timing) {

        BudgetPeriod period = BudgetPeriod.of(year, month, timing);
        log.info("Drafting budget snapshot for {}", period);
        return ResponseEntity.ok(snapshotMapper.toResponse(budgetSnapshotService.draftFromSchedules(period)));
    }
}
