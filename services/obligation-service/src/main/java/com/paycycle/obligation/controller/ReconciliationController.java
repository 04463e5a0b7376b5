package com.paycycle.obligation.controller;

import com.paycycle.obligation.domain.OrphanReport;
import com.paycycle.obligation.domain.SyncReport;
import com.paycycle.obligation.service.Reconciler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for ledger reconciliation reports
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/reconciliation")
@RequiredArgsConstructor
@Validated
@Tag(name = "Reconciliation", description = "Schedule versus ledger reconciliation APIs")
public class ReconciliationController {

    private final Reconciler reconciler;

    @GetMapping("/obligations/{obligationId}")
    @Operation(summary = "Reconcile an obligation's schedule for one month")
    public ResponseEntity<SyncReport> reconcile(
            @PathVariable UUID obligationId,
            @RequestParam int year,
            @RequestParam @Min(1) @Max(12) int month) {

        log.debug("Reconciliation requested: obligation={}, period={}-{}", obligationId, year, month);
        return ResponseEntity.ok(reconciler.reconcile(obligationId, YearMonth.of(year, month)));
    }

    @GetMapping("/obligations/{obligationId}/schedules")
    @Operation(summary = "Reconcile every schedule of an obligation")
    public ResponseEntity<List<SyncReport>> reconcileObligation(@PathVariable UUID obligationId) {
        return ResponseEntity.ok(reconciler.reconcileObligation(obligationId));
    }

    @GetMapping("/schedules/{scheduleId}")
    @Operation(summary = "Reconcile one schedule")
    public ResponseEntity<SyncReport> reconcileSchedule(@PathVariable UUID scheduleId) {
        return ResponseEntity.ok(reconciler.reconcileSchedule(scheduleId));
    }

    @GetMapping("/orphans")
    @Operation(summary = "List ledger transactions orphaned by failed payments")
    public ResponseEntity<List<OrphanReport>> sweepOrphans() {
        return ResponseEntity.ok(reconciler.sweepOrphans());
    }
}
