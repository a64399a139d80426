package com.bmsedge.parking.controllers;

import com.bmsedge.parking.dto.BackfillResultDTO;
import com.bmsedge.parking.dto.CloseShiftRequest;
import com.bmsedge.parking.dto.DiscrepancyDTO;
import com.bmsedge.parking.dto.EmergencyEndRequest;
import com.bmsedge.parking.dto.HandoverRequest;
import com.bmsedge.parking.dto.HandoverResultDTO;
import com.bmsedge.parking.dto.OpenShiftRequest;
import com.bmsedge.parking.dto.ShiftCloseResultDTO;
import com.bmsedge.parking.dto.ShiftSessionDTO;
import com.bmsedge.parking.dto.ShiftStatisticsDTO;
import com.bmsedge.parking.service.EntryShiftLinker;
import com.bmsedge.parking.service.ShiftConsistencyAuditService;
import com.bmsedge.parking.service.ShiftLedgerService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@RestController
@RequestMapping("/api/shifts")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class ShiftController {

    private final ShiftLedgerService shiftLedgerService;
    private final EntryShiftLinker entryShiftLinker;
    private final ShiftConsistencyAuditService auditService;

    @PostMapping
    public ResponseEntity<ShiftSessionDTO> openShift(@RequestBody OpenShiftRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(shiftLedgerService.openShift(request));
    }

    @GetMapping("/active")
    public ResponseEntity<ShiftSessionDTO> getActiveShift() {
        return shiftLedgerService.getActiveShift()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ShiftSessionDTO> getShift(@PathVariable Long id) {
        return ResponseEntity.ok(shiftLedgerService.getShift(id));
    }

    @PostMapping("/{id}/close")
    public ResponseEntity<ShiftCloseResultDTO> closeShift(
            @PathVariable Long id,
            @RequestBody CloseShiftRequest request) {
        return ResponseEntity.ok(shiftLedgerService.closeShift(id, request));
    }

    @PostMapping("/handover")
    public ResponseEntity<HandoverResultDTO> handover(@RequestBody HandoverRequest request) {
        return ResponseEntity.ok(shiftLedgerService.handover(request));
    }

    @PostMapping("/{id}/emergency-end")
    public ResponseEntity<ShiftCloseResultDTO> emergencyEnd(
            @PathVariable Long id,
            @RequestBody EmergencyEndRequest request) {
        return ResponseEntity.ok(shiftLedgerService.emergencyEnd(id, request));
    }

    // Dashboard statistics, always recomputed from the shift's entries
    @GetMapping("/{id}/statistics")
    public ResponseEntity<ShiftStatisticsDTO> getStatistics(@PathVariable Long id) {
        return ResponseEntity.ok(shiftLedgerService.getShiftStatistics(id));
    }

    // Advisory cash reconciliation, does not close the shift
    @GetMapping("/{id}/reconciliation")
    public ResponseEntity<DiscrepancyDTO> previewReconciliation(
            @PathVariable Long id,
            @RequestParam BigDecimal actualCash) {
        return ResponseEntity.ok(shiftLedgerService.reconcileShift(id, actualCash));
    }

    @GetMapping("/{id}/audit")
    public ResponseEntity<ShiftStatisticsDTO> auditShift(@PathVariable Long id) {
        return ResponseEntity.ok(auditService.verifyShift(id));
    }

    // Administrative recovery of entries created while no shift was active
    @PostMapping("/{id}/backfill")
    public ResponseEntity<BackfillResultDTO> backfill(
            @PathVariable Long id,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime cutoff) {
        return ResponseEntity.ok(entryShiftLinker.linkUnassignedEntries(id, cutoff));
    }
}
