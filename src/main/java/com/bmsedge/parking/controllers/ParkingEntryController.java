package com.bmsedge.parking.controllers;

import com.bmsedge.parking.dto.FeeCorrectionRequest;
import com.bmsedge.parking.dto.ParkingEntryDTO;
import com.bmsedge.parking.dto.SettlePaymentRequest;
import com.bmsedge.parking.dto.VehicleEntryRequest;
import com.bmsedge.parking.dto.VehicleExitRequest;
import com.bmsedge.parking.service.ParkingEntryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/entries")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class ParkingEntryController {

    private final ParkingEntryService entryService;

    // Vehicle entry, linked to the active shift
    @PostMapping
    public ResponseEntity<ParkingEntryDTO> recordEntry(@RequestBody VehicleEntryRequest request) {
        return ResponseEntity.ok(entryService.recordEntry(request));
    }

    // Vehicle exit, bills the stay
    @PostMapping("/{id}/exit")
    public ResponseEntity<ParkingEntryDTO> recordExit(
            @PathVariable Long id,
            @RequestBody(required = false) VehicleExitRequest request) {
        return ResponseEntity.ok(entryService.recordExit(id, request != null ? request : new VehicleExitRequest()));
    }

    @PostMapping("/{id}/settle")
    public ResponseEntity<ParkingEntryDTO> settlePayment(
            @PathVariable Long id,
            @RequestBody(required = false) SettlePaymentRequest request) {
        return ResponseEntity.ok(entryService.settlePayment(id, request));
    }

    @PatchMapping("/{id}/fee")
    public ResponseEntity<ParkingEntryDTO> correctFee(
            @PathVariable Long id,
            @RequestBody FeeCorrectionRequest request) {
        return ResponseEntity.ok(entryService.correctFee(id, request));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ParkingEntryDTO> getEntry(@PathVariable Long id) {
        return ResponseEntity.ok(entryService.getEntry(id));
    }

    @GetMapping("/parked")
    public ResponseEntity<List<ParkingEntryDTO>> getCurrentlyParked() {
        return ResponseEntity.ok(entryService.getCurrentlyParked());
    }

    // Archive, entries are never deleted
    @DeleteMapping("/{id}")
    public ResponseEntity<ParkingEntryDTO> archiveEntry(@PathVariable Long id) {
        return ResponseEntity.ok(entryService.archiveEntry(id));
    }
}
