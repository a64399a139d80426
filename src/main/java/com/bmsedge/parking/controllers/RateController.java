package com.bmsedge.parking.controllers;

import com.bmsedge.parking.dto.VehicleRateDTO;
import com.bmsedge.parking.service.RateTableService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/rates")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class RateController {

    private final RateTableService rateTableService;

    @GetMapping
    public ResponseEntity<List<VehicleRateDTO>> getAllRates() {
        return ResponseEntity.ok(rateTableService.getAllRates());
    }

    // Create or update one vehicle type's daily rate
    @PutMapping
    public ResponseEntity<VehicleRateDTO> upsertRate(@RequestBody VehicleRateDTO dto) {
        return ResponseEntity.ok(rateTableService.upsertRate(dto));
    }
}
