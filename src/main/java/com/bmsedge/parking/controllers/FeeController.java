package com.bmsedge.parking.controllers;

import com.bmsedge.parking.dto.FeeQuoteDTO;
import com.bmsedge.parking.service.ParkingFeeService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;

@RestController
@RequestMapping("/api/fees")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class FeeController {

    private final ParkingFeeService feeService;

    // Fee preview; exitTime defaults to now
    @GetMapping("/quote")
    public ResponseEntity<FeeQuoteDTO> quote(
            @RequestParam String vehicleType,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime entryTime,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime exitTime) {
        return ResponseEntity.ok(feeService.computeFee(vehicleType, entryTime, exitTime));
    }
}
