package com.bmsedge.parking.service;

import com.bmsedge.parking.dto.VehicleRateDTO;
import com.bmsedge.parking.exception.InvalidRequestException;
import com.bmsedge.parking.model.VehicleRate;
import com.bmsedge.parking.repository.VehicleRateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import jakarta.annotation.PostConstruct;
import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class RateTableService {

    private final VehicleRateRepository rateRepository;

    @Value("${parking.rates.default-rate:100.00}")
    private BigDecimal defaultRate;

    @Value("${parking.rates.seed-on-startup:true}")
    private boolean seedOnStartup;

    @Value("${parking.rates.seed:2 Wheeler:50,4 Wheeler:100,6 Wheeler:150,Trailer:225}")
    private String seedRates;

    @PostConstruct
    public void seedDefaultRates() {
        if (!seedOnStartup || rateRepository.count() > 0) {
            return;
        }
        for (String pair : seedRates.split(",")) {
            int sep = pair.lastIndexOf(':');
            if (sep <= 0) {
                log.warn("Skipping malformed rate seed '{}'", pair);
                continue;
            }
            rateRepository.save(VehicleRate.builder()
                    .vehicleType(pair.substring(0, sep).trim())
                    .dailyRate(new BigDecimal(pair.substring(sep + 1).trim()))
                    .build());
        }
        log.info("Seeded {} vehicle rates (default rate {})", rateRepository.count(), defaultRate);
    }

    /**
     * Snapshot of the current rates for one engine call.
     */
    @Transactional(readOnly = true)
    public RateTable load() {
        return RateTable.of(rateRepository.findAll(), defaultRate);
    }

    public List<VehicleRateDTO> getAllRates() {
        return rateRepository.findAllByOrderByVehicleTypeAsc().stream()
                .map(this::convertToDTO)
                .collect(Collectors.toList());
    }

    // Create or update the rate for one vehicle type
    @Transactional
    public VehicleRateDTO upsertRate(VehicleRateDTO dto) {
        if (dto.getVehicleType() == null || VehicleTypeNormalizer.normalize(dto.getVehicleType()).isEmpty()) {
            throw new InvalidRequestException("Vehicle type is required");
        }
        if (dto.getDailyRate() == null || dto.getDailyRate().signum() < 0) {
            throw new InvalidRequestException("Daily rate must be a non-negative amount");
        }

        String key = VehicleTypeNormalizer.normalize(dto.getVehicleType());
        VehicleRate rate = rateRepository.findByNormalizedKey(key)
                .orElseGet(() -> VehicleRate.builder().build());
        rate.setVehicleType(dto.getVehicleType().trim());
        rate.setDailyRate(dto.getDailyRate());

        VehicleRate saved = rateRepository.save(rate);
        log.info("Rate for '{}' set to {}", saved.getVehicleType(), saved.getDailyRate());
        return convertToDTO(saved);
    }

    private VehicleRateDTO convertToDTO(VehicleRate rate) {
        return VehicleRateDTO.builder()
                .id(rate.getId())
                .vehicleType(rate.getVehicleType())
                .dailyRate(rate.getDailyRate())
                .build();
    }
}
