package com.bmsedge.parking.repository;

import com.bmsedge.parking.model.VehicleRate;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface VehicleRateRepository extends JpaRepository<VehicleRate, Long> {

    Optional<VehicleRate> findByNormalizedKey(String normalizedKey);

    List<VehicleRate> findAllByOrderByVehicleTypeAsc();
}
