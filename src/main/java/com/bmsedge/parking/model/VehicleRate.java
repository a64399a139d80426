package com.bmsedge.parking.model;

import com.bmsedge.parking.service.VehicleTypeNormalizer;
import lombok.*;
import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Table(name = "vehicle_rates", uniqueConstraints = @UniqueConstraint(
        name = "uk_vehicle_rates_key", columnNames = "normalized_key"))
public class VehicleRate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vehicle_type", nullable = false, length = 50)
    private String vehicleType;          // display name, e.g. "2 Wheeler"

    @Column(name = "normalized_key", nullable = false, length = 50)
    private String normalizedKey;        // lookup key, e.g. "2wheeler"

    @Column(name = "daily_rate", nullable = false, precision = 10, scale = 2)
    private BigDecimal dailyRate;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
        normalizedKey = VehicleTypeNormalizer.normalize(vehicleType);
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
        normalizedKey = VehicleTypeNormalizer.normalize(vehicleType);
    }
}
