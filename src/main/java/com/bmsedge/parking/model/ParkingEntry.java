package com.bmsedge.parking.model;

import lombok.*;
import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Table(name = "parking_entries", indexes = {
        @Index(name = "idx_entries_shift", columnList = "shift_id"),
        @Index(name = "idx_entries_entry_time", columnList = "entry_time"),
        @Index(name = "idx_entries_unassigned", columnList = "shift_id,entry_time")
})
public class ParkingEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 20)
    private String vehicleNumber;

    @Column(name = "vehicle_type", nullable = false, length = 50)
    private String vehicleType;          // as captured at the gate, not normalized

    @Column(name = "entry_time", nullable = false)
    private LocalDateTime entryTime;

    private LocalDateTime exitTime;

    // Set once at exit. Only an authorized correction replaces it.
    @Column(precision = 10, scale = 2)
    private BigDecimal fee;

    private Integer billableDays;
    private Boolean usedFallbackRate;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private PaymentMethod paymentMethod;

    @Column(nullable = false)
    private Boolean paymentSettled;

    private LocalDateTime settledAt;

    // Stamped at creation from the active shift
    @Column(name = "shift_id")
    private Long shiftId;

    // Correction audit
    @Column(precision = 10, scale = 2)
    private BigDecimal assessedFee;
    private String correctionReason;
    private String correctedBy;
    private LocalDateTime correctedAt;

    @Column(nullable = false)
    private Boolean archived;
    private LocalDateTime archivedAt;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
        if (paymentSettled == null) {
            paymentSettled = false;
        }
        if (archived == null) {
            archived = false;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean hasExited() {
        return exitTime != null;
    }

    /**
     * An entry contributes revenue only once it has exited, carries a fee
     * and the payment is settled.
     */
    public boolean isRevenueBearing() {
        return !Boolean.TRUE.equals(archived)
                && exitTime != null
                && fee != null
                && Boolean.TRUE.equals(paymentSettled);
    }
}
