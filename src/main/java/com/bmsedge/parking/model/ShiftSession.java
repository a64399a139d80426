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
@Table(name = "shift_sessions",
        uniqueConstraints = @UniqueConstraint(name = "uk_shift_sessions_active_slot", columnNames = "active_slot"),
        indexes = {
                @Index(name = "idx_shift_status", columnList = "status"),
                @Index(name = "idx_shift_end_time", columnList = "end_time")
        })
public class ShiftSession {

    /** Value held by {@code activeSlot} while a shift is active. */
    public static final int ACTIVE_SLOT = 1;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String employeeId;

    private String employeeName;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "end_time")
    private LocalDateTime endTime;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal openingCash;

    @Column(precision = 12, scale = 2)
    private BigDecimal closingCash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ShiftStatus status;

    // 1 while active, NULL once completed. Unique, so at most one active row.
    @Column(name = "active_slot")
    private Integer activeSlot;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private ShiftCloseType closeType;

    // Close-time reconciliation annotation
    @Column(precision = 12, scale = 2)
    private BigDecimal expectedClosingCash;

    @Column(precision = 12, scale = 2)
    private BigDecimal cashDiscrepancy;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private DiscrepancyLevel discrepancyLevel;

    // Revenue recorded at close and kept in step by every entry write; checked by the consistency audit
    @Column(precision = 12, scale = 2)
    private BigDecimal recordedCashRevenue;

    @Column(precision = 12, scale = 2)
    private BigDecimal recordedRevenueTotal;

    private Boolean discrepancyAcknowledged;

    @Column(columnDefinition = "TEXT")
    private String shiftNotes;

    @Column(columnDefinition = "TEXT")
    private String closingNotes;

    private String supervisorId;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
        if (status == null) {
            status = ShiftStatus.ACTIVE;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isActive() {
        return status == ShiftStatus.ACTIVE;
    }
}
