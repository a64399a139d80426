package com.bmsedge.parking.model;

import lombok.*;
import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Audit row written for every shift handover.
 */
@Entity
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Table(name = "shift_changes")
public class ShiftChange {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long previousShiftId;
    private Long newShiftId;

    private String outgoingEmployeeId;
    private String incomingEmployeeId;
    private String incomingEmployeeName;

    @Column(precision = 12, scale = 2)
    private BigDecimal cashTransferred;

    @Column(columnDefinition = "TEXT")
    private String handoverNotes;

    @Column(columnDefinition = "TEXT")
    private String pendingIssues;

    private String supervisorId;

    @Column(nullable = false)
    private LocalDateTime changeTimestamp;

    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
