package com.bmsedge.parking.service;

import com.bmsedge.parking.dto.ShiftStatisticsDTO;
import com.bmsedge.parking.exception.AggregationInconsistencyException;
import com.bmsedge.parking.model.ShiftSession;
import com.bmsedge.parking.model.ShiftStatus;
import com.bmsedge.parking.repository.ShiftSessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ShiftConsistencyAuditServiceTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Kolkata");
    private static final LocalDateTime NOW = LocalDateTime.of(2024, 9, 1, 12, 0);

    @Mock
    private ShiftSessionRepository shiftRepository;

    @Mock
    private RevenueAggregator revenueAggregator;

    private ShiftConsistencyAuditService auditService;

    @BeforeEach
    void setUp() {
        auditService = new ShiftConsistencyAuditService(shiftRepository, revenueAggregator,
                new DurationCalculator(Clock.fixed(NOW.atZone(ZONE).toInstant(), ZONE)));
        ReflectionTestUtils.setField(auditService, "auditEnabled", true);
        ReflectionTestUtils.setField(auditService, "lookbackHours", 48L);
    }

    private static ShiftSession completed(Long id, String recordedCash, String recordedTotal) {
        return ShiftSession.builder()
                .id(id)
                .status(ShiftStatus.COMPLETED)
                .recordedCashRevenue(new BigDecimal(recordedCash))
                .recordedRevenueTotal(new BigDecimal(recordedTotal))
                .build();
    }

    private static ShiftStatisticsDTO stats(Long id, String cash, String total) {
        return ShiftStatisticsDTO.builder()
                .shiftId(id)
                .cashRevenue(new BigDecimal(cash))
                .revenueTotal(new BigDecimal(total))
                .build();
    }

    @Test
    void matchingSnapshotPasses() {
        when(shiftRepository.findById(1L)).thenReturn(Optional.of(completed(1L, "250", "450")));
        when(revenueAggregator.recompute(1L)).thenReturn(stats(1L, "250.00", "450.00"));

        assertEquals(new BigDecimal("450.00"), auditService.verifyShift(1L).getRevenueTotal());
    }

    @Test
    void driftedSnapshotIsReported() {
        when(shiftRepository.findById(1L)).thenReturn(Optional.of(completed(1L, "250", "450")));
        when(revenueAggregator.recompute(1L)).thenReturn(stats(1L, "300.00", "500.00"));

        AggregationInconsistencyException ex = assertThrows(AggregationInconsistencyException.class,
                () -> auditService.verifyShift(1L));
        assertTrue(ex.getMessage().contains("cashRevenue"));
    }

    @Test
    void activeShiftHasNoSnapshotToCompare() {
        when(shiftRepository.findById(1L)).thenReturn(Optional.of(
                ShiftSession.builder().id(1L).status(ShiftStatus.ACTIVE).build()));
        when(revenueAggregator.recompute(1L)).thenReturn(stats(1L, "10.00", "10.00"));

        assertNotNull(auditService.verifyShift(1L));
    }

    @Test
    void scheduledAuditContinuesPastInconsistentShift() {
        when(shiftRepository.findCompletedSince(NOW.minusHours(48)))
                .thenReturn(List.of(completed(1L, "100", "100"), completed(2L, "50", "50")));
        when(revenueAggregator.recompute(1L)).thenReturn(stats(1L, "120.00", "120.00"));
        when(revenueAggregator.recompute(2L)).thenReturn(stats(2L, "50.00", "50.00"));

        assertDoesNotThrow(() -> auditService.auditRecentShifts());

        verify(revenueAggregator).recompute(2L);
    }

    @Test
    void disabledAuditDoesNothing() {
        ReflectionTestUtils.setField(auditService, "auditEnabled", false);

        auditService.auditRecentShifts();

        verifyNoInteractions(shiftRepository, revenueAggregator);
    }
}
