package com.bmsedge.parking.service;

import com.bmsedge.parking.dto.ShiftStatisticsDTO;
import com.bmsedge.parking.exception.AggregationInconsistencyException;
import com.bmsedge.parking.exception.ResourceNotFoundException;
import com.bmsedge.parking.model.ShiftSession;
import com.bmsedge.parking.repository.ShiftSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Compares the revenue recorded on completed shifts at close with a fresh
 * recomputation from their entries. A mismatch means some write path
 * changed entries without refreshing the shift; it is reported, never fixed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShiftConsistencyAuditService {

    private final ShiftSessionRepository shiftRepository;
    private final RevenueAggregator revenueAggregator;
    private final DurationCalculator durationCalculator;

    @Value("${parking.audit.enabled:true}")
    private boolean auditEnabled;

    @Value("${parking.audit.lookback-hours:48}")
    private long lookbackHours;

    @Scheduled(cron = "${parking.audit.cron:0 */15 * * * *}")
    public void auditRecentShifts() {
        if (!auditEnabled) {
            return;
        }
        List<ShiftSession> shifts = shiftRepository.findCompletedSince(durationCalculator.now().minusHours(lookbackHours));
        int inconsistent = 0;
        for (ShiftSession shift : shifts) {
            try {
                verify(shift);
            } catch (AggregationInconsistencyException e) {
                inconsistent++;
                log.error("DATA INTEGRITY ALERT: {}", e.getMessage());
            }
        }
        if (inconsistent > 0) {
            log.error("Consistency audit found {} inconsistent shift(s) out of {}", inconsistent, shifts.size());
        } else {
            log.debug("Consistency audit checked {} completed shift(s)", shifts.size());
        }
    }

    @Transactional(readOnly = true)
    public ShiftStatisticsDTO verifyShift(Long shiftId) {
        ShiftSession shift = shiftRepository.findById(shiftId)
                .orElseThrow(() -> new ResourceNotFoundException("Shift not found with id: " + shiftId));
        return verify(shift);
    }

    private ShiftStatisticsDTO verify(ShiftSession shift) {
        ShiftStatisticsDTO statistics = revenueAggregator.recompute(shift.getId());
        if (shift.isActive()) {
            return statistics;
        }
        check(shift.getId(), "cashRevenue", shift.getRecordedCashRevenue(), statistics.getCashRevenue());
        check(shift.getId(), "revenueTotal", shift.getRecordedRevenueTotal(), statistics.getRevenueTotal());
        return statistics;
    }

    private void check(Long shiftId, String field, BigDecimal recorded, BigDecimal recomputed) {
        if (recorded == null || recorded.compareTo(recomputed) != 0) {
            throw new AggregationInconsistencyException(shiftId, field, recorded, recomputed);
        }
    }
}
