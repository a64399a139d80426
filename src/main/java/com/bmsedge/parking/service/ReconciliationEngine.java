package com.bmsedge.parking.service;

import com.bmsedge.parking.dto.DiscrepancyDTO;
import com.bmsedge.parking.dto.ShiftStatisticsDTO;
import com.bmsedge.parking.exception.ResourceNotFoundException;
import com.bmsedge.parking.model.DiscrepancyLevel;
import com.bmsedge.parking.model.ShiftSession;
import com.bmsedge.parking.repository.ShiftSessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Compares counted cash against opening cash plus cash revenue.
 * Read-only apart from {@link #annotate}, which the shift ledger calls at close.
 */
@Service
@Slf4j
public class ReconciliationEngine {

    private final ShiftSessionRepository shiftRepository;
    private final RevenueAggregator revenueAggregator;
    private final BigDecimal minorThreshold;
    private final BigDecimal majorThreshold;

    public ReconciliationEngine(
            ShiftSessionRepository shiftRepository,
            RevenueAggregator revenueAggregator,
            @Value("${parking.reconciliation.minor-threshold:10.00}") BigDecimal minorThreshold,
            @Value("${parking.reconciliation.major-threshold:100.00}") BigDecimal majorThreshold) {
        if (minorThreshold.compareTo(majorThreshold) > 0) {
            throw new IllegalArgumentException("Minor discrepancy threshold " + minorThreshold
                    + " exceeds major threshold " + majorThreshold);
        }
        this.shiftRepository = shiftRepository;
        this.revenueAggregator = revenueAggregator;
        this.minorThreshold = minorThreshold;
        this.majorThreshold = majorThreshold;
    }

    @Transactional(readOnly = true)
    public DiscrepancyDTO reconcile(Long shiftId, BigDecimal actualClosingCash) {
        ShiftSession shift = shiftRepository.findById(shiftId)
                .orElseThrow(() -> new ResourceNotFoundException("Shift not found with id: " + shiftId));
        return reconcile(shift, revenueAggregator.recompute(shiftId), actualClosingCash);
    }

    public DiscrepancyDTO reconcile(ShiftSession shift, ShiftStatisticsDTO statistics, BigDecimal actualClosingCash) {
        // Digital payments never reach the drawer
        BigDecimal expected = expectedClosingCash(shift, statistics);
        BigDecimal actual = actualClosingCash.setScale(2, RoundingMode.HALF_UP);
        BigDecimal delta = actual.subtract(expected);
        DiscrepancyLevel level = classify(delta);

        return DiscrepancyDTO.builder()
                .shiftId(shift.getId())
                .openingCash(shift.getOpeningCash())
                .cashRevenue(statistics.getCashRevenue())
                .expectedClosingCash(expected)
                .actualClosingCash(actual)
                .delta(delta)
                .level(level)
                .requiresAcknowledgement(level == DiscrepancyLevel.MAJOR)
                .build();
    }

    public DiscrepancyLevel classify(BigDecimal delta) {
        BigDecimal magnitude = delta.abs();
        if (magnitude.compareTo(minorThreshold) <= 0) {
            return DiscrepancyLevel.BALANCED;
        }
        if (magnitude.compareTo(majorThreshold) <= 0) {
            return DiscrepancyLevel.MINOR;
        }
        return DiscrepancyLevel.MAJOR;
    }

    /**
     * Records expected and actual cash on the session for audit.
     * {@code discrepancy} is null when no cash count was taken.
     */
    public void annotate(ShiftSession shift, ShiftStatisticsDTO statistics, DiscrepancyDTO discrepancy) {
        shift.setExpectedClosingCash(expectedClosingCash(shift, statistics));
        shift.setRecordedCashRevenue(statistics.getCashRevenue());
        shift.setRecordedRevenueTotal(statistics.getRevenueTotal());
        if (discrepancy != null) {
            shift.setClosingCash(discrepancy.getActualClosingCash());
            shift.setCashDiscrepancy(discrepancy.getDelta());
            shift.setDiscrepancyLevel(discrepancy.getLevel());
        }
    }

    /**
     * Keeps the revenue recorded on a completed shift in step with its
     * entries after a normal write (a late exit or settlement). The
     * close-time cash reconciliation is left exactly as it was closed.
     */
    public void recordRevenue(ShiftSession shift, ShiftStatisticsDTO statistics) {
        shift.setRecordedCashRevenue(statistics.getCashRevenue());
        shift.setRecordedRevenueTotal(statistics.getRevenueTotal());
    }

    /**
     * Re-annotates a completed shift after an authorized correction changed
     * its entries. The counted cash stays as recorded. A correction that
     * pushes the shift into a major discrepancy voids any earlier
     * acknowledgement.
     */
    public DiscrepancyDTO reannotate(ShiftSession shift, ShiftStatisticsDTO statistics) {
        DiscrepancyLevel previousLevel = shift.getDiscrepancyLevel();
        DiscrepancyDTO discrepancy = shift.getClosingCash() != null
                ? reconcile(shift, statistics, shift.getClosingCash())
                : null;
        annotate(shift, statistics, discrepancy);

        if (discrepancy != null && discrepancy.getLevel() == DiscrepancyLevel.MAJOR
                && previousLevel != DiscrepancyLevel.MAJOR) {
            shift.setDiscrepancyAcknowledged(false);
            log.error("Correction escalated shift {} to an unacknowledged MAJOR discrepancy {}: expected {} actual {}",
                    shift.getId(), discrepancy.getDelta(), discrepancy.getExpectedClosingCash(),
                    discrepancy.getActualClosingCash());
        } else {
            log.warn("Shift {} re-annotated after correction: expected cash {} recorded cash revenue {}",
                    shift.getId(), shift.getExpectedClosingCash(), shift.getRecordedCashRevenue());
        }
        return discrepancy;
    }

    private BigDecimal expectedClosingCash(ShiftSession shift, ShiftStatisticsDTO statistics) {
        return shift.getOpeningCash().add(statistics.getCashRevenue()).setScale(2, RoundingMode.HALF_UP);
    }
}
