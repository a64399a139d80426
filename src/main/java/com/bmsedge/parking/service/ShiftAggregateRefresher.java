package com.bmsedge.parking.service;

import com.bmsedge.parking.dto.ShiftStatisticsDTO;
import com.bmsedge.parking.model.ShiftSession;
import com.bmsedge.parking.repository.ShiftSessionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.function.BiConsumer;

/**
 * The single call every entry write path makes after changing a shift's
 * entries: recompute, keep a completed shift's recorded figures in step,
 * then broadcast after commit.
 */
@Service
@RequiredArgsConstructor
public class ShiftAggregateRefresher {

    private final ShiftSessionRepository shiftRepository;
    private final RevenueAggregator revenueAggregator;
    private final ReconciliationEngine reconciliationEngine;
    private final ShiftStatisticsPublisher statisticsPublisher;

    /**
     * Normal flow (entry, exit, settlement, archive). A completed shift only
     * has its recorded revenue updated; its close-time discrepancy stands.
     */
    @Transactional
    public ShiftStatisticsDTO refresh(Long shiftId) {
        return refresh(shiftId, reconciliationEngine::recordRevenue);
    }

    /**
     * Authorized edits (fee correction, backfill). A completed shift is
     * re-reconciled against the cash counted at its close.
     */
    @Transactional
    public ShiftStatisticsDTO refreshAfterCorrection(Long shiftId) {
        return refresh(shiftId, reconciliationEngine::reannotate);
    }

    private ShiftStatisticsDTO refresh(Long shiftId, BiConsumer<ShiftSession, ShiftStatisticsDTO> completedShiftUpdate) {
        if (shiftId == null) {
            return null;
        }
        ShiftStatisticsDTO statistics = revenueAggregator.recompute(shiftId);

        shiftRepository.findById(shiftId)
                .filter(shift -> !shift.isActive())
                .ifPresent(shift -> {
                    completedShiftUpdate.accept(shift, statistics);
                    shiftRepository.save(shift);
                });

        statisticsPublisher.publishStatisticsAfterCommit(statistics);
        return statistics;
    }
}
