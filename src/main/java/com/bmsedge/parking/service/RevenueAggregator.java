package com.bmsedge.parking.service;

import com.bmsedge.parking.dto.ShiftStatisticsDTO;
import com.bmsedge.parking.dto.VehicleTypeBreakdownDTO;
import com.bmsedge.parking.exception.ResourceNotFoundException;
import com.bmsedge.parking.model.ParkingEntry;
import com.bmsedge.parking.model.PaymentMethod;
import com.bmsedge.parking.repository.ParkingEntryRepository;
import com.bmsedge.parking.repository.ShiftSessionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives a shift's statistics from the full set of entries linked to it.
 * Nothing here is cached or counted incrementally: every call re-reads the
 * rows, so the result cannot drift from the entries.
 */
@Service
@RequiredArgsConstructor
public class RevenueAggregator {

    private final ParkingEntryRepository entryRepository;
    private final ShiftSessionRepository shiftRepository;

    /**
     * Call inside the transaction of the write that changed the shift's
     * entries, after flushing, so the read sees that write.
     */
    @Transactional(readOnly = true)
    public ShiftStatisticsDTO recompute(Long shiftId) {
        if (shiftId == null || !shiftRepository.existsById(shiftId)) {
            throw new ResourceNotFoundException("Shift not found with id: " + shiftId);
        }
        return aggregate(shiftId, entryRepository.findLiveByShiftId(shiftId));
    }

    /**
     * Pure function of the entry set. Archived rows are ignored.
     */
    public static ShiftStatisticsDTO aggregate(Long shiftId, List<ParkingEntry> entries) {
        int entered = 0;
        int exited = 0;
        int settled = 0;
        BigDecimal cash = BigDecimal.ZERO;
        BigDecimal digital = BigDecimal.ZERO;
        BigDecimal pending = BigDecimal.ZERO;
        long totalStayMinutes = 0;

        Map<String, TypeTally> byType = new TreeMap<>();

        for (ParkingEntry entry : entries) {
            if (Boolean.TRUE.equals(entry.getArchived())) {
                continue;
            }
            entered++;
            TypeTally tally = byType.computeIfAbsent(VehicleTypeNormalizer.normalize(entry.getVehicleType()),
                    k -> new TypeTally(entry.getVehicleType() != null ? entry.getVehicleType().trim() : ""));
            tally.entered++;

            if (!entry.hasExited()) {
                continue;
            }
            exited++;
            tally.exited++;
            totalStayMinutes += Duration.between(entry.getEntryTime(), entry.getExitTime()).toMinutes();

            if (entry.isRevenueBearing()) {
                settled++;
                tally.revenue = tally.revenue.add(entry.getFee());
                if (entry.getPaymentMethod() == PaymentMethod.DIGITAL) {
                    digital = digital.add(entry.getFee());
                } else {
                    cash = cash.add(entry.getFee());
                }
            } else if (entry.getFee() != null) {
                pending = pending.add(entry.getFee());
            }
        }

        BigDecimal total = cash.add(digital);
        List<VehicleTypeBreakdownDTO> breakdown = new ArrayList<>();
        for (TypeTally tally : byType.values()) {
            breakdown.add(VehicleTypeBreakdownDTO.builder()
                    .vehicleType(tally.label)
                    .entered(tally.entered)
                    .exited(tally.exited)
                    .revenue(money(tally.revenue))
                    .build());
        }

        return ShiftStatisticsDTO.builder()
                .shiftId(shiftId)
                .vehiclesEntered(entered)
                .vehiclesExited(exited)
                .currentlyParked(entered - exited)
                .revenueTotal(money(total))
                .cashRevenue(money(cash))
                .digitalRevenue(money(digital))
                .settledTransactions(settled)
                .pendingSettlementAmount(money(pending))
                .averageTransaction(settled > 0
                        ? total.divide(BigDecimal.valueOf(settled), 2, RoundingMode.HALF_UP)
                        : money(BigDecimal.ZERO))
                .averageDurationMinutes(exited > 0 ? (double) totalStayMinutes / exited : 0.0)
                .vehicleTypes(breakdown)
                .build();
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

    private static final class TypeTally {
        private final String label;
        private int entered;
        private int exited;
        private BigDecimal revenue = BigDecimal.ZERO;

        private TypeTally(String label) {
            this.label = label;
        }
    }
}
