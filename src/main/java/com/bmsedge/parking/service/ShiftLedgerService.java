package com.bmsedge.parking.service;

import com.bmsedge.parking.dto.CloseShiftRequest;
import com.bmsedge.parking.dto.DiscrepancyDTO;
import com.bmsedge.parking.dto.EmergencyEndRequest;
import com.bmsedge.parking.dto.HandoverRequest;
import com.bmsedge.parking.dto.HandoverResultDTO;
import com.bmsedge.parking.dto.OpenShiftRequest;
import com.bmsedge.parking.dto.ShiftCloseResultDTO;
import com.bmsedge.parking.dto.ShiftEventDTO;
import com.bmsedge.parking.dto.ShiftSessionDTO;
import com.bmsedge.parking.dto.ShiftStatisticsDTO;
import com.bmsedge.parking.exception.DiscrepancyAcknowledgementRequiredException;
import com.bmsedge.parking.exception.InvalidRequestException;
import com.bmsedge.parking.exception.ResourceNotFoundException;
import com.bmsedge.parking.exception.ShiftAlreadyActiveException;
import com.bmsedge.parking.exception.ShiftNotActiveException;
import com.bmsedge.parking.model.DiscrepancyLevel;
import com.bmsedge.parking.model.ShiftChange;
import com.bmsedge.parking.model.ShiftCloseType;
import com.bmsedge.parking.model.ShiftSession;
import com.bmsedge.parking.model.ShiftStatus;
import com.bmsedge.parking.repository.ShiftChangeRepository;
import com.bmsedge.parking.repository.ShiftSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Shift lifecycle: none -> ACTIVE -> COMPLETED, with at most one ACTIVE
 * shift system-wide.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShiftLedgerService {

    private final ShiftSessionRepository shiftRepository;
    private final ShiftChangeRepository shiftChangeRepository;
    private final RevenueAggregator revenueAggregator;
    private final ReconciliationEngine reconciliationEngine;
    private final ShiftStatisticsPublisher statisticsPublisher;
    private final ShiftReportMailer reportMailer;
    private final DurationCalculator durationCalculator;

    @Transactional
    public ShiftSessionDTO openShift(OpenShiftRequest request) {
        requireText(request.getEmployeeId(), "Employee id is required");
        requireCash(request.getOpeningCash(), "Opening cash");

        ShiftSession opened = open(request.getEmployeeId().trim(), request.getEmployeeName(),
                request.getOpeningCash(), request.getShiftNotes());

        publishEvent("SHIFT_OPENED", opened);
        return convertToDTO(opened);
    }

    @Transactional
    public ShiftCloseResultDTO closeShift(Long shiftId, CloseShiftRequest request) {
        requireCash(request.getClosingCash(), "Closing cash");

        ShiftSession shift = shiftRepository.findByIdForUpdate(shiftId)
                .orElseThrow(() -> new ResourceNotFoundException("Shift not found with id: " + shiftId));
        if (!shift.isActive()) {
            throw new ShiftNotActiveException("Shift " + shiftId + " is not active (status " + shift.getStatus() + ")");
        }

        ShiftCloseResultDTO result = close(shift, request.getClosingCash(), request.getNotes(),
                Boolean.TRUE.equals(request.getAcknowledgeDiscrepancy()), ShiftCloseType.NORMAL, null);

        publishEvent("SHIFT_CLOSED", shift);
        return result;
    }

    /**
     * Closes the active shift and opens the next one with the counted cash
     * carried forward. Either both halves commit or neither does.
     */
    @Transactional
    public HandoverResultDTO handover(HandoverRequest request) {
        requireCash(request.getClosingCash(), "Closing cash");
        requireText(request.getHandoverNotes(), "Handover notes are required");
        requireText(request.getIncomingEmployeeId(), "Incoming employee id is required");

        ShiftSession outgoing = shiftRepository.findActiveForUpdate()
                .orElseThrow(() -> new ShiftNotActiveException("No active shift to hand over"));
        String incomingId = request.getIncomingEmployeeId().trim();
        if (incomingId.equals(outgoing.getEmployeeId())) {
            throw new InvalidRequestException("Incoming employee cannot be the same as the outgoing employee");
        }

        ShiftCloseResultDTO closed = close(outgoing, request.getClosingCash(),
                "Handover to " + displayName(incomingId, request.getIncomingEmployeeName()) + ". "
                        + request.getHandoverNotes().trim(),
                Boolean.TRUE.equals(request.getAcknowledgeDiscrepancy()), ShiftCloseType.HANDOVER,
                request.getSupervisorId());

        String pending = isBlank(request.getPendingIssues()) ? "No pending issues." : request.getPendingIssues().trim();
        ShiftSession incoming = open(incomingId, request.getIncomingEmployeeName(), closed.getShift().getClosingCash(),
                "Handover from shift " + outgoing.getId() + ". " + pending);

        LocalDateTime changedAt = durationCalculator.now();
        ShiftChange change = shiftChangeRepository.save(ShiftChange.builder()
                .previousShiftId(outgoing.getId())
                .newShiftId(incoming.getId())
                .outgoingEmployeeId(outgoing.getEmployeeId())
                .incomingEmployeeId(incomingId)
                .incomingEmployeeName(request.getIncomingEmployeeName())
                .cashTransferred(closed.getShift().getClosingCash())
                .handoverNotes(request.getHandoverNotes().trim())
                .pendingIssues(request.getPendingIssues())
                .supervisorId(request.getSupervisorId())
                .changeTimestamp(changedAt)
                .build());

        log.info("Shift handover {} -> {}: {} -> {}, cash transferred {}",
                outgoing.getId(), incoming.getId(), outgoing.getEmployeeId(), incomingId,
                change.getCashTransferred());
        publishEvent("SHIFT_HANDOVER", incoming);

        return HandoverResultDTO.builder()
                .previousShift(closed)
                .newShift(convertToDTO(incoming))
                .changeId(change.getId())
                .handoverTimestamp(changedAt)
                .build();
    }

    /**
     * Supervisor-forced end. The reason stands in for the discrepancy note;
     * the cash count is optional.
     */
    @Transactional
    public ShiftCloseResultDTO emergencyEnd(Long shiftId, EmergencyEndRequest request) {
        requireText(request.getReason(), "An emergency end reason is required");
        requireText(request.getSupervisorId(), "Supervisor id is required for an emergency end");
        if (request.getClosingCash() != null) {
            requireCash(request.getClosingCash(), "Closing cash");
        }

        ShiftSession shift = shiftRepository.findByIdForUpdate(shiftId)
                .orElseThrow(() -> new ResourceNotFoundException("Shift not found with id: " + shiftId));
        if (!shift.isActive()) {
            throw new ShiftNotActiveException("Shift " + shiftId + " is not active (status " + shift.getStatus() + ")");
        }

        ShiftCloseResultDTO result = close(shift, request.getClosingCash(), "EMERGENCY: " + request.getReason().trim(),
                true, ShiftCloseType.EMERGENCY, request.getSupervisorId().trim());

        log.warn("Shift {} emergency-ended by supervisor {}: {}", shiftId, request.getSupervisorId(), request.getReason());
        publishEvent("SHIFT_EMERGENCY_END", shift);
        return result;
    }

    public Optional<ShiftSessionDTO> getActiveShift() {
        return shiftRepository.findFirstByStatusOrderByStartTimeDesc(ShiftStatus.ACTIVE).map(this::convertToDTO);
    }

    public ShiftSessionDTO getShift(Long shiftId) {
        return shiftRepository.findById(shiftId)
                .map(this::convertToDTO)
                .orElseThrow(() -> new ResourceNotFoundException("Shift not found with id: " + shiftId));
    }

    public ShiftStatisticsDTO getShiftStatistics(Long shiftId) {
        return revenueAggregator.recompute(shiftId);
    }

    /**
     * Advisory reconciliation; nothing is written.
     */
    public DiscrepancyDTO reconcileShift(Long shiftId, BigDecimal actualClosingCash) {
        requireCash(actualClosingCash, "Actual closing cash");
        return reconciliationEngine.reconcile(shiftId, actualClosingCash);
    }

    private ShiftSession open(String employeeId, String employeeName, BigDecimal openingCash, String notes) {
        shiftRepository.findFirstByStatusOrderByStartTimeDesc(ShiftStatus.ACTIVE).ifPresent(active -> {
            throw new ShiftAlreadyActiveException(active.getId());
        });

        ShiftSession shift = ShiftSession.builder()
                .employeeId(employeeId)
                .employeeName(employeeName)
                .startTime(durationCalculator.now())
                .openingCash(openingCash.setScale(2, RoundingMode.HALF_UP))
                .status(ShiftStatus.ACTIVE)
                .activeSlot(ShiftSession.ACTIVE_SLOT)
                .shiftNotes(notes)
                .build();

        ShiftSession saved;
        try {
            // Flush now so a concurrent open trips the active_slot constraint here
            saved = shiftRepository.saveAndFlush(shift);
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent shift open rejected for employee {}", employeeId);
            throw new ShiftAlreadyActiveException(null);
        }

        log.info("Shift {} opened for employee {} with opening cash {}", saved.getId(), employeeId, saved.getOpeningCash());
        return saved;
    }

    private ShiftCloseResultDTO close(ShiftSession shift, BigDecimal closingCash, String notes,
                                      boolean acknowledged, ShiftCloseType closeType, String supervisorId) {
        ShiftStatisticsDTO statistics = revenueAggregator.recompute(shift.getId());
        DiscrepancyDTO discrepancy = closingCash != null
                ? reconciliationEngine.reconcile(shift, statistics, closingCash)
                : null;

        if (discrepancy != null && discrepancy.getLevel() == DiscrepancyLevel.MAJOR
                && (!acknowledged || isBlank(notes))) {
            log.warn("Refusing to close shift {}: major discrepancy {} not acknowledged",
                    shift.getId(), discrepancy.getDelta());
            throw new DiscrepancyAcknowledgementRequiredException(discrepancy);
        }

        reconciliationEngine.annotate(shift, statistics, discrepancy);
        shift.setStatus(ShiftStatus.COMPLETED);
        shift.setActiveSlot(null);
        shift.setEndTime(durationCalculator.now());
        shift.setCloseType(closeType);
        shift.setClosingNotes(notes);
        shift.setSupervisorId(supervisorId);
        shift.setDiscrepancyAcknowledged(discrepancy != null && discrepancy.getLevel() == DiscrepancyLevel.MAJOR);

        ShiftSession saved = shiftRepository.saveAndFlush(shift);
        logDiscrepancy(saved, discrepancy);

        ShiftCloseResultDTO result = ShiftCloseResultDTO.builder()
                .shift(convertToDTO(saved))
                .statistics(statistics)
                .discrepancy(discrepancy)
                .build();

        statisticsPublisher.publishStatisticsAfterCommit(statistics);
        TransactionHooks.afterCommit(() -> reportMailer.sendShiftSummary(result));
        return result;
    }

    private void logDiscrepancy(ShiftSession shift, DiscrepancyDTO discrepancy) {
        if (discrepancy == null) {
            log.info("Shift {} closed ({}) without a cash count; expected cash {}",
                    shift.getId(), shift.getCloseType(), shift.getExpectedClosingCash());
            return;
        }
        switch (discrepancy.getLevel()) {
            case BALANCED:
                log.info("Shift {} closed ({}) balanced: expected {} actual {}", shift.getId(), shift.getCloseType(),
                        discrepancy.getExpectedClosingCash(), discrepancy.getActualClosingCash());
                break;
            case MINOR:
                log.warn("Shift {} closed ({}) with minor discrepancy {}: expected {} actual {}", shift.getId(),
                        shift.getCloseType(), discrepancy.getDelta(), discrepancy.getExpectedClosingCash(),
                        discrepancy.getActualClosingCash());
                break;
            default:
                log.error("Shift {} closed ({}) with acknowledged MAJOR discrepancy {}: expected {} actual {} note: {}",
                        shift.getId(), shift.getCloseType(), discrepancy.getDelta(),
                        discrepancy.getExpectedClosingCash(), discrepancy.getActualClosingCash(),
                        shift.getClosingNotes());
        }
    }

    private void publishEvent(String type, ShiftSession shift) {
        statisticsPublisher.publishEventAfterCommit(ShiftEventDTO.builder()
                .type(type)
                .shiftId(shift.getId())
                .employeeId(shift.getEmployeeId())
                .timestamp(durationCalculator.now())
                .build());
    }

    private static void requireCash(BigDecimal amount, String label) {
        if (amount == null || amount.signum() < 0) {
            throw new InvalidRequestException(label + " must be a non-negative amount");
        }
    }

    private static void requireText(String value, String message) {
        if (isBlank(value)) {
            throw new InvalidRequestException(message);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String displayName(String employeeId, String employeeName) {
        return isBlank(employeeName) ? employeeId : employeeName.trim();
    }

    private ShiftSessionDTO convertToDTO(ShiftSession shift) {
        return ShiftSessionDTO.builder()
                .id(shift.getId())
                .employeeId(shift.getEmployeeId())
                .employeeName(shift.getEmployeeName())
                .startTime(shift.getStartTime())
                .endTime(shift.getEndTime())
                .openingCash(shift.getOpeningCash())
                .closingCash(shift.getClosingCash())
                .status(shift.getStatus())
                .closeType(shift.getCloseType())
                .expectedClosingCash(shift.getExpectedClosingCash())
                .cashDiscrepancy(shift.getCashDiscrepancy())
                .discrepancyLevel(shift.getDiscrepancyLevel())
                .discrepancyAcknowledged(shift.getDiscrepancyAcknowledged())
                .shiftNotes(shift.getShiftNotes())
                .closingNotes(shift.getClosingNotes())
                .supervisorId(shift.getSupervisorId())
                .build();
    }
}
