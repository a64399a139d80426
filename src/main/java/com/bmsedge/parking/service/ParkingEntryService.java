package com.bmsedge.parking.service;

import com.bmsedge.parking.dto.FeeCorrectionRequest;
import com.bmsedge.parking.dto.FeeQuoteDTO;
import com.bmsedge.parking.dto.ParkingEntryDTO;
import com.bmsedge.parking.dto.SettlePaymentRequest;
import com.bmsedge.parking.dto.VehicleEntryRequest;
import com.bmsedge.parking.dto.VehicleExitRequest;
import com.bmsedge.parking.exception.FeeAlreadyAssessedException;
import com.bmsedge.parking.exception.InvalidRequestException;
import com.bmsedge.parking.exception.ResourceNotFoundException;
import com.bmsedge.parking.model.ParkingEntry;
import com.bmsedge.parking.model.PaymentMethod;
import com.bmsedge.parking.repository.ParkingEntryRepository;
import com.bmsedge.parking.repository.ShiftSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Vehicle entry/exit lifecycle. Every write that changes a linked entry's
 * exit state, fee, payment or archive flag refreshes its shift's statistics
 * in the same transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParkingEntryService {

    private final ParkingEntryRepository entryRepository;
    private final ShiftSessionRepository shiftRepository;
    private final EntryShiftLinker entryShiftLinker;
    private final ParkingFeeService feeService;
    private final DurationCalculator durationCalculator;
    private final ShiftAggregateRefresher aggregateRefresher;

    @Transactional
    public ParkingEntryDTO recordEntry(VehicleEntryRequest request) {
        if (request.getVehicleType() == null || request.getVehicleType().isBlank()) {
            throw new InvalidRequestException("Vehicle type is required");
        }
        LocalDateTime entryTime = request.getEntryTime() != null ? request.getEntryTime() : durationCalculator.now();

        ParkingEntry entry = ParkingEntry.builder()
                .vehicleNumber(request.getVehicleNumber())
                .vehicleType(request.getVehicleType().trim())
                .entryTime(entryTime)
                .paymentMethod(parsePaymentMethod(request.getPaymentMethod()))
                .paymentSettled(false)
                .archived(false)
                .build();

        ParkingEntry saved = entryShiftLinker.createLinkedEntry(entry);
        log.info("Vehicle {} ({}) entered at {} shift={}",
                saved.getVehicleNumber(), saved.getVehicleType(), saved.getEntryTime(), saved.getShiftId());
        return convertToDTO(saved);
    }

    /**
     * Bills the stay and records the exit. The fee is assessed exactly once.
     */
    @Transactional
    public ParkingEntryDTO recordExit(Long entryId, VehicleExitRequest request) {
        ParkingEntry entry = findLiveEntry(entryId);
        if (entry.hasExited() || entry.getFee() != null) {
            throw new FeeAlreadyAssessedException("Entry " + entryId + " already exited at " + entry.getExitTime()
                    + " with fee " + entry.getFee());
        }

        lockOwningShift(entry);

        LocalDateTime exitTime = request.getExitTime() != null ? request.getExitTime() : durationCalculator.now();
        FeeQuoteDTO quote = feeService.computeFee(entry.getVehicleType(), entry.getEntryTime(), exitTime);

        PaymentMethod method = parsePaymentMethod(request.getPaymentMethod());
        if (method == null) {
            method = entry.getPaymentMethod();
        }
        if (method == null) {
            throw new InvalidRequestException("Payment method is required at exit for entry " + entryId);
        }
        boolean settled = request.getPaymentSettled() == null || request.getPaymentSettled();

        entry.setExitTime(exitTime);
        entry.setFee(quote.getFee());
        entry.setAssessedFee(quote.getFee());
        entry.setBillableDays(quote.getBillableDays());
        entry.setUsedFallbackRate(quote.getUsedFallbackRate());
        entry.setPaymentMethod(method);
        entry.setPaymentSettled(settled);
        entry.setSettledAt(settled ? exitTime : null);

        ParkingEntry saved = entryRepository.saveAndFlush(entry);
        aggregateRefresher.refresh(saved.getShiftId());

        log.info("Vehicle {} exited: {} day(s) x {} = {} via {} (settled={}, fallbackRate={})",
                saved.getVehicleNumber(), quote.getBillableDays(), quote.getDailyRate(), quote.getFee(),
                method, settled, quote.getUsedFallbackRate());
        return convertToDTO(saved);
    }

    @Transactional
    public ParkingEntryDTO settlePayment(Long entryId, SettlePaymentRequest request) {
        ParkingEntry entry = findLiveEntry(entryId);
        if (!entry.hasExited() || entry.getFee() == null) {
            throw new InvalidRequestException("Entry " + entryId + " has not been billed yet");
        }
        if (Boolean.TRUE.equals(entry.getPaymentSettled())) {
            throw new InvalidRequestException("Entry " + entryId + " is already settled");
        }

        PaymentMethod method = request != null ? parsePaymentMethod(request.getPaymentMethod()) : null;
        lockOwningShift(entry);
        if (method != null) {
            entry.setPaymentMethod(method);
        }
        entry.setPaymentSettled(true);
        entry.setSettledAt(durationCalculator.now());

        ParkingEntry saved = entryRepository.saveAndFlush(entry);
        aggregateRefresher.refresh(saved.getShiftId());

        log.info("Entry {} settled {} via {}", entryId, saved.getFee(), saved.getPaymentMethod());
        return convertToDTO(saved);
    }

    /**
     * Authorized correction of an assessed fee. The original assessment is
     * kept on the row and the owning shift's aggregates are refreshed.
     */
    @Transactional
    public ParkingEntryDTO correctFee(Long entryId, FeeCorrectionRequest request) {
        if (request.getFee() == null || request.getFee().signum() < 0) {
            throw new InvalidRequestException("Corrected fee must be a non-negative amount");
        }
        if (isBlank(request.getReason()) || isBlank(request.getCorrectedBy())) {
            throw new InvalidRequestException("A reason and the correcting user are required");
        }

        ParkingEntry entry = findLiveEntry(entryId);
        if (!entry.hasExited() || entry.getFee() == null) {
            throw new InvalidRequestException("Entry " + entryId + " has no assessed fee to correct");
        }

        lockOwningShift(entry);
        BigDecimal previous = entry.getFee();
        entry.setFee(request.getFee().setScale(2, RoundingMode.HALF_UP));
        entry.setCorrectionReason(request.getReason().trim());
        entry.setCorrectedBy(request.getCorrectedBy().trim());
        entry.setCorrectedAt(durationCalculator.now());

        ParkingEntry saved = entryRepository.saveAndFlush(entry);
        aggregateRefresher.refreshAfterCorrection(saved.getShiftId());

        log.warn("Fee for entry {} corrected {} -> {} by {}: {}",
                entryId, previous, saved.getFee(), saved.getCorrectedBy(), saved.getCorrectionReason());
        return convertToDTO(saved);
    }

    // Entries are never hard-deleted
    @Transactional
    public ParkingEntryDTO archiveEntry(Long entryId) {
        ParkingEntry entry = findLiveEntry(entryId);
        lockOwningShift(entry);
        entry.setArchived(true);
        entry.setArchivedAt(durationCalculator.now());

        ParkingEntry saved = entryRepository.saveAndFlush(entry);
        aggregateRefresher.refresh(saved.getShiftId());

        log.info("Entry {} archived", entryId);
        return convertToDTO(saved);
    }

    public ParkingEntryDTO getEntry(Long entryId) {
        return entryRepository.findById(entryId)
                .map(this::convertToDTO)
                .orElseThrow(() -> new ResourceNotFoundException("Parking entry not found with id: " + entryId));
    }

    public List<ParkingEntryDTO> getCurrentlyParked() {
        return entryRepository.findCurrentlyParked().stream()
                .map(this::convertToDTO)
                .collect(Collectors.toList());
    }

    private ParkingEntry findLiveEntry(Long entryId) {
        ParkingEntry entry = entryRepository.findById(entryId)
                .orElseThrow(() -> new ResourceNotFoundException("Parking entry not found with id: " + entryId));
        if (Boolean.TRUE.equals(entry.getArchived())) {
            throw new InvalidRequestException("Entry " + entryId + " is archived");
        }
        return entry;
    }

    /**
     * Takes a shared lock on the entry's shift before the entry is written,
     * so the write and a close of that shift are applied one after the other
     * and the close recomputes from committed entries only.
     */
    private void lockOwningShift(ParkingEntry entry) {
        if (entry.getShiftId() != null) {
            shiftRepository.findByIdForShare(entry.getShiftId());
        }
    }

    private PaymentMethod parsePaymentMethod(String raw) {
        try {
            return PaymentMethod.fromRaw(raw);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private ParkingEntryDTO convertToDTO(ParkingEntry entry) {
        return ParkingEntryDTO.builder()
                .id(entry.getId())
                .vehicleNumber(entry.getVehicleNumber())
                .vehicleType(entry.getVehicleType())
                .entryTime(entry.getEntryTime())
                .exitTime(entry.getExitTime())
                .fee(entry.getFee())
                .billableDays(entry.getBillableDays())
                .usedFallbackRate(entry.getUsedFallbackRate())
                .paymentMethod(entry.getPaymentMethod())
                .paymentSettled(entry.getPaymentSettled())
                .shiftId(entry.getShiftId())
                .assessedFee(entry.getAssessedFee())
                .correctionReason(entry.getCorrectionReason())
                .archived(entry.getArchived())
                .build();
    }
}
