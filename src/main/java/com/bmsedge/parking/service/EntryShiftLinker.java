package com.bmsedge.parking.service;

import com.bmsedge.parking.dto.BackfillResultDTO;
import com.bmsedge.parking.exception.InvalidRequestException;
import com.bmsedge.parking.exception.ResourceNotFoundException;
import com.bmsedge.parking.model.ParkingEntry;
import com.bmsedge.parking.model.ShiftSession;
import com.bmsedge.parking.repository.ParkingEntryRepository;
import com.bmsedge.parking.repository.ShiftSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Binds new parking entries to the shift that is active when they are created.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntryShiftLinker {

    private final ParkingEntryRepository entryRepository;
    private final ShiftSessionRepository shiftRepository;
    private final ShiftAggregateRefresher aggregateRefresher;

    /**
     * Reads the active shift under a shared lock and inserts the entry in the
     * same transaction. A shift being closed concurrently holds the exclusive
     * lock, so the entry either lands before the close commits or sees no
     * active shift and stays unlinked.
     */
    @Transactional
    public ParkingEntry createLinkedEntry(ParkingEntry entry) {
        if (entry.getId() != null) {
            throw new InvalidRequestException("Entry " + entry.getId() + " already exists");
        }
        Optional<ShiftSession> active = shiftRepository.findActiveForLinking();
        entry.setShiftId(active.map(ShiftSession::getId).orElse(null));

        ParkingEntry saved = entryRepository.saveAndFlush(entry);

        if (saved.getShiftId() != null) {
            aggregateRefresher.refresh(saved.getShiftId());
        } else {
            log.warn("No active shift; entry {} ({}) created unlinked", saved.getId(), saved.getVehicleNumber());
        }
        return saved;
    }

    /**
     * Administrative recovery: assigns every unlinked entry that entered
     * before {@code cutoff} to {@code shiftId}. Entries already linked are
     * never touched.
     */
    @Transactional
    public BackfillResultDTO linkUnassignedEntries(Long shiftId, LocalDateTime cutoff) {
        if (cutoff == null) {
            throw new InvalidRequestException("Cutoff time is required");
        }
        shiftRepository.findByIdForShare(shiftId)
                .orElseThrow(() -> new ResourceNotFoundException("Shift not found with id: " + shiftId));

        int linked = entryRepository.assignUnlinkedBefore(shiftId, cutoff);
        log.warn("Backfill linked {} unassigned entries before {} to shift {}", linked, cutoff, shiftId);

        if (linked > 0) {
            aggregateRefresher.refreshAfterCorrection(shiftId);
        }

        return BackfillResultDTO.builder()
                .shiftId(shiftId)
                .cutoff(cutoff)
                .linkedEntries(linked)
                .build();
    }
}
