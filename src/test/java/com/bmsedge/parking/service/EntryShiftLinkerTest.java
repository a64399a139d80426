package com.bmsedge.parking.service;

import com.bmsedge.parking.dto.BackfillResultDTO;
import com.bmsedge.parking.exception.InvalidRequestException;
import com.bmsedge.parking.exception.ResourceNotFoundException;
import com.bmsedge.parking.model.ParkingEntry;
import com.bmsedge.parking.model.ShiftSession;
import com.bmsedge.parking.model.ShiftStatus;
import com.bmsedge.parking.repository.ParkingEntryRepository;
import com.bmsedge.parking.repository.ShiftSessionRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EntryShiftLinkerTest {

    private static final LocalDateTime T = LocalDateTime.of(2024, 8, 2, 10, 0);

    @Mock
    private ParkingEntryRepository entryRepository;

    @Mock
    private ShiftSessionRepository shiftRepository;

    @Mock
    private ShiftAggregateRefresher aggregateRefresher;

    @InjectMocks
    private EntryShiftLinker linker;

    private static ParkingEntry newEntry() {
        return ParkingEntry.builder()
                .vehicleNumber("KA05MN1234")
                .vehicleType("4 Wheeler")
                .entryTime(T)
                .build();
    }

    private void echoSave() {
        when(entryRepository.saveAndFlush(any(ParkingEntry.class))).thenAnswer(inv -> {
            ParkingEntry e = inv.getArgument(0);
            e.setId(11L);
            return e;
        });
    }

    @Test
    void entryIsLinkedToTheActiveShift() {
        when(shiftRepository.findActiveForLinking()).thenReturn(Optional.of(
                ShiftSession.builder().id(3L).status(ShiftStatus.ACTIVE).build()));
        echoSave();

        ParkingEntry saved = linker.createLinkedEntry(newEntry());

        assertEquals(3L, saved.getShiftId());
        verify(aggregateRefresher).refresh(3L);
    }

    @Test
    void entryWithoutActiveShiftStaysUnlinked() {
        when(shiftRepository.findActiveForLinking()).thenReturn(Optional.empty());
        echoSave();

        ParkingEntry saved = linker.createLinkedEntry(newEntry());

        assertNull(saved.getShiftId());
        verifyNoInteractions(aggregateRefresher);
    }

    @Test
    void existingEntryIsNeverRelinked() {
        ParkingEntry existing = newEntry();
        existing.setId(9L);

        assertThrows(InvalidRequestException.class, () -> linker.createLinkedEntry(existing));
        verifyNoInteractions(shiftRepository, entryRepository);
    }

    @Test
    void backfillAssignsUnlinkedEntriesAndRefreshes() {
        when(shiftRepository.findByIdForShare(3L)).thenReturn(Optional.of(
                ShiftSession.builder().id(3L).status(ShiftStatus.COMPLETED).build()));
        when(entryRepository.assignUnlinkedBefore(3L, T)).thenReturn(4);

        BackfillResultDTO result = linker.linkUnassignedEntries(3L, T);

        assertEquals(4, result.getLinkedEntries());
        assertEquals(T, result.getCutoff());
        verify(aggregateRefresher).refreshAfterCorrection(3L);
        verify(aggregateRefresher, never()).refresh(any());
    }

    @Test
    void backfillWithNothingToLinkSkipsRefresh() {
        when(shiftRepository.findByIdForShare(3L)).thenReturn(Optional.of(
                ShiftSession.builder().id(3L).status(ShiftStatus.ACTIVE).build()));
        when(entryRepository.assignUnlinkedBefore(3L, T)).thenReturn(0);

        assertEquals(0, linker.linkUnassignedEntries(3L, T).getLinkedEntries());
        verifyNoInteractions(aggregateRefresher);
    }

    @Test
    void backfillToUnknownShiftIsNotFound() {
        when(shiftRepository.findByIdForShare(8L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> linker.linkUnassignedEntries(8L, T));
        verify(entryRepository, never()).assignUnlinkedBefore(anyLong(), any());
    }

    @Test
    void backfillRequiresCutoff() {
        assertThrows(InvalidRequestException.class, () -> linker.linkUnassignedEntries(3L, null));
    }
}
