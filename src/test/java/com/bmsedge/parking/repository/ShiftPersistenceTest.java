package com.bmsedge.parking.repository;

import com.bmsedge.parking.dto.BackfillResultDTO;
import com.bmsedge.parking.dto.CloseShiftRequest;
import com.bmsedge.parking.dto.HandoverRequest;
import com.bmsedge.parking.dto.HandoverResultDTO;
import com.bmsedge.parking.dto.OpenShiftRequest;
import com.bmsedge.parking.dto.ShiftSessionDTO;
import com.bmsedge.parking.exception.ShiftAlreadyActiveException;
import com.bmsedge.parking.model.ParkingEntry;
import com.bmsedge.parking.model.ShiftChange;
import com.bmsedge.parking.model.ShiftSession;
import com.bmsedge.parking.model.ShiftStatus;
import com.bmsedge.parking.service.DurationCalculator;
import com.bmsedge.parking.service.EntryShiftLinker;
import com.bmsedge.parking.service.ReconciliationEngine;
import com.bmsedge.parking.service.RevenueAggregator;
import com.bmsedge.parking.service.ShiftAggregateRefresher;
import com.bmsedge.parking.service.ShiftLedgerService;
import com.bmsedge.parking.service.ShiftReportMailer;
import com.bmsedge.parking.service.ShiftStatisticsPublisher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Runs the shift ledger and entry linking against an embedded database so
 * the unique active slot, the JPQL and the transaction boundaries are real.
 * Each service call commits or rolls back on its own.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({ShiftLedgerService.class, EntryShiftLinker.class, ShiftAggregateRefresher.class,
        RevenueAggregator.class, ReconciliationEngine.class, ShiftStatisticsPublisher.class,
        ShiftReportMailer.class, DurationCalculator.class})
class ShiftPersistenceTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Kolkata");
    private static final LocalDateTime NOW = LocalDateTime.of(2024, 11, 5, 9, 0);

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW.atZone(ZONE).toInstant(), ZONE);
        }
    }

    @MockBean
    private SimpMessagingTemplate messagingTemplate;

    @MockBean
    private ShiftChangeRepository shiftChangeRepository;

    @Autowired
    private ShiftSessionRepository shiftRepository;

    @Autowired
    private ParkingEntryRepository entryRepository;

    @Autowired
    private ShiftLedgerService ledgerService;

    @Autowired
    private EntryShiftLinker linker;

    @AfterEach
    void cleanUp() {
        entryRepository.deleteAll();
        shiftRepository.deleteAll();
    }

    private static ShiftSession session(String employeeId, ShiftStatus status) {
        return ShiftSession.builder()
                .employeeId(employeeId)
                .startTime(NOW.minusHours(8))
                .openingCash(new BigDecimal("1000.00"))
                .status(status)
                .activeSlot(status == ShiftStatus.ACTIVE ? ShiftSession.ACTIVE_SLOT : null)
                .build();
    }

    private static ParkingEntry entry(String vehicleNumber, LocalDateTime entryTime) {
        return ParkingEntry.builder()
                .vehicleNumber(vehicleNumber)
                .vehicleType("4 Wheeler")
                .entryTime(entryTime)
                .build();
    }

    private Long open(String employeeId) {
        OpenShiftRequest request = new OpenShiftRequest();
        request.setEmployeeId(employeeId);
        request.setOpeningCash(new BigDecimal("1000"));
        return ledgerService.openShift(request).getId();
    }

    private void close(Long shiftId) {
        CloseShiftRequest request = new CloseShiftRequest();
        request.setClosingCash(new BigDecimal("1000"));
        ledgerService.closeShift(shiftId, request);
    }

    private HandoverRequest handoverTo(String incomingEmployeeId) {
        HandoverRequest request = new HandoverRequest();
        request.setClosingCash(new BigDecimal("1000"));
        request.setHandoverNotes("Barrier 2 sticks");
        request.setIncomingEmployeeId(incomingEmployeeId);
        return request;
    }

    @Test
    void storeRejectsASecondActiveShift() {
        shiftRepository.saveAndFlush(session("E1", ShiftStatus.ACTIVE));

        assertThrows(DataIntegrityViolationException.class,
                () -> shiftRepository.saveAndFlush(session("E2", ShiftStatus.ACTIVE)));
        assertEquals(1, shiftRepository.count());
    }

    @Test
    void completedShiftsDoNotHoldTheActiveSlot() {
        shiftRepository.saveAndFlush(session("E1", ShiftStatus.COMPLETED));
        shiftRepository.saveAndFlush(session("E2", ShiftStatus.COMPLETED));
        shiftRepository.saveAndFlush(session("E3", ShiftStatus.ACTIVE));

        assertEquals(3, shiftRepository.count());
    }

    @Test
    void openingWhileAShiftIsActiveFailsUntilItCloses() {
        Long first = open("E1");

        assertThrows(ShiftAlreadyActiveException.class, () -> open("E2"));

        close(first);
        Long second = open("E2");

        ShiftSession closed = shiftRepository.findById(first).orElseThrow();
        assertEquals(ShiftStatus.COMPLETED, closed.getStatus());
        assertNull(closed.getActiveSlot());
        assertEquals(ShiftSession.ACTIVE_SLOT, shiftRepository.findById(second).orElseThrow().getActiveSlot());
    }

    @Test
    void newEntryIsLinkedToTheActiveShiftAndArchivedRowsAreNotLive() {
        Long shiftId = open("E1");

        ParkingEntry linked = linker.createLinkedEntry(entry("KA01AA0001", NOW.minusHours(1)));
        ParkingEntry archived = entry("KA01AA0002", NOW.minusHours(2));
        archived.setShiftId(shiftId);
        archived.setArchived(true);
        entryRepository.saveAndFlush(archived);

        assertEquals(shiftId, linked.getShiftId());
        assertEquals(1, entryRepository.findLiveByShiftId(shiftId).size());
        assertEquals(linked.getId(), entryRepository.findLiveByShiftId(shiftId).get(0).getId());
    }

    @Test
    void entryCreatedWithNoActiveShiftStaysUnlinked() {
        ParkingEntry unlinked = linker.createLinkedEntry(entry("KA01AA0003", NOW.minusMinutes(5)));

        assertNull(entryRepository.findById(unlinked.getId()).orElseThrow().getShiftId());
    }

    @Test
    void backfillOnlyAssignsUnlinkedLiveEntriesBeforeTheCutoff() {
        Long first = open("E1");
        Long alreadyLinked = linker.createLinkedEntry(entry("KA02BB0001", NOW.minusHours(3))).getId();
        close(first);

        Long early = linker.createLinkedEntry(entry("KA02BB0002", NOW.minusHours(2))).getId();
        Long late = linker.createLinkedEntry(entry("KA02BB0003", NOW.minusMinutes(30))).getId();
        ParkingEntry archivedEarly = entry("KA02BB0004", NOW.minusHours(2));
        archivedEarly.setArchived(true);
        Long archived = entryRepository.saveAndFlush(archivedEarly).getId();

        Long second = open("E2");
        BackfillResultDTO result = linker.linkUnassignedEntries(second, NOW.minusHours(1));

        assertEquals(1, result.getLinkedEntries());
        assertEquals(first, entryRepository.findById(alreadyLinked).orElseThrow().getShiftId());
        assertEquals(second, entryRepository.findById(early).orElseThrow().getShiftId());
        assertNull(entryRepository.findById(late).orElseThrow().getShiftId());
        assertNull(entryRepository.findById(archived).orElseThrow().getShiftId());
    }

    @Test
    void handoverMovesTheActiveSlotToTheIncomingShift() {
        Long outgoingId = open("E1");
        when(shiftChangeRepository.save(any(ShiftChange.class))).thenAnswer(inv -> inv.getArgument(0));

        HandoverResultDTO result = ledgerService.handover(handoverTo("E2"));

        ShiftSession outgoing = shiftRepository.findById(outgoingId).orElseThrow();
        ShiftSession incoming = shiftRepository.findById(result.getNewShift().getId()).orElseThrow();
        assertEquals(ShiftStatus.COMPLETED, outgoing.getStatus());
        assertNull(outgoing.getActiveSlot());
        assertEquals(ShiftStatus.ACTIVE, incoming.getStatus());
        assertEquals(0, new BigDecimal("1000.00").compareTo(incoming.getOpeningCash()));
    }

    @Test
    void failedHandoverLeavesTheOutgoingShiftActive() {
        Long outgoingId = open("E1");
        when(shiftChangeRepository.save(any(ShiftChange.class)))
                .thenThrow(new DataAccessResourceFailureException("shift_changes unavailable"));

        assertThrows(DataAccessResourceFailureException.class, () -> ledgerService.handover(handoverTo("E2")));

        ShiftSession outgoing = shiftRepository.findById(outgoingId).orElseThrow();
        assertEquals(ShiftStatus.ACTIVE, outgoing.getStatus());
        assertEquals(ShiftSession.ACTIVE_SLOT, outgoing.getActiveSlot());
        assertNull(outgoing.getEndTime());
        assertEquals(1, shiftRepository.count());
        ShiftSessionDTO active = ledgerService.getActiveShift().orElseThrow();
        assertEquals("E1", active.getEmployeeId());
    }
}
