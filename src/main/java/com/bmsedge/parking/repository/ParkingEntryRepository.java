package com.bmsedge.parking.repository;

import com.bmsedge.parking.model.ParkingEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface ParkingEntryRepository extends JpaRepository<ParkingEntry, Long> {

    @Query("SELECT e FROM ParkingEntry e WHERE e.shiftId = :shiftId AND e.archived = false")
    List<ParkingEntry> findLiveByShiftId(@Param("shiftId") Long shiftId);

    // Backfill only: never touches rows that already carry a shift
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ParkingEntry e SET e.shiftId = :shiftId WHERE e.shiftId IS NULL " +
            "AND e.archived = false AND e.entryTime < :cutoff")
    int assignUnlinkedBefore(@Param("shiftId") Long shiftId, @Param("cutoff") LocalDateTime cutoff);

    @Query("SELECT e FROM ParkingEntry e WHERE e.exitTime IS NULL AND e.archived = false ORDER BY e.entryTime ASC")
    List<ParkingEntry> findCurrentlyParked();
}
