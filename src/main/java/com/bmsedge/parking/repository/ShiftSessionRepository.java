package com.bmsedge.parking.repository;

import com.bmsedge.parking.model.ShiftSession;
import com.bmsedge.parking.model.ShiftStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface ShiftSessionRepository extends JpaRepository<ShiftSession, Long> {

    Optional<ShiftSession> findFirstByStatusOrderByStartTimeDesc(ShiftStatus status);

    // Shared lock: entry creation waits for an in-flight close to commit
    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("SELECT s FROM ShiftSession s WHERE s.status = com.bmsedge.parking.model.ShiftStatus.ACTIVE")
    Optional<ShiftSession> findActiveForLinking();

    // Shared lock taken by writes to an existing entry of this shift
    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("SELECT s FROM ShiftSession s WHERE s.id = :id")
    Optional<ShiftSession> findByIdForShare(@Param("id") Long id);

    // Exclusive lock held for the duration of a close or handover
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM ShiftSession s WHERE s.id = :id")
    Optional<ShiftSession> findByIdForUpdate(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM ShiftSession s WHERE s.status = com.bmsedge.parking.model.ShiftStatus.ACTIVE")
    Optional<ShiftSession> findActiveForUpdate();

    @Query("SELECT s FROM ShiftSession s WHERE s.status = com.bmsedge.parking.model.ShiftStatus.COMPLETED " +
            "AND s.endTime >= :since ORDER BY s.endTime DESC")
    List<ShiftSession> findCompletedSince(@Param("since") LocalDateTime since);
}
