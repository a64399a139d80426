package com.bmsedge.parking.repository;

import com.bmsedge.parking.model.ShiftChange;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ShiftChangeRepository extends JpaRepository<ShiftChange, Long> {
}
