package com.bmsedge.parking.service;

import com.bmsedge.parking.dto.ShiftEventDTO;
import com.bmsedge.parking.dto.ShiftStatisticsDTO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

/**
 * Pushes shift statistics and lifecycle events to dashboard clients over
 * STOMP once the write that produced them has committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShiftStatisticsPublisher {

    static final String SHIFTS_TOPIC = "/topic/shifts";

    private final SimpMessagingTemplate messagingTemplate;

    public void publishStatisticsAfterCommit(ShiftStatisticsDTO statistics) {
        if (statistics == null || statistics.getShiftId() == null) {
            return;
        }
        TransactionHooks.afterCommit(() ->
                send(SHIFTS_TOPIC + "/" + statistics.getShiftId() + "/statistics", statistics));
    }

    public void publishEventAfterCommit(ShiftEventDTO event) {
        TransactionHooks.afterCommit(() -> send(SHIFTS_TOPIC, event));
    }

    private void send(String destination, Object payload) {
        try {
            messagingTemplate.convertAndSend(destination, payload);
            log.debug("Broadcast to {}", destination);
        } catch (Exception e) {
            // The write is already committed; dashboards resync on next fetch
            log.error("Error broadcasting to {}: {}", destination, e.getMessage(), e);
        }
    }
}
