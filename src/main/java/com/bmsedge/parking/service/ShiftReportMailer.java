package com.bmsedge.parking.service;

import com.bmsedge.parking.dto.DiscrepancyDTO;
import com.bmsedge.parking.dto.ShiftCloseResultDTO;
import com.bmsedge.parking.dto.ShiftSessionDTO;
import com.bmsedge.parking.dto.ShiftStatisticsDTO;
import com.bmsedge.parking.dto.VehicleTypeBreakdownDTO;
import com.bmsedge.parking.model.DiscrepancyLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.format.DateTimeFormatter;

/**
 * Mails a plain-text summary after each shift close.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShiftReportMailer {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("dd MMM yyyy HH:mm");

    private final ObjectProvider<JavaMailSender> mailSender;

    @Value("${parking.report.mail.enabled:false}")
    private boolean mailEnabled;

    @Value("${parking.report.mail.recipients:}")
    private String[] recipients;

    @Value("${parking.report.mail.from:noreply@parking-ledger.local}")
    private String fromEmail;

    @Async
    public void sendShiftSummary(ShiftCloseResultDTO result) {
        if (!mailEnabled) {
            return;
        }
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null || recipients == null || recipients.length == 0) {
            log.warn("Shift summary mail enabled but no mail sender or recipients configured");
            return;
        }

        try {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(fromEmail);
            message.setTo(recipients);
            message.setSubject(buildSubject(result));
            message.setText(buildBody(result));
            sender.send(message);
            log.info("Shift summary mailed for shift {}", result.getShift().getId());
        } catch (Exception e) {
            // Mail runs after commit; the close itself already succeeded
            log.error("Failed to send shift summary for shift {}: {}", result.getShift().getId(), e.getMessage(), e);
        }
    }

    String buildSubject(ShiftCloseResultDTO result) {
        DiscrepancyDTO discrepancy = result.getDiscrepancy();
        String prefix = discrepancy != null && discrepancy.getLevel() == DiscrepancyLevel.MAJOR
                ? "[MAJOR DISCREPANCY] "
                : "";
        return prefix + "Shift " + result.getShift().getId() + " closed - " + result.getShift().getEmployeeId();
    }

    String buildBody(ShiftCloseResultDTO result) {
        ShiftSessionDTO shift = result.getShift();
        ShiftStatisticsDTO stats = result.getStatistics();
        DiscrepancyDTO discrepancy = result.getDiscrepancy();

        StringBuilder body = new StringBuilder();
        body.append("Shift ").append(shift.getId()).append(" (").append(shift.getCloseType()).append(")\n");
        body.append("Employee: ").append(shift.getEmployeeName() != null ? shift.getEmployeeName() : shift.getEmployeeId()).append('\n');
        body.append("Start: ").append(shift.getStartTime() != null ? shift.getStartTime().format(TIME_FORMAT) : "-").append('\n');
        body.append("End: ").append(shift.getEndTime() != null ? shift.getEndTime().format(TIME_FORMAT) : "-").append("\n\n");

        body.append("Vehicles entered: ").append(stats.getVehiclesEntered()).append('\n');
        body.append("Vehicles exited: ").append(stats.getVehiclesExited()).append('\n');
        body.append("Still parked: ").append(stats.getCurrentlyParked()).append('\n');
        body.append("Revenue: ").append(stats.getRevenueTotal())
                .append(" (cash ").append(stats.getCashRevenue())
                .append(", digital ").append(stats.getDigitalRevenue()).append(")\n");
        body.append("Pending settlement: ").append(stats.getPendingSettlementAmount()).append('\n');
        for (VehicleTypeBreakdownDTO type : stats.getVehicleTypes()) {
            body.append("  ").append(type.getVehicleType()).append(": ")
                    .append(type.getEntered()).append(" in, ")
                    .append(type.getExited()).append(" out, ")
                    .append(type.getRevenue()).append('\n');
        }

        body.append("\nOpening cash: ").append(shift.getOpeningCash()).append('\n');
        body.append("Expected closing cash: ").append(shift.getExpectedClosingCash()).append('\n');
        if (discrepancy != null) {
            body.append("Actual closing cash: ").append(discrepancy.getActualClosingCash()).append('\n');
            body.append("Difference: ").append(discrepancy.getDelta())
                    .append(" (").append(discrepancy.getLevel()).append(")\n");
        } else {
            body.append("Actual closing cash: not counted\n");
        }
        if (shift.getClosingNotes() != null) {
            body.append("\nNotes: ").append(shift.getClosingNotes()).append('\n');
        }
        return body.toString();
    }
}
