package com.bmsedge.parking.service;

import com.bmsedge.parking.dto.FeeQuoteDTO;
import com.bmsedge.parking.exception.InvalidIntervalException;
import com.bmsedge.parking.exception.InvalidRequestException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ParkingFeeServiceTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Kolkata");
    private static final LocalDateTime T = LocalDateTime.of(2024, 5, 1, 8, 0);

    @Mock
    private RateTableService rateTableService;

    private ParkingFeeService feeService;

    @BeforeEach
    void setUp() {
        DurationCalculator durationCalculator =
                new DurationCalculator(Clock.fixed(T.plusHours(30).atZone(ZONE).toInstant(), ZONE));
        feeService = new ParkingFeeService(rateTableService, durationCalculator, new FeeCalculator(),
                OverstayPenaltyPolicy.NONE);
    }

    private RateTable twoWheelerTable() {
        return RateTable.of(Map.of("2-Wheeler", new BigDecimal("50")), new BigDecimal("100"));
    }

    @Test
    void twentySixHourTwoWheelerStayCostsTwoDays() {
        when(rateTableService.load()).thenReturn(twoWheelerTable());

        FeeQuoteDTO quote = feeService.computeFee("2-Wheeler", T, T.plusHours(26));

        assertEquals(2, quote.getBillableDays());
        assertEquals(new BigDecimal("100.00"), quote.getFee());
        assertFalse(quote.getUsedFallbackRate());
    }

    @Test
    void unspacedTypeResolvesToConfiguredRate() {
        when(rateTableService.load()).thenReturn(twoWheelerTable());

        FeeQuoteDTO quote = feeService.computeFee("2wheeler", T, T.plusHours(26));

        assertEquals("2-Wheeler", quote.getResolvedVehicleType());
        assertEquals(new BigDecimal("100.00"), quote.getFee());
    }

    @Test
    void unknownTypeUsesDefaultRate() {
        when(rateTableService.load()).thenReturn(twoWheelerTable());

        FeeQuoteDTO quote = feeService.computeFee("Tractor", T, T.plusHours(2));

        assertTrue(quote.getUsedFallbackRate());
        assertEquals(new BigDecimal("100.00"), quote.getFee());
    }

    @Test
    void missingExitQuotesAgainstNow() {
        when(rateTableService.load()).thenReturn(twoWheelerTable());

        FeeQuoteDTO quote = feeService.computeFee("2-Wheeler", T, null);

        assertEquals(T.plusHours(30), quote.getExitTime());
        assertEquals(2, quote.getBillableDays());
    }

    @Test
    void exitBeforeEntryIsNeverClampedToZero() {
        when(rateTableService.load()).thenReturn(twoWheelerTable());

        assertThrows(InvalidIntervalException.class,
                () -> feeService.computeFee("2-Wheeler", T, T.minusHours(1)));
    }

    @Test
    void blankVehicleTypeIsRejected() {
        assertThrows(InvalidRequestException.class,
                () -> feeService.computeFee(twoWheelerTable(), " ", T, T.plusHours(1)));
        verifyNoInteractions(rateTableService);
    }

    @Test
    void overstayPolicyIsAddedOnTop() {
        DurationCalculator durationCalculator =
                new DurationCalculator(Clock.fixed(T.atZone(ZONE).toInstant(), ZONE));
        ParkingFeeService withPenalty = new ParkingFeeService(rateTableService, durationCalculator,
                new FeeCalculator(), (type, stay, days, rate) -> days > 1 ? new BigDecimal("20") : BigDecimal.ZERO);

        FeeQuoteDTO quote = withPenalty.computeFee(twoWheelerTable(), "2-Wheeler", T, T.plusHours(30));

        assertEquals(new BigDecimal("20.00"), quote.getOverstayPenalty());
        assertEquals(new BigDecimal("120.00"), quote.getFee());
    }
}
