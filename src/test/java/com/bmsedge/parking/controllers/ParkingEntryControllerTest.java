package com.bmsedge.parking.controllers;

import com.bmsedge.parking.exception.FeeAlreadyAssessedException;
import com.bmsedge.parking.exception.GlobalExceptionHandler;
import com.bmsedge.parking.exception.InvalidIntervalException;
import com.bmsedge.parking.service.ParkingEntryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ParkingEntryControllerTest {

    @Mock
    private ParkingEntryService parkingEntryService;

    @InjectMocks
    private ParkingEntryController parkingEntryController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(parkingEntryController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void repeatedExitIsAConflict() throws Exception {
        when(parkingEntryService.recordExit(eq(3L), any()))
                .thenThrow(new FeeAlreadyAssessedException("Entry 3 already exited"));

        mockMvc.perform(post("/api/entries/3/exit"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("FeeAlreadyAssessed"));
    }

    @Test
    void exitBeforeEntryIsABadRequest() throws Exception {
        LocalDateTime t = LocalDateTime.of(2024, 1, 2, 10, 0);
        when(parkingEntryService.recordExit(eq(3L), any()))
                .thenThrow(new InvalidIntervalException(t, t.minusHours(1)));

        mockMvc.perform(post("/api/entries/3/exit"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("InvalidInterval"));
    }
}
