package com.bmsedge.parking;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import lombok.extern.slf4j.Slf4j;

import jakarta.annotation.PostConstruct;
import java.util.TimeZone;

@SpringBootApplication
@Slf4j
public class ParkingLedgerApplication {

    @Value("${parking.timezone:Asia/Kolkata}")
    private String timezone;

    /**
     * Pin the JVM default zone so entry, exit and shift timestamps
     * are all recorded in local parking-lot time.
     */
    @PostConstruct
    public void init() {
        TimeZone.setDefault(TimeZone.getTimeZone(timezone));
        log.info("========================================");
        log.info("Application timezone set to: {}", TimeZone.getDefault().getID());
        log.info("========================================");
    }

    public static void main(String[] args) {
        SpringApplication.run(ParkingLedgerApplication.class, args);
    }
}
