package com.bmsedge.parking.config;

import com.bmsedge.parking.service.OverstayPenaltyPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Shared beans for the fee and reconciliation engine.
 */
@Configuration
@EnableScheduling  // consistency audit
@EnableAsync       // shift summary mail
public class EngineConfig {

    @Bean
    public Clock clock(@Value("${parking.timezone:Asia/Kolkata}") String timezone) {
        return Clock.system(ZoneId.of(timezone));
    }

    /**
     * No overstay penalty unless another policy bean is registered.
     */
    @Bean
    @ConditionalOnMissingBean
    public OverstayPenaltyPolicy overstayPenaltyPolicy() {
        return OverstayPenaltyPolicy.NONE;
    }
}
