package com.flagship.inventory_ledger.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Time sources for the application.
 *
 * All timestamps are stored as UTC instants. The organization zone only decides
 * where a calendar day, ISO week or month begins when reports bucket history.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ZoneId organizationZone(@Value("${inventory.timezone:Africa/Dar_es_Salaam}") String timezone) {
        return ZoneId.of(timezone);
    }
}
