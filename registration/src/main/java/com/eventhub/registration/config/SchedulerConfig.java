package com.eventhub.registration.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables @Scheduled methods (EphemeralStoreSweeper).
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {
}
