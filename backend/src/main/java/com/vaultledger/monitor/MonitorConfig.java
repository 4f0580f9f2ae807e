package com.vaultledger.monitor;

import com.vaultledger.health.HealthProperties;
import com.vaultledger.schedule.ScheduleProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({ HealthProperties.class, ScheduleProperties.class })
public class MonitorConfig {
}
