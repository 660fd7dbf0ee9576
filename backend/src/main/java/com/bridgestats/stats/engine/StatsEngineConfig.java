package com.bridgestats.stats.engine;

import com.bridgestats.alert.AlertProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the stats engine from every {@link ScheduledPass} bean. Invalid configuration fails startup
 * before anything is scheduled.
 */
@Configuration
@EnableConfigurationProperties(StatsProperties.class)
@Slf4j
public class StatsEngineConfig {

    public static final String RESERVE_CHECK_PASS = "reserve-check";

    @Bean
    public StatsEngine statsEngine(List<ScheduledPass> passes, StatsProperties properties,
                                   AlertProperties alertProperties) {
        List<String> names = passes.stream().map(ScheduledPass::name).toList();
        List<String> problems = new ArrayList<>(properties.validate(names));
        if (properties.isEnabled(RESERVE_CHECK_PASS) && names.contains(RESERVE_CHECK_PASS)
                && (alertProperties.getWebhookUrl() == null || alertProperties.getWebhookUrl().isBlank())) {
            problems.add("bridgestats.alert.webhook-url is required while the reserve check is enabled");
        }
        if (!problems.isEmpty()) {
            problems.forEach(p -> log.error("Invalid stats configuration: {}", p));
            throw new IllegalStateException("Invalid stats configuration: " + String.join("; ", problems));
        }
        Map<ScheduledPass, Duration> schedule = new LinkedHashMap<>();
        for (ScheduledPass pass : passes) {
            if (properties.isEnabled(pass.name())) {
                schedule.put(pass, Duration.ofSeconds(properties.getIntervals().get(pass.name())));
            } else {
                log.info("Pass {} is disabled", pass.name());
            }
        }
        return new StatsEngine(schedule, Duration.ofSeconds(properties.getShutdownAwaitSeconds()));
    }
}
