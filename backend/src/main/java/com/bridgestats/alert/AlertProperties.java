package com.bridgestats.alert;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Alert webhook settings. Documented in application.yml under bridgestats.alert.
 */
@ConfigurationProperties(prefix = "bridgestats.alert")
@NoArgsConstructor
@Getter
@Setter
public class AlertProperties {

    /** Chat webhook receiving markdown posts. Required when the reserve check is enabled. */
    private String webhookUrl;

    /** Title prefix of reserve alerts. */
    private String title = "[bridge-reserve]";

    /** How long an identical message is suppressed after delivery. */
    private long dedupTtlMinutes = 60;

    /** Upper bound on distinct suppressed messages kept in memory. */
    private long dedupMaxEntries = 1_000;

    private int timeoutSeconds = 10;
}
