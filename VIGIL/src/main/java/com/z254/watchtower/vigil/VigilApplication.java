package com.z254.watchtower.vigil;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * VIGIL - Incident lifecycle tracking and operational reporting.
 *
 * <p>VIGIL provides:
 * <ul>
 *   <li>Incident state machine - Validated status transitions with derived milestone timestamps</li>
 *   <li>Timeline - Append-only audit trail for every incident mutation</li>
 *   <li>Notifications - Chat and paging alerts for high-severity incidents</li>
 *   <li>Reporting - MTTR, SLA compliance, breakdowns, trends and exports</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties
public class VigilApplication {

    public static void main(String[] args) {
        SpringApplication.run(VigilApplication.class, args);
    }
}
