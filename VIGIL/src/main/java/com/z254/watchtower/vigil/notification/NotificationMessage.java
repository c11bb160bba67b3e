package com.z254.watchtower.vigil.notification;

import com.z254.watchtower.vigil.domain.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Transport-neutral alert about an incident.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationMessage {
    private String incidentId;
    private String title;
    private Severity severity;
    /** Deep link into the web front end */
    private String link;
    /** User whose integration settings decide which channels are used, null for all */
    private String recipientId;

    /**
     * Human-readable rendering used by chat destinations.
     */
    public String toText() {
        return "🚨 **" + severity + "** New incident: " + title + "\n"
                + "ID: " + incidentId + "\n"
                + link;
    }
}
