package com.whereq.headshot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.validator.constraints.URL;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Webhook subscription for a job's terminal transition.
 *
 * An absent or empty event list subscribes to every terminal status. Non-terminal statuses in
 * the list never fire.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notifications {

    private static final Set<JobStatus> TERMINAL = EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED);

    @URL(message = "notifications.webhook must be a valid URL")
    private String webhook;

    private List<JobStatus> events;

    @JsonIgnore
    public boolean hasWebhook() {
        return webhook != null && !webhook.isBlank();
    }

    public boolean shouldNotify(JobStatus status) {
        if (!hasWebhook() || !TERMINAL.contains(status)) {
            return false;
        }
        return events == null || events.isEmpty() || events.contains(status);
    }
}
