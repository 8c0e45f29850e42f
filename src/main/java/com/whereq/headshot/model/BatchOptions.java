package com.whereq.headshot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Caller options carried with a batch job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchOptions {
    /**
     * Extra parameters passed through to the generation provider
     */
    private Map<String, Object> providerParameters;

    /**
     * Terminal-state webhook
     */
    private Notifications notifications;

    /**
     * Free-form client metadata, stored and echoed only
     */
    private Map<String, String> metadata;

    public static BatchOptions empty() {
        return new BatchOptions(Map.of(), null, Map.of());
    }
}
