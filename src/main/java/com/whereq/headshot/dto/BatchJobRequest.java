package com.whereq.headshot.dto;

import com.whereq.headshot.model.JobPriority;
import com.whereq.headshot.model.Notifications;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request to generate several styled headshots from one photo
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchJobRequest {

    /**
     * Base64 encoded source photo
     */
    @NotBlank(message = "imageBase64 is required")
    private String imageBase64;

    /**
     * Preset name (professional_package, complete_package, style_comparison, custom_batch)
     */
    private String batchType;

    /**
     * Styles for a custom batch, in processing order
     */
    private List<String> styles;

    /**
     * Images per style; custom batches only
     */
    private Integer outputsPerVariant;

    /**
     * Overrides the preset's default priority
     */
    private JobPriority priority;

    /**
     * Passed through to the generation provider
     */
    private Map<String, Object> providerParameters;

    @Valid
    private Notifications notifications;

    private Map<String, String> metadata;
}
