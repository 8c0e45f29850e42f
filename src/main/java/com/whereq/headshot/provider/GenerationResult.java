package com.whereq.headshot.provider;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Provider response for one style
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationResult {
    /**
     * Provider-side handle (prediction id)
     */
    private String handle;

    private boolean success;

    /**
     * Output image URLs
     */
    private List<String> outputs;

    private String error;
}
