package com.whereq.headshot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of one style variant within a batch job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariantOutcome {
    /**
     * Style identifier
     */
    private String style;

    /**
     * Whether the provider produced outputs for this style
     */
    private boolean success;

    /**
     * Number of images produced
     */
    private int imagesCount;

    /**
     * Output image references returned by the provider
     */
    private List<String> outputs;

    /**
     * Provider error message (if failed)
     */
    private String error;

    /**
     * Time spent on this variant in milliseconds
     */
    private long processingTimeMs;

    public static VariantOutcome succeeded(String style, List<String> outputs, long processingTimeMs) {
        return VariantOutcome.builder()
            .style(style)
            .success(true)
            .imagesCount(outputs.size())
            .outputs(List.copyOf(outputs))
            .processingTimeMs(processingTimeMs)
            .build();
    }

    public static VariantOutcome failed(String style, String error, long processingTimeMs) {
        return VariantOutcome.builder()
            .style(style)
            .success(false)
            .outputs(List.of())
            .error(error)
            .processingTimeMs(processingTimeMs)
            .build();
    }
}
