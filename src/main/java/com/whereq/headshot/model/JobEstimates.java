package com.whereq.headshot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Duration and cost estimate computed at submission time
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobEstimates {
    private int estimatedTimeMinutes;
    private BigDecimal estimatedCostUsd;
    private int totalOutputs;
}
