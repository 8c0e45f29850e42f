package com.whereq.headshot.service;

import com.whereq.headshot.model.JobPriority;
import lombok.Value;

import java.util.List;

/**
 * A validated submission with its preset expanded
 */
@Value
public class ResolvedBatch {
    String batchType;
    List<String> styles;
    int outputsPerVariant;
    JobPriority priority;
}
