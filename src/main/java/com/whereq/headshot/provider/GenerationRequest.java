package com.whereq.headshot.provider;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One style generation call
 */
@Value
@Builder
public class GenerationRequest {
    String jobId;
    String imageBase64;
    String style;
    int outputCount;
    Map<String, Object> parameters;
}
