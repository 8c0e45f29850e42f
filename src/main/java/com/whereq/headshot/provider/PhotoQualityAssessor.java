package com.whereq.headshot.provider;

import com.whereq.headshot.model.QualityAssessment;
import reactor.core.publisher.Mono;

/**
 * Judges whether a source photo is usable for headshot generation
 */
public interface PhotoQualityAssessor {
    Mono<QualityAssessment> assess(String imageBase64);
}
