package com.whereq.headshot.model;

import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runtime state of a job owned by a worker. Never persisted; only progress is flushed to the store.
 */
@Getter
public class ActiveJob {

    private final String jobId;
    private final Instant admittedAt;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final AtomicInteger currentVariantIndex = new AtomicInteger(0);

    /**
     * Provider handle of the call in flight, if any
     */
    private final AtomicReference<String> inFlightHandle = new AtomicReference<>();

    private volatile Instant processingStartedAt;
    private volatile String currentStep;

    public ActiveJob(String jobId, Instant admittedAt) {
        this.jobId = jobId;
        this.admittedAt = admittedAt;
    }

    /**
     * @return true if this call set the flag
     */
    public boolean requestCancel() {
        return cancelRequested.compareAndSet(false, true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public void markProcessingStarted(Instant at) {
        this.processingStartedAt = at;
    }

    public void setCurrentStep(String currentStep) {
        this.currentStep = currentStep;
    }
}
