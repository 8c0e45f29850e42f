package com.whereq.headshot.queue;

import com.whereq.headshot.model.QueuedJob;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * In-memory stable priority queue. The job store is the durable record; this queue is rebuilt
 * from it on startup.
 */
@Slf4j
@Component
public class PriorityJobQueue implements JobQueue {

    private final TreeSet<QueuedJob> entries = new TreeSet<>(QueuedJob.ADMISSION_ORDER);
    private final Map<String, QueuedJob> byJobId = new HashMap<>();
    private long nextSequence;
    private int highWaterMark;

    public PriorityJobQueue(MeterRegistry meterRegistry) {
        Gauge.builder("headshot.batch.queue.size", this::size)
            .description("Jobs waiting for a worker slot")
            .register(meterRegistry);

        Gauge.builder("headshot.batch.queue.peak", this::highWaterMark)
            .description("Largest queue depth observed")
            .register(meterRegistry);
    }

    @Override
    public synchronized boolean enqueue(QueuedJob job) {
        if (byJobId.containsKey(job.getJobId())) {
            log.warn("Job {} is already queued", job.getJobId());
            return false;
        }
        job.setSequence(nextSequence++);
        entries.add(job);
        byJobId.put(job.getJobId(), job);
        highWaterMark = Math.max(highWaterMark, entries.size());

        log.debug("Enqueued job {} ({}), queue size: {}", job.getJobId(), job.getPriority(), entries.size());
        return true;
    }

    @Override
    public synchronized Optional<QueuedJob> peekNext() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.first());
    }

    @Override
    public synchronized boolean remove(String jobId) {
        QueuedJob removed = byJobId.remove(jobId);
        if (removed == null) {
            return false;
        }
        entries.remove(removed);
        log.debug("Removed job {} from queue", jobId);
        return true;
    }

    @Override
    public synchronized int positionOf(String jobId) {
        QueuedJob entry = byJobId.get(jobId);
        if (entry == null) {
            return 0;
        }
        return entries.headSet(entry, false).size() + 1;
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    @Override
    public synchronized int highWaterMark() {
        return highWaterMark;
    }

    @Override
    public synchronized List<QueuedJob> snapshot() {
        return new ArrayList<>(entries);
    }
}
