package com.whereq.headshot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Threading for the batch scheduler: one coordination thread for admission decisions and a
 * worker pool sized to the concurrency limit
 */
@Configuration
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler batchWorkerScheduler(HeadshotProperties properties) {
        int workers = properties.getBatch().getMaxConcurrentJobs();
        return Schedulers.newBoundedElastic(workers, Integer.MAX_VALUE, "batch-worker");
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler batchAdmissionScheduler() {
        return Schedulers.newSingle("batch-admission");
    }
}
