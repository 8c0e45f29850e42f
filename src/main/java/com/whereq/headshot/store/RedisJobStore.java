package com.whereq.headshot.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.headshot.config.HeadshotProperties;
import com.whereq.headshot.exception.InfrastructureException;
import com.whereq.headshot.exception.JobNotFoundException;
import com.whereq.headshot.model.BatchJob;
import com.whereq.headshot.model.JobProgressUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;

/**
 * Job store backed by Redis. Each job is a JSON document; a set indexes non-terminal jobs and a
 * sorted set per owner indexes history by creation time.
 *
 * Updates are optimistic: the record is read, changed in memory, and written back by a Lua
 * script only if the stored document is still the one that was read. On a conflict the update is
 * re-applied to the fresh record, so a late write can never reopen a terminal job.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "headshot.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisJobStore implements JobStore {

    static final String JOB_KEY_PREFIX = "headshot:batch:job:";
    static final String NON_TERMINAL_KEY = "headshot:batch:jobs:non-terminal";
    static final String OWNER_KEY_PREFIX = "headshot:batch:owner:";

    static final int MAX_UPDATE_ATTEMPTS = 5;

    /**
     * KEYS: job key, non-terminal set. ARGV: expected document, new document, terminal flag,
     * retention millis, job id.
     */
    static final RedisScript<Long> COMPARE_AND_SET = RedisScript.of(
        "if redis.call('GET', KEYS[1]) ~= ARGV[1] then return 0 end\n"
            + "redis.call('SET', KEYS[1], ARGV[2])\n"
            + "if ARGV[3] == '1' then\n"
            + "  redis.call('SREM', KEYS[2], ARGV[5])\n"
            + "  redis.call('PEXPIRE', KEYS[1], ARGV[4])\n"
            + "end\n"
            + "return 1",
        Long.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration terminalRetention;

    public RedisJobStore(@Qualifier("jobStoreRedisTemplate") ReactiveRedisTemplate<String, String> jobStoreRedisTemplate,
                         ObjectMapper objectMapper,
                         HeadshotProperties properties) {
        this.redisTemplate = jobStoreRedisTemplate;
        this.objectMapper = objectMapper;
        this.terminalRetention = properties.getStore().getTerminalRetention();
    }

    @Override
    public Mono<BatchJob> create(BatchJob job) {
        String key = JOB_KEY_PREFIX + job.getId();

        return Mono.fromCallable(() -> serialize(job))
            .flatMap(json -> redisTemplate.opsForValue().setIfAbsent(key, json))
            .flatMap(created -> {
                if (!Boolean.TRUE.equals(created)) {
                    return Mono.error(new IllegalStateException("Job already exists: " + job.getId()));
                }
                return redisTemplate.opsForSet().add(NON_TERMINAL_KEY, job.getId())
                    .then(redisTemplate.opsForZSet().add(OWNER_KEY_PREFIX + job.getOwnerId(),
                        job.getId(), job.getCreatedAt().toEpochMilli()));
            })
            .doOnSuccess(v -> log.debug("Stored job {} for owner {}", job.getId(), job.getOwnerId()))
            .thenReturn(job.copy());
    }

    @Override
    public Mono<BatchJob> updateProgress(String jobId, JobProgressUpdate update) {
        return attemptUpdate(jobId, update, 1);
    }

    private Mono<BatchJob> attemptUpdate(String jobId, JobProgressUpdate update, int attempt) {
        String key = JOB_KEY_PREFIX + jobId;

        return redisTemplate.opsForValue().get(key)
            .switchIfEmpty(Mono.error(() -> new JobNotFoundException(jobId)))
            .flatMap(current -> {
                BatchJob job = deserialize(current);
                if (!job.apply(update)) {
                    log.debug("Ignored update to terminal job {}", jobId);
                    return Mono.just(job);
                }
                return compareAndSet(key, current, job)
                    .flatMap(written -> {
                        if (written) {
                            return Mono.just(job);
                        }
                        if (attempt >= MAX_UPDATE_ATTEMPTS) {
                            return Mono.error(new InfrastructureException(
                                "Job " + jobId + " kept changing during update, gave up after " + attempt + " attempts"));
                        }
                        log.debug("Concurrent write to job {}, retrying update (attempt {})", jobId, attempt + 1);
                        return attemptUpdate(jobId, update, attempt + 1);
                    });
            });
    }

    @Override
    public Mono<BatchJob> get(String jobId) {
        return redisTemplate.opsForValue()
            .get(JOB_KEY_PREFIX + jobId)
            .map(this::deserialize);
    }

    @Override
    public Flux<BatchJob> listNonTerminal() {
        return redisTemplate.opsForSet()
            .members(NON_TERMINAL_KEY)
            .flatMap(this::get)
            .filter(job -> !job.getStatus().isTerminal())
            .sort(Comparator.comparing(BatchJob::getCreatedAt));
    }

    @Override
    public Flux<BatchJob> listByOwner(String ownerId, int limit) {
        // Expired terminal records leave stale ids in the owner index; they are skipped here.
        return redisTemplate.opsForZSet()
            .reverseRange(OWNER_KEY_PREFIX + ownerId, Range.closed(0L, (long) limit * 2 - 1))
            .concatMap(this::get)
            .take(limit);
    }

    private Mono<Boolean> compareAndSet(String key, String expected, BatchJob job) {
        boolean terminal = job.getStatus().isTerminal();
        List<String> keys = List.of(key, NON_TERMINAL_KEY);

        return Mono.fromCallable(() -> serialize(job))
            .flatMap(json -> redisTemplate.execute(COMPARE_AND_SET, keys, List.of(expected, json,
                    terminal ? "1" : "0", String.valueOf(terminalRetention.toMillis()), job.getId()))
                .next())
            .map(result -> result == 1L)
            .doOnNext(written -> {
                if (written && terminal) {
                    log.debug("Job {} is terminal ({}), retained for {}", job.getId(), job.getStatus(), terminalRetention);
                }
            });
    }

    private String serialize(BatchJob job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new InfrastructureException("Failed to serialize job " + job.getId(), e);
        }
    }

    private BatchJob deserialize(String json) {
        try {
            return objectMapper.readValue(json, BatchJob.class);
        } catch (JsonProcessingException e) {
            throw new InfrastructureException("Failed to deserialize job record", e);
        }
    }
}
