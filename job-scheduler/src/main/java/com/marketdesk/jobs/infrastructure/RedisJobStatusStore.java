package com.marketdesk.jobs.infrastructure;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Stores job timestamps as ISO-8601 strings under job:lastrun:* and job:lastcompletion:*.
 * Failures are logged and never propagate into the scheduler loop.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RedisJobStatusStore implements JobStatusStore {

    static final String LAST_RUN_PREFIX = "job:lastrun:";
    static final String LAST_COMPLETION_PREFIX = "job:lastcompletion:";

    private final StringRedisTemplate redisTemplate;

    @Override
    public void saveLastRun(String jobName, Instant at) {
        write(LAST_RUN_PREFIX + jobName, at);
    }

    @Override
    public void saveLastCompletion(String jobName, Instant at) {
        write(LAST_COMPLETION_PREFIX + jobName, at);
    }

    @Override
    public Optional<Instant> findLastRun(String jobName) {
        return read(LAST_RUN_PREFIX + jobName);
    }

    @Override
    public Optional<Instant> findLastCompletion(String jobName) {
        return read(LAST_COMPLETION_PREFIX + jobName);
    }

    private void write(String key, Instant at) {
        try {
            redisTemplate.opsForValue().set(key, at.toString());
        } catch (DataAccessException e) {
            log.warn("Failed to persist {}: {}", key, e.getMessage());
        }
    }

    private Optional<Instant> read(String key) {
        String value;
        try {
            value = redisTemplate.opsForValue().get(key);
        } catch (DataAccessException e) {
            log.warn("Failed to read {}: {}", key, e.getMessage());
            return Optional.empty();
        }
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable timestamp {}={}", key, value);
            return Optional.empty();
        }
    }
}
