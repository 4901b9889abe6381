package com.example.jobscheduler.registry;

import com.example.jobscheduler.domain.model.JobDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory table of scheduled jobs keyed by job id.
 * <p>
 * Writers are serialized and publish a fresh immutable snapshot on every change; readers
 * take the current snapshot without locking and never observe a half-registered job.
 */
@Slf4j
@Component
public class JobRegistry {

    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile SortedMap<String, ScheduledJob> jobs = Collections.emptySortedMap();

    /**
     * Insert a job, or swap it in place of an existing one with the same id.
     *
     * @param job             Entry to register
     * @param replaceExisting Whether an existing job with the same id is replaced
     * @return the definition active after the call; the existing one if it was kept
     */
    public JobDefinition register(ScheduledJob job, boolean replaceExisting) {
        writeLock.lock();
        try {
            var existing = jobs.get(job.getJobId());
            if (existing != null && !replaceExisting) {
                log.warn("Job {} already registered and replace is disabled, keeping existing definition", job.getJobId());
                return existing.getDefinition();
            }

            var updated = new TreeMap<>(jobs);
            updated.put(job.getJobId(), job);
            jobs = Collections.unmodifiableSortedMap(updated);

            if (existing != null) {
                log.info("Replaced job {}", job.getJobId());
            }
            return job.getDefinition();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Remove a job
     *
     * @return whether the job existed
     */
    public boolean unregister(String jobId) {
        writeLock.lock();
        try {
            if (!jobs.containsKey(jobId)) {
                return false;
            }
            var updated = new TreeMap<>(jobs);
            updated.remove(jobId);
            jobs = Collections.unmodifiableSortedMap(updated);
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    public Optional<ScheduledJob> lookup(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    /**
     * Snapshot of all jobs ordered by job id
     */
    public List<ScheduledJob> listAll() {
        return new ArrayList<>(jobs.values());
    }

    public int size() {
        return jobs.size();
    }

    public void clear() {
        writeLock.lock();
        try {
            jobs = Collections.emptySortedMap();
        } finally {
            writeLock.unlock();
        }
    }
}
