package com.example.jobscheduler.service.scheduler;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.domain.enums.JobOutcome;
import com.example.jobscheduler.domain.enums.SchedulerState;
import com.example.jobscheduler.domain.model.CronSpec;
import com.example.jobscheduler.domain.model.ExecutionPolicy;
import com.example.jobscheduler.domain.model.IntervalSpec;
import com.example.jobscheduler.domain.model.JobDefinition;
import com.example.jobscheduler.domain.model.JobEvent;
import com.example.jobscheduler.domain.model.ScheduleState;
import com.example.jobscheduler.dto.JobInfo;
import com.example.jobscheduler.exception.InvalidSchedulerStateException;
import com.example.jobscheduler.exception.SchedulerConfigurationException;
import com.example.jobscheduler.registry.JobRegistry;
import com.example.jobscheduler.registry.ScheduledJob;
import com.example.jobscheduler.service.handler.JobHandler;
import com.example.jobscheduler.service.listener.JobEventPublisher;
import com.example.jobscheduler.service.listener.JobExecutionListener;
import com.example.jobscheduler.trigger.TriggerFactory;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide job scheduler.
 * <p>
 * Owns the lifecycle UNINITIALIZED → INITIALIZED → RUNNING → STOPPED and a single fire-loop
 * thread that decides when jobs are due. Handlers run on the worker pool, so a long job never
 * delays the timing of the others.
 * <p>
 * Per due job the fire loop:
 * 1. Gathers every fire time up to now and advances the job to its next future fire time
 * 2. Drops or collapses late fire times according to the misfire grace and coalesce policy
 * 3. Reserves an execution slot, skipping the run when the job is at max instances
 * 4. Hands the run to {@link JobInvoker}, which takes the distributed lock for distributed jobs
 * <p>
 * Each process decides on its own that a job is due; the distributed lock is what keeps two
 * processes from running the same tick.
 */
@Slf4j
public class SchedulerCore {

    private final JobRegistry registry;
    private final TriggerFactory triggerFactory;
    private final JobInvoker invoker;
    private final JobSchedulerProperties properties;
    private final Clock clock;
    private final ExecutorService jobExecutor;
    private final List<JobExecutionListener> listeners;
    private final List<JobSource> jobSources;
    private final JobEventPublisher publisher = new JobEventPublisher();

    private final Object lifecycleMonitor = new Object();
    private final ReentrantLock loopLock = new ReentrantLock();
    private final Condition wakeUp = loopLock.newCondition();

    private volatile SchedulerState state = SchedulerState.UNINITIALIZED;
    private volatile boolean stopping;
    private volatile ExecutionPolicy defaultPolicy;
    private Thread fireLoopThread;

    public SchedulerCore(JobRegistry registry,
                         TriggerFactory triggerFactory,
                         JobInvoker invoker,
                         JobSchedulerProperties properties,
                         Clock clock,
                         ExecutorService jobExecutor,
                         List<JobExecutionListener> listeners,
                         List<JobSource> jobSources) {
        this.registry = registry;
        this.triggerFactory = triggerFactory;
        this.invoker = invoker;
        this.properties = properties;
        this.clock = clock;
        this.jobExecutor = jobExecutor;
        this.listeners = List.copyOf(listeners);
        this.jobSources = List.copyOf(jobSources);
    }

    // === Lifecycle ===

    /**
     * Validate the default execution policy and install the listeners.
     * Calling it again is a logged no-op.
     */
    public void init() {
        synchronized (lifecycleMonitor) {
            if (state == SchedulerState.STOPPED) {
                throw new InvalidSchedulerStateException(state, "initialize");
            }
            if (state != SchedulerState.UNINITIALIZED) {
                log.warn("Scheduler already initialized");
                return;
            }

            var policy = properties.defaultExecutionPolicy();
            validatePolicy(null, policy);
            if (properties.getLockTtlSeconds() <= 0) {
                throw new SchedulerConfigurationException("lock TTL must be positive, got " + properties.getLockTtlSeconds());
            }
            defaultPolicy = policy;
            publisher.install(listeners);
            state = SchedulerState.INITIALIZED;

            log.info("Scheduler initialized (instance={}, coalesce={}, maxInstances={}, misfireGrace={}s, lockTtl={}s, listeners={})",
                    invoker.getInstanceId(), policy.isCoalesce(), policy.getMaxInstances(), policy.getMisfireGraceSeconds(),
                    properties.getLockTtlSeconds(), publisher.getListenerCount());
        }
    }

    /**
     * Register the jobs of every {@link JobSource} and start the fire loop.
     * Initializes first when needed; calling it while running is a logged no-op.
     */
    public void start() {
        synchronized (lifecycleMonitor) {
            if (state == SchedulerState.STOPPED) {
                throw new InvalidSchedulerStateException(state, "start");
            }
            if (state == SchedulerState.UNINITIALIZED) {
                init();
            }
            if (state == SchedulerState.RUNNING) {
                log.warn("Scheduler already running");
                return;
            }

            registerSourceJobs();

            loopLock.lock();
            try {
                state = SchedulerState.RUNNING;
            } finally {
                loopLock.unlock();
            }

            fireLoopThread = new Thread(this::runFireLoop, "scheduler-fire-loop");
            fireLoopThread.start();

            log.info("Scheduler started with {} jobs", registry.size());
        }
    }

    /**
     * Stop scheduling and wait for in-flight jobs to finish.
     * <p>
     * Runs that were queued but had not started are discarded. Jobs still running after the drain
     * timeout are interrupted and reported as an anomaly.
     */
    public void stop() {
        synchronized (lifecycleMonitor) {
            if (state == SchedulerState.STOPPED) {
                return;
            }

            loopLock.lock();
            try {
                stopping = true;
                wakeUp.signalAll();
            } finally {
                loopLock.unlock();
            }

            joinFireLoop();
            drainWorkers();

            registry.clear();
            state = SchedulerState.STOPPED;
            log.info("Scheduler stopped");
        }
    }

    private void joinFireLoop() {
        if (fireLoopThread == null) {
            return;
        }
        try {
            fireLoopThread.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the fire loop to exit");
        }
    }

    private void drainWorkers() {
        var drainTimeout = properties.getDrainTimeoutSeconds();
        jobExecutor.shutdown();
        try {
            if (jobExecutor.awaitTermination(drainTimeout, TimeUnit.SECONDS)) {
                return;
            }
            log.error("Scheduler stop: jobs still running after drain timeout of {}s, interrupting them", drainTimeout);
            var neverStarted = jobExecutor.shutdownNow();
            if (!neverStarted.isEmpty()) {
                log.warn("Discarded {} queued job runs", neverStarted.size());
            }
            if (!jobExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.error("Scheduler stop: jobs ignored interruption and are still running");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            jobExecutor.shutdownNow();
            log.error("Scheduler stop interrupted while draining jobs, interrupting them");
        }
    }

    private void registerSourceJobs() {
        var registered = 0;
        for (var source : jobSources) {
            List<JobDefinition> jobs;
            try {
                jobs = source.getJobs();
            } catch (RuntimeException e) {
                log.error("Job source {} failed, none of its jobs were registered: {}",
                        source.getClass().getSimpleName(), e.getMessage(), e);
                continue;
            }
            if (jobs == null) {
                log.error("Job source {} returned no job list", source.getClass().getSimpleName());
                continue;
            }
            for (var job : jobs) {
                if (job == null) {
                    log.error("Job source {} returned a null job, skipping it", source.getClass().getSimpleName());
                    continue;
                }
                try {
                    addJob(job, true);
                    registered++;
                } catch (SchedulerConfigurationException e) {
                    log.error("Job {} not scheduled: {}", job.getJobId(), e.getMessage());
                }
            }
        }
        log.info("All jobs registered ({} from {} source(s))", registered, jobSources.size());
    }

    // === Job management ===

    /**
     * Add a fixed-interval job with the default policy, distributed, replacing any job with the same id
     */
    public JobDefinition addIntervalJob(String jobId, IntervalSpec spec, JobHandler handler) {
        return addJob(JobDefinition.builder()
                .jobId(jobId)
                .triggerSpec(spec)
                .handler(handler)
                .build(), true);
    }

    /**
     * Add a cron job with the default policy, distributed, replacing any job with the same id
     */
    public JobDefinition addCronJob(String jobId, CronSpec spec, JobHandler handler) {
        return addJob(JobDefinition.builder()
                .jobId(jobId)
                .triggerSpec(spec)
                .handler(handler)
                .build(), true);
    }

    /**
     * Register a job.
     *
     * @param definition      Job to register; missing policy and lock TTL take the configured defaults
     * @param replaceExisting Whether an existing job with the same id is replaced
     * @return the definition active after the call
     * @throws SchedulerConfigurationException if the definition or its trigger is invalid
     * @throws InvalidSchedulerStateException  if the scheduler is not initialized or is stopping
     */
    public JobDefinition addJob(JobDefinition definition, boolean replaceExisting) {
        requireAcceptingJobs("add job to");
        var resolved = resolve(definition);
        var now = clock.instant();
        var trigger = triggerFactory.create(resolved.getJobId(), resolved.getTriggerSpec(), now);
        var firstFireTime = trigger.nextFireTime(null, now);

        JobDefinition active;
        loopLock.lock();
        try {
            var existing = registry.lookup(resolved.getJobId());
            if (existing.isPresent() && !replaceExisting) {
                return registry.register(existing.get(), false);
            }

            // a replaced job keeps its state so in-flight runs still count against max instances
            var scheduleState = existing.map(ScheduledJob::getState).orElseGet(() -> new ScheduleState(firstFireTime));
            scheduleState.setNextFireTime(firstFireTime);
            scheduleState.setPaused(false);

            active = registry.register(new ScheduledJob(resolved, trigger, scheduleState), true);
            wakeUp.signalAll();
        } finally {
            loopLock.unlock();
        }

        log.info("Added job: {} ({}{}), next run at {}", resolved.getJobId(), trigger.describe(),
                resolved.isDistributed() ? ", distributed lock ttl=" + resolved.getLockTtlSeconds() + "s" : ", local",
                firstFireTime);
        return active;
    }

    /**
     * Remove a job. Runs already in flight finish normally.
     *
     * @return whether the job existed
     */
    public boolean removeJob(String jobId) {
        loopLock.lock();
        try {
            var removed = registry.unregister(jobId);
            if (removed) {
                wakeUp.signalAll();
                log.info("Removed job: {}", jobId);
            }
            return removed;
        } finally {
            loopLock.unlock();
        }
    }

    /**
     * Stop firing a job until it is resumed
     *
     * @return false if the job does not exist
     */
    public boolean pauseJob(String jobId) {
        loopLock.lock();
        try {
            var job = registry.lookup(jobId);
            if (job.isEmpty()) {
                return false;
            }
            job.get().getState().setPaused(true);
            wakeUp.signalAll();
            log.info("Paused job: {}", jobId);
            return true;
        } finally {
            loopLock.unlock();
        }
    }

    /**
     * Resume a paused job. Its next fire time is recomputed from now, so fire times that passed
     * while paused are not replayed.
     *
     * @return false if the job does not exist
     */
    public boolean resumeJob(String jobId) {
        loopLock.lock();
        try {
            var job = registry.lookup(jobId);
            if (job.isEmpty()) {
                return false;
            }
            var scheduleState = job.get().getState();
            if (scheduleState.isPaused()) {
                scheduleState.setNextFireTime(job.get().getTrigger().nextFireTime(null, clock.instant()));
                scheduleState.setPaused(false);
                wakeUp.signalAll();
            }
            log.info("Resumed job: {}, next run at {}", jobId, scheduleState.getNextFireTime());
            return true;
        } finally {
            loopLock.unlock();
        }
    }

    public Optional<JobInfo> getJobInfo(String jobId) {
        return registry.lookup(jobId).map(this::toJobInfo);
    }

    /**
     * All jobs, ordered by job id
     */
    public List<JobInfo> listJobs() {
        return registry.listAll().stream().map(this::toJobInfo).toList();
    }

    public SchedulerState getState() {
        return state;
    }

    public boolean isRunning() {
        return state == SchedulerState.RUNNING && !stopping;
    }

    public String getInstanceId() {
        return invoker.getInstanceId();
    }

    // === Fire loop ===

    private void runFireLoop() {
        log.debug("Fire loop started");
        loopLock.lock();
        try {
            while (state == SchedulerState.RUNNING && !stopping) {
                Instant nextWakeUp;
                try {
                    nextWakeUp = processDueJobs();
                } catch (VirtualMachineError e) {
                    throw e;
                } catch (RuntimeException | Error e) {
                    log.error("Unexpected error in fire loop iteration: {}", e.getMessage(), e);
                    nextWakeUp = clock.instant().plusSeconds(1);
                }
                var waitMs = waitMillis(clock.instant(), nextWakeUp, properties.getMaxIdleWaitMs());
                if (waitMs > 0 && !stopping) {
                    wakeUp.await(waitMs, TimeUnit.MILLISECONDS);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Fire loop interrupted");
        } finally {
            loopLock.unlock();
            log.debug("Fire loop stopped");
        }
    }

    /**
     * How long the fire loop sleeps before its next pass.
     * A fire time less than a millisecond away still waits 1ms so the loop never spins.
     *
     * @return 0 when the next fire time is already due
     */
    static long waitMillis(Instant now, Instant nextWakeUp, long maxIdleWaitMs) {
        if (nextWakeUp == null) {
            return maxIdleWaitMs;
        }
        var untilNext = Duration.between(now, nextWakeUp);
        if (untilNext.isNegative() || untilNext.isZero()) {
            return 0;
        }
        return Math.max(1, Math.min(untilNext.toMillis(), maxIdleWaitMs));
    }

    /**
     * Fire every job that is due at the current clock time.
     *
     * @return the earliest upcoming fire time over all active jobs, or null if there is none
     */
    Instant processDueJobs() {
        loopLock.lock();
        try {
            if (stopping || state == SchedulerState.STOPPED) {
                return null;
            }

            var now = clock.instant();
            Instant earliest = null;
            for (var job : registry.listAll()) {
                var scheduleState = job.getState();
                if (scheduleState.isPaused() || scheduleState.getNextFireTime() == null) {
                    continue;
                }
                if (!scheduleState.getNextFireTime().isAfter(now)) {
                    fireDueJob(job, now);
                }

                var next = scheduleState.getNextFireTime();
                if (next == null) {
                    registry.unregister(job.getJobId());
                    log.info("Removed job {}: trigger has no further fire times", job.getJobId());
                    continue;
                }
                if (earliest == null || next.isBefore(earliest)) {
                    earliest = next;
                }
            }
            return earliest;
        } finally {
            loopLock.unlock();
        }
    }

    private void fireDueJob(ScheduledJob job, Instant now) {
        var jobId = job.getJobId();
        var policy = job.getDefinition().getExecutionPolicy();
        var grace = Duration.ofSeconds(policy.getMisfireGraceSeconds());

        var onTime = new ArrayList<Instant>();
        Instant latestMissed = null;
        var missedCount = 0;

        var runTime = job.getState().getNextFireTime();
        while (runTime != null && !runTime.isAfter(now)) {
            if (now.isAfter(runTime.plus(grace))) {
                latestMissed = runTime;
                missedCount++;
            } else {
                onTime.add(runTime);
            }
            runTime = job.getTrigger().nextFireTime(runTime, now);
        }
        job.getState().setNextFireTime(runTime);

        if (policy.isCoalesce()) {
            if (onTime.isEmpty()) {
                var lateBy = Duration.between(latestMissed, now);
                log.warn("Run time of job {} was missed by {}", jobId, lateBy);
                publisher.publish(JobEvent.skipped(jobId, JobOutcome.MISSED, latestMissed, now,
                        String.format("missed by %s, %d run(s) dropped", lateBy, missedCount)));
                return;
            }
            if (onTime.size() + missedCount > 1) {
                log.debug("Coalescing {} due runs of job {} into one", onTime.size() + missedCount, jobId);
            }
            dispatch(job, onTime.get(onTime.size() - 1));
            return;
        }

        if (latestMissed != null) {
            log.warn("Run time of job {} was missed {} time(s), running once to catch up", jobId, missedCount);
            dispatch(job, latestMissed);
        }
        for (var fireTime : onTime) {
            dispatch(job, fireTime);
        }
    }

    private void dispatch(ScheduledJob job, Instant fireTime) {
        var jobId = job.getJobId();
        var maxInstances = job.getDefinition().getExecutionPolicy().getMaxInstances();

        if (!job.getState().tryReserveInstance(maxInstances)) {
            log.warn("Execution of job {} skipped: maximum number of running instances reached ({})", jobId, maxInstances);
            publisher.publish(JobEvent.skipped(jobId, JobOutcome.SKIPPED_MAX_INSTANCES, fireTime, clock.instant(),
                    "maximum number of running instances reached (" + maxInstances + ")"));
            return;
        }

        try {
            jobExecutor.execute(() -> runInvocation(job, fireTime));
        } catch (RejectedExecutionException e) {
            job.getState().releaseInstance();
            log.error("Run of job {} at {} rejected by the worker pool: {}", jobId, fireTime, e.getMessage());
        }
    }

    private void runInvocation(ScheduledJob job, Instant fireTime) {
        JobEvent event;
        try {
            if (stopping) {
                log.debug("Scheduler stopping, discarding queued run of job {}", job.getJobId());
                return;
            }
            event = invoker.invoke(job.getDefinition(), fireTime);
        } finally {
            job.getState().releaseInstance();
        }
        publisher.publish(event);
    }

    // === Helpers ===

    private void requireAcceptingJobs(String operation) {
        if (!state.isAcceptingJobs() || stopping) {
            throw new InvalidSchedulerStateException(state, operation);
        }
    }

    private JobDefinition resolve(JobDefinition definition) {
        if (definition == null) {
            throw new SchedulerConfigurationException("job definition is required");
        }
        var jobId = definition.getJobId();
        if (jobId == null || jobId.isBlank()) {
            throw new SchedulerConfigurationException("job id is required");
        }
        if (definition.getHandler() == null) {
            throw new SchedulerConfigurationException(jobId, "handler is required");
        }
        if (definition.getTriggerSpec() == null) {
            throw new SchedulerConfigurationException(jobId, "trigger spec is required");
        }

        var policy = definition.getExecutionPolicy() != null ? definition.getExecutionPolicy() : defaultPolicy;
        validatePolicy(jobId, policy);

        var lockTtl = definition.getLockTtlSeconds() != null ? definition.getLockTtlSeconds() : properties.getLockTtlSeconds();
        if (lockTtl <= 0) {
            throw new SchedulerConfigurationException(jobId, "lock TTL must be positive, got " + lockTtl);
        }

        return definition.toBuilder()
                .executionPolicy(policy)
                .lockTtlSeconds(lockTtl)
                .build();
    }

    private static void validatePolicy(String jobId, ExecutionPolicy policy) {
        if (policy.getMaxInstances() < 1) {
            throw configurationError(jobId, "max instances must be at least 1, got " + policy.getMaxInstances());
        }
        if (policy.getMisfireGraceSeconds() < 0) {
            throw configurationError(jobId, "misfire grace must not be negative, got " + policy.getMisfireGraceSeconds());
        }
    }

    private static SchedulerConfigurationException configurationError(String jobId, String reason) {
        return jobId != null ? new SchedulerConfigurationException(jobId, reason) : new SchedulerConfigurationException(reason);
    }

    private JobInfo toJobInfo(ScheduledJob job) {
        var definition = job.getDefinition();
        var scheduleState = job.getState();
        return JobInfo.builder()
                .jobId(definition.getJobId())
                .description(definition.getDescription())
                .trigger(job.getTrigger().describe())
                .nextFireTime(scheduleState.isPaused() ? null : scheduleState.getNextFireTime())
                .paused(scheduleState.isPaused())
                .runningInstances(scheduleState.getRunningInstances())
                .maxInstances(definition.getExecutionPolicy().getMaxInstances())
                .distributed(definition.isDistributed())
                .build();
    }
}
