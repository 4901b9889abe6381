package com.example.jobscheduler.config;

import com.example.jobscheduler.registry.JobRegistry;
import com.example.jobscheduler.service.listener.JobExecutionListener;
import com.example.jobscheduler.service.scheduler.JobInvoker;
import com.example.jobscheduler.service.scheduler.JobSource;
import com.example.jobscheduler.service.scheduler.SchedulerCore;
import com.example.jobscheduler.trigger.TriggerFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wiring of the scheduler core and the worker pool that runs job handlers.
 * <p>
 * Listeners and job sources are collected from the context, listeners in {@code @Order} order.
 */
@Slf4j
@EnableAsync(proxyTargetClass = true)
@Configuration
public class SchedulerConfig {

    public static final String ALERT_EXECUTOR = "alertExecutor";

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Fixed pool of platform threads for job handlers.
     * Handlers block on I/O, and the pool size bounds how many run at once on this instance.
     */
    @Bean(name = "jobExecutor")
    public ExecutorService jobExecutor(JobSchedulerProperties properties) {
        log.info("Creating job executor with {} worker threads", properties.getExecutorPoolSize());

        return Executors.newFixedThreadPool(properties.getExecutorPoolSize(), new CustomizableThreadFactory("job-executor-"));
    }

    /**
     * Small pool for outbound alerts. When it is saturated alerts are dropped, never run on the
     * caller, so job workers are not held up by a slow webhook.
     */
    @Bean(name = ALERT_EXECUTOR)
    public TaskExecutor alertExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("alert-");
        executor.setRejectedExecutionHandler((r, e) -> log.warn("Alert executor saturated, dropping alert"));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();

        return executor;
    }

    @Bean
    public SchedulerCore schedulerCore(JobRegistry registry,
                                       TriggerFactory triggerFactory,
                                       JobInvoker invoker,
                                       JobSchedulerProperties properties,
                                       Clock clock,
                                       @Qualifier("jobExecutor") ExecutorService jobExecutor,
                                       ObjectProvider<JobExecutionListener> listeners,
                                       ObjectProvider<JobSource> jobSources) {
        return new SchedulerCore(registry, triggerFactory, invoker, properties, clock, jobExecutor,
                listeners.orderedStream().toList(), jobSources.orderedStream().toList());
    }
}
