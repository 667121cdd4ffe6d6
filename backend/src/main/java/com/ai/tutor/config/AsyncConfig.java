package com.ai.tutor.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded worker pool for background prefetch jobs.
 *
 * When a student enters a practice session, context warming and exercise pool
 * refills run on this pool so the page is never blocked on the generative
 * engine. The queue is bounded; jobs that do not fit are rejected and the
 * submitter logs and drops them.
 */
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final TutorProperties properties;

    @Bean(name = "prefetchExecutor")
    public TaskExecutor prefetchExecutor() {
        TutorProperties.Prefetch prefetch = properties.getPrefetch();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(prefetch.getCorePoolSize());
        executor.setMaxPoolSize(prefetch.getMaxPoolSize());
        executor.setQueueCapacity(prefetch.getQueueCapacity());
        executor.setThreadNamePrefix("prefetch-");
        executor.initialize();
        return executor;
    }
}
