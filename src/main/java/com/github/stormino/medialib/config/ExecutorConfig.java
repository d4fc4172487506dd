package com.github.stormino.medialib.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

    private final MediaLibraryProperties properties;

    /**
     * Workers for acquisition jobs. In-flight subprocesses are abandoned on
     * shutdown, so the pool does not wait for running jobs.
     */
    @Bean(name = "jobExecutor")
    public Executor jobExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getDownload().getParallelJobs());
        executor.setMaxPoolSize(properties.getDownload().getParallelJobs());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("acquire-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
