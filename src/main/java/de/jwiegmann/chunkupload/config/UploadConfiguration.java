package de.jwiegmann.chunkupload.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties(UploadProperties.class)
public class UploadConfiguration {

    public static final String MERGE_EXECUTOR = "mergeExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Worker-Pool für Merges und Aufräumarbeiten nach Cancel.
     * Merges laufen entkoppelt vom Request, der sie ausgelöst hat.
     */
    @Bean(name = MERGE_EXECUTOR)
    public TaskExecutor mergeExecutor(UploadProperties properties) {
        UploadProperties.Merge merge = properties.getMerge();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(merge.getCorePoolSize());
        executor.setMaxPoolSize(merge.getMaxPoolSize());
        executor.setQueueCapacity(merge.getQueueCapacity());
        executor.setThreadNamePrefix("merge-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        log.info("Merge executor initialized: core={}, max={}, queue={}",
                merge.getCorePoolSize(), merge.getMaxPoolSize(), merge.getQueueCapacity());
        return executor;
    }
}
