package mgnrega.tracker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class ExecutorConfig {

    @Bean(name = "generationExecutor")
    public ThreadPoolTaskExecutor generationExecutor(TrackerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getSeed().getGenerationThreads());
        executor.setMaxPoolSize(properties.getSeed().getGenerationThreads());
        executor.setThreadNamePrefix("data-gen-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    /**
     * Runs manually triggered syncs one at a time. At most one more run waits in the queue;
     * further requests are dropped because the queued run covers the same month.
     */
    @Bean(name = "syncExecutor")
    public ThreadPoolTaskExecutor syncExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardPolicy());
        executor.setThreadNamePrefix("manual-sync-");
        executor.initialize();
        return executor;
    }
}
