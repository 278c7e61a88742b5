package io.github.drompincen.chatrelay.gateway.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Request processing runs on {@code chat-worker-} threads so a socket's read loop never waits on
 * an upstream call. Upstream calls themselves run on {@code llm-call-} threads where they can be
 * abandoned at the request deadline.
 */
@Configuration
public class ExecutorConfig {

    @Bean
    ThreadPoolTaskExecutor chatWorkerExecutor(
            @Value("${chatrelay.workers.core-size:8}") int coreSize,
            @Value("${chatrelay.workers.max-size:32}") int maxSize,
            @Value("${chatrelay.workers.queue-capacity:200}") int queueCapacity) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("chat-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService llmExecutor() {
        var threads = new CustomizableThreadFactory("llm-call-");
        threads.setDaemon(true);
        return Executors.newCachedThreadPool(threads);
    }
}
