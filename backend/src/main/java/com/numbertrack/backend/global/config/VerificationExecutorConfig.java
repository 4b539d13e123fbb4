package com.numbertrack.backend.global.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded worker pool for verification batch runs. A full queue rejects the hand-off instead of blocking.
 */
@Configuration
public class VerificationExecutorConfig {

    public static final String VERIFICATION_BATCH_EXECUTOR = "verificationBatchExecutor";

    @Bean(name = VERIFICATION_BATCH_EXECUTOR)
    public ThreadPoolTaskExecutor verificationBatchExecutor(
            @Value("${app.verification.worker.pool-size:2}") int poolSize,
            @Value("${app.verification.worker.queue-capacity:20}") int queueCapacity,
            @Value("${app.verification.worker.await-termination-seconds:30}") int awaitTerminationSeconds
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("verification-batch-");
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
        executor.initialize();
        return executor;
    }
}
