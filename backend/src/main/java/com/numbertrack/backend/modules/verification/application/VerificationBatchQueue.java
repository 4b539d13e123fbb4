package com.numbertrack.backend.modules.verification.application;

import java.util.UUID;

import com.numbertrack.backend.global.config.VerificationExecutorConfig;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Hands batch tasks to the bounded worker pool.
 */
@Component
public class VerificationBatchQueue {

    private final TaskExecutor executor;
    private final VerificationBatchWorker worker;

    public VerificationBatchQueue(
            @Qualifier(VerificationExecutorConfig.VERIFICATION_BATCH_EXECUTOR) TaskExecutor executor,
            VerificationBatchWorker worker
    ) {
        this.executor = executor;
        this.worker = worker;
    }

    /**
     * @throws TaskRejectedException when the pool and its queue are saturated
     */
    public void enqueue(UUID taskId) {
        executor.execute(() -> worker.run(taskId));
    }
}
