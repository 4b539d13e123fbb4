package com.numbertrack.backend.modules.verification.application;

import java.util.EnumSet;
import java.util.List;

import com.numbertrack.backend.modules.verification.domain.VerificationBatchStatus;
import com.numbertrack.backend.modules.verification.domain.VerificationBatchTask;
import com.numbertrack.backend.modules.verification.infrastructure.persistence.VerificationBatchTaskRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Re-enqueues batch tasks that a previous process left unfinished.
 */
@Component
public class VerificationBatchRecovery {

    private static final Logger log = LoggerFactory.getLogger(VerificationBatchRecovery.class);

    private final VerificationBatchTaskRepository taskRepository;
    private final VerificationBatchQueue queue;
    private final BatchProgressRecorder recorder;

    public VerificationBatchRecovery(
            VerificationBatchTaskRepository taskRepository,
            VerificationBatchQueue queue,
            BatchProgressRecorder recorder
    ) {
        this.taskRepository = taskRepository;
        this.queue = queue;
        this.recorder = recorder;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void resumeUnfinishedTasks() {
        List<VerificationBatchTask> unfinished = taskRepository.findByStatusInOrderByCreatedAtAsc(
                EnumSet.of(VerificationBatchStatus.PENDING, VerificationBatchStatus.IN_PROGRESS));
        for (VerificationBatchTask task : unfinished) {
            try {
                queue.enqueue(task.getId());
                log.info("re-enqueued unfinished batch task={} status={}", task.getId(), task.getStatus());
            } catch (TaskRejectedException ex) {
                log.error("[ALERT][VerificationBatch] task={} could not be resumed, queue full", task.getId(), ex);
                recorder.fail(task.getId(), "Worker queue full during recovery");
            }
        }
    }
}
