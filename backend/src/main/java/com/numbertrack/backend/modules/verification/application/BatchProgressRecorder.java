package com.numbertrack.backend.modules.verification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.numbertrack.backend.modules.verification.domain.BatchFailure;
import com.numbertrack.backend.modules.verification.domain.VerificationBatchTask;
import com.numbertrack.backend.modules.verification.domain.VerificationScopeType;
import com.numbertrack.backend.modules.verification.domain.VerificationToken;
import com.numbertrack.backend.modules.verification.infrastructure.persistence.VerificationBatchTaskRepository;
import com.numbertrack.backend.modules.verification.infrastructure.persistence.VerificationTokenRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists batch progress one step at a time. Every method commits on its own, so a crash mid-run
 * leaves the counters of all finished employees readable.
 */
@Service
@Transactional(propagation = Propagation.REQUIRES_NEW)
public class BatchProgressRecorder {

    private static final int TOKEN_COLLISION_RETRIES = 3;

    private final VerificationBatchTaskRepository taskRepository;
    private final VerificationTokenRepository tokenRepository;
    private final VerificationTokenGenerator tokenGenerator;
    private final Clock clock;

    public BatchProgressRecorder(
            VerificationBatchTaskRepository taskRepository,
            VerificationTokenRepository tokenRepository,
            VerificationTokenGenerator tokenGenerator,
            Clock clock
    ) {
        this.taskRepository = taskRepository;
        this.tokenRepository = tokenRepository;
        this.tokenGenerator = tokenGenerator;
        this.clock = clock;
    }

    /**
     * Moves the task to in-progress. Empty when the task is unknown or already terminal.
     */
    public Optional<BatchRun> begin(UUID taskId) {
        return taskRepository.findByIdForUpdate(taskId)
                .filter(task -> !task.isTerminal())
                .map(task -> {
                    task.start(now());
                    return new BatchRun(task.getId(), task.getScopeType(), task.getScopeValues(),
                            task.getDurationDays(), task.getTotalEmployees(), task.failedEmployeeIds());
                });
    }

    /**
     * Stores a fresh token for the employee and counts it in the same commit.
     */
    public VerificationToken issueToken(UUID taskId, String employeeId, OffsetDateTime expiresAt) {
        VerificationBatchTask task = lock(taskId);
        String value = uniqueTokenValue();
        VerificationToken token = tokenRepository.save(VerificationToken.issue(value, employeeId, taskId, expiresAt));
        task.recordTokenIssued();
        return token;
    }

    public void recordTokenFailed(UUID taskId, BatchFailure failure) {
        lock(taskId).recordTokenFailed(failure);
    }

    /**
     * Marks the token as sent and counts the delivery in the same commit.
     */
    public void recordEmailSucceeded(UUID taskId, UUID tokenId) {
        VerificationBatchTask task = lock(taskId);
        token(tokenId).markDelivered();
        task.recordEmailSucceeded();
    }

    public void recordEmailFailed(UUID taskId, UUID tokenId, BatchFailure failure) {
        VerificationBatchTask task = lock(taskId);
        token(tokenId).markDeliveryFailed();
        task.recordEmailFailed(failure);
    }

    public void complete(UUID taskId) {
        VerificationBatchTask task = lock(taskId);
        if (!task.isTerminal()) {
            task.complete(now());
        }
    }

    public void fail(UUID taskId, String reason) {
        taskRepository.findByIdForUpdate(taskId)
                .filter(task -> !task.isTerminal())
                .ifPresent(task -> task.fail(reason, now()));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public Optional<VerificationToken> findToken(UUID taskId, String employeeId) {
        return tokenRepository.findByBatchTaskIdAndEmployeeId(taskId, employeeId);
    }

    private String uniqueTokenValue() {
        for (int attempt = 0; attempt < TOKEN_COLLISION_RETRIES; attempt++) {
            String candidate = tokenGenerator.nextToken();
            if (!tokenRepository.existsByToken(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("could not generate a unique verification token");
    }

    private VerificationBatchTask lock(UUID taskId) {
        return taskRepository.findByIdForUpdate(taskId)
                .orElseThrow(() -> new IllegalStateException("batch task " + taskId + " disappeared"));
    }

    private VerificationToken token(UUID tokenId) {
        return tokenRepository.findById(tokenId)
                .orElseThrow(() -> new IllegalStateException("verification token " + tokenId + " disappeared"));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    /**
     * Snapshot taken when the run starts. {@code failedEmployeeIds} is non-empty only on a resumed run.
     */
    public record BatchRun(
            UUID taskId,
            VerificationScopeType scopeType,
            List<String> scopeValues,
            int durationDays,
            int totalEmployees,
            Set<String> failedEmployeeIds
    ) {
    }
}
