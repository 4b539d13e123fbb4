package com.numbertrack.backend.modules.verification.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.numbertrack.backend.modules.verification.domain.VerificationBatchStatus;
import com.numbertrack.backend.modules.verification.domain.VerificationBatchTask;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface VerificationBatchTaskRepository extends JpaRepository<VerificationBatchTask, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from VerificationBatchTask t where t.id = :id")
    Optional<VerificationBatchTask> findByIdForUpdate(@Param("id") UUID id);

    List<VerificationBatchTask> findByStatusInOrderByCreatedAtAsc(Collection<VerificationBatchStatus> statuses);
}
