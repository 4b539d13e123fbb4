package com.numbertrack.backend.modules.mobilenumber.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.numbertrack.backend.modules.mobilenumber.domain.MobileNumber;
import com.numbertrack.backend.modules.mobilenumber.domain.MobileNumberStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MobileNumberRepository extends JpaRepository<MobileNumber, UUID> {

    /**
     * Includes soft-deleted rows: a phone string can never be registered twice.
     */
    boolean existsByPhoneNumber(String phoneNumber);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select m from MobileNumber m where m.phoneNumber = :phoneNumber and m.deletedAt is null")
    Optional<MobileNumber> findByPhoneNumberForUpdate(@Param("phoneNumber") String phoneNumber);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select m from MobileNumber m where m.id = :id and m.deletedAt is null")
    Optional<MobileNumber> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
            select count(m) from MobileNumber m
            where m.deletedAt is null
              and m.currentEmployeeId = :employeeId
              and m.status = :status
            """)
    long countHeldByEmployeeWithStatus(
            @Param("employeeId") String employeeId,
            @Param("status") MobileNumberStatus status
    );

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select m from MobileNumber m
            where m.deletedAt is null
              and m.applicantEmployeeId = :employeeId
              and m.status not in :excludedStatuses
            order by m.phoneNumber asc
            """)
    List<MobileNumber> findByApplicantForUpdate(
            @Param("employeeId") String employeeId,
            @Param("excludedStatuses") Collection<MobileNumberStatus> excludedStatuses
    );

    @Query("""
            select m from MobileNumber m
            where m.deletedAt is null
              and m.currentEmployeeId = :employeeId
              and m.status <> :excluded
            order by m.phoneNumber asc
            """)
    List<MobileNumber> findHeldByEmployeeExcept(
            @Param("employeeId") String employeeId,
            @Param("excluded") MobileNumberStatus excluded
    );

    default List<MobileNumber> findHeldByEmployee(String employeeId) {
        return findHeldByEmployeeExcept(employeeId, MobileNumberStatus.DEACTIVATED);
    }
}
