package com.numbertrack.backend.modules.mobilenumber.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.numbertrack.backend.modules.mobilenumber.domain.NumberApplicantHistory;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NumberApplicantHistoryRepository extends JpaRepository<NumberApplicantHistory, UUID> {

    @Query("""
            select h from NumberApplicantHistory h
            where h.mobileNumber.id = :mobileNumberId
            order by h.createdAt asc
            """)
    List<NumberApplicantHistory> findByMobileNumberId(@Param("mobileNumberId") UUID mobileNumberId);
}
