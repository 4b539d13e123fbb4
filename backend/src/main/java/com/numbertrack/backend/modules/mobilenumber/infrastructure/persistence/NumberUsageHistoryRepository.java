package com.numbertrack.backend.modules.mobilenumber.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.numbertrack.backend.modules.mobilenumber.domain.NumberUsageHistory;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NumberUsageHistoryRepository extends JpaRepository<NumberUsageHistory, UUID> {

    @Query("""
            select h from NumberUsageHistory h
            where h.mobileNumber.id = :mobileNumberId
              and h.employeeId = :employeeId
              and h.endDate is null
            """)
    List<NumberUsageHistory> findOpenIntervals(
            @Param("mobileNumberId") UUID mobileNumberId,
            @Param("employeeId") String employeeId
    );

    @Query("""
            select h from NumberUsageHistory h
            where h.mobileNumber.id = :mobileNumberId
            order by h.startDate asc, h.createdAt asc
            """)
    List<NumberUsageHistory> findByMobileNumberId(@Param("mobileNumberId") UUID mobileNumberId);
}
