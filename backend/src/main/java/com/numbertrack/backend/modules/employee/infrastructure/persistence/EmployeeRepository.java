package com.numbertrack.backend.modules.employee.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.numbertrack.backend.modules.employee.domain.Employee;
import com.numbertrack.backend.modules.employee.domain.EmploymentStatus;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EmployeeRepository extends JpaRepository<Employee, UUID> {

    @Query(value = "SELECT nextval('employee_business_id_seq')", nativeQuery = true)
    long nextBusinessIdSequence();

    @Query("select e from Employee e where e.employeeId = :employeeId and e.deletedAt is null")
    Optional<Employee> findActiveRecord(@Param("employeeId") String employeeId);

    @Query("""
            select e from Employee e
            where e.deletedAt is null
              and e.employmentStatus = :status
            order by e.employeeId asc
            """)
    List<Employee> findAllByStatus(@Param("status") EmploymentStatus status);

    @Query("""
            select e from Employee e
            where e.deletedAt is null
              and e.employmentStatus = :status
              and e.department in :departments
            order by e.employeeId asc
            """)
    List<Employee> findAllByStatusAndDepartmentIn(
            @Param("status") EmploymentStatus status,
            @Param("departments") Collection<String> departments
    );

    @Query("""
            select e from Employee e
            where e.deletedAt is null
              and e.employmentStatus = :status
              and e.employeeId in :employeeIds
            order by e.employeeId asc
            """)
    List<Employee> findAllByStatusAndEmployeeIdIn(
            @Param("status") EmploymentStatus status,
            @Param("employeeIds") Collection<String> employeeIds
    );

    @Query("""
            select e from Employee e
            where e.deletedAt is null
              and (:status is null or e.employmentStatus = :status)
              and (lower(e.fullName) like :pattern
                   or lower(e.employeeId) like :pattern
                   or lower(coalesce(e.department, '')) like :pattern)
            """)
    Page<Employee> search(
            @Param("pattern") String pattern,
            @Param("status") EmploymentStatus status,
            Pageable pageable
    );
}
