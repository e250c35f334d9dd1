package com.example.rota.timeentry;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface TimeEntryRepository extends JpaRepository<TimeEntry, Long> {

    /** The open entry of a staff member, if any. */
    Optional<TimeEntry> findByActiveStaffId(Long staffId);

    boolean existsByShift_Id(Long shiftId);

    @Query("SELECT e.staff.id FROM TimeEntry e WHERE e.id = :id")
    Optional<Long> findStaffIdById(@Param("id") Long id);

    /** Open entries clocked in before the cutoff that have not been flagged as a missed clock-out yet. */
    @Query("SELECT e.id FROM TimeEntry e WHERE e.organizationId = :orgId AND e.activeStaffId IS NOT NULL " +
            "AND e.clockIn < :cutoff AND e.missedClockOut = false ORDER BY e.clockIn ASC")
    List<Long> findUnflaggedOpenBefore(@Param("orgId") Long organizationId,
                                       @Param("cutoff") LocalDateTime cutoff);

    @Query("SELECT e FROM TimeEntry e WHERE e.staff.id = :staffId AND e.clockIn >= :from AND e.clockIn < :to " +
            "ORDER BY e.clockIn ASC")
    List<TimeEntry> findByStaffInRange(@Param("staffId") Long staffId,
                                       @Param("from") LocalDateTime from,
                                       @Param("to") LocalDateTime to);

    @Query("SELECT e FROM TimeEntry e JOIN FETCH e.staff WHERE e.organizationId = :orgId " +
            "AND e.clockIn >= :from AND e.clockIn < :to ORDER BY e.clockIn ASC")
    List<TimeEntry> findByOrganizationInRange(@Param("orgId") Long organizationId,
                                              @Param("from") LocalDateTime from,
                                              @Param("to") LocalDateTime to);

    /** Approved closed entries feeding payroll; shift and segments are loaded for wage attribution. */
    @Query("SELECT DISTINCT e FROM TimeEntry e JOIN FETCH e.staff LEFT JOIN FETCH e.shift s " +
            "LEFT JOIN FETCH s.category LEFT JOIN FETCH s.location LEFT JOIN FETCH s.segments seg LEFT JOIN FETCH seg.category " +
            "WHERE e.organizationId = :orgId AND e.state = com.example.rota.timeentry.TimeEntryState.CLOSED " +
            "AND e.approvalStatus = com.example.rota.timeentry.ApprovalStatus.APPROVED " +
            "AND e.clockIn >= :from AND e.clockIn < :to")
    List<TimeEntry> findApprovedInRange(@Param("orgId") Long organizationId,
                                        @Param("from") LocalDateTime from,
                                        @Param("to") LocalDateTime to);
}
