package com.example.rota.shift;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ShiftRepository extends JpaRepository<Shift, Long> {

    /**
     * Row lock serializing assignment, pickup and exchange resolution of one shift.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Shift s WHERE s.id = :id")
    Optional<Shift> findByIdForUpdate(@Param("id") Long id);

    /** Non-archived shifts of an organization starting within [from, to). */
    @Query("SELECT s FROM Shift s LEFT JOIN FETCH s.assignee LEFT JOIN FETCH s.location LEFT JOIN FETCH s.category " +
            "WHERE s.organizationId = :orgId AND s.archived = false AND s.startAt >= :from AND s.startAt < :to " +
            "ORDER BY s.startAt ASC")
    List<Shift> findSchedule(@Param("orgId") Long organizationId,
                             @Param("from") LocalDateTime from,
                             @Param("to") LocalDateTime to);

    @Query("SELECT s FROM Shift s LEFT JOIN FETCH s.location LEFT JOIN FETCH s.category " +
            "WHERE s.organizationId = :orgId AND s.archived = false AND s.assignee IS NULL AND s.startAt >= :from " +
            "ORDER BY s.startAt ASC")
    List<Shift> findOpenFrom(@Param("orgId") Long organizationId, @Param("from") LocalDateTime from);

    /** Shifts of one staff member overlapping [from, to), used to pick the shift a clock-in belongs to. */
    @Query("SELECT s FROM Shift s WHERE s.assignee.id = :staffId AND s.archived = false " +
            "AND s.startAt < :to AND s.endAt > :from ORDER BY s.startAt ASC")
    List<Shift> findAssignedOverlapping(@Param("staffId") Long staffId,
                                        @Param("from") LocalDateTime from,
                                        @Param("to") LocalDateTime to);
}
