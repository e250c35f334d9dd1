package com.example.rota.swap;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SwapRequestRepository extends JpaRepository<SwapRequest, Long> {

    boolean existsByPendingKey(String pendingKey);

    boolean existsByShift_Id(Long shiftId);

    /** Shift of a request, read without loading the request itself. */
    @Query("SELECT r.shift.id FROM SwapRequest r WHERE r.id = :id")
    Optional<Long> findShiftIdById(@Param("id") Long id);

    @Query("SELECT r FROM SwapRequest r JOIN FETCH r.shift JOIN FETCH r.requester " +
            "WHERE r.organizationId = :orgId ORDER BY r.requestedAt DESC")
    List<SwapRequest> findByOrganization(@Param("orgId") Long organizationId);

    @Query("SELECT r FROM SwapRequest r JOIN FETCH r.shift JOIN FETCH r.requester " +
            "WHERE r.requester.id = :staffId ORDER BY r.requestedAt DESC")
    List<SwapRequest> findByRequester(@Param("staffId") Long staffId);
}
