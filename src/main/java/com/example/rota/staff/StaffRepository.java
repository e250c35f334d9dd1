package com.example.rota.staff;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface StaffRepository extends JpaRepository<Staff, Long> {

    Optional<Staff> findByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCase(String email);

    List<Staff> findByOrganizationIdOrderByNameAsc(Long organizationId);

    List<Staff> findByOrganizationIdAndRoleIn(Long organizationId, Collection<StaffRole> roles);

    /**
     * Row lock used to serialize clock transitions of one staff member.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Staff s WHERE s.id = :id")
    Optional<Staff> findByIdForUpdate(@Param("id") Long id);
}
