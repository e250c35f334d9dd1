package com.example.rota.location;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface StaffLocationRepository extends JpaRepository<StaffLocation, Long> {

    @Query("SELECT sl.location FROM StaffLocation sl WHERE sl.staff.id = :staffId ORDER BY sl.location.name ASC")
    List<Location> findLocationsByStaffId(@Param("staffId") Long staffId);

    @Query("SELECT sl.location.id FROM StaffLocation sl WHERE sl.staff.id = :staffId")
    List<Long> findLocationIdsByStaffId(@Param("staffId") Long staffId);

    @Query("SELECT sl.staff.id FROM StaffLocation sl WHERE sl.location.id = :locationId")
    List<Long> findStaffIdsByLocationId(@Param("locationId") Long locationId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM StaffLocation sl WHERE sl.staff.id = :staffId")
    int deleteByStaffId(@Param("staffId") Long staffId);
}
